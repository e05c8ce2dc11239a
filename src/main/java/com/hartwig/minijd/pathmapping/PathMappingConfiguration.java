package com.hartwig.minijd.pathmapping;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutablePathMappingConfiguration.class)
@JsonSerialize(as = ImmutablePathMappingConfiguration.class)
public interface PathMappingConfiguration {
    String VERSION = "pathmapping-1.0";

    String version();

    @JsonProperty("path_mapping_rules")
    List<PathMappingRule> pathMappingRules();

    static PathMappingConfiguration of(List<PathMappingRule> rules) {
        return ImmutablePathMappingConfiguration.builder().version(VERSION).pathMappingRules(rules).build();
    }
}
