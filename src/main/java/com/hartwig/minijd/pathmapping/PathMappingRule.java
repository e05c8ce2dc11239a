package com.hartwig.minijd.pathmapping;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutablePathMappingRule.class)
@JsonSerialize(as = ImmutablePathMappingRule.class)
public interface PathMappingRule {
    /**
     * Path convention of the submitting host.
     */
    @JsonProperty("source_path_format")
    PathFormat sourcePathFormat();

    @JsonProperty("source_path")
    String sourcePath();

    @JsonProperty("destination_path")
    String destinationPath();

    static PathMappingRule of(PathFormat sourcePathFormat, String sourcePath, String destinationPath) {
        return ImmutablePathMappingRule.builder()
                .sourcePathFormat(sourcePathFormat)
                .sourcePath(sourcePath)
                .destinationPath(destinationPath)
                .build();
    }
}
