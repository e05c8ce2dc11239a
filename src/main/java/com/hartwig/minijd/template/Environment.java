package com.hartwig.minijd.template;

import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableEnvironment.class)
@JsonSerialize(as = ImmutableEnvironment.class)
public interface Environment {
    String name();

    Optional<String> description();

    Optional<EnvironmentScript> script();

    /**
     * Environment variables set for every action run while this environment is entered. Values are format strings.
     */
    Map<String, String> variables();

    static ImmutableEnvironment.Builder builder() {
        return ImmutableEnvironment.builder();
    }
}
