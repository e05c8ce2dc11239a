package com.hartwig.minijd.template;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableTaskParameterDefinition.class)
@JsonSerialize(as = ImmutableTaskParameterDefinition.class)
public interface TaskParameterDefinition {
    String name();

    ParameterType type();

    ParameterRange range();

    static ImmutableTaskParameterDefinition.Builder builder() {
        return ImmutableTaskParameterDefinition.builder();
    }
}
