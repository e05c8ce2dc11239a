package com.hartwig.minijd.template;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableParameterDefinition.class)
@JsonSerialize(as = ImmutableParameterDefinition.class)
public interface ParameterDefinition {
    String name();

    ParameterType type();

    Optional<String> description();

    /**
     * Value used when the submission does not bind this parameter.
     */
    @JsonProperty("default")
    Optional<String> defaultValue();

    List<String> allowedValues();

    /**
     * INT and FLOAT only.
     */
    Optional<BigDecimal> minValue();

    Optional<BigDecimal> maxValue();

    /**
     * STRING and PATH only.
     */
    Optional<Integer> minLength();

    Optional<Integer> maxLength();

    /**
     * PATH only.
     */
    Optional<PathObjectType> objectType();

    Optional<PathDataFlow> dataFlow();

    static ImmutableParameterDefinition.Builder builder() {
        return ImmutableParameterDefinition.builder();
    }
}
