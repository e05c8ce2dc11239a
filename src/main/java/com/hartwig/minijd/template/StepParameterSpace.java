package com.hartwig.minijd.template;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableStepParameterSpace.class)
@JsonSerialize(as = ImmutableStepParameterSpace.class)
public interface StepParameterSpace {
    List<TaskParameterDefinition> taskParameterDefinitions();

    /**
     * Combination expression over the task parameter names, e.g. {@code "(Frame, Eye) * Camera"}.
     * When absent all parameters are combined as a product in declaration order.
     */
    Optional<String> combination();

    static ImmutableStepParameterSpace.Builder builder() {
        return ImmutableStepParameterSpace.builder();
    }
}
