package com.hartwig.minijd.template;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableStep.class)
@JsonSerialize(as = ImmutableStep.class)
public interface Step {
    /**
     * Step name, unique within the template.
     */
    String name();

    Optional<String> description();

    /**
     * Steps whose tasks must all succeed before any task of this step runs.
     */
    List<StepDependency> dependencies();

    /**
     * Task parameters of this step. Without a parameter space the step has a single task.
     */
    Optional<StepParameterSpace> parameterSpace();

    StepScript script();

    /**
     * Environments entered after the job environments, for sessions running this step.
     */
    List<Environment> stepEnvironments();

    default List<String> dependencyNames() {
        return dependencies().stream().map(StepDependency::dependsOn).collect(Collectors.toList());
    }

    static ImmutableStep.Builder builder() {
        return ImmutableStep.builder();
    }
}
