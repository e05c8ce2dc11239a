package com.hartwig.minijd.template;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableStepDependency.class)
@JsonSerialize(as = ImmutableStepDependency.class)
public interface StepDependency {
    String dependsOn();

    static StepDependency of(String stepName) {
        return ImmutableStepDependency.builder().dependsOn(stepName).build();
    }
}
