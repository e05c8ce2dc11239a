package com.hartwig.minijd.template;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableStepActions.class)
@JsonSerialize(as = ImmutableStepActions.class)
public interface StepActions {
    Action onRun();

    static StepActions onRun(Action action) {
        return ImmutableStepActions.builder().onRun(action).build();
    }
}
