package com.hartwig.minijd.template;

import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableEnvironmentActions.class)
@JsonSerialize(as = ImmutableEnvironmentActions.class)
public interface EnvironmentActions {
    Optional<Action> onEnter();

    Optional<Action> onExit();

    static ImmutableEnvironmentActions.Builder builder() {
        return ImmutableEnvironmentActions.builder();
    }
}
