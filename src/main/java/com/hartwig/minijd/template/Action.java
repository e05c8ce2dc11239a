package com.hartwig.minijd.template;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableAction.class)
@JsonSerialize(as = ImmutableAction.class)
public interface Action {
    /**
     * Executable to run. Format string.
     */
    String command();

    /**
     * Arguments passed to the command, each a format string.
     */
    List<String> args();

    /**
     * Maximum run time in seconds, after which the action is cancelled.
     */
    Optional<Integer> timeout();

    /**
     * How the running process is stopped on cancellation. Terminates the process tree when absent.
     */
    Optional<CancelationMethod> cancelation();

    static ImmutableAction.Builder builder() {
        return ImmutableAction.builder();
    }
}
