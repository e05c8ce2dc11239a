package com.hartwig.minijd.session;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface SessionEvent {
    String sessionId();

    SessionEventType type();

    @Value.Default
    default Instant timestamp() {
        return Instant.now();
    }

    /**
     * Environment name for environment events and their actions, the step name for task events and their actions.
     */
    Optional<String> subject();

    /**
     * Output line, status text or summary, depending on the type.
     */
    Optional<String> message();

    /**
     * Outcome of ACTION_COMPLETED and TASK_COMPLETED events.
     */
    Optional<ActionStatus> status();

    /**
     * Percentage reported by an ACTION_PROGRESS event.
     */
    Optional<Double> progress();

    /**
     * Task parameter values of TASK_STARTED events.
     */
    Map<String, String> taskParameters();

    static ImmutableSessionEvent.Builder builder() {
        return ImmutableSessionEvent.builder();
    }
}
