package com.hartwig.minijd.session;

import java.time.Duration;
import java.util.List;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface SessionResult {
    String sessionId();

    /**
     * ENDED_SUCCESS or ENDED_FAILED.
     */
    SessionState state();

    List<SessionEvent> events();

    int succeededTasks();

    int failedTasks();

    int notRunTasks();

    Duration duration();

    default boolean isSuccess() {
        return state() == SessionState.ENDED_SUCCESS;
    }
}
