package com.hartwig.minijd.session;

import java.util.EnumSet;
import java.util.Set;

public enum SessionState {
    INITIALIZING,
    ENTERING_ENVIRONMENTS,
    READY,
    RUNNING_TASK,
    EXITING_ENVIRONMENTS,
    ENDED_SUCCESS,
    ENDED_FAILED;

    public boolean isEnded() {
        return this == ENDED_SUCCESS || this == ENDED_FAILED;
    }

    Set<SessionState> successors() {
        switch (this) {
            case INITIALIZING:
                return EnumSet.of(ENTERING_ENVIRONMENTS, ENDED_FAILED);
            case ENTERING_ENVIRONMENTS:
                return EnumSet.of(READY, EXITING_ENVIRONMENTS);
            case READY:
                return EnumSet.of(RUNNING_TASK, EXITING_ENVIRONMENTS);
            case RUNNING_TASK:
                return EnumSet.of(READY);
            case EXITING_ENVIRONMENTS:
                return EnumSet.of(ENDED_SUCCESS, ENDED_FAILED);
            default:
                return EnumSet.noneOf(SessionState.class);
        }
    }
}
