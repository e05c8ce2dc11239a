package com.hartwig.minijd.session;

public enum SessionEventType {
    SESSION_STARTED,
    ENVIRONMENT_ENTERED,
    ENVIRONMENT_EXITED,
    TASK_STARTED,
    ACTION_STARTED,
    ACTION_OUTPUT,
    ACTION_PROGRESS,
    ACTION_STATUS,
    ACTION_COMPLETED,
    TASK_COMPLETED,
    SESSION_ENDED
}
