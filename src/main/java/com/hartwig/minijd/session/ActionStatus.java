package com.hartwig.minijd.session;

public enum ActionStatus {
    SUCCESS,
    FAILED,
    CANCELED,
    TIMEOUT
}
