package com.hartwig.minijd.template;

public enum CancelationMode {
    TERMINATE,
    NOTIFY_THEN_TERMINATE
}
