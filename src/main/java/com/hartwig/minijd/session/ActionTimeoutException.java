package com.hartwig.minijd.session;

/**
 * An action ran past its timeout and was canceled.
 */
public class ActionTimeoutException extends ActionCanceledException {
    public ActionTimeoutException(final String message) {
        super(message);
    }
}
