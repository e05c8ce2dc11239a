package com.hartwig.minijd.session;

import com.hartwig.minijd.MiniJdException;

public class ActionCanceledException extends MiniJdException {
    public ActionCanceledException(final String message) {
        super(message);
    }
}
