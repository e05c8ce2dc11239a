package com.hartwig.minijd.session;

import com.hartwig.minijd.MiniJdException;

/**
 * The session could not prepare its working directory or files. No environment was entered.
 */
public class SessionSetupException extends MiniJdException {
    public SessionSetupException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
