package com.hartwig.minijd.session;

import com.hartwig.minijd.MiniJdException;

/**
 * An action could not be started or exited with a non-zero code.
 */
public class ActionFailureException extends MiniJdException {
    private final int exitCode;

    public ActionFailureException(final String message, final int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public ActionFailureException(final String message, final Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /**
     * Exit code of the process, -1 when it never started.
     */
    public int getExitCode() {
        return exitCode;
    }
}
