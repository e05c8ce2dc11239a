package com.hartwig.minijd;

/**
 * Base class of all errors raised by the job template engine.
 */
public class MiniJdException extends RuntimeException {
    public MiniJdException(final String message) {
        super(message);
    }

    public MiniJdException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
