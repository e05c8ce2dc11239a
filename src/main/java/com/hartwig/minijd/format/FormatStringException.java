package com.hartwig.minijd.format;

import com.hartwig.minijd.MiniJdException;

/**
 * A format string could not be parsed or resolved.
 */
public class FormatStringException extends MiniJdException {
    public FormatStringException(final String message) {
        super(message);
    }
}
