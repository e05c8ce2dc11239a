package com.hartwig.minijd.pathmapping;

import com.hartwig.minijd.MiniJdException;

/**
 * Path mapping rules are malformed. Raised before any session starts.
 */
public class PathMappingException extends MiniJdException {
    public PathMappingException(final String message) {
        super(message);
    }

    public PathMappingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
