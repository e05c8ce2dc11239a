package com.hartwig.minijd.expansion;

import com.hartwig.minijd.MiniJdException;

/**
 * A task parameter range cannot be expanded into values.
 */
public class RangeExpansionException extends MiniJdException {
    public RangeExpansionException(final String message) {
        super(message);
    }
}
