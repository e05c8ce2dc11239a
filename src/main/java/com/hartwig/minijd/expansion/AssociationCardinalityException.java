package com.hartwig.minijd.expansion;

import com.hartwig.minijd.MiniJdException;

/**
 * The members of an association {@code (a, b, ...)} do not expand to the same number of values.
 */
public class AssociationCardinalityException extends MiniJdException {
    public AssociationCardinalityException(final String message) {
        super(message);
    }
}
