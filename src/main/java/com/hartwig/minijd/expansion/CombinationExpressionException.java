package com.hartwig.minijd.expansion;

import com.hartwig.minijd.MiniJdException;

/**
 * A combination expression is malformed or does not match the step's task parameters.
 */
public class CombinationExpressionException extends MiniJdException {
    public CombinationExpressionException(final String message) {
        super(message);
    }
}
