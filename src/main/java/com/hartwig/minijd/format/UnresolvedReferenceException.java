package com.hartwig.minijd.format;

/**
 * A placeholder refers to a value that does not exist in the scope it is resolved in.
 */
public class UnresolvedReferenceException extends FormatStringException {
    private final String placeholder;
    private final String scope;

    public UnresolvedReferenceException(final String placeholder, final String scope) {
        super(String.format("Unresolved reference '%s' in %s", placeholder, scope));
        this.placeholder = placeholder;
        this.scope = scope;
    }

    /**
     * Exact placeholder text as written in the template, braces included.
     */
    public String getPlaceholder() {
        return placeholder;
    }

    public String getScope() {
        return scope;
    }
}
