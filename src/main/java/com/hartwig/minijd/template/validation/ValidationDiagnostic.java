package com.hartwig.minijd.template.validation;

import org.immutables.value.Value;

/**
 * One problem found in a template. The location is a path into the document such as
 * {@code steps[Render].script.actions.onRun.args[1]}.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ValidationDiagnostic {
    @Value.Parameter
    String location();

    @Value.Parameter
    String message();

    static ValidationDiagnostic of(String location, String message) {
        return ImmutableValidationDiagnostic.of(location, message);
    }

    default String describe() {
        return location() + ": " + message();
    }
}
