package com.hartwig.minijd.template.validation;

import java.util.List;

/**
 * The step dependencies of a template form a cycle.
 */
public class CyclicDependencyException extends TemplateValidationException {
    private final List<String> cycle;

    public CyclicDependencyException(final List<String> cycle, final List<ValidationDiagnostic> diagnostics) {
        super(diagnostics);
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Step names along the cycle, the first name repeated at the end.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
