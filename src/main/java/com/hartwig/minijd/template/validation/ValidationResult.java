package com.hartwig.minijd.template.validation;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of validating a template: the ordered diagnostics and, when there are none, the validated template.
 */
public final class ValidationResult {
    private final List<ValidationDiagnostic> diagnostics;
    private final List<String> cycle;
    private final ValidatedJobTemplate template;

    private ValidationResult(final List<ValidationDiagnostic> diagnostics, final List<String> cycle, final ValidatedJobTemplate template) {
        this.diagnostics = List.copyOf(diagnostics);
        this.cycle = List.copyOf(cycle);
        this.template = template;
    }

    public static ValidationResult valid(ValidatedJobTemplate template) {
        return new ValidationResult(List.of(), List.of(), template);
    }

    public static ValidationResult invalid(List<ValidationDiagnostic> diagnostics, List<String> cycle) {
        if (diagnostics.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one diagnostic");
        }
        return new ValidationResult(diagnostics, cycle, null);
    }

    public boolean isValid() {
        return template != null;
    }

    public List<ValidationDiagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * The dependency cycle found, if any, as step names with the first repeated at the end.
     */
    public List<String> cycle() {
        return cycle;
    }

    public Optional<ValidatedJobTemplate> getTemplate() {
        return Optional.ofNullable(template);
    }

    /**
     * @throws CyclicDependencyException if the steps form a cycle
     * @throws TemplateValidationException for any other problem
     */
    public ValidatedJobTemplate orElseThrow() {
        if (isValid()) {
            return template;
        }
        if (!cycle.isEmpty()) {
            throw new CyclicDependencyException(cycle, diagnostics);
        }
        throw new TemplateValidationException(diagnostics);
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{valid}" : "ValidationResult{invalid, " + diagnostics + "}";
    }
}
