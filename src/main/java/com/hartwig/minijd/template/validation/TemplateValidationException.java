package com.hartwig.minijd.template.validation;

import java.util.List;
import java.util.stream.Collectors;

import com.hartwig.minijd.MiniJdException;

public class TemplateValidationException extends MiniJdException {
    private final List<ValidationDiagnostic> diagnostics;

    public TemplateValidationException(final List<ValidationDiagnostic> diagnostics) {
        super("Template is invalid:\n" + diagnostics.stream().map(ValidationDiagnostic::describe).collect(Collectors.joining("\n")));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<ValidationDiagnostic> getDiagnostics() {
        return diagnostics;
    }
}
