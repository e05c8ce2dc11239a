package com.hartwig.minijd.job;

import java.util.List;

import com.hartwig.minijd.MiniJdException;

/**
 * The values supplied for a job do not satisfy its parameter definitions.
 */
public class JobParameterException extends MiniJdException {
    private final List<String> problems;

    public JobParameterException(final List<String> problems) {
        super("Invalid job parameters: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
