package com.hartwig.minijd.template.validation;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.hartwig.minijd.template.JobTemplate;
import com.hartwig.minijd.template.Step;

/**
 * A template that passed validation. Steps are addressed by handle, their index in declaration order, and dependencies are
 * stored as handles so nothing is looked up by name after validation.
 */
public final class ValidatedJobTemplate {
    private final JobTemplate template;
    private final Map<String, Integer> handlesByName;
    private final List<List<Integer>> dependencies;
    private final List<Integer> topologicalOrder;

    ValidatedJobTemplate(final JobTemplate template, final Map<String, Integer> handlesByName, final List<List<Integer>> dependencies,
            final List<Integer> topologicalOrder) {
        this.template = template;
        this.handlesByName = Map.copyOf(handlesByName);
        this.dependencies = dependencies.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
        this.topologicalOrder = List.copyOf(topologicalOrder);
    }

    public JobTemplate getTemplate() {
        return template;
    }

    public int stepCount() {
        return template.steps().size();
    }

    public Step getStep(int handle) {
        return template.steps().get(handle);
    }

    public int handleOf(String stepName) {
        var handle = handlesByName.get(stepName);
        if (handle == null) {
            throw new IllegalArgumentException(String.format("No step named '%s' in template '%s'", stepName, template.name()));
        }
        return handle;
    }

    /**
     * Handles of the steps the given step depends on, in declaration order of the dependencies.
     */
    public List<Integer> getDependencies(int handle) {
        return dependencies.get(handle);
    }

    /**
     * Every step after all of its dependencies. Ties are broken by declaration order, so the order is stable.
     */
    public List<Integer> getTopologicalOrder() {
        return topologicalOrder;
    }
}
