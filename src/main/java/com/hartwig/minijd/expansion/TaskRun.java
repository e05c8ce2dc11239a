package com.hartwig.minijd.expansion;

import java.util.Map;
import java.util.stream.Collectors;

import org.immutables.value.Value;

/**
 * One task of a step: a single value for each of the step's task parameters, in declaration order.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface TaskRun {
    Map<String, TaskParameterValue> parameters();

    static TaskRun empty() {
        return ImmutableTaskRun.builder().build();
    }

    static TaskRun of(Map<String, TaskParameterValue> parameters) {
        return ImmutableTaskRun.builder().parameters(parameters).build();
    }

    /**
     * Compact rendering such as {@code Frame=1, Eye=left}, used in logs and events.
     */
    default String describe() {
        return parameters().entrySet()
                .stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue().value())
                .collect(Collectors.joining(", "));
    }
}
