package com.hartwig.minijd.expansion;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.hartwig.minijd.format.SymbolTable;
import com.hartwig.minijd.template.Step;
import com.hartwig.minijd.template.TaskParameterDefinition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the task runs of a step. The same step and job parameters always give the same runs in the same order.
 */
public final class TaskRunExpander {
    private static final Logger LOGGER = LoggerFactory.getLogger(TaskRunExpander.class);

    /**
     * Largest number of task runs a single step may expand to.
     */
    public static final int MAX_TASK_RUNS = 1_000_000;

    private TaskRunExpander() {
    }

    /**
     * @param jobSymbols job scope symbols, used to resolve format strings in the task parameter ranges
     */
    public static List<TaskRun> expand(Step step, SymbolTable jobSymbols) {
        if (step.parameterSpace().isEmpty()) {
            return List.of(TaskRun.empty());
        }
        var space = step.parameterSpace().get();
        var definitions = space.taskParameterDefinitions();
        var names = definitions.stream().map(TaskParameterDefinition::name).collect(Collectors.toList());
        var combination = space.combination().map(CombinationExpression::parse).orElseGet(() -> CombinationExpression.productOf(names));
        checkTaskCount(step, combination, jobSymbols);
        var valuesByName = new LinkedHashMap<String, List<TaskParameterValue>>();
        for (TaskParameterDefinition definition : definitions) {
            valuesByName.put(definition.name(), RangeExpander.expand(definition, jobSymbols));
        }
        var taskRuns = new ArrayList<TaskRun>();
        for (Map<String, TaskParameterValue> parameters : combination.evaluate(valuesByName)) {
            taskRuns.add(TaskRun.of(inDeclarationOrder(names, parameters)));
        }
        LOGGER.debug("Step [{}] expands to {} task(s) using '{}'", step.name(), taskRuns.size(), combination);
        return taskRuns;
    }

    /**
     * Counts the task runs before any of them is built, so an oversized or mismatched parameter space fails fast.
     */
    private static void checkTaskCount(Step step, CombinationExpression combination, SymbolTable jobSymbols) {
        var sizesByName = new HashMap<String, Integer>();
        for (TaskParameterDefinition definition : step.parameterSpace().orElseThrow().taskParameterDefinitions()) {
            var size = RangeExpander.size(definition, jobSymbols);
            RangeExpander.checkSize(definition.name(), size);
            sizesByName.put(definition.name(), (int) size);
        }
        long taskCount;
        try {
            taskCount = combination.cardinality(sizesByName);
        } catch (ArithmeticException e) {
            taskCount = Long.MAX_VALUE;
        }
        if (taskCount > MAX_TASK_RUNS) {
            throw new RangeExpansionException(String.format("Step '%s' expands to more than the maximum of %d tasks", step.name(), MAX_TASK_RUNS));
        }
    }

    /**
     * Task runs given literally instead of expanded from the parameter space. Each run must bind every task parameter of the
     * step and nothing else.
     */
    public static List<TaskRun> fromOverrides(Step step, List<Map<String, String>> overrides) {
        var definitions = step.parameterSpace().map(space -> space.taskParameterDefinitions()).orElse(List.of());
        var taskRuns = new ArrayList<TaskRun>();
        for (Map<String, String> override : overrides) {
            for (String name : override.keySet()) {
                if (definitions.stream().noneMatch(definition -> definition.name().equals(name))) {
                    throw new RangeExpansionException(String.format("Step '%s' has no task parameter '%s'", step.name(), name));
                }
            }
            var parameters = new LinkedHashMap<String, TaskParameterValue>();
            for (TaskParameterDefinition definition : definitions) {
                var value = override.get(definition.name());
                if (value == null) {
                    throw new RangeExpansionException(String.format("Task run %s of step '%s' misses task parameter '%s'",
                            override,
                            step.name(),
                            definition.name()));
                }
                RangeExpander.checkType(definition.name(), definition.type(), value);
                parameters.put(definition.name(), TaskParameterValue.of(definition.type(), value));
            }
            taskRuns.add(TaskRun.of(parameters));
        }
        return taskRuns;
    }

    private static Map<String, TaskParameterValue> inDeclarationOrder(List<String> names, Map<String, TaskParameterValue> parameters) {
        var ordered = new LinkedHashMap<String, TaskParameterValue>();
        for (String name : names) {
            ordered.put(name, parameters.get(name));
        }
        return ordered;
    }
}
