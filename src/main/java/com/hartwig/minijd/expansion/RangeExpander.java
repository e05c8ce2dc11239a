package com.hartwig.minijd.expansion;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.hartwig.minijd.format.FormatString;
import com.hartwig.minijd.format.SymbolTable;
import com.hartwig.minijd.template.ParameterType;
import com.hartwig.minijd.template.TaskParameterDefinition;

/**
 * Expands the range of a task parameter into its ordered values. Format strings in the range are resolved against the job
 * parameters first.
 */
public final class RangeExpander {
    private RangeExpander() {
    }

    public static List<TaskParameterValue> expand(TaskParameterDefinition definition, SymbolTable jobSymbols) {
        var range = definition.range();
        var type = definition.type();
        var values = new ArrayList<TaskParameterValue>();
        if (range.isExpression()) {
            var expression = parseExpression(definition, jobSymbols);
            checkSize(definition.name(), expression.size());
            for (Long value : expression.expand()) {
                values.add(TaskParameterValue.of(type, Long.toString(value)));
            }
            return values;
        }
        if (range.getValues().isEmpty()) {
            throw new RangeExpansionException(String.format("Task parameter '%s' has no values", definition.name()));
        }
        for (String rawValue : range.getValues()) {
            var value = FormatString.resolve(rawValue, jobSymbols);
            checkType(definition.name(), type, value);
            values.add(TaskParameterValue.of(type, value));
        }
        return values;
    }

    /**
     * Number of values of the range, without expanding it.
     */
    public static long size(TaskParameterDefinition definition, SymbolTable jobSymbols) {
        var range = definition.range();
        return range.isExpression() ? parseExpression(definition, jobSymbols).size() : range.getValues().size();
    }

    /**
     * @throws RangeExpansionException if a range or a step has more values than {@link TaskRunExpander#MAX_TASK_RUNS}
     */
    static void checkSize(String name, long size) {
        if (size > TaskRunExpander.MAX_TASK_RUNS) {
            throw new RangeExpansionException(String.format("Task parameter '%s' has %d values, more than the maximum of %d tasks per step",
                    name,
                    size,
                    TaskRunExpander.MAX_TASK_RUNS));
        }
    }

    private static IntRangeExpression parseExpression(TaskParameterDefinition definition, SymbolTable jobSymbols) {
        if (definition.type() != ParameterType.INT) {
            throw new RangeExpansionException(String.format("Task parameter '%s' of type %s must list its values, range expressions are for INT only",
                    definition.name(),
                    definition.type()));
        }
        return IntRangeExpression.parse(FormatString.resolve(definition.range().getExpression().orElseThrow(), jobSymbols));
    }

    static void checkType(String name, ParameterType type, String value) {
        try {
            if (type == ParameterType.INT) {
                Long.parseLong(value.strip());
            } else if (type == ParameterType.FLOAT) {
                new BigDecimal(value.strip());
            }
        } catch (NumberFormatException e) {
            throw new RangeExpansionException(String.format("Value '%s' of task parameter '%s' is not a valid %s", value, name, type));
        }
    }
}
