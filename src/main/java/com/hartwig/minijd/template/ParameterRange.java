package com.hartwig.minijd.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The values of a task parameter: either an explicit list, or (INT only) a range expression such as {@code "1-100:10,105"}.
 */
public final class ParameterRange {
    private final String expression;
    private final List<String> values;

    private ParameterRange(final String expression, final List<String> values) {
        this.expression = expression;
        this.values = values;
    }

    public static ParameterRange expression(String expression) {
        return new ParameterRange(Objects.requireNonNull(expression), List.of());
    }

    public static ParameterRange values(List<String> values) {
        return new ParameterRange(null, List.copyOf(values));
    }

    public static ParameterRange values(String... values) {
        return values(List.of(values));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static ParameterRange fromJson(JsonNode node) {
        if (node.isArray()) {
            var values = new ArrayList<String>();
            for (JsonNode element : node) {
                if (!element.isValueNode() || element.isNull()) {
                    throw new IllegalArgumentException("Range list values must be scalars, but found: " + element);
                }
                values.add(element.asText());
            }
            return values(values);
        }
        if (node.isValueNode() && !node.isNull()) {
            return expression(node.asText());
        }
        throw new IllegalArgumentException("Range must be a list of values or a range expression, but found: " + node);
    }

    public Optional<String> getExpression() {
        return Optional.ofNullable(expression);
    }

    public List<String> getValues() {
        return values;
    }

    public boolean isExpression() {
        return expression != null;
    }

    @JsonValue
    Object toJson() {
        return isExpression() ? expression : values;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var that = (ParameterRange) o;
        return Objects.equals(expression, that.expression) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, values);
    }

    @Override
    public String toString() {
        return isExpression() ? expression : values.toString();
    }
}
