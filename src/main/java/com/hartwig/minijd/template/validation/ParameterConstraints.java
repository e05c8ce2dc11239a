package com.hartwig.minijd.template.validation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.hartwig.minijd.template.ParameterDefinition;
import com.hartwig.minijd.template.ParameterType;

/**
 * Type specific constraint checks of job parameters, looked up by parameter type.
 */
public final class ParameterConstraints {
    private static final Map<ParameterType, TypeRules> RULES_BY_TYPE = new EnumMap<>(ParameterType.class);

    static {
        RULES_BY_TYPE.put(ParameterType.INT, new NumericRules(true));
        RULES_BY_TYPE.put(ParameterType.FLOAT, new NumericRules(false));
        RULES_BY_TYPE.put(ParameterType.STRING, new TextRules(false));
        RULES_BY_TYPE.put(ParameterType.PATH, new TextRules(true));
    }

    private ParameterConstraints() {
    }

    /**
     * Problems with the definition itself: constraints that do not apply to its type, or that contradict each other, the
     * default value or the allowed values.
     */
    public static List<String> checkDefinition(ParameterDefinition definition) {
        var rules = RULES_BY_TYPE.get(definition.type());
        var problems = rules.checkDefinition(definition);
        for (String allowed : definition.allowedValues()) {
            rules.checkValue(definition, allowed, false).forEach(problem -> problems.add("allowed value " + problem));
        }
        definition.defaultValue()
                .ifPresent(defaultValue -> rules.checkValue(definition, defaultValue, true)
                        .forEach(problem -> problems.add("default value " + problem)));
        return problems;
    }

    /**
     * Problems with a value bound to the parameter.
     */
    public static List<String> checkValue(ParameterDefinition definition, String value) {
        return RULES_BY_TYPE.get(definition.type()).checkValue(definition, value, true);
    }

    private interface TypeRules {
        List<String> checkDefinition(ParameterDefinition definition);

        List<String> checkValue(ParameterDefinition definition, String value, boolean checkAllowedValues);
    }

    private static final class NumericRules implements TypeRules {
        private final boolean integral;

        NumericRules(final boolean integral) {
            this.integral = integral;
        }

        @Override
        public List<String> checkDefinition(ParameterDefinition definition) {
            var problems = new ArrayList<String>();
            if (definition.minLength().isPresent() || definition.maxLength().isPresent()) {
                problems.add(String.format("minLength and maxLength do not apply to %s parameters", definition.type()));
            }
            if (definition.objectType().isPresent() || definition.dataFlow().isPresent()) {
                problems.add("objectType and dataFlow only apply to PATH parameters");
            }
            if (integral) {
                definition.minValue().filter(min -> !isIntegral(min)).ifPresent(min -> problems.add("minValue must be an integer"));
                definition.maxValue().filter(max -> !isIntegral(max)).ifPresent(max -> problems.add("maxValue must be an integer"));
            }
            if (definition.minValue().isPresent() && definition.maxValue().isPresent()
                    && definition.minValue().get().compareTo(definition.maxValue().get()) > 0) {
                problems.add(String.format("minValue %s is larger than maxValue %s",
                        definition.minValue().get().toPlainString(),
                        definition.maxValue().get().toPlainString()));
            }
            return problems;
        }

        @Override
        public List<String> checkValue(ParameterDefinition definition, String value, boolean checkAllowedValues) {
            var problems = new ArrayList<String>();
            BigDecimal number;
            try {
                number = new BigDecimal(value.strip());
            } catch (NumberFormatException e) {
                problems.add(String.format("'%s' is not a valid %s", value, definition.type()));
                return problems;
            }
            if (integral && !isIntegral(number)) {
                problems.add(String.format("'%s' is not a valid INT", value));
                return problems;
            }
            definition.minValue()
                    .filter(min -> number.compareTo(min) < 0)
                    .ifPresent(min -> problems.add(String.format("'%s' is less than minValue %s", value, min.toPlainString())));
            definition.maxValue()
                    .filter(max -> number.compareTo(max) > 0)
                    .ifPresent(max -> problems.add(String.format("'%s' is larger than maxValue %s", value, max.toPlainString())));
            if (checkAllowedValues && !definition.allowedValues().isEmpty() && definition.allowedValues()
                    .stream()
                    .noneMatch(allowed -> sameNumber(allowed, number))) {
                problems.add(String.format("'%s' is not one of the allowed values %s", value, definition.allowedValues()));
            }
            return problems;
        }

        private static boolean isIntegral(BigDecimal number) {
            return number.scale() <= 0;
        }

        private static boolean sameNumber(String allowed, BigDecimal number) {
            try {
                return new BigDecimal(allowed.strip()).compareTo(number) == 0;
            } catch (NumberFormatException e) {
                return false;
            }
        }
    }

    private static final class TextRules implements TypeRules {
        private final boolean path;

        TextRules(final boolean path) {
            this.path = path;
        }

        @Override
        public List<String> checkDefinition(ParameterDefinition definition) {
            var problems = new ArrayList<String>();
            if (definition.minValue().isPresent() || definition.maxValue().isPresent()) {
                problems.add(String.format("minValue and maxValue do not apply to %s parameters", definition.type()));
            }
            if (!path && (definition.objectType().isPresent() || definition.dataFlow().isPresent())) {
                problems.add("objectType and dataFlow only apply to PATH parameters");
            }
            definition.minLength().filter(min -> min < 0).ifPresent(min -> problems.add("minLength must not be negative"));
            definition.maxLength().filter(max -> max < 1).ifPresent(max -> problems.add("maxLength must be positive"));
            if (definition.minLength().isPresent() && definition.maxLength().isPresent()
                    && definition.minLength().get() > definition.maxLength().get()) {
                problems.add(String.format("minLength %d is larger than maxLength %d",
                        definition.minLength().get(),
                        definition.maxLength().get()));
            }
            return problems;
        }

        @Override
        public List<String> checkValue(ParameterDefinition definition, String value, boolean checkAllowedValues) {
            var problems = new ArrayList<String>();
            definition.minLength()
                    .filter(min -> value.length() < min)
                    .ifPresent(min -> problems.add(String.format("'%s' is shorter than minLength %d", value, min)));
            definition.maxLength()
                    .filter(max -> value.length() > max)
                    .ifPresent(max -> problems.add(String.format("'%s' is longer than maxLength %d", value, max)));
            if (checkAllowedValues && !definition.allowedValues().isEmpty() && !definition.allowedValues().contains(value)) {
                problems.add(String.format("'%s' is not one of the allowed values %s", value, definition.allowedValues()));
            }
            return problems;
        }
    }
}
