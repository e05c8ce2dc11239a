package com.hartwig.minijd.expansion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Tree of product ({@code a * b}) and association ({@code (a, b)}) nodes over task parameter names.
 *
 * <pre>
 * expr := term ('*' term)*
 * term := NAME | '(' expr (',' expr)* ')'
 * </pre>
 * <p>
 * A parenthesised single expression only groups. Products vary their left operand slowest.
 */
public abstract class CombinationExpression {

    public static CombinationExpression parse(String text) {
        return new CombinationParser(text).parse();
    }

    /**
     * Product of the given parameters, in the given order.
     */
    public static CombinationExpression productOf(List<String> names) {
        if (names.size() == 1) {
            return new Parameter(names.get(0));
        }
        return new Product(names.stream().map(Parameter::new).collect(Collectors.toList()));
    }

    /**
     * Evaluates the expression into partial task runs, each mapping parameter names to one value.
     *
     * @throws AssociationCardinalityException when an association zips sequences of different length
     */
    public abstract List<Map<String, TaskParameterValue>> evaluate(Map<String, List<TaskParameterValue>> valuesByName);

    /**
     * Number of task runs the expression produces, without materializing them.
     */
    public abstract long cardinality(Map<String, Integer> sizesByName);

    /**
     * Parameter names in order of appearance, duplicates included.
     */
    public abstract List<String> parameterNames();

    static final class Parameter extends CombinationExpression {
        private final String name;

        Parameter(final String name) {
            this.name = name;
        }

        @Override
        public List<Map<String, TaskParameterValue>> evaluate(Map<String, List<TaskParameterValue>> valuesByName) {
            var values = valuesByName.get(name);
            if (values == null) {
                throw new IllegalArgumentException(String.format("No values for task parameter '%s'", name));
            }
            return values.stream().map(value -> Map.of(name, value)).collect(Collectors.toList());
        }

        @Override
        public long cardinality(Map<String, Integer> sizesByName) {
            var size = sizesByName.get(name);
            if (size == null) {
                throw new IllegalArgumentException(String.format("No size for task parameter '%s'", name));
            }
            return size;
        }

        @Override
        public List<String> parameterNames() {
            return List.of(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    static final class Product extends CombinationExpression {
        private final List<CombinationExpression> operands;

        Product(final List<CombinationExpression> operands) {
            this.operands = List.copyOf(operands);
        }

        @Override
        public List<Map<String, TaskParameterValue>> evaluate(Map<String, List<TaskParameterValue>> valuesByName) {
            List<Map<String, TaskParameterValue>> result = List.of(Map.of());
            for (CombinationExpression operand : operands) {
                var operandValues = operand.evaluate(valuesByName);
                var combined = new ArrayList<Map<String, TaskParameterValue>>(result.size() * operandValues.size());
                for (Map<String, TaskParameterValue> left : result) {
                    for (Map<String, TaskParameterValue> right : operandValues) {
                        combined.add(merge(left, right));
                    }
                }
                result = combined;
            }
            return result;
        }

        @Override
        public long cardinality(Map<String, Integer> sizesByName) {
            long size = 1;
            for (CombinationExpression operand : operands) {
                size = Math.multiplyExact(size, operand.cardinality(sizesByName));
            }
            return size;
        }

        @Override
        public List<String> parameterNames() {
            return operands.stream().flatMap(operand -> operand.parameterNames().stream()).collect(Collectors.toList());
        }

        @Override
        public String toString() {
            return operands.stream().map(CombinationExpression::toString).collect(Collectors.joining(" * "));
        }
    }

    static final class Association extends CombinationExpression {
        private final List<CombinationExpression> members;

        Association(final List<CombinationExpression> members) {
            this.members = List.copyOf(members);
        }

        @Override
        public List<Map<String, TaskParameterValue>> evaluate(Map<String, List<TaskParameterValue>> valuesByName) {
            var memberValues = members.stream().map(member -> member.evaluate(valuesByName)).collect(Collectors.toList());
            checkSameSize(memberValues.stream().map(values -> (long) values.size()).collect(Collectors.toList()));
            var result = new ArrayList<Map<String, TaskParameterValue>>();
            for (int i = 0; i < memberValues.get(0).size(); i++) {
                Map<String, TaskParameterValue> zipped = Map.of();
                for (List<Map<String, TaskParameterValue>> values : memberValues) {
                    zipped = merge(zipped, values.get(i));
                }
                result.add(zipped);
            }
            return result;
        }

        @Override
        public long cardinality(Map<String, Integer> sizesByName) {
            var sizes = members.stream().map(member -> member.cardinality(sizesByName)).collect(Collectors.toList());
            checkSameSize(sizes);
            return sizes.get(0);
        }

        private void checkSameSize(List<Long> sizes) {
            if (sizes.stream().distinct().count() > 1) {
                var described = new ArrayList<String>();
                for (int i = 0; i < members.size(); i++) {
                    described.add(String.format("%s has %d", members.get(i), sizes.get(i)));
                }
                throw new AssociationCardinalityException(String.format("Association %s requires equal numbers of values, but %s",
                        this,
                        String.join(", ", described)));
            }
        }

        @Override
        public List<String> parameterNames() {
            return members.stream().flatMap(member -> member.parameterNames().stream()).collect(Collectors.toList());
        }

        @Override
        public String toString() {
            return members.stream().map(CombinationExpression::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }

    private static Map<String, TaskParameterValue> merge(Map<String, TaskParameterValue> left, Map<String, TaskParameterValue> right) {
        var merged = new LinkedHashMap<String, TaskParameterValue>(left);
        merged.putAll(right);
        return merged;
    }
}
