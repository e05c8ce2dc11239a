package com.hartwig.minijd.expansion;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for combination expressions.
 */
class CombinationParser {
    private final String text;
    private int position;

    CombinationParser(final String text) {
        this.text = text;
    }

    CombinationExpression parse() {
        if (text == null || text.isBlank()) {
            throw error("Combination expression is empty");
        }
        var expression = parseProduct();
        skipWhitespace();
        if (position < text.length()) {
            throw error(String.format("Unexpected '%c' at position %d", text.charAt(position), position));
        }
        return expression;
    }

    private CombinationExpression parseProduct() {
        var operands = new ArrayList<CombinationExpression>();
        operands.add(parseTerm());
        while (peek() == '*') {
            position++;
            operands.add(parseTerm());
        }
        return operands.size() == 1 ? operands.get(0) : new CombinationExpression.Product(operands);
    }

    private CombinationExpression parseTerm() {
        var next = peek();
        if (next == '(') {
            position++;
            List<CombinationExpression> members = new ArrayList<>();
            members.add(parseProduct());
            while (peek() == ',') {
                position++;
                members.add(parseProduct());
            }
            if (peek() != ')') {
                throw error(String.format("Expected ')' at position %d", position));
            }
            position++;
            return members.size() == 1 ? members.get(0) : new CombinationExpression.Association(members);
        }
        if (Character.isLetter(next) || next == '_') {
            int start = position;
            while (position < text.length() && (Character.isLetterOrDigit(text.charAt(position)) || text.charAt(position) == '_')) {
                position++;
            }
            return new CombinationExpression.Parameter(text.substring(start, position));
        }
        if (next == 0) {
            throw error("Unexpected end of expression");
        }
        throw error(String.format("Unexpected '%c' at position %d", next, position));
    }

    private char peek() {
        skipWhitespace();
        return position < text.length() ? text.charAt(position) : 0;
    }

    private void skipWhitespace() {
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
    }

    private CombinationExpressionException error(String message) {
        return new CombinationExpressionException(String.format("Invalid combination expression '%s': %s", text, message));
    }
}
