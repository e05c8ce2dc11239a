package com.hartwig.minijd.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A string with {@code {{ Scope.Name }}} placeholders. Resolution is a single literal substitution pass: resolved values are
 * never scanned for placeholders again.
 */
public final class FormatString {
    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";
    private static final Pattern EXPRESSION = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private final String original;
    private final List<Segment> segments;

    private FormatString(final String original, final List<Segment> segments) {
        this.original = original;
        this.segments = segments;
    }

    public static FormatString parse(String text) {
        Objects.requireNonNull(text);
        var segments = new ArrayList<Segment>();
        int position = 0;
        while (position < text.length()) {
            int open = text.indexOf(OPEN, position);
            if (open < 0) {
                segments.add(Segment.literal(text.substring(position)));
                break;
            }
            if (open > position) {
                segments.add(Segment.literal(text.substring(position, open)));
            }
            int close = text.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                throw new FormatStringException(String.format("Unterminated placeholder at position %d in '%s'", open, text));
            }
            var placeholder = text.substring(open, close + CLOSE.length());
            var expression = text.substring(open + OPEN.length(), close).strip();
            if (!EXPRESSION.matcher(expression).matches()) {
                throw new FormatStringException(String.format("Invalid expression '%s' at position %d in '%s'", placeholder, open, text));
            }
            segments.add(Segment.reference(expression, placeholder));
            position = close + CLOSE.length();
        }
        return new FormatString(text, Collections.unmodifiableList(segments));
    }

    /**
     * Resolves every placeholder against the symbol table.
     *
     * @throws UnresolvedReferenceException naming the first placeholder without a value
     */
    public String resolve(SymbolTable symbols) {
        var builder = new StringBuilder();
        for (Segment segment : segments) {
            if (segment.isReference()) {
                var value = symbols.get(segment.text)
                        .orElseThrow(() -> new UnresolvedReferenceException(segment.placeholder, symbols.getScope()));
                builder.append(value);
            } else {
                builder.append(segment.text);
            }
        }
        return builder.toString();
    }

    public static String resolve(String text, SymbolTable symbols) {
        return parse(text).resolve(symbols);
    }

    /**
     * Symbol names referenced by this string, in order of appearance.
     */
    public List<String> getReferences() {
        return segments.stream().filter(Segment::isReference).map(segment -> segment.text).collect(Collectors.toList());
    }

    /**
     * Placeholders as written, in order of appearance.
     */
    public List<String> getPlaceholders() {
        return segments.stream().filter(Segment::isReference).map(segment -> segment.placeholder).collect(Collectors.toList());
    }

    public boolean hasReferences() {
        return segments.stream().anyMatch(Segment::isReference);
    }

    @Override
    public String toString() {
        return original;
    }

    private static final class Segment {
        private final String text;
        private final String placeholder;

        private Segment(final String text, final String placeholder) {
            this.text = text;
            this.placeholder = placeholder;
        }

        static Segment literal(String text) {
            return new Segment(text, null);
        }

        static Segment reference(String expression, String placeholder) {
            return new Segment(expression, placeholder);
        }

        boolean isReference() {
            return placeholder != null;
        }
    }
}
