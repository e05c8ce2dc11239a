package com.hartwig.minijd.format;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from symbol names such as {@code Task.Param.Frame} to their values. Adding symbols returns a new table.
 */
public final class SymbolTable {
    private final String scope;
    private final Map<String, String> values;

    private SymbolTable(final String scope, final Map<String, String> values) {
        this.scope = scope;
        this.values = values;
    }

    public static SymbolTable empty(String scope) {
        return new SymbolTable(scope, Map.of());
    }

    public Optional<String> get(String symbol) {
        return Optional.ofNullable(values.get(symbol));
    }

    public boolean contains(String symbol) {
        return values.containsKey(symbol);
    }

    public SymbolTable with(String symbol, String value) {
        return withAll(Map.of(symbol, value));
    }

    public SymbolTable withAll(Map<String, String> symbols) {
        var copy = new LinkedHashMap<>(values);
        copy.putAll(symbols);
        return new SymbolTable(scope, Map.copyOf(copy));
    }

    public SymbolTable withAll(SymbolTable other) {
        return withAll(other.values);
    }

    /**
     * Same symbols, described as a different scope in error messages.
     */
    public SymbolTable inScope(String newScope) {
        return new SymbolTable(newScope, values);
    }

    public String getScope() {
        return scope;
    }

    public Set<String> getSymbols() {
        return values.keySet();
    }

    @Override
    public String toString() {
        return scope + values;
    }
}
