package com.hartwig.minijd.job;

import java.util.Map;

import com.hartwig.minijd.format.FormatString;
import com.hartwig.minijd.format.SymbolNames;
import com.hartwig.minijd.format.SymbolTable;

import org.immutables.value.Value;

/**
 * Job parameters bound for one submission.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface JobParameterValues {
    Map<String, ParameterValue> values();

    static JobParameterValues empty() {
        return ImmutableJobParameterValues.builder().build();
    }

    static JobParameterValues of(Map<String, ParameterValue> values) {
        return ImmutableJobParameterValues.builder().values(values).build();
    }

    /**
     * {@code Param.<name>} and {@code RawParam.<name>} for every parameter.
     */
    @Value.Lazy
    default SymbolTable toSymbolTable() {
        var symbols = SymbolTable.empty("job scope");
        for (var entry : values().entrySet()) {
            symbols = symbols.with(SymbolNames.param(entry.getKey()), entry.getValue().value())
                    .with(SymbolNames.rawParam(entry.getKey()), entry.getValue().rawValue());
        }
        return symbols;
    }

    default String resolve(String formatString) {
        return FormatString.resolve(formatString, toSymbolTable());
    }
}
