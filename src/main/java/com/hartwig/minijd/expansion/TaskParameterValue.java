package com.hartwig.minijd.expansion;

import com.hartwig.minijd.template.ParameterType;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface TaskParameterValue {
    @Value.Parameter
    ParameterType type();

    @Value.Parameter
    String value();

    static TaskParameterValue of(ParameterType type, String value) {
        return ImmutableTaskParameterValue.of(type, value);
    }
}
