package com.hartwig.minijd.job;

import com.hartwig.minijd.template.ParameterType;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ParameterValue {
    ParameterType type();

    /**
     * Value as seen on the execution host. Differs from {@link #rawValue()} for path mapped PATH parameters only.
     */
    String value();

    /**
     * Value as submitted.
     */
    String rawValue();

    static ParameterValue of(ParameterType type, String value) {
        return ImmutableParameterValue.builder().type(type).value(value).rawValue(value).build();
    }
}
