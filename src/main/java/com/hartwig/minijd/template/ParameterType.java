package com.hartwig.minijd.template;

public enum ParameterType {
    STRING,
    PATH,
    INT,
    FLOAT;

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}
