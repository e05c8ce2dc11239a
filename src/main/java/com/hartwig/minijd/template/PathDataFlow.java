package com.hartwig.minijd.template;

public enum PathDataFlow {
    NONE,
    IN,
    OUT,
    INOUT
}
