package com.hartwig.minijd.template;

public enum PathObjectType {
    FILE,
    DIRECTORY
}
