package com.hartwig.minijd.template;

public enum EmbeddedFileType {
    TEXT
}
