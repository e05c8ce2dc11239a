package com.hartwig.minijd.template;

import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableEmbeddedFile.class)
@JsonSerialize(as = ImmutableEmbeddedFile.class)
public interface EmbeddedFile {
    String name();

    @Value.Default
    default EmbeddedFileType type() {
        return EmbeddedFileType.TEXT;
    }

    /**
     * Name of the file on disk. A unique name is generated when absent.
     */
    Optional<String> filename();

    /**
     * Whether the executable bit is set on the materialized file.
     */
    @Value.Default
    default boolean runnable() {
        return false;
    }

    /**
     * File contents. Format string, resolved in the scope of the owning script.
     */
    String data();

    static ImmutableEmbeddedFile.Builder builder() {
        return ImmutableEmbeddedFile.builder();
    }
}
