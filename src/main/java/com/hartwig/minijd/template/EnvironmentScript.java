package com.hartwig.minijd.template;

import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableEnvironmentScript.class)
@JsonSerialize(as = ImmutableEnvironmentScript.class)
public interface EnvironmentScript {
    EnvironmentActions actions();

    /**
     * Files written at session setup, referenced as {@code {{Env.File.<name>}}}.
     */
    List<EmbeddedFile> embeddedFiles();

    static ImmutableEnvironmentScript.Builder builder() {
        return ImmutableEnvironmentScript.builder();
    }
}
