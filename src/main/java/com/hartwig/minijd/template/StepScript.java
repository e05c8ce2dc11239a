package com.hartwig.minijd.template;

import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableStepScript.class)
@JsonSerialize(as = ImmutableStepScript.class)
public interface StepScript {
    StepActions actions();

    /**
     * Files written into the session before each task, referenced as {@code {{Task.File.<name>}}}.
     */
    List<EmbeddedFile> embeddedFiles();

    static ImmutableStepScript.Builder builder() {
        return ImmutableStepScript.builder();
    }
}
