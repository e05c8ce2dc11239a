package com.hartwig.minijd.template;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableJobTemplate.class)
@JsonSerialize(as = ImmutableJobTemplate.class)
public interface JobTemplate {
    String SPECIFICATION_VERSION = "jobtemplate-2023-09";

    /**
     * Schema identifier, only {@value SPECIFICATION_VERSION} is understood.
     */
    String specificationVersion();

    /**
     * Job name. Format string that may reference job parameters.
     */
    String name();

    Optional<String> description();

    /**
     * Job parameters, bound once per submission.
     */
    List<ParameterDefinition> parameterDefinitions();

    /**
     * Steps, in declaration order.
     */
    List<Step> steps();

    /**
     * Environments entered by every session of this job, before any step environment.
     */
    @JsonAlias("environments")
    List<Environment> jobEnvironments();

    static ImmutableJobTemplate.Builder builder() {
        return ImmutableJobTemplate.builder().specificationVersion(SPECIFICATION_VERSION);
    }
}
