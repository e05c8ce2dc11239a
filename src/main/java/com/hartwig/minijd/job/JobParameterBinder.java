package com.hartwig.minijd.job;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

import com.hartwig.minijd.pathmapping.PathMapper;
import com.hartwig.minijd.template.JobTemplate;
import com.hartwig.minijd.template.ParameterDefinition;
import com.hartwig.minijd.template.ParameterType;
import com.hartwig.minijd.template.validation.ParameterConstraints;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds submitted values, or defaults, to the parameters of a template. PATH values are rewritten for the execution host.
 */
public class JobParameterBinder {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobParameterBinder.class);

    private final PathMapper pathMapper;

    public JobParameterBinder(final PathMapper pathMapper) {
        this.pathMapper = pathMapper;
    }

    /**
     * @throws JobParameterException listing every missing, unknown or invalid value
     */
    public JobParameterValues bind(JobTemplate template, Map<String, String> suppliedValues) {
        var problems = new ArrayList<String>();
        var values = new LinkedHashMap<String, ParameterValue>();
        var known = new ArrayList<String>();
        for (ParameterDefinition definition : template.parameterDefinitions()) {
            known.add(definition.name());
            var supplied = suppliedValues.get(definition.name());
            var rawValue = supplied != null ? supplied : definition.defaultValue().orElse(null);
            if (rawValue == null) {
                problems.add(String.format("Value for parameter '%s' must be provided", definition.name()));
                continue;
            }
            var valueProblems = ParameterConstraints.checkValue(definition, rawValue);
            if (!valueProblems.isEmpty()) {
                valueProblems.forEach(problem -> problems.add(String.format("Parameter '%s': %s", definition.name(), problem)));
                continue;
            }
            var value = definition.type() == ParameterType.PATH ? pathMapper.translate(rawValue) : rawValue;
            if (!value.equals(rawValue)) {
                LOGGER.info("Parameter [{}] mapped from '{}' to '{}'", definition.name(), rawValue, value);
            }
            values.put(definition.name(),
                    ImmutableParameterValue.builder().type(definition.type()).value(value).rawValue(rawValue).build());
        }
        for (String name : suppliedValues.keySet()) {
            if (!known.contains(name)) {
                problems.add(String.format("Parameter '%s' is not defined by template '%s'", name, template.name()));
            }
        }
        if (!problems.isEmpty()) {
            throw new JobParameterException(problems);
        }
        return JobParameterValues.of(values);
    }
}
