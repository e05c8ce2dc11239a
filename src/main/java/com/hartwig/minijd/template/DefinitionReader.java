package com.hartwig.minijd.template;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.hartwig.minijd.session.SessionConfiguration;

/**
 * Reads job templates and session configuration. Accepts YAML as well as JSON documents.
 */
public class DefinitionReader {
    private final ObjectMapper objectMapper;

    public DefinitionReader() {
        objectMapper = new ObjectMapper(new YAMLFactory());
        objectMapper.registerModule(new Jdk8Module());
    }

    public JobTemplate readTemplate(InputStream template) throws IOException {
        return objectMapper.readValue(template, JobTemplate.class);
    }

    public JobTemplate readTemplate(Path template) throws IOException {
        try (var inputStream = Files.newInputStream(template)) {
            return readTemplate(inputStream);
        }
    }

    public SessionConfiguration readSessionConfiguration(InputStream configuration) throws IOException {
        return objectMapper.readValue(configuration, SessionConfiguration.class);
    }
}
