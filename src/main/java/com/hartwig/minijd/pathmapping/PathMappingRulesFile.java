package com.hartwig.minijd.pathmapping;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads and writes the {@value PathMappingConfiguration#VERSION} document.
 */
public final class PathMappingRulesFile {
    private static final ObjectMapper READER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper WRITER = new ObjectMapper();

    private PathMappingRulesFile() {
    }

    /**
     * @throws PathMappingException when the document cannot be parsed or has an unsupported version
     */
    public static List<PathMappingRule> read(InputStream inputStream) {
        PathMappingConfiguration configuration;
        try {
            configuration = READER.readValue(inputStream, PathMappingConfiguration.class);
        } catch (IOException e) {
            throw new PathMappingException("Could not read path mapping rules: " + e.getMessage(), e);
        }
        if (!PathMappingConfiguration.VERSION.equals(configuration.version())) {
            throw new PathMappingException(String.format("Unsupported path mapping version '%s', expected '%s'",
                    configuration.version(),
                    PathMappingConfiguration.VERSION));
        }
        return configuration.pathMappingRules();
    }

    public static List<PathMappingRule> read(Path path) {
        try (var inputStream = Files.newInputStream(path)) {
            return read(inputStream);
        } catch (IOException e) {
            throw new PathMappingException("Could not open path mapping rules file " + path, e);
        }
    }

    public static void write(List<PathMappingRule> rules, Path path) throws IOException {
        WRITER.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), PathMappingConfiguration.of(rules));
    }
}
