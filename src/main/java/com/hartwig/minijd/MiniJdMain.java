package com.hartwig.minijd;

import java.io.FileInputStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import com.hartwig.minijd.pathmapping.PathMapper;
import com.hartwig.minijd.pathmapping.PathMappingRulesFile;
import com.hartwig.minijd.session.SessionConfiguration;
import com.hartwig.minijd.session.SessionEventListener;
import com.hartwig.minijd.template.DefinitionReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;

public class MiniJdMain implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(MiniJdMain.class);

    @CommandLine.Parameters(paramLabel = "template",
                            index = "0",
                            description = "Path to the job template, YAML or JSON")
    private Path templatePath;

    @CommandLine.Option(names = { "-p", "--parameter" },
                        description = "Job parameter value as Name=Value, repeatable")
    private Map<String, String> parameters = new LinkedHashMap<>();

    @CommandLine.Option(names = { "--path-mapping-rules" },
                        description = "Path mapping configuration file")
    private Path pathMappingRulesPath;

    @CommandLine.Option(names = { "--config" },
                        description = "Session configuration file")
    private Path configPath;

    @CommandLine.Option(names = { "--step" },
                        description = "Step to run together with its dependencies, repeatable. Runs all steps when absent.")
    private List<String> steps = List.of();

    @Override
    public Integer call() {
        JobTemplateEngine engine = null;
        try (var template = new FileInputStream(templatePath.toFile())) {
            var configuration = SessionConfiguration.defaults();
            if (configPath != null) {
                try (var config = new FileInputStream(configPath.toFile())) {
                    configuration = new DefinitionReader().readSessionConfiguration(config);
                }
            }
            var pathMapper = pathMappingRulesPath != null
                    ? PathMapper.forHost(PathMappingRulesFile.read(pathMappingRulesPath))
                    : PathMapper.none();
            engine = new JobTemplateEngine(configuration, pathMapper);

            var validation = engine.validate(template);
            if (!validation.isValid()) {
                validation.diagnostics().forEach(diagnostic -> LOGGER.error("Invalid template: {}", diagnostic.describe()));
                return 1;
            }
            var validated = validation.orElseThrow();
            var values = engine.bindParameters(validated, parameters);

            LOGGER.info("Starting job from template {}.", templatePath);
            var success = engine.runJob(validated, values, new LinkedHashSet<>(steps), Map.of(), SessionEventListener.none()).get();
            LOGGER.info("Finished running job. Final result: {}.", success ? "Success" : "Failed");
            return success ? 0 : 1;
        } catch (ExecutionException e) {
            LOGGER.error("Job failed: {}", e.getCause().getMessage());
            return 1;
        } catch (Exception e) {
            LOGGER.error("Unexpected exception", e);
            return 1;
        } finally {
            if (engine != null) {
                engine.shutdown();
            }
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new MiniJdMain()).execute(args));
    }
}
