package com.hartwig.minijd;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import com.hartwig.minijd.expansion.TaskRun;
import com.hartwig.minijd.expansion.TaskRunExpander;
import com.hartwig.minijd.job.JobParameterBinder;
import com.hartwig.minijd.job.JobParameterValues;
import com.hartwig.minijd.pathmapping.PathMapper;
import com.hartwig.minijd.session.ActionRunner;
import com.hartwig.minijd.session.ProcessActionRunner;
import com.hartwig.minijd.session.SessionConfiguration;
import com.hartwig.minijd.session.SessionEventListener;
import com.hartwig.minijd.session.SessionPlan;
import com.hartwig.minijd.session.SessionResult;
import com.hartwig.minijd.session.SessionRunner;
import com.hartwig.minijd.template.DefinitionReader;
import com.hartwig.minijd.template.JobTemplate;
import com.hartwig.minijd.template.Step;
import com.hartwig.minijd.template.validation.TemplateValidator;
import com.hartwig.minijd.template.validation.ValidatedJobTemplate;
import com.hartwig.minijd.template.validation.ValidationDiagnostic;
import com.hartwig.minijd.template.validation.ValidationResult;
import com.hartwig.minijd.workflow.LocalStepScheduler;
import com.hartwig.minijd.workflow.StepGraph;
import com.hartwig.minijd.workflow.StepGraph.StepRunningState;
import com.hartwig.minijd.workflow.StepRun;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for running job templates on this host: validate a template, bind its parameters, expand steps into task runs
 * and run them in sessions.
 */
public class JobTemplateEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobTemplateEngine.class);
    private static final int MAX_CONCURRENT_JOBS = 8;

    private final DefinitionReader definitionReader = new DefinitionReader();
    private final TemplateValidator templateValidator = new TemplateValidator();
    private final PathMapper pathMapper;
    private final SessionRunner sessionRunner;
    private final ExecutorService executorService;

    public JobTemplateEngine(final SessionConfiguration configuration, final PathMapper pathMapper, final ActionRunner actionRunner) {
        this.pathMapper = pathMapper;
        this.sessionRunner = new SessionRunner(configuration, pathMapper, actionRunner);
        this.executorService = ThreadUtil.createExecutorService(MAX_CONCURRENT_JOBS, "job-run-thread-%d");
    }

    public JobTemplateEngine(final SessionConfiguration configuration, final PathMapper pathMapper) {
        this(configuration, pathMapper, new ProcessActionRunner());
    }

    /**
     * Parses and validates a YAML or JSON template. A document that cannot be parsed is reported as a diagnostic.
     */
    public ValidationResult validate(InputStream template) {
        JobTemplate parsed;
        try {
            parsed = definitionReader.readTemplate(template);
        } catch (IOException e) {
            LOGGER.warn("Could not parse job template: {}", e.getMessage());
            return ValidationResult.invalid(List.of(ValidationDiagnostic.of("template", e.getMessage())), List.of());
        }
        return validate(parsed);
    }

    public ValidationResult validate(JobTemplate template) {
        return templateValidator.validate(template);
    }

    public JobParameterValues bindParameters(ValidatedJobTemplate template, Map<String, String> suppliedValues) {
        return new JobParameterBinder(pathMapper).bind(template.getTemplate(), suppliedValues);
    }

    public List<TaskRun> expand(Step step, JobParameterValues parameters) {
        return TaskRunExpander.expand(step, parameters.toSymbolTable());
    }

    public SessionResult runSession(SessionPlan plan, SessionEventListener listener) {
        return sessionRunner.run(plan, listener);
    }

    public SessionResult runSession(SessionPlan plan) {
        return sessionRunner.run(plan);
    }

    public CompletableFuture<Boolean> runJob(ValidatedJobTemplate template, JobParameterValues parameters) {
        return runJob(template, parameters, Set.of(), Map.of(), SessionEventListener.none());
    }

    /**
     * Runs the selected steps, and the steps they depend on, in dependency order.
     *
     * @param stepNames         steps to run, empty for all
     * @param taskRunOverrides  literal task runs per step name, replacing the expansion of that step's parameter space
     * @return completes with true when every task of every selected step succeeded
     */
    public CompletableFuture<Boolean> runJob(ValidatedJobTemplate template, JobParameterValues parameters, Set<String> stepNames,
            Map<String, List<Map<String, String>>> taskRunOverrides, SessionEventListener listener) {
        var jobName = parameters.resolve(template.getTemplate().name());
        LOGGER.info("[{}] Starting job", jobName);
        var stepRuns = new HashMap<String, StepRun>();
        var stepScheduler = new LocalStepScheduler(sessionRunner, listener);
        var execution = new StepGraph(template, executorService).createExecution(stepScheduler, step -> stepRuns.get(step.name()), stepNames);
        // expand every selected step before any session starts
        for (var entry : execution.getStepStateView().entrySet()) {
            if (entry.getValue() != StepRunningState.WAITING) {
                continue;
            }
            var step = template.getStep(template.handleOf(entry.getKey()));
            try {
                stepRuns.put(step.name(), stepRun(template, step, parameters, taskRunOverrides.get(step.name())));
            } catch (MiniJdException e) {
                stepScheduler.shutdown();
                LOGGER.error("[{}] Job not started, step [{}] cannot be expanded: {}", jobName, step.name(), e.getMessage());
                return CompletableFuture.failedFuture(e);
            }
        }
        execution.subscribe(states -> LOGGER.info("[{}] Step graph updated: {}", jobName, execution.toDotFormat()));
        return execution.start().whenComplete((success, error) -> {
            stepScheduler.shutdown();
            LOGGER.info("[{}] Job finished with status '{}'", jobName, Boolean.TRUE.equals(success) ? "Success" : "Failed");
        });
    }

    private StepRun stepRun(ValidatedJobTemplate template, Step step, JobParameterValues parameters, List<Map<String, String>> overrides) {
        var taskRuns = overrides != null ? TaskRunExpander.fromOverrides(step, overrides) : expand(step, parameters);
        return StepRun.from(step, template.getTemplate(), parameters, taskRuns);
    }

    public void shutdown() {
        executorService.shutdown();
    }
}
