package com.hartwig.minijd;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;

import com.hartwig.minijd.expansion.AssociationCardinalityException;
import com.hartwig.minijd.expansion.RangeExpansionException;
import com.hartwig.minijd.job.JobParameterValues;
import com.hartwig.minijd.pathmapping.PathMapper;
import com.hartwig.minijd.session.ActionFailureException;
import com.hartwig.minijd.session.ActionRunner;
import com.hartwig.minijd.session.SessionConfiguration;
import com.hartwig.minijd.session.SessionEvent;
import com.hartwig.minijd.session.SessionEventType;
import com.hartwig.minijd.template.Action;
import com.hartwig.minijd.template.JobTemplate;
import com.hartwig.minijd.template.ParameterDefinition;
import com.hartwig.minijd.template.ParameterRange;
import com.hartwig.minijd.template.ParameterType;
import com.hartwig.minijd.template.Step;
import com.hartwig.minijd.template.StepActions;
import com.hartwig.minijd.template.StepDependency;
import com.hartwig.minijd.template.StepParameterSpace;
import com.hartwig.minijd.template.StepScript;
import com.hartwig.minijd.template.TaskParameterDefinition;
import com.hartwig.minijd.template.validation.ValidatedJobTemplate;
import com.hartwig.minijd.template.validation.ValidationDiagnostic;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(10)
class JobTemplateEngineTest {
    private static final List<String> RENDER_TASKS = List.of("onRun of Render (Frame=1, Eye=left)",
            "onRun of Render (Frame=1, Eye=right)",
            "onRun of Render (Frame=2, Eye=left)",
            "onRun of Render (Frame=2, Eye=right)");

    @TempDir
    Path root;

    private final List<String> descriptions = new CopyOnWriteArrayList<>();
    private final List<String> failing = new CopyOnWriteArrayList<>();
    private JobTemplateEngine engine;
    private ValidatedJobTemplate template;
    private JobParameterValues parameters;

    @BeforeEach
    void setUp() throws IOException {
        ActionRunner actionRunner = (invocation, canceled, output) -> {
            descriptions.add(invocation.description());
            if (failing.contains(invocation.description())) {
                throw new ActionFailureException(invocation.description() + " exited with code 2", 2);
            }
        };
        var configuration = SessionConfiguration.builder().workingDirectoryRoot(root.toString()).maxConcurrentSessions(2).build();
        engine = new JobTemplateEngine(configuration, PathMapper.none(), actionRunner);
        try (var is = getClass().getClassLoader().getResourceAsStream("render-job.yaml")) {
            template = engine.validate(is).orElseThrow();
        }
        parameters = engine.bindParameters(template, Map.of("SceneFile", "/scenes/intro.blend", "FrameEnd", "2"));
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    void runsEveryTaskOfEveryStepInDependencyOrder() throws ExecutionException, InterruptedException {
        assertThat(engine.runJob(template, parameters).get()).isTrue();

        assertThat(descriptions).hasSize(5);
        assertThat(descriptions.subList(0, 4)).containsExactlyInAnyOrderElementsOf(RENDER_TASKS);
        assertThat(descriptions.get(4)).isEqualTo("onRun of Encode ()");
    }

    @Test
    void failedTaskStopsDependentSteps() throws ExecutionException, InterruptedException {
        failing.add("onRun of Render (Frame=2, Eye=left)");

        assertThat(engine.runJob(template, parameters).get()).isFalse();
        assertThat(descriptions).containsExactlyInAnyOrderElementsOf(RENDER_TASKS);
    }

    @Test
    void runsOnlySelectedSteps() throws ExecutionException, InterruptedException {
        var events = new CopyOnWriteArrayList<SessionEvent>();

        assertThat(engine.runJob(template, parameters, Set.of("Render"), Map.of(), events::add).get()).isTrue();
        assertThat(descriptions).containsExactlyInAnyOrderElementsOf(RENDER_TASKS);
        assertThat(events.stream().filter(event -> event.type() == SessionEventType.TASK_COMPLETED)).hasSize(4);
    }

    @Test
    void taskRunOverridesReplaceTheExpansion() throws ExecutionException, InterruptedException {
        var overrides = Map.of("Render", List.of(Map.of("Frame", "7", "Eye", "left")));

        assertThat(engine.runJob(template, parameters, Set.of("Render"), overrides, event -> {
        }).get()).isTrue();
        assertThat(descriptions).containsExactly("onRun of Render (Frame=7, Eye=left)");
    }

    @Test
    void invalidOverrideFailsTheJobBeforeAnyTask() {
        var overrides = Map.of("Render", List.of(Map.of("Frame", "seven", "Eye", "left")));

        var job = engine.runJob(template, parameters, Set.of(), overrides, event -> {
        });
        var e = assertThrows(ExecutionException.class, job::get);
        assertThat(e.getCause()).isInstanceOf(RangeExpansionException.class)
                .hasMessage("Value 'seven' of task parameter 'Frame' is not a valid INT");
        assertThat(descriptions).isEmpty();
    }

    private ValidatedJobTemplate dependentSpace(String combination) {
        var echo = StepScript.builder().actions(StepActions.onRun(Action.builder().command("echo").build())).build();
        var template = JobTemplate.builder()
                .name("spaces")
                .addParameterDefinitions(ParameterDefinition.builder().name("N").type(ParameterType.INT).build())
                .addSteps(Step.builder().name("Prepare").script(echo).build())
                .addSteps(Step.builder()
                        .name("Fan")
                        .addDependencies(StepDependency.of("Prepare"))
                        .parameterSpace(StepParameterSpace.builder()
                                .addTaskParameterDefinitions(TaskParameterDefinition.builder()
                                        .name("X")
                                        .type(ParameterType.INT)
                                        .range(ParameterRange.expression("1-{{Param.N}}"))
                                        .build())
                                .addTaskParameterDefinitions(TaskParameterDefinition.builder()
                                        .name("Y")
                                        .type(ParameterType.INT)
                                        .range(ParameterRange.values("1", "2"))
                                        .build())
                                .combination(combination)
                                .build())
                        .script(echo)
                        .build())
                .build();
        return engine.validate(template).orElseThrow();
    }

    @Test
    void associationMismatchFromJobParametersFailsBeforeAnyTask() {
        var spaces = dependentSpace("(X, Y)");
        var values = engine.bindParameters(spaces, Map.of("N", "3"));

        var e = assertThrows(ExecutionException.class, () -> engine.runJob(spaces, values).get());
        assertThat(e.getCause()).isInstanceOf(AssociationCardinalityException.class)
                .hasMessage("Association (X, Y) requires equal numbers of values, but X has 3, Y has 2");
        assertThat(descriptions).isEmpty();
    }

    @Test
    void oversizedSpaceFromJobParametersFailsBeforeAnyTask() {
        var spaces = dependentSpace("X * Y");
        var values = engine.bindParameters(spaces, Map.of("N", "900000"));

        var e = assertThrows(ExecutionException.class, () -> engine.runJob(spaces, values).get());
        assertThat(e.getCause()).isInstanceOf(RangeExpansionException.class)
                .hasMessage("Step 'Fan' expands to more than the maximum of 1000000 tasks");
        assertThat(descriptions).isEmpty();
    }

    @Test
    void matchingAssociationFromJobParametersRuns() throws ExecutionException, InterruptedException {
        var spaces = dependentSpace("(X, Y)");
        var values = engine.bindParameters(spaces, Map.of("N", "2"));

        assertThat(engine.runJob(spaces, values).get()).isTrue();
        assertThat(descriptions).hasSize(3);
        assertThat(descriptions.get(0)).isEqualTo("onRun of Prepare ()");
        assertThat(descriptions.subList(1, 3)).containsExactlyInAnyOrder("onRun of Fan (X=1, Y=1)", "onRun of Fan (X=2, Y=2)");
    }

    @Test
    void expandsStepsWithBoundParameters() {
        assertThat(engine.expand(template.getStep(template.handleOf("Render")), parameters)).hasSize(4);
        assertThat(engine.expand(template.getStep(template.handleOf("Encode")), parameters)).hasSize(1);
    }

    @Test
    void reportsUnparsableTemplates() {
        var result = engine.validate(new ByteArrayInputStream("steps: [unclosed".getBytes(StandardCharsets.UTF_8)));

        assertThat(result.isValid()).isFalse();
        assertThat(result.diagnostics()).extracting(ValidationDiagnostic::location).containsExactly("template");
    }
}
