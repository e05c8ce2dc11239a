package com.hartwig.minijd.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;

import com.hartwig.minijd.job.JobParameterValues;
import com.hartwig.minijd.template.Action;
import com.hartwig.minijd.template.JobTemplate;
import com.hartwig.minijd.template.Step;
import com.hartwig.minijd.template.StepActions;
import com.hartwig.minijd.template.StepDependency;
import com.hartwig.minijd.template.StepScript;
import com.hartwig.minijd.template.validation.TemplateValidator;
import com.hartwig.minijd.template.validation.ValidatedJobTemplate;
import com.hartwig.minijd.workflow.StepGraph.StepRunningState;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(5)
class StepGraphTest {

    private static Step step(String name, String... dependencies) {
        var builder = Step.builder()
                .name(name)
                .script(StepScript.builder().actions(StepActions.onRun(Action.builder().command("echo").addArgs(name).build())).build());
        for (String dependency : dependencies) {
            builder.addDependencies(StepDependency.of(dependency));
        }
        return builder.build();
    }

    private static ValidatedJobTemplate template(Step... steps) {
        return new TemplateValidator().validate(JobTemplate.builder().name("graph").addSteps(steps).build()).orElseThrow();
    }

    private static Function<Step, StepRun> stepRuns(ValidatedJobTemplate template) {
        return step -> StepRun.from(step, template.getTemplate(), JobParameterValues.empty(), List.of());
    }

    private static StepRun forStep(String name) {
        return argThat(stepRun -> stepRun != null && stepRun.step().name().equals(name));
    }

    @Test
    void singleStepSucceeds() throws ExecutionException, InterruptedException {
        var template = template(step("Build"));
        var stepScheduler = mock(StepScheduler.class);
        when(stepScheduler.schedule(any())).thenReturn(CompletableFuture.completedFuture(true));

        var execution = new StepGraph(template, ForkJoinPool.commonPool()).createExecution(stepScheduler, stepRuns(template), Set.of());
        assertThat(execution.start().get()).isTrue();
        assertThat(execution.getStepStateView()).isEqualTo(Map.of("Build", StepRunningState.SUCCESS));
        assertThat(execution.toDotFormat()).isEqualTo("strict digraph G {\n" + "  1 [ label=\"Build\" color=\"green\" ];\n" + "}\n");
    }

    @Test
    void singleStepSucceedsSubscription() throws ExecutionException, InterruptedException {
        var template = template(step("Build"));
        var stepScheduler = mock(StepScheduler.class);
        when(stepScheduler.schedule(any())).thenAnswer(stepRun -> CompletableFuture.completedFuture(true));
        var stepStates = new ArrayList<Map<String, StepRunningState>>();

        var execution = new StepGraph(template, ForkJoinPool.commonPool()).createExecution(stepScheduler, stepRuns(template), Set.of());
        execution.subscribe(stepStates::add);

        assertThat(execution.start().get()).isTrue();
        assertThat(stepStates).containsExactly(Map.of("Build", StepRunningState.WAITING),
                Map.of("Build", StepRunningState.RUNNING),
                Map.of("Build", StepRunningState.SUCCESS));
    }

    @Test
    void singleStepFails() throws ExecutionException, InterruptedException {
        var template = template(step("Build"));
        var stepScheduler = mock(StepScheduler.class);
        when(stepScheduler.schedule(any())).thenReturn(CompletableFuture.completedFuture(false));

        var execution = new StepGraph(template, ForkJoinPool.commonPool()).createExecution(stepScheduler, stepRuns(template), Set.of());
        assertThat(execution.start().get()).isFalse();
        assertThat(execution.getStepStateView()).isEqualTo(Map.of("Build", StepRunningState.FAILED));
        assertThat(execution.toDotFormat()).isEqualTo("strict digraph G {\n" + "  1 [ label=\"Build\" color=\"red\" ];\n" + "}\n");
    }

    @Test
    void linearStepsRunInOrder() throws ExecutionException, InterruptedException {
        var template = template(step("Encode", "Render"), step("Render"));
        var stepScheduler = mock(StepScheduler.class);
        when(stepScheduler.schedule(any())).thenAnswer(stepRun -> CompletableFuture.completedFuture(true));
        var stepStates = new ArrayList<Map<String, StepRunningState>>();

        var execution = new StepGraph(template, ForkJoinPool.commonPool()).createExecution(stepScheduler, stepRuns(template), Set.of());
        execution.subscribe(stepStates::add);

        assertThat(execution.start().get()).isTrue();
        assertThat(stepStates).hasSize(5);
        assertThat(stepStates.get(0)).isEqualTo(Map.of("Render", StepRunningState.WAITING, "Encode", StepRunningState.WAITING));
        assertThat(stepStates.get(1)).isEqualTo(Map.of("Render", StepRunningState.RUNNING, "Encode", StepRunningState.WAITING));
        assertThat(stepStates.get(2)).isEqualTo(Map.of("Render", StepRunningState.SUCCESS, "Encode", StepRunningState.WAITING));
        assertThat(stepStates.get(3)).isEqualTo(Map.of("Render", StepRunningState.SUCCESS, "Encode", StepRunningState.RUNNING));
        assertThat(stepStates.get(4)).isEqualTo(Map.of("Render", StepRunningState.SUCCESS, "Encode", StepRunningState.SUCCESS));
        assertThat(execution.getStepStateView().keySet()).containsExactly("Render", "Encode");
        assertThat(execution.toDotFormat()).isEqualTo("strict digraph G {\n"
                + "  1 [ label=\"Render\" color=\"green\" ];\n"
                + "  2 [ label=\"Encode\" color=\"green\" ];\n"
                + "  1 -> 2;\n"
                + "}\n");
    }

    @Test
    void failureMakesDownstreamStepsNotRunnable() throws ExecutionException, InterruptedException {
        var template = template(step("Fetch"), step("Render", "Fetch"), step("Encode", "Render"), step("Lint"));
        var stepScheduler = mock(StepScheduler.class);
        doReturn(CompletableFuture.completedFuture(false)).when(stepScheduler).schedule(forStep("Fetch"));
        doReturn(CompletableFuture.completedFuture(true)).when(stepScheduler).schedule(forStep("Lint"));

        var execution = new StepGraph(template, ForkJoinPool.commonPool()).createExecution(stepScheduler, stepRuns(template), Set.of());
        assertThat(execution.start().get()).isFalse();
        assertThat(execution.getStepStateView()).isEqualTo(Map.of("Fetch",
                StepRunningState.FAILED,
                "Render",
                StepRunningState.NOT_RUNNABLE,
                "Encode",
                StepRunningState.NOT_RUNNABLE,
                "Lint",
                StepRunningState.SUCCESS));
        verify(stepScheduler, never()).schedule(forStep("Render"));
        verify(stepScheduler, never()).schedule(forStep("Encode"));
    }

    @Test
    void dependenciesCompleteBeforeDependents() throws ExecutionException, InterruptedException {
        var template = template(step("Merge", "Left", "Right"), step("Left", "Split"), step("Right", "Split"), step("Split"));
        var scheduled = new CopyOnWriteArrayList<String>();
        var stepScheduler = mock(StepScheduler.class);
        doAnswer(invocation -> {
            StepRun stepRun = invocation.getArgument(0);
            return CompletableFuture.supplyAsync(() -> {
                scheduled.add(stepRun.step().name());
                return true;
            });
        }).when(stepScheduler).schedule(any());

        var execution = new StepGraph(template, ForkJoinPool.commonPool()).createExecution(stepScheduler, stepRuns(template), Set.of());
        assertThat(execution.start().get()).isTrue();
        assertThat(scheduled).hasSize(4);
        assertThat(scheduled.get(0)).isEqualTo("Split");
        assertThat(scheduled.subList(1, 3)).containsExactlyInAnyOrder("Left", "Right");
        assertThat(scheduled.get(3)).isEqualTo("Merge");
    }

    @Test
    void onlySelectedStepsAndTheirDependenciesRun() throws ExecutionException, InterruptedException {
        var template = template(step("Render"), step("Encode", "Render"), step("Publish", "Encode"), step("Docs"));
        var stepScheduler = mock(StepScheduler.class);
        when(stepScheduler.schedule(any())).thenReturn(CompletableFuture.completedFuture(true));

        var execution =
                new StepGraph(template, ForkJoinPool.commonPool()).createExecution(stepScheduler, stepRuns(template), Set.of("Encode"));
        assertThat(execution.start().get()).isTrue();
        assertThat(execution.getStepStateView()).isEqualTo(Map.of("Render",
                StepRunningState.SUCCESS,
                "Encode",
                StepRunningState.SUCCESS,
                "Publish",
                StepRunningState.SKIPPED,
                "Docs",
                StepRunningState.SKIPPED));
        verify(stepScheduler, never()).schedule(forStep("Publish"));
        verify(stepScheduler, never()).schedule(forStep("Docs"));
        assertThat(execution.toDotFormat()).contains("label=\"Docs\" color=\"lightgrey\"");
    }

    @Test
    void unknownSelectedStepIsRejected() {
        var template = template(step("Render"));
        var stepScheduler = mock(StepScheduler.class);
        var graph = new StepGraph(template, ForkJoinPool.commonPool());
        var e = assertThrows(IllegalArgumentException.class, () -> graph.createExecution(stepScheduler, stepRuns(template), Set.of("Missing")));
        assertThat(e.getMessage()).isEqualTo("No step named 'Missing' in template 'graph'");
        verifyNoInteractions(stepScheduler);
    }

    @Test
    void stepThatCannotBePreparedFails() throws ExecutionException, InterruptedException {
        var template = template(step("Render"), step("Encode", "Render"));
        var stepScheduler = mock(StepScheduler.class);
        Function<Step, StepRun> failing = step -> {
            throw new IllegalStateException("no task runs for " + step.name());
        };

        var execution = new StepGraph(template, ForkJoinPool.commonPool()).createExecution(stepScheduler, failing, Set.of());
        assertThat(execution.start().get()).isFalse();
        assertThat(execution.getStepStateView()).isEqualTo(Map.of("Render", StepRunningState.FAILED, "Encode", StepRunningState.NOT_RUNNABLE));
        verifyNoInteractions(stepScheduler);
    }

    @Test
    void errorWhilePreparingCompletesTheJobExceptionally() {
        var template = template(step("Render"));
        var stepScheduler = mock(StepScheduler.class);
        Function<Step, StepRun> exhausted = step -> {
            throw new OutOfMemoryError("Java heap space");
        };

        var execution = new StepGraph(template, ForkJoinPool.commonPool()).createExecution(stepScheduler, exhausted, Set.of());
        var e = assertThrows(ExecutionException.class, () -> execution.start().get());
        assertThat(e.getCause()).isInstanceOf(OutOfMemoryError.class).hasMessage("Java heap space");
        verifyNoInteractions(stepScheduler);
    }

    @Test
    void exceptionallyCompletedStepFails() throws ExecutionException, InterruptedException {
        var template = template(step("Render"));
        var stepScheduler = mock(StepScheduler.class);
        when(stepScheduler.schedule(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("scheduler is gone")));

        var execution = new StepGraph(template, ForkJoinPool.commonPool()).createExecution(stepScheduler, stepRuns(template), Set.of());
        assertThat(execution.start().get()).isFalse();
        assertThat(execution.getStepStateView()).isEqualTo(Map.of("Render", StepRunningState.FAILED));
    }

    @Test
    void hangingStepCanBeCanceled() throws ExecutionException, InterruptedException {
        var template = template(step("Render"));
        var stepScheduler = mock(StepScheduler.class);
        when(stepScheduler.schedule(any())).thenReturn(new CompletableFuture<>());
        var executorService = Executors.newSingleThreadExecutor();
        try {
            var execution = new StepGraph(template, executorService).createExecution(stepScheduler, stepRuns(template), Set.of());
            var success = execution.start();
            execution.cancel();
            assertThat(success.get()).isFalse();
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    void startingTwiceReturnsTheSameFuture() throws ExecutionException, InterruptedException {
        var template = template(step("Render"));
        var stepScheduler = mock(StepScheduler.class);
        when(stepScheduler.schedule(any())).thenReturn(CompletableFuture.completedFuture(true));

        var execution = new StepGraph(template, ForkJoinPool.commonPool()).createExecution(stepScheduler, stepRuns(template), Set.of());
        var first = execution.start();
        assertThat(execution.start()).isSameAs(first);
        assertThat(first.get()).isTrue();
        verify(stepScheduler).schedule(any());
    }
}
