package com.hartwig.minijd.expansion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.hartwig.minijd.format.SymbolTable;
import com.hartwig.minijd.format.UnresolvedReferenceException;
import com.hartwig.minijd.template.Action;
import com.hartwig.minijd.template.ParameterRange;
import com.hartwig.minijd.template.ParameterType;
import com.hartwig.minijd.template.Step;
import com.hartwig.minijd.template.StepActions;
import com.hartwig.minijd.template.StepParameterSpace;
import com.hartwig.minijd.template.StepScript;
import com.hartwig.minijd.template.TaskParameterDefinition;

import org.junit.jupiter.api.Test;

class TaskRunExpanderTest {
    private static final SymbolTable JOB_SYMBOLS = SymbolTable.empty("job scope").with("Param.FrameEnd", "3");

    private static Step step(StepParameterSpace space) {
        var builder = Step.builder()
                .name("Render")
                .script(StepScript.builder().actions(StepActions.onRun(Action.builder().command("render").build())).build());
        if (space != null) {
            builder.parameterSpace(space);
        }
        return builder.build();
    }

    private static TaskParameterDefinition parameter(String name, ParameterType type, ParameterRange range) {
        return TaskParameterDefinition.builder().name(name).type(type).range(range).build();
    }

    private static List<String> describe(List<TaskRun> taskRuns) {
        return taskRuns.stream().map(TaskRun::describe).collect(Collectors.toList());
    }

    @Test
    void stepWithoutParameterSpaceHasOneEmptyTask() {
        var taskRuns = TaskRunExpander.expand(step(null), JOB_SYMBOLS);
        assertThat(taskRuns).containsExactly(TaskRun.empty());
        assertThat(taskRuns.get(0).parameters()).isEmpty();
    }

    @Test
    void defaultCombinationIsProductInDeclarationOrder() {
        var space = StepParameterSpace.builder()
                .addTaskParameterDefinitions(parameter("Frame", ParameterType.INT, ParameterRange.expression("1-{{Param.FrameEnd}}")),
                        parameter("Eye", ParameterType.STRING, ParameterRange.values("left", "right")))
                .build();
        assertThat(describe(TaskRunExpander.expand(step(space), JOB_SYMBOLS))).containsExactly("Frame=1, Eye=left",
                "Frame=1, Eye=right",
                "Frame=2, Eye=left",
                "Frame=2, Eye=right",
                "Frame=3, Eye=left",
                "Frame=3, Eye=right");
    }

    @Test
    void parametersStayInDeclarationOrderWhateverTheCombination() {
        var space = StepParameterSpace.builder()
                .addTaskParameterDefinitions(parameter("Frame", ParameterType.INT, ParameterRange.expression("1-2")),
                        parameter("Eye", ParameterType.STRING, ParameterRange.values("left", "right")))
                .combination("Eye * Frame")
                .build();
        var taskRuns = TaskRunExpander.expand(step(space), JOB_SYMBOLS);
        assertThat(describe(taskRuns)).containsExactly("Frame=1, Eye=left", "Frame=2, Eye=left", "Frame=1, Eye=right", "Frame=2, Eye=right");
        assertThat(taskRuns.get(0).parameters().keySet()).containsExactly("Frame", "Eye");
        assertThat(taskRuns.get(0).parameters().get("Frame").type()).isEqualTo(ParameterType.INT);
    }

    @Test
    void expansionIsDeterministic() {
        var space = StepParameterSpace.builder()
                .addTaskParameterDefinitions(parameter("A", ParameterType.INT, ParameterRange.expression("1-5")),
                        parameter("B", ParameterType.FLOAT, ParameterRange.values("0.1", "0.2", "0.3", "0.4", "0.5")),
                        parameter("C", ParameterType.PATH, ParameterRange.values("/a", "/b")))
                .combination("(A, B) * C")
                .build();
        var first = TaskRunExpander.expand(step(space), JOB_SYMBOLS);
        var second = TaskRunExpander.expand(step(space), JOB_SYMBOLS);
        assertThat(first).hasSize(10).isEqualTo(second);
    }

    @Test
    void listedValuesAreResolvedAgainstJobParameters() {
        var space = StepParameterSpace.builder()
                .addTaskParameterDefinitions(parameter("Last", ParameterType.INT, ParameterRange.values("{{Param.FrameEnd}}")))
                .build();
        assertThat(describe(TaskRunExpander.expand(step(space), JOB_SYMBOLS))).containsExactly("Last=3");
    }

    @Test
    void unknownJobParameterInRangeFails() {
        var space = StepParameterSpace.builder()
                .addTaskParameterDefinitions(parameter("Frame", ParameterType.INT, ParameterRange.expression("1-{{Param.Missing}}")))
                .build();
        assertThrows(UnresolvedReferenceException.class, () -> TaskRunExpander.expand(step(space), JOB_SYMBOLS));
    }

    @Test
    void badValuesFail() {
        var space = StepParameterSpace.builder()
                .addTaskParameterDefinitions(parameter("Frame", ParameterType.INT, ParameterRange.values("1", "two")))
                .build();
        var e = assertThrows(RangeExpansionException.class, () -> TaskRunExpander.expand(step(space), JOB_SYMBOLS));
        assertThat(e.getMessage()).isEqualTo("Value 'two' of task parameter 'Frame' is not a valid INT");
    }

    @Test
    void associationMismatchAfterResolvingFails() {
        var space = StepParameterSpace.builder()
                .addTaskParameterDefinitions(parameter("Frame", ParameterType.INT, ParameterRange.expression("1-{{Param.FrameEnd}}")),
                        parameter("Eye", ParameterType.STRING, ParameterRange.values("left", "right")))
                .combination("(Frame, Eye)")
                .build();
        var e = assertThrows(AssociationCardinalityException.class, () -> TaskRunExpander.expand(step(space), JOB_SYMBOLS));
        assertThat(e.getMessage()).isEqualTo("Association (Frame, Eye) requires equal numbers of values, but Frame has 3, Eye has 2");
    }

    @Test
    void rangeAboveTaskLimitFails() {
        var space = StepParameterSpace.builder()
                .addTaskParameterDefinitions(parameter("Frame", ParameterType.INT, ParameterRange.expression("1-2000000")))
                .build();
        var e = assertThrows(RangeExpansionException.class, () -> TaskRunExpander.expand(step(space), JOB_SYMBOLS));
        assertThat(e.getMessage()).isEqualTo("Task parameter 'Frame' has 2000000 values, more than the maximum of 1000000 tasks per step");
    }

    @Test
    void productAboveTaskLimitFailsBeforeExpanding() {
        var space = StepParameterSpace.builder()
                .addTaskParameterDefinitions(parameter("Frame", ParameterType.INT, ParameterRange.expression("1-100000")),
                        parameter("Tile", ParameterType.INT, ParameterRange.expression("1-100000")))
                .build();
        var e = assertThrows(RangeExpansionException.class, () -> TaskRunExpander.expand(step(space), JOB_SYMBOLS));
        assertThat(e.getMessage()).isEqualTo("Step 'Render' expands to more than the maximum of 1000000 tasks");
    }

    @Test
    void overridesReplaceExpansion() {
        var space = StepParameterSpace.builder()
                .addTaskParameterDefinitions(parameter("Frame", ParameterType.INT, ParameterRange.expression("1-100")),
                        parameter("Eye", ParameterType.STRING, ParameterRange.values("left", "right")))
                .build();
        var taskRuns = TaskRunExpander.fromOverrides(step(space), List.of(Map.of("Eye", "right", "Frame", "42")));
        assertThat(describe(taskRuns)).containsExactly("Frame=42, Eye=right");
    }

    @Test
    void overridesMustMatchTheParameters() {
        var space = StepParameterSpace.builder()
                .addTaskParameterDefinitions(parameter("Frame", ParameterType.INT, ParameterRange.expression("1-100")))
                .build();
        var unknown = assertThrows(RangeExpansionException.class,
                () -> TaskRunExpander.fromOverrides(step(space), List.of(Map.of("Frame", "1", "Eye", "left"))));
        assertThat(unknown.getMessage()).isEqualTo("Step 'Render' has no task parameter 'Eye'");
        var missing = assertThrows(RangeExpansionException.class, () -> TaskRunExpander.fromOverrides(step(space), List.of(Map.of())));
        assertThat(missing.getMessage()).isEqualTo("Task run {} of step 'Render' misses task parameter 'Frame'");
        assertThrows(RangeExpansionException.class, () -> TaskRunExpander.fromOverrides(step(space), List.of(Map.of("Frame", "x"))));
    }
}
