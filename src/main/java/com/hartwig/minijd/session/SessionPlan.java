package com.hartwig.minijd.session;

import java.util.List;

import com.hartwig.minijd.expansion.TaskRun;
import com.hartwig.minijd.job.JobParameterValues;
import com.hartwig.minijd.template.Environment;
import com.hartwig.minijd.template.Step;

import org.immutables.value.Value;

/**
 * What one session does: enter the environments in order, run the task runs of the step, exit the environments in reverse.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface SessionPlan {
    /**
     * Job environments followed by the step environments.
     */
    List<Environment> environments();

    Step step();

    List<TaskRun> taskRuns();

    @Value.Default
    default JobParameterValues jobParameters() {
        return JobParameterValues.empty();
    }

    static ImmutableSessionPlan.Builder builder() {
        return ImmutableSessionPlan.builder();
    }
}
