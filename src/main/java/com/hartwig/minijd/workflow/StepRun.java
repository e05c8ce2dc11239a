package com.hartwig.minijd.workflow;

import java.util.ArrayList;
import java.util.List;

import com.hartwig.minijd.expansion.TaskRun;
import com.hartwig.minijd.job.JobParameterValues;
import com.hartwig.minijd.session.SessionPlan;
import com.hartwig.minijd.template.Environment;
import com.hartwig.minijd.template.JobTemplate;
import com.hartwig.minijd.template.Step;

import org.immutables.value.Value;

/**
 * A step of a job ready to be scheduled: its task runs are known and the job parameters bound.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StepRun {
    String jobName();

    Step step();

    /**
     * Job environments followed by the step environments, in the order sessions enter them.
     */
    List<Environment> environments();

    List<TaskRun> taskRuns();

    JobParameterValues jobParameters();

    default String getName() {
        return jobName() + "/" + step().name();
    }

    static StepRun from(Step step, JobTemplate template, JobParameterValues jobParameters, List<TaskRun> taskRuns) {
        var environments = new ArrayList<Environment>(template.jobEnvironments());
        environments.addAll(step.stepEnvironments());
        return ImmutableStepRun.builder()
                .jobName(jobParameters.resolve(template.name()))
                .step(step)
                .environments(environments)
                .taskRuns(taskRuns)
                .jobParameters(jobParameters)
                .build();
    }

    /**
     * Splits the task runs into consecutive batches of at most {@code tasksPerSession}, one session each.
     */
    default List<SessionPlan> toSessionPlans(int tasksPerSession) {
        if (tasksPerSession <= 0) {
            throw new IllegalArgumentException("Tasks per session must be positive, but was " + tasksPerSession);
        }
        var plans = new ArrayList<SessionPlan>();
        for (int start = 0; start < taskRuns().size(); start += tasksPerSession) {
            plans.add(SessionPlan.builder()
                    .environments(environments())
                    .step(step())
                    .taskRuns(taskRuns().subList(start, Math.min(start + tasksPerSession, taskRuns().size())))
                    .jobParameters(jobParameters())
                    .build());
        }
        return plans;
    }
}
