package com.hartwig.minijd.workflow;

import java.util.concurrent.CompletableFuture;

public interface StepScheduler {
    /**
     * Runs every task of the step.
     *
     * @return completes with true when all tasks succeeded, false otherwise
     */
    CompletableFuture<Boolean> schedule(StepRun stepRun);
}
