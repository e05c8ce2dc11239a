package com.hartwig.minijd.session;

import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Runs one action to completion.
 */
public interface ActionRunner {
    /**
     * Blocks until the action ends.
     *
     * @param canceled polled while the action runs; once it returns true the action is stopped using its cancelation mode
     * @param output   receives every output line, possibly on another thread
     * @throws ActionFailureException  if the process could not start or exited with a non-zero code
     * @throws ActionTimeoutException  if the process ran past its timeout
     * @throws ActionCanceledException if the process was canceled
     */
    void run(ActionInvocation invocation, BooleanSupplier canceled, Consumer<String> output);
}
