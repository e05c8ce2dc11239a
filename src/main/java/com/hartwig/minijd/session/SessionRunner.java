package com.hartwig.minijd.session;

import java.util.concurrent.atomic.AtomicInteger;

import com.hartwig.minijd.pathmapping.PathMapper;

/**
 * Creates and runs sessions with a shared configuration, path mapping and action runner.
 */
public class SessionRunner {
    private final SessionConfiguration configuration;
    private final PathMapper pathMapper;
    private final ActionRunner actionRunner;
    private final AtomicInteger sessionCounter = new AtomicInteger();

    public SessionRunner(final SessionConfiguration configuration, final PathMapper pathMapper, final ActionRunner actionRunner) {
        this.configuration = configuration;
        this.pathMapper = pathMapper;
        this.actionRunner = actionRunner;
    }

    public SessionRunner(final SessionConfiguration configuration, final PathMapper pathMapper) {
        this(configuration, pathMapper, new ProcessActionRunner());
    }

    /**
     * A new session for the plan, not started yet. Use this over {@link #run(SessionPlan)} to keep a handle for cancellation.
     */
    public Session create(SessionPlan plan, SessionEventListener listener) {
        var id = String.format("%s-%d", plan.step().name(), sessionCounter.incrementAndGet());
        return new Session(id, plan, configuration, pathMapper, actionRunner, listener);
    }

    public SessionResult run(SessionPlan plan, SessionEventListener listener) {
        return create(plan, listener).run();
    }

    public SessionResult run(SessionPlan plan) {
        return run(plan, SessionEventListener.none());
    }

    public SessionConfiguration getConfiguration() {
        return configuration;
    }
}
