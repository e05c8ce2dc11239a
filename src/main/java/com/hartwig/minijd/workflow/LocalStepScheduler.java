package com.hartwig.minijd.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

import com.hartwig.minijd.ThreadUtil;
import com.hartwig.minijd.session.Session;
import com.hartwig.minijd.session.SessionEventListener;
import com.hartwig.minijd.session.SessionPlan;
import com.hartwig.minijd.session.SessionResult;
import com.hartwig.minijd.session.SessionRunner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs steps on this host. The task runs of a step are split into sessions that run in parallel, up to the configured maximum.
 */
public class LocalStepScheduler implements StepScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStepScheduler.class);

    private final SessionRunner sessionRunner;
    private final SessionEventListener listener;
    private final ExecutorService executor;
    private final Set<Session> runningSessions = ConcurrentHashMap.newKeySet();
    private final List<SessionResult> results = new ArrayList<>();
    private volatile boolean canceled;

    public LocalStepScheduler(final SessionRunner sessionRunner, final SessionEventListener listener) {
        this.sessionRunner = sessionRunner;
        this.listener = listener;
        this.executor = ThreadUtil.createExecutorService(sessionRunner.getConfiguration().maxConcurrentSessions(), "session-thread-%d");
    }

    @Override
    public CompletableFuture<Boolean> schedule(StepRun stepRun) {
        var plans = stepRun.toSessionPlans(sessionRunner.getConfiguration().tasksPerSession());
        LOGGER.info("[{}] Scheduling {} task(s) in {} session(s)", stepRun.getName(), stepRun.taskRuns().size(), plans.size());
        var sessionFutures = new ArrayList<CompletableFuture<Boolean>>();
        for (SessionPlan plan : plans) {
            var session = sessionRunner.create(plan, listener);
            sessionFutures.add(CompletableFuture.supplyAsync(() -> runSession(stepRun, session), executor));
        }
        return CompletableFuture.allOf(sessionFutures.toArray(new CompletableFuture[0])).thenApply(ignored -> {
            var success = sessionFutures.stream().allMatch(CompletableFuture::join);
            LOGGER.info("[{}] Step completed with status '{}'", stepRun.getName(), success ? "Success" : "Failed");
            return success;
        });
    }

    private boolean runSession(StepRun stepRun, Session session) {
        runningSessions.add(session);
        if (canceled) {
            session.cancel();
        }
        try {
            var result = session.run();
            synchronized (results) {
                results.add(result);
            }
            return result.isSuccess();
        } catch (Exception e) {
            LOGGER.error("[{}] Session [{}] failed with", stepRun.getName(), session.getId(), e);
            return false;
        } finally {
            runningSessions.remove(session);
        }
    }

    /**
     * Cancels every running session. Sessions that have not started yet end without running any task.
     */
    public void cancelAll() {
        canceled = true;
        runningSessions.forEach(Session::cancel);
    }

    /**
     * Results of all sessions that ended so far, in order of completion.
     */
    public List<SessionResult> getResults() {
        synchronized (results) {
            return List.copyOf(results);
        }
    }

    public void shutdown() {
        executor.shutdown();
    }
}
