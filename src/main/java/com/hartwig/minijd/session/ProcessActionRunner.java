package com.hartwig.minijd.session;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import com.hartwig.minijd.ThreadUtil;
import com.hartwig.minijd.template.CancelationMode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs actions as local processes. Stdout and stderr are merged and read line by line on a helper thread.
 */
public class ProcessActionRunner implements ActionRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessActionRunner.class);
    private static final long POLL_INTERVAL_MILLIS = 50;
    private static final long KILL_WAIT_SECONDS = 5;
    private static final long OUTPUT_DRAIN_SECONDS = 2;

    private final ExecutorService outputReaders;

    public ProcessActionRunner() {
        this(ThreadUtil.createDaemonExecutorService("action-output-%d"));
    }

    ProcessActionRunner(final ExecutorService outputReaders) {
        this.outputReaders = outputReaders;
    }

    @Override
    public void run(ActionInvocation invocation, BooleanSupplier canceled, Consumer<String> output) {
        var builder = new ProcessBuilder(invocation.commandLine()).directory(invocation.workingDirectory().toFile())
                .redirectErrorStream(true);
        builder.environment().clear();
        builder.environment().putAll(invocation.environment());
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ActionFailureException(String.format("Could not start %s: %s", invocation.description(), e.getMessage()), e);
        }
        LOGGER.debug("Started {} as pid {}: {}", invocation.description(), process.pid(), invocation.commandLine());
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            LOGGER.debug("Could not close stdin of {}", invocation.description(), e);
        }
        var reader = outputReaders.submit(() -> readLines(process, output));

        var deadline = invocation.timeout().map(timeout -> System.nanoTime() + timeout.toNanos());
        try {
            while (!process.waitFor(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (canceled.getAsBoolean()) {
                    LOGGER.info("Canceling {}", invocation.description());
                    stop(process, invocation);
                    awaitOutput(reader, invocation);
                    throw new ActionCanceledException(String.format("%s was canceled", invocation.description()));
                }
                if (deadline.isPresent() && System.nanoTime() - deadline.get() >= 0) {
                    LOGGER.warn("{} exceeded its timeout of {}s", invocation.description(), invocation.timeout().get().toSeconds());
                    stop(process, invocation);
                    awaitOutput(reader, invocation);
                    throw new ActionTimeoutException(String.format("%s timed out after %ds",
                            invocation.description(),
                            invocation.timeout().get().toSeconds()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            throw new ActionCanceledException(String.format("%s was interrupted", invocation.description()));
        }
        awaitOutput(reader, invocation);
        var exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new ActionFailureException(String.format("%s exited with code %d", invocation.description(), exitCode), exitCode);
        }
    }

    private static Void readLines(Process process, Consumer<String> output) throws IOException {
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.accept(line);
            }
        }
        return null;
    }

    private static void stop(Process process, ActionInvocation invocation) throws InterruptedException {
        if (invocation.cancelationMode() == CancelationMode.NOTIFY_THEN_TERMINATE) {
            var tree = descendants(process);
            tree.forEach(ProcessHandle::destroy);
            process.destroy();
            if (process.waitFor(invocation.notifyPeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                // children may outlive the parent
                tree.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
                return;
            }
            LOGGER.info("{} still running after notify period of {}s, terminating",
                    invocation.description(),
                    invocation.notifyPeriod().toSeconds());
        }
        kill(process);
    }

    private static void kill(Process process) {
        descendants(process).forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("Process {} did not exit after being killed", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static List<ProcessHandle> descendants(Process process) {
        return process.descendants().collect(Collectors.toList());
    }

    private static void awaitOutput(Future<?> reader, ActionInvocation invocation) {
        try {
            reader.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            LOGGER.warn("Output of {} still open after the process ended, leaving it", invocation.description());
            reader.cancel(true);
        } catch (ExecutionException e) {
            LOGGER.warn("Failed reading output of {}", invocation.description(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
