package com.hartwig.minijd.session;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import com.hartwig.minijd.MiniJdException;
import com.hartwig.minijd.expansion.TaskRun;
import com.hartwig.minijd.format.FormatString;
import com.hartwig.minijd.format.SymbolNames;
import com.hartwig.minijd.format.SymbolTable;
import com.hartwig.minijd.pathmapping.PathMapper;
import com.hartwig.minijd.pathmapping.PathMappingRulesFile;
import com.hartwig.minijd.template.Action;
import com.hartwig.minijd.template.CancelationMethod;
import com.hartwig.minijd.template.Environment;
import com.hartwig.minijd.template.ParameterType;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One sequential session: a private working directory, a stack of entered environments and the task runs of one step, run one
 * at a time. The lifecycle is {@link #initialize()}, {@link #enterEnvironment(Environment)} for each planned environment,
 * {@link #runTask(TaskRun)} for each task run and {@link #exitEnvironments()}; {@link #run()} does all of it. Calls out of
 * order fail with {@link IllegalStateException}.
 */
public class Session {
    private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

    public static final String PATH_MAPPING_RULES_FILENAME = "path_mapping_rules.json";
    static final String EMBEDDED_FILES_DIRECTORY = "embedded_files";
    static final String ENV_DIRECTIVE = "openjd_env:";
    static final String UNSET_ENV_DIRECTIVE = "openjd_unset_env:";
    static final String PROGRESS_DIRECTIVE = "openjd_progress:";
    static final String STATUS_DIRECTIVE = "openjd_status:";

    private final String id;
    private final SessionPlan plan;
    private final SessionConfiguration configuration;
    private final PathMapper pathMapper;
    private final ActionRunner actionRunner;
    private final SessionEventListener listener;
    private final EmbeddedFileWriter fileWriter = new EmbeddedFileWriter();
    private final List<SessionEvent> events = Collections.synchronizedList(new ArrayList<>());
    private final AtomicBoolean canceled = new AtomicBoolean();
    private final List<SymbolTable> environmentScopes = new ArrayList<>();
    private final Deque<Integer> enteredEnvironments = new ArrayDeque<>();

    private volatile SessionState state = SessionState.INITIALIZING;
    private SessionContext context;
    private long startNanos;
    private boolean environmentFailed;
    private boolean exitFailed;
    private int startedTasks;
    private int succeededTasks;
    private int failedTasks;
    private SessionResult result;

    public Session(final String id, final SessionPlan plan, final SessionConfiguration configuration, final PathMapper pathMapper,
            final ActionRunner actionRunner, final SessionEventListener listener) {
        this.id = id;
        this.plan = plan;
        this.configuration = configuration;
        this.pathMapper = pathMapper;
        this.actionRunner = actionRunner;
        this.listener = listener;
    }

    /**
     * Runs the whole lifecycle. Returns normally whatever the outcome; the result tells how it went.
     */
    public SessionResult run() {
        try {
            initialize();
        } catch (SessionSetupException e) {
            return result;
        }
        for (Environment environment : plan.environments()) {
            if (canceled.get() || !enterEnvironment(environment)) {
                break;
            }
        }
        for (TaskRun taskRun : plan.taskRuns()) {
            if (isStopped()) {
                break;
            }
            runTask(taskRun);
        }
        return exitEnvironments();
    }

    /**
     * Creates the working directory, writes the path mapping rules and the embedded files of every planned environment.
     *
     * @throws SessionSetupException if any of it fails; the session has then ended and no environment was entered
     */
    public void initialize() {
        requireState(SessionState.INITIALIZING);
        startNanos = System.nanoTime();
        emit(SessionEvent.builder().type(SessionEventType.SESSION_STARTED).subject(plan.step().name()));
        Path workingDirectory = null;
        try {
            var root = Paths.get(configuration.workingDirectoryRoot());
            Files.createDirectories(root);
            workingDirectory = Files.createTempDirectory(root, "minijd-session-").toAbsolutePath();
            var rulesFile = workingDirectory.resolve(PATH_MAPPING_RULES_FILENAME);
            PathMappingRulesFile.write(pathMapper.getRules(), rulesFile);
            var symbols = plan.jobParameters()
                    .toSymbolTable()
                    .with(SymbolNames.SESSION_WORKING_DIRECTORY, workingDirectory.toString())
                    .with(SymbolNames.SESSION_HAS_PATH_MAPPING_RULES, Boolean.toString(pathMapper.hasRules()))
                    .with(SymbolNames.SESSION_PATH_MAPPING_RULES_FILE, rulesFile.toString())
                    .inScope("session " + id);
            context = new SessionContext(id, workingDirectory, symbols, EnvironmentOverlay.empty());
            var filesDirectory = workingDirectory.resolve(EMBEDDED_FILES_DIRECTORY);
            for (int i = 0; i < plan.environments().size(); i++) {
                var environment = plan.environments().get(i);
                var scope = symbols.inScope("environment " + environment.name());
                if (environment.script().isPresent()) {
                    scope = fileWriter.write(environment.script().get().embeddedFiles(),
                            filesDirectory.resolve("environment-" + i),
                            scope,
                            SymbolNames::envFile);
                }
                environmentScopes.add(scope);
            }
        } catch (IOException | MiniJdException e) {
            LOGGER.error("[{}] Session setup failed", id, e);
            if (workingDirectory != null) {
                deleteWorkingDirectory(workingDirectory);
            }
            end(SessionState.ENDED_FAILED);
            throw new SessionSetupException(String.format("Could not set up session %s: %s", id, e.getMessage()), e);
        }
        LOGGER.info("[{}] Session started in {}", id, workingDirectory);
        transition(SessionState.ENTERING_ENVIRONMENTS);
    }

    /**
     * Enters the next environment: pushes its variables and runs its onEnter action. The environment counts as entered, and will
     * be exited, even when onEnter fails.
     *
     * @return whether onEnter succeeded; after a failure no further environment can be entered and no task can run
     */
    public boolean enterEnvironment(Environment environment) {
        requireState(SessionState.ENTERING_ENVIRONMENTS);
        if (environmentFailed) {
            throw new IllegalStateException(String.format("Session %s already failed to enter an environment", id));
        }
        var index = enteredEnvironments.size();
        if (index >= plan.environments().size() || !plan.environments().get(index).equals(environment)) {
            throw new IllegalArgumentException(String.format("Environment '%s' is not the next planned environment of session %s",
                    environment.name(),
                    id));
        }
        var scope = environmentScopes.get(index);
        var status = ActionStatus.SUCCESS;
        var variables = new LinkedHashMap<String, String>();
        try {
            for (Map.Entry<String, String> variable : environment.variables().entrySet()) {
                variables.put(variable.getKey(), FormatString.resolve(variable.getValue(), context.getSymbols()));
            }
        } catch (MiniJdException e) {
            LOGGER.error("[{}] Could not resolve variables of environment [{}]: {}", id, environment.name(), e.getMessage());
            status = ActionStatus.FAILED;
        }
        context = context.withOverlay(context.getOverlay().push(environment.name(), variables));
        enteredEnvironments.push(index);

        var onEnter = environment.script().flatMap(script -> script.actions().onEnter());
        if (status == ActionStatus.SUCCESS && onEnter.isPresent()) {
            var changes = new ConcurrentLinkedQueue<Pair<String, Optional<String>>>();
            status = runAction(onEnter.get(), "onEnter of " + environment.name(), environment.name(), scope, true,
                    line -> parseEnvironmentDirective(line, changes));
            if (status == ActionStatus.SUCCESS) {
                applyEnvironmentChanges(changes);
            }
        }
        if (status != ActionStatus.SUCCESS) {
            environmentFailed = true;
            LOGGER.warn("[{}] Failed to enter environment [{}]", id, environment.name());
            return false;
        }
        emit(SessionEvent.builder().type(SessionEventType.ENVIRONMENT_ENTERED).subject(environment.name()));
        LOGGER.info("[{}] Entered environment [{}]", id, environment.name());
        return true;
    }

    /**
     * Runs the onRun action of the step for one task run, with the step's embedded files written for this task.
     */
    public ActionStatus runTask(TaskRun taskRun) {
        if (state == SessionState.ENTERING_ENVIRONMENTS) {
            if (environmentFailed) {
                throw new IllegalStateException(String.format("Session %s cannot run tasks, an environment failed", id));
            }
            transition(SessionState.READY);
        }
        transition(SessionState.RUNNING_TASK);
        startedTasks++;
        var step = plan.step();
        var taskParameters = new LinkedHashMap<String, String>();
        taskRun.parameters().forEach((name, value) -> taskParameters.put(name, value.value()));
        emit(SessionEvent.builder().type(SessionEventType.TASK_STARTED).subject(step.name()).taskParameters(taskParameters));
        var description = String.format("onRun of %s (%s)", step.name(), taskRun.describe());
        ActionStatus status;
        try {
            var scope = fileWriter.write(step.script().embeddedFiles(),
                    context.getWorkingDirectory().resolve(EMBEDDED_FILES_DIRECTORY).resolve("task-" + startedTasks),
                    taskSymbols(taskRun),
                    SymbolNames::taskFile);
            status = runAction(step.script().actions().onRun(), description, step.name(), scope, true, line -> {
            });
        } catch (IOException | MiniJdException e) {
            LOGGER.error("[{}] Could not prepare {}: {}", id, description, e.getMessage());
            status = ActionStatus.FAILED;
        }
        if (status == ActionStatus.SUCCESS) {
            succeededTasks++;
        } else {
            failedTasks++;
        }
        emit(SessionEvent.builder().type(SessionEventType.TASK_COMPLETED).subject(step.name()).status(status));
        transition(SessionState.READY);
        return status;
    }

    /**
     * Exits every entered environment in reverse order, running onExit regardless of earlier failures, then removes the working
     * directory and ends the session.
     */
    public SessionResult exitEnvironments() {
        requireState(SessionState.ENTERING_ENVIRONMENTS, SessionState.READY);
        transition(SessionState.EXITING_ENVIRONMENTS);
        while (!enteredEnvironments.isEmpty()) {
            var index = enteredEnvironments.pop();
            var environment = plan.environments().get(index);
            var onExit = environment.script().flatMap(script -> script.actions().onExit());
            var status = ActionStatus.SUCCESS;
            if (onExit.isPresent()) {
                status = runAction(onExit.get(), "onExit of " + environment.name(), environment.name(), environmentScopes.get(index), false,
                        line -> {
                        });
                if (status != ActionStatus.SUCCESS) {
                    exitFailed = true;
                }
            }
            context = context.withOverlay(context.getOverlay().pop());
            emit(SessionEvent.builder().type(SessionEventType.ENVIRONMENT_EXITED).subject(environment.name()).status(status));
            LOGGER.info("[{}] Exited environment [{}]", id, environment.name());
        }
        deleteWorkingDirectory(context.getWorkingDirectory());
        var success = !environmentFailed && !exitFailed && failedTasks == 0 && notRunTasks() == 0 && !canceled.get();
        end(success ? SessionState.ENDED_SUCCESS : SessionState.ENDED_FAILED);
        return result;
    }

    /**
     * Stops the running action using its cancelation method. No further environment is entered and no further task started;
     * entered environments are still exited.
     */
    public void cancel() {
        if (!canceled.getAndSet(true)) {
            LOGGER.info("[{}] Session canceled", id);
        }
    }

    public boolean isStopped() {
        return canceled.get() || environmentFailed || failedTasks > 0;
    }

    public String getId() {
        return id;
    }

    public SessionState getState() {
        return state;
    }

    public Optional<SessionResult> getResult() {
        return Optional.ofNullable(result);
    }

    private SymbolTable taskSymbols(TaskRun taskRun) {
        var symbols = new LinkedHashMap<String, String>();
        taskRun.parameters().forEach((name, value) -> {
            var mapped = value.type() == ParameterType.PATH ? pathMapper.translate(value.value()) : value.value();
            symbols.put(SymbolNames.taskParam(name), mapped);
            symbols.put(SymbolNames.taskRawParam(name), value.value());
        });
        return context.getSymbols().withAll(symbols).inScope(String.format("task %s (%s)", plan.step().name(), taskRun.describe()));
    }

    private ActionStatus runAction(Action action, String description, String subject, SymbolTable scope, boolean cancelable,
            Consumer<String> lineHandler) {
        ActionInvocation invocation;
        try {
            var cancelation = action.cancelation().orElse(CancelationMethod.terminate());
            var builder = ActionInvocation.builder()
                    .description(description)
                    .command(FormatString.resolve(action.command(), scope))
                    .args(action.args().stream().map(arg -> FormatString.resolve(arg, scope)).collect(Collectors.toList()))
                    .workingDirectory(context.getWorkingDirectory())
                    .environment(context.getOverlay().resolve(System.getenv()))
                    .cancelationMode(cancelation.mode())
                    .notifyPeriod(Duration.ofSeconds(cancelation.notifyPeriodInSeconds()
                            .orElse(configuration.defaultNotifyPeriodSeconds())));
            action.timeout().ifPresent(timeout -> builder.timeout(Duration.ofSeconds(timeout)));
            invocation = builder.build();
        } catch (MiniJdException e) {
            LOGGER.error("[{}] Could not resolve {}: {}", id, description, e.getMessage());
            emit(SessionEvent.builder()
                    .type(SessionEventType.ACTION_COMPLETED)
                    .subject(subject)
                    .status(ActionStatus.FAILED)
                    .message(e.getMessage()));
            return ActionStatus.FAILED;
        }

        LOGGER.info("[{}] Running {}", id, description);
        emit(SessionEvent.builder()
                .type(SessionEventType.ACTION_STARTED)
                .subject(subject)
                .message(String.join(" ", invocation.commandLine())));
        ActionStatus status;
        String message;
        try {
            actionRunner.run(invocation, cancelable ? canceled::get : () -> false, line -> onOutput(subject, line, lineHandler));
            status = ActionStatus.SUCCESS;
            message = description + " succeeded";
        } catch (ActionTimeoutException e) {
            status = ActionStatus.TIMEOUT;
            message = e.getMessage();
        } catch (ActionCanceledException e) {
            status = ActionStatus.CANCELED;
            message = e.getMessage();
        } catch (ActionFailureException e) {
            status = ActionStatus.FAILED;
            message = e.getMessage();
        }
        if (status == ActionStatus.SUCCESS) {
            LOGGER.info("[{}] {}", id, message);
        } else {
            LOGGER.warn("[{}] {}", id, message);
        }
        emit(SessionEvent.builder().type(SessionEventType.ACTION_COMPLETED).subject(subject).status(status).message(message));
        return status;
    }

    private void onOutput(String subject, String line, Consumer<String> lineHandler) {
        LOGGER.info("[{}] [{}] {}", id, subject, line);
        emit(SessionEvent.builder().type(SessionEventType.ACTION_OUTPUT).subject(subject).message(line));
        if (line.startsWith(PROGRESS_DIRECTIVE)) {
            var value = StringUtils.substringAfter(line, PROGRESS_DIRECTIVE).strip();
            try {
                var progress = Double.parseDouble(value);
                if (progress >= 0 && progress <= 100) {
                    emit(SessionEvent.builder().type(SessionEventType.ACTION_PROGRESS).subject(subject).progress(progress));
                } else {
                    LOGGER.warn("[{}] Ignoring progress {} outside 0-100", id, value);
                }
            } catch (NumberFormatException e) {
                LOGGER.warn("[{}] Ignoring malformed progress '{}'", id, value);
            }
        } else if (line.startsWith(STATUS_DIRECTIVE)) {
            emit(SessionEvent.builder()
                    .type(SessionEventType.ACTION_STATUS)
                    .subject(subject)
                    .message(StringUtils.substringAfter(line, STATUS_DIRECTIVE).strip()));
        }
        lineHandler.accept(line);
    }

    private void parseEnvironmentDirective(String line, ConcurrentLinkedQueue<Pair<String, Optional<String>>> changes) {
        if (line.startsWith(ENV_DIRECTIVE)) {
            var assignment = StringUtils.substringAfter(line, ENV_DIRECTIVE).strip();
            var name = StringUtils.substringBefore(assignment, "=");
            if (name.isEmpty() || !assignment.contains("=")) {
                LOGGER.warn("[{}] Ignoring malformed '{}', expected NAME=VALUE", id, line);
                return;
            }
            changes.add(Pair.of(name, Optional.of(StringUtils.substringAfter(assignment, "="))));
        } else if (line.startsWith(UNSET_ENV_DIRECTIVE)) {
            var name = StringUtils.substringAfter(line, UNSET_ENV_DIRECTIVE).strip();
            if (name.isEmpty()) {
                LOGGER.warn("[{}] Ignoring '{}' without a variable name", id, line);
                return;
            }
            changes.add(Pair.of(name, Optional.empty()));
        }
    }

    private void applyEnvironmentChanges(ConcurrentLinkedQueue<Pair<String, Optional<String>>> changes) {
        var overlay = context.getOverlay();
        for (Pair<String, Optional<String>> change : changes) {
            overlay = change.getRight().isPresent()
                    ? overlay.set(change.getLeft(), change.getRight().get())
                    : overlay.unset(change.getLeft());
        }
        context = context.withOverlay(overlay);
    }

    private int notRunTasks() {
        return Math.max(0, plan.taskRuns().size() - startedTasks);
    }

    private void end(SessionState endState) {
        transition(endState);
        var duration = Duration.ofNanos(System.nanoTime() - startNanos);
        var summary = String.format("%s: %d succeeded, %d failed, %d not run in %s",
                endState,
                succeededTasks,
                failedTasks,
                notRunTasks(),
                duration);
        emit(SessionEvent.builder()
                .type(SessionEventType.SESSION_ENDED)
                .subject(plan.step().name())
                .status(endState == SessionState.ENDED_SUCCESS ? ActionStatus.SUCCESS : ActionStatus.FAILED)
                .message(summary));
        LOGGER.info("[{}] Session ended {}", id, summary);
        synchronized (events) {
            result = ImmutableSessionResult.builder()
                    .sessionId(id)
                    .state(endState)
                    .events(events)
                    .succeededTasks(succeededTasks)
                    .failedTasks(failedTasks)
                    .notRunTasks(notRunTasks())
                    .duration(duration)
                    .build();
        }
    }

    private void deleteWorkingDirectory(Path workingDirectory) {
        if (configuration.keepWorkingDirectory()) {
            LOGGER.info("[{}] Keeping working directory {}", id, workingDirectory);
            return;
        }
        try (var paths = Files.walk(workingDirectory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            LOGGER.warn("[{}] Could not delete working directory {}", id, workingDirectory, e);
        }
    }

    private void emit(ImmutableSessionEvent.Builder event) {
        var built = event.sessionId(id).build();
        events.add(built);
        listener.onEvent(built);
    }

    private void requireState(SessionState... allowed) {
        for (SessionState candidate : allowed) {
            if (state == candidate) {
                return;
            }
        }
        throw new IllegalStateException(String.format("Session %s is %s, expected one of %s", id, state, List.of(allowed)));
    }

    private void transition(SessionState next) {
        if (!state.successors().contains(next)) {
            throw new IllegalStateException(String.format("Session %s cannot go from %s to %s", id, state, next));
        }
        LOGGER.debug("[{}] {} -> {}", id, state, next);
        state = next;
    }
}
