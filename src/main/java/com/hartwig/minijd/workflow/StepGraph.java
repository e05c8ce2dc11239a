package com.hartwig.minijd.workflow;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.hartwig.minijd.template.Step;
import com.hartwig.minijd.template.validation.ValidatedJobTemplate;

import org.apache.commons.lang3.tuple.Pair;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.EdgeReversedGraph;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;
import org.jgrapht.traverse.DepthFirstIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The step dependency graph of a validated template. An execution schedules every step whose dependencies all succeeded and
 * marks everything downstream of a failed step as not runnable.
 */
public class StepGraph {
    private static final Logger LOGGER = LoggerFactory.getLogger(StepGraph.class);

    private final ValidatedJobTemplate template;
    private final ExecutorService executorService;

    public StepGraph(final ValidatedJobTemplate template, final ExecutorService executorService) {
        this.template = template;
        this.executorService = executorService;
    }

    /**
     * @param stepRuns  creates the run of a step when it becomes ready; a step whose run cannot be created fails
     * @param stepNames steps to run; their dependencies run as well, every other step is skipped. Empty runs all steps.
     */
    public StepGraphExecution createExecution(StepScheduler stepScheduler, Function<Step, StepRun> stepRuns, Set<String> stepNames) {
        for (String stepName : stepNames) {
            template.handleOf(stepName);
        }
        return new StepGraphExecution(stepScheduler, stepRuns, stepNames);
    }

    /**
     * Edges point from a step to the steps that depend on it.
     */
    private DefaultDirectedGraph<Integer, DefaultEdge> createGraph() {
        var g = new DefaultDirectedGraph<Integer, DefaultEdge>(DefaultEdge.class);
        for (Integer handle : template.getTopologicalOrder()) {
            g.addVertex(handle);
        }
        for (Integer handle : template.getTopologicalOrder()) {
            for (Integer dependency : template.getDependencies(handle)) {
                g.addEdge(dependency, handle, new DefaultEdge());
            }
        }
        return g;
    }

    public enum StepRunningState {
        WAITING("black"),
        RUNNING("orange"),
        SUCCESS("green"),
        FAILED("red"),
        NOT_RUNNABLE("grey"),
        SKIPPED("lightgrey");

        final String color;

        StepRunningState(final String color) {
            this.color = color;
        }
    }

    public class StepGraphExecution {
        private final Map<String, StepRunningState> stepNameToRunningState = new LinkedHashMap<>();
        private final BlockingQueue<Pair<Integer, Boolean>> stepDoneQueue = new LinkedBlockingQueue<>();
        private final DefaultDirectedGraph<Integer, DefaultEdge> fullGraph;
        private final DefaultDirectedGraph<Integer, DefaultEdge> runGraph;
        private final StepScheduler stepScheduler;
        private final Function<Step, StepRun> stepRuns;
        private CompletableFuture<Boolean> doneFuture;

        // copy on write map, for viewing the step state from another thread.
        private volatile Map<String, StepRunningState> stepStateView;
        private final List<Consumer<Map<String, StepRunningState>>> stepStateSubscribers = Collections.synchronizedList(new ArrayList<>());
        private Future<?> cancellableFuture;

        private StepGraphExecution(final StepScheduler stepScheduler, final Function<Step, StepRun> stepRuns, final Set<String> stepNames) {
            fullGraph = createGraph();
            runGraph = createGraph();
            this.stepScheduler = stepScheduler;
            this.stepRuns = stepRuns;

            var selected = selectedWithDependencies(stepNames);
            for (Integer handle : template.getTopologicalOrder()) {
                var name = template.getStep(handle).name();
                if (!selected.contains(handle)) {
                    LOGGER.info("Skipping step [{}] since it was not selected.", name);
                    runGraph.removeVertex(handle);
                    stepNameToRunningState.put(name, StepRunningState.SKIPPED);
                } else {
                    stepNameToRunningState.put(name, StepRunningState.WAITING);
                }
            }
            stepStateView = Collections.unmodifiableMap(new LinkedHashMap<>(stepNameToRunningState));
        }

        private Set<Integer> selectedWithDependencies(Set<String> stepNames) {
            if (stepNames.isEmpty()) {
                return fullGraph.vertexSet();
            }
            var selected = new HashSet<Integer>();
            var reversed = new EdgeReversedGraph<>(fullGraph);
            for (String stepName : stepNames) {
                new DepthFirstIterator<>(reversed, template.handleOf(stepName)).forEachRemaining(selected::add);
            }
            return selected;
        }

        /**
         * Starts the worker thread for this graph execution.
         *
         * @return Future that returns true if every selected step finished successfully, false otherwise.
         */
        public synchronized CompletableFuture<Boolean> start() {
            if (doneFuture != null) {
                LOGGER.warn("Execution of job template '{}' was already started.", template.getTemplate().name());
                return doneFuture;
            }
            // cancelling a CompletableFuture does not interrupt the worker, so keep the executor's future for cancel()
            doneFuture = new CompletableFuture<>();
            cancellableFuture = executorService.submit(() -> {
                try {
                    run();
                } catch (Throwable t) {
                    LOGGER.error("Execution of job template '{}' failed", template.getTemplate().name(), t);
                    doneFuture.completeExceptionally(t);
                }
            });
            return doneFuture;
        }

        private void run() {
            updateStepStateView();
            while (!runGraph.vertexSet().isEmpty()) {
                runRound();
                try {
                    var done = stepDoneQueue.take();
                    onStepDone(done.getLeft(), done.getRight());
                } catch (InterruptedException e) {
                    LOGGER.warn("Job execution interrupted. Cleaning up.");
                    Thread.currentThread().interrupt();
                    doneFuture.complete(false);
                    return;
                }
            }
            doneFuture.complete(stepNameToRunningState.values()
                    .stream()
                    .allMatch(state -> state == StepRunningState.SUCCESS || state == StepRunningState.SKIPPED));
        }

        public synchronized void cancel() {
            if (cancellableFuture != null) {
                cancellableFuture.cancel(true);
                // the worker may not have started, or may run on a pool that does not interrupt
                doneFuture.complete(false);
            }
        }

        private void runRound() {
            var readySteps = runGraph.vertexSet()
                    .stream()
                    .filter(handle -> runGraph.incomingEdgesOf(handle).isEmpty())
                    .filter(handle -> stepNameToRunningState.get(template.getStep(handle).name()) == StepRunningState.WAITING)
                    .sorted()
                    .collect(Collectors.toList());
            for (Integer handle : readySteps) {
                var step = template.getStep(handle);
                stepNameToRunningState.put(step.name(), StepRunningState.RUNNING);
                try {
                    var stepRun = stepRuns.apply(step);
                    stepScheduler.schedule(stepRun).whenComplete((result, error) -> {
                        if (error != null) {
                            LOGGER.error("[{}] Step failed with", step.name(), error);
                        }
                        stepDoneQueue.add(Pair.of(handle, error == null && result));
                    });
                } catch (RuntimeException e) {
                    LOGGER.error("[{}] Could not prepare step: {}", step.name(), e.getMessage());
                    stepDoneQueue.add(Pair.of(handle, false));
                }
            }
            if (!readySteps.isEmpty()) {
                updateStepStateView();
            }
        }

        private void onStepDone(Integer handle, boolean success) {
            var name = template.getStep(handle).name();
            if (!success) {
                var iterator = new DepthFirstIterator<>(runGraph, handle);
                var notRunnable = new ArrayList<Integer>();
                while (iterator.hasNext()) {
                    notRunnable.add(iterator.next());
                }
                runGraph.removeAllVertices(notRunnable);
                for (Integer downstream : notRunnable) {
                    stepNameToRunningState.put(template.getStep(downstream).name(), StepRunningState.NOT_RUNNABLE);
                }
                stepNameToRunningState.put(name, StepRunningState.FAILED);
                LOGGER.warn("Step [{}] failed, {} step(s) downstream will not run", name, notRunnable.size() - 1);
            } else {
                runGraph.removeVertex(handle);
                stepNameToRunningState.put(name, StepRunningState.SUCCESS);
            }
            updateStepStateView();
        }

        private void updateStepStateView() {
            stepStateView = Collections.unmodifiableMap(new LinkedHashMap<>(stepNameToRunningState));
            synchronized (stepStateSubscribers) {
                stepStateSubscribers.forEach(subscriber -> subscriber.accept(stepStateView));
            }
        }

        /**
         * State of every step, in topological order.
         */
        public Map<String, StepRunningState> getStepStateView() {
            return stepStateView;
        }

        public String toDotFormat() {
            var exporter = new DOTExporter<Integer, DefaultEdge>();
            exporter.setVertexAttributeProvider((v) -> {
                Map<String, Attribute> map = new LinkedHashMap<>();
                var name = template.getStep(v).name();
                map.put("label", DefaultAttribute.createAttribute(name));
                map.put("color", DefaultAttribute.createAttribute(stepStateView.get(name).color));
                return map;
            });
            var writer = new StringWriter();
            exporter.exportGraph(fullGraph, writer);
            return writer.toString();
        }

        public void subscribe(Consumer<Map<String, StepRunningState>> subscriber) {
            this.stepStateSubscribers.add(subscriber);
        }
    }
}
