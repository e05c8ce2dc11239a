package com.hartwig.minijd.template.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.hartwig.minijd.MiniJdException;
import com.hartwig.minijd.expansion.AssociationCardinalityException;
import com.hartwig.minijd.expansion.CombinationExpression;
import com.hartwig.minijd.expansion.IntRangeExpression;
import com.hartwig.minijd.expansion.RangeExpander;
import com.hartwig.minijd.expansion.TaskRunExpander;
import com.hartwig.minijd.format.FormatString;
import com.hartwig.minijd.format.FormatStringException;
import com.hartwig.minijd.format.SymbolNames;
import com.hartwig.minijd.format.SymbolTable;
import com.hartwig.minijd.template.Action;
import com.hartwig.minijd.template.CancelationMode;
import com.hartwig.minijd.template.EmbeddedFile;
import com.hartwig.minijd.template.Environment;
import com.hartwig.minijd.template.JobTemplate;
import com.hartwig.minijd.template.ParameterDefinition;
import com.hartwig.minijd.template.ParameterType;
import com.hartwig.minijd.template.Step;
import com.hartwig.minijd.template.StepParameterSpace;
import com.hartwig.minijd.template.TaskParameterDefinition;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.alg.cycle.TarjanSimpleCycles;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a parsed template before anything runs. Every problem found is reported, not just the first.
 */
public class TemplateValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateValidator.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern FILENAME = Pattern.compile("[^/\\\\:*?\"<>|]+");
    private static final int MAX_NAME_LENGTH = 64;
    private static final Set<String> SESSION_SYMBOLS = Set.of(SymbolNames.SESSION_WORKING_DIRECTORY,
            SymbolNames.SESSION_HAS_PATH_MAPPING_RULES,
            SymbolNames.SESSION_PATH_MAPPING_RULES_FILE);

    public ValidationResult validate(JobTemplate template) {
        var diagnostics = new ArrayList<ValidationDiagnostic>();
        if (!JobTemplate.SPECIFICATION_VERSION.equals(template.specificationVersion())) {
            diagnostics.add(ValidationDiagnostic.of("specificationVersion",
                    String.format("Unsupported specification version '%s', expected '%s'",
                            template.specificationVersion(),
                            JobTemplate.SPECIFICATION_VERSION)));
        }
        var jobSymbols = checkParameterDefinitions(template.parameterDefinitions(), diagnostics);
        if (template.name().isBlank()) {
            diagnostics.add(ValidationDiagnostic.of("name", "Job name must not be empty"));
        }
        checkFormatString(template.name(), "name", jobSymbols, diagnostics);

        var jobEnvironmentNames = checkEnvironments(template.jobEnvironments(), "jobEnvironments", Set.of(), jobSymbols, diagnostics);

        if (template.steps().isEmpty()) {
            diagnostics.add(ValidationDiagnostic.of("steps", "A template needs at least one step"));
        }
        var handlesByName = new LinkedHashMap<String, Integer>();
        for (int handle = 0; handle < template.steps().size(); handle++) {
            var step = template.steps().get(handle);
            var location = "steps[" + step.name() + "]";
            if (step.name().isBlank() || step.name().length() > MAX_NAME_LENGTH) {
                diagnostics.add(ValidationDiagnostic.of(location + ".name",
                        String.format("Step name must be between 1 and %d characters", MAX_NAME_LENGTH)));
            }
            if (handlesByName.putIfAbsent(step.name(), handle) != null) {
                diagnostics.add(ValidationDiagnostic.of(location, String.format("Duplicate step name '%s'", step.name())));
            }
            checkStep(step, location, jobSymbols, jobEnvironmentNames, diagnostics);
        }

        var dependencies = checkDependencies(template.steps(), handlesByName, diagnostics);
        var graph = dependencyGraph(template.steps().size(), dependencies);
        var cycle = findCycle(graph, template.steps());
        if (!cycle.isEmpty()) {
            diagnostics.add(ValidationDiagnostic.of("steps", "Steps form a dependency cycle: " + String.join(" -> ", cycle)));
        }

        if (!diagnostics.isEmpty()) {
            LOGGER.info("Template [{}] has {} problem(s)", template.name(), diagnostics.size());
            return ValidationResult.invalid(diagnostics, cycle);
        }
        var topologicalOrder = new ArrayList<Integer>();
        new TopologicalOrderIterator<>(graph, Comparator.<Integer>naturalOrder()).forEachRemaining(topologicalOrder::add);
        LOGGER.debug("Template [{}] is valid, step order {}", template.name(), topologicalOrder);
        return ValidationResult.valid(new ValidatedJobTemplate(template, handlesByName, dependencies, topologicalOrder));
    }

    private static Set<String> checkParameterDefinitions(List<ParameterDefinition> definitions, List<ValidationDiagnostic> diagnostics) {
        var symbols = new HashSet<String>();
        var names = new HashSet<String>();
        for (ParameterDefinition definition : definitions) {
            var location = "parameterDefinitions[" + definition.name() + "]";
            checkIdentifier(definition.name(), location + ".name", diagnostics);
            if (!names.add(definition.name())) {
                diagnostics.add(ValidationDiagnostic.of(location, String.format("Duplicate parameter name '%s'", definition.name())));
            }
            for (String problem : ParameterConstraints.checkDefinition(definition)) {
                diagnostics.add(ValidationDiagnostic.of(location, problem));
            }
            symbols.add(SymbolNames.param(definition.name()));
            symbols.add(SymbolNames.rawParam(definition.name()));
        }
        return symbols;
    }

    private static Set<String> checkEnvironments(List<Environment> environments, String location, Set<String> reservedNames,
            Set<String> jobSymbols, List<ValidationDiagnostic> diagnostics) {
        var names = new HashSet<String>();
        for (Environment environment : environments) {
            var environmentLocation = location + "[" + environment.name() + "]";
            if (environment.name().isBlank() || environment.name().length() > MAX_NAME_LENGTH) {
                diagnostics.add(ValidationDiagnostic.of(environmentLocation + ".name",
                        String.format("Environment name must be between 1 and %d characters", MAX_NAME_LENGTH)));
            }
            if (!names.add(environment.name())) {
                diagnostics.add(ValidationDiagnostic.of(environmentLocation,
                        String.format("Duplicate environment name '%s'", environment.name())));
            } else if (reservedNames.contains(environment.name())) {
                diagnostics.add(ValidationDiagnostic.of(environmentLocation,
                        String.format("Environment name '%s' is already used by a job environment", environment.name())));
            }
            checkEnvironment(environment, environmentLocation, jobSymbols, diagnostics);
        }
        return names;
    }

    private static void checkEnvironment(Environment environment, String location, Set<String> jobSymbols,
            List<ValidationDiagnostic> diagnostics) {
        if (environment.script().isEmpty() && environment.variables().isEmpty()) {
            diagnostics.add(ValidationDiagnostic.of(location, "An environment needs a script or variables"));
        }
        var variableSymbols = union(jobSymbols, SESSION_SYMBOLS);
        for (Map.Entry<String, String> variable : environment.variables().entrySet()) {
            var variableLocation = location + ".variables." + variable.getKey();
            checkIdentifier(variable.getKey(), variableLocation, diagnostics);
            checkFormatString(variable.getValue(), variableLocation, variableSymbols, diagnostics);
        }
        environment.script().ifPresent(script -> {
            var fileSymbols = checkEmbeddedFiles(script.embeddedFiles(), location + ".script.embeddedFiles", SymbolNames::envFile, diagnostics);
            var scriptSymbols = union(variableSymbols, fileSymbols);
            for (EmbeddedFile file : script.embeddedFiles()) {
                checkFormatString(file.data(), location + ".script.embeddedFiles[" + file.name() + "].data", scriptSymbols, diagnostics);
            }
            var actions = script.actions();
            if (actions.onEnter().isEmpty() && actions.onExit().isEmpty()) {
                diagnostics.add(ValidationDiagnostic.of(location + ".script.actions", "An environment script needs onEnter or onExit"));
            }
            actions.onEnter().ifPresent(action -> checkAction(action, location + ".script.actions.onEnter", scriptSymbols, diagnostics));
            actions.onExit().ifPresent(action -> checkAction(action, location + ".script.actions.onExit", scriptSymbols, diagnostics));
        });
    }

    private static void checkStep(Step step, String location, Set<String> jobSymbols, Set<String> jobEnvironmentNames,
            List<ValidationDiagnostic> diagnostics) {
        var taskSymbols = new HashSet<String>();
        step.parameterSpace().ifPresent(space -> {
            for (TaskParameterDefinition definition : space.taskParameterDefinitions()) {
                taskSymbols.add(SymbolNames.taskParam(definition.name()));
                taskSymbols.add(SymbolNames.taskRawParam(definition.name()));
            }
            checkParameterSpace(space, location + ".parameterSpace", jobSymbols, diagnostics);
        });
        var fileSymbols =
                checkEmbeddedFiles(step.script().embeddedFiles(), location + ".script.embeddedFiles", SymbolNames::taskFile, diagnostics);
        var scriptSymbols = union(union(jobSymbols, SESSION_SYMBOLS), union(taskSymbols, fileSymbols));
        for (EmbeddedFile file : step.script().embeddedFiles()) {
            checkFormatString(file.data(), location + ".script.embeddedFiles[" + file.name() + "].data", scriptSymbols, diagnostics);
        }
        checkAction(step.script().actions().onRun(), location + ".script.actions.onRun", scriptSymbols, diagnostics);
        checkEnvironments(step.stepEnvironments(), location + ".stepEnvironments", jobEnvironmentNames, jobSymbols, diagnostics);
    }

    private static void checkParameterSpace(StepParameterSpace space, String location, Set<String> jobSymbols,
            List<ValidationDiagnostic> diagnostics) {
        var definitions = space.taskParameterDefinitions();
        if (definitions.isEmpty()) {
            diagnostics.add(ValidationDiagnostic.of(location + ".taskParameterDefinitions", "A parameter space needs at least one task parameter"));
            return;
        }
        var names = new ArrayList<String>();
        var sizes = new HashMap<String, Integer>();
        for (TaskParameterDefinition definition : definitions) {
            var definitionLocation = location + ".taskParameterDefinitions[" + definition.name() + "]";
            checkIdentifier(definition.name(), definitionLocation + ".name", diagnostics);
            if (names.contains(definition.name())) {
                diagnostics.add(ValidationDiagnostic.of(definitionLocation,
                        String.format("Duplicate task parameter name '%s'", definition.name())));
                continue;
            }
            names.add(definition.name());
            staticRangeSize(definition, definitionLocation + ".range", jobSymbols, diagnostics).ifPresent(size -> sizes.put(definition.name(),
                    size));
        }

        CombinationExpression combination;
        try {
            combination = space.combination().map(CombinationExpression::parse).orElseGet(() -> CombinationExpression.productOf(names));
        } catch (MiniJdException e) {
            diagnostics.add(ValidationDiagnostic.of(location + ".combination", e.getMessage()));
            return;
        }
        var used = combination.parameterNames();
        var covered = true;
        for (String name : new HashSet<>(used)) {
            if (!names.contains(name)) {
                diagnostics.add(ValidationDiagnostic.of(location + ".combination", String.format("Unknown task parameter '%s'", name)));
                covered = false;
            } else if (Collections.frequency(used, name) > 1) {
                diagnostics.add(ValidationDiagnostic.of(location + ".combination",
                        String.format("Task parameter '%s' appears more than once", name)));
                covered = false;
            }
        }
        for (String name : names) {
            if (!used.contains(name)) {
                diagnostics.add(ValidationDiagnostic.of(location + ".combination", String.format("Task parameter '%s' is not used", name)));
                covered = false;
            }
        }
        if (covered && sizes.keySet().containsAll(names)) {
            try {
                var taskCount = combination.cardinality(sizes);
                if (taskCount > TaskRunExpander.MAX_TASK_RUNS) {
                    diagnostics.add(ValidationDiagnostic.of(location + ".combination",
                            String.format("Combination produces %d tasks, more than the maximum of %d", taskCount, TaskRunExpander.MAX_TASK_RUNS)));
                }
            } catch (AssociationCardinalityException e) {
                diagnostics.add(ValidationDiagnostic.of(location + ".combination", e.getMessage()));
            } catch (ArithmeticException e) {
                diagnostics.add(ValidationDiagnostic.of(location + ".combination",
                        String.format("Combination produces more than the maximum of %d tasks", TaskRunExpander.MAX_TASK_RUNS)));
            }
        }
    }

    /**
     * Number of values of a task parameter when its range does not depend on job parameters.
     */
    private static Optional<Integer> staticRangeSize(TaskParameterDefinition definition, String location, Set<String> jobSymbols,
            List<ValidationDiagnostic> diagnostics) {
        var range = definition.range();
        var hasReferences = false;
        if (range.isExpression()) {
            if (definition.type() != ParameterType.INT) {
                diagnostics.add(ValidationDiagnostic.of(location,
                        String.format("Range expressions are only allowed for INT, not %s; list the values instead", definition.type())));
                return Optional.empty();
            }
            hasReferences = checkFormatString(range.getExpression().orElseThrow(), location, jobSymbols, diagnostics);
        } else {
            if (range.getValues().isEmpty()) {
                diagnostics.add(ValidationDiagnostic.of(location, "Range must list at least one value"));
                return Optional.empty();
            }
            for (int i = 0; i < range.getValues().size(); i++) {
                hasReferences |= checkFormatString(range.getValues().get(i), location + "[" + i + "]", jobSymbols, diagnostics);
            }
        }
        if (hasReferences) {
            return Optional.empty();
        }
        try {
            long size = range.isExpression()
                    ? IntRangeExpression.parse(range.getExpression().orElseThrow()).size()
                    : RangeExpander.expand(definition, SymbolTable.empty("template validation")).size();
            if (size > TaskRunExpander.MAX_TASK_RUNS) {
                diagnostics.add(ValidationDiagnostic.of(location,
                        String.format("Range has %d values, more than the maximum of %d", size, TaskRunExpander.MAX_TASK_RUNS)));
                return Optional.empty();
            }
            return Optional.of((int) size);
        } catch (MiniJdException e) {
            diagnostics.add(ValidationDiagnostic.of(location, e.getMessage()));
            return Optional.empty();
        }
    }

    private static Set<String> checkEmbeddedFiles(List<EmbeddedFile> files, String location,
            Function<String, String> symbolName, List<ValidationDiagnostic> diagnostics) {
        var names = new HashSet<String>();
        var symbols = new HashSet<String>();
        for (EmbeddedFile file : files) {
            var fileLocation = location + "[" + file.name() + "]";
            checkIdentifier(file.name(), fileLocation + ".name", diagnostics);
            if (!names.add(file.name())) {
                diagnostics.add(ValidationDiagnostic.of(fileLocation, String.format("Duplicate embedded file name '%s'", file.name())));
            }
            file.filename()
                    .filter(filename -> !FILENAME.matcher(filename).matches() || filename.equals(".") || filename.equals(".."))
                    .ifPresent(filename -> diagnostics.add(ValidationDiagnostic.of(fileLocation + ".filename",
                            String.format("'%s' is not a plain file name", filename))));
            symbols.add(symbolName.apply(file.name()));
        }
        return symbols;
    }

    private static void checkAction(Action action, String location, Set<String> symbols, List<ValidationDiagnostic> diagnostics) {
        if (action.command().isBlank()) {
            diagnostics.add(ValidationDiagnostic.of(location + ".command", "Command must not be empty"));
        }
        checkFormatString(action.command(), location + ".command", symbols, diagnostics);
        for (int i = 0; i < action.args().size(); i++) {
            checkFormatString(action.args().get(i), location + ".args[" + i + "]", symbols, diagnostics);
        }
        action.timeout()
                .filter(timeout -> timeout <= 0)
                .ifPresent(timeout -> diagnostics.add(ValidationDiagnostic.of(location + ".timeout",
                        String.format("Timeout must be positive, but is %d", timeout))));
        action.cancelation().ifPresent(cancelation -> cancelation.notifyPeriodInSeconds().ifPresent(period -> {
            if (cancelation.mode() != CancelationMode.NOTIFY_THEN_TERMINATE) {
                diagnostics.add(ValidationDiagnostic.of(location + ".cancelation.notifyPeriodInSeconds",
                        "Notify period only applies to NOTIFY_THEN_TERMINATE"));
            } else if (period <= 0) {
                diagnostics.add(ValidationDiagnostic.of(location + ".cancelation.notifyPeriodInSeconds",
                        String.format("Notify period must be positive, but is %d", period)));
            }
        }));
    }

    /**
     * Reports syntax errors and references to symbols outside the given set.
     *
     * @return whether the string contains any placeholder
     */
    private static boolean checkFormatString(String text, String location, Set<String> symbols, List<ValidationDiagnostic> diagnostics) {
        FormatString formatString;
        try {
            formatString = FormatString.parse(text);
        } catch (FormatStringException e) {
            diagnostics.add(ValidationDiagnostic.of(location, e.getMessage()));
            return false;
        }
        var references = formatString.getReferences();
        var placeholders = formatString.getPlaceholders();
        for (int i = 0; i < references.size(); i++) {
            if (!symbols.contains(references.get(i))) {
                diagnostics.add(ValidationDiagnostic.of(location, String.format("Unresolved reference '%s'", placeholders.get(i))));
            }
        }
        return formatString.hasReferences();
    }

    private static void checkIdentifier(String name, String location, List<ValidationDiagnostic> diagnostics) {
        if (!IDENTIFIER.matcher(name).matches() || name.length() > MAX_NAME_LENGTH) {
            diagnostics.add(ValidationDiagnostic.of(location,
                    String.format("'%s' is not a valid identifier of at most %d characters", name, MAX_NAME_LENGTH)));
        }
    }

    private static List<List<Integer>> checkDependencies(List<Step> steps, Map<String, Integer> handlesByName,
            List<ValidationDiagnostic> diagnostics) {
        var dependencies = new ArrayList<List<Integer>>();
        for (Step step : steps) {
            var location = "steps[" + step.name() + "].dependencies";
            var handles = new ArrayList<Integer>();
            for (String dependsOn : step.dependencyNames()) {
                var handle = handlesByName.get(dependsOn);
                if (handle == null) {
                    diagnostics.add(ValidationDiagnostic.of(location, String.format("Unknown step '%s'", dependsOn)));
                } else if (dependsOn.equals(step.name())) {
                    diagnostics.add(ValidationDiagnostic.of(location, String.format("Step '%s' depends on itself", dependsOn)));
                } else if (handles.contains(handle)) {
                    diagnostics.add(ValidationDiagnostic.of(location, String.format("Duplicate dependency on '%s'", dependsOn)));
                } else {
                    handles.add(handle);
                }
            }
            dependencies.add(handles);
        }
        return dependencies;
    }

    /**
     * Edges point from a step to the steps depending on it.
     */
    private static Graph<Integer, DefaultEdge> dependencyGraph(int stepCount, List<List<Integer>> dependencies) {
        var graph = new DefaultDirectedGraph<Integer, DefaultEdge>(DefaultEdge.class);
        for (int handle = 0; handle < stepCount; handle++) {
            graph.addVertex(handle);
        }
        for (int handle = 0; handle < stepCount; handle++) {
            for (Integer dependency : dependencies.get(handle)) {
                graph.addEdge(dependency, handle);
            }
        }
        return graph;
    }

    /**
     * @return step names along one cycle in "depends on" direction, starting and ending at the earliest declared step of the
     * cycle, or an empty list
     */
    private static List<String> findCycle(Graph<Integer, DefaultEdge> graph, List<Step> steps) {
        if (!new CycleDetector<>(graph).detectCycles()) {
            return List.of();
        }
        List<Integer> chosen = null;
        for (List<Integer> cycle : new TarjanSimpleCycles<>(graph).findSimpleCycles()) {
            var ordered = dependsOnOrder(graph, cycle);
            if (chosen == null || ordered.get(0) < chosen.get(0) || (ordered.get(0).equals(chosen.get(0)) && ordered.size() < chosen.size())) {
                chosen = ordered;
            }
        }
        if (chosen == null) {
            return List.of();
        }
        var names = chosen.stream().map(handle -> steps.get(handle).name()).collect(Collectors.toCollection(ArrayList::new));
        names.add(names.get(0));
        return names;
    }

    private static List<Integer> dependsOnOrder(Graph<Integer, DefaultEdge> graph, List<Integer> cycle) {
        var ordered = new ArrayList<>(cycle);
        // walk against the edges: a dependent comes before the step it depends on
        var followsEdges = true;
        for (int i = 0; i < ordered.size(); i++) {
            if (!graph.containsEdge(ordered.get(i), ordered.get((i + 1) % ordered.size()))) {
                followsEdges = false;
                break;
            }
        }
        if (followsEdges) {
            Collections.reverse(ordered);
        }
        Collections.rotate(ordered, -ordered.indexOf(Collections.min(ordered)));
        return ordered;
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        var union = new HashSet<>(first);
        union.addAll(second);
        return union;
    }
}
