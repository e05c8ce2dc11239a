package com.hartwig.minijd.session;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Action runner for tests: records every invocation and replies with canned output and failures, keyed by the start of the
 * action description.
 */
class ScriptedActionRunner implements ActionRunner {
    private final List<ActionInvocation> invocations = new ArrayList<>();
    private final List<Boolean> cancelableFlags = new ArrayList<>();
    private final Map<String, List<String>> outputs = new HashMap<>();
    private final Map<String, RuntimeException> failures = new HashMap<>();
    private final Map<String, Runnable> hooks = new HashMap<>();
    private final Map<String, String> fileContents = new HashMap<>();

    ScriptedActionRunner output(String descriptionPrefix, String... lines) {
        outputs.put(descriptionPrefix, List.of(lines));
        return this;
    }

    ScriptedActionRunner fail(String descriptionPrefix, RuntimeException failure) {
        failures.put(descriptionPrefix, failure);
        return this;
    }

    ScriptedActionRunner hook(String descriptionPrefix, Runnable hook) {
        hooks.put(descriptionPrefix, hook);
        return this;
    }

    @Override
    public void run(ActionInvocation invocation, BooleanSupplier canceled, Consumer<String> output) {
        invocations.add(invocation);
        var description = invocation.description();
        var command = Path.of(invocation.command());
        if (Files.isRegularFile(command)) {
            try {
                fileContents.put(description, Files.readString(command));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        matching(hooks, description).forEach(Runnable::run);
        cancelableFlags.add(canceled.getAsBoolean());
        matching(outputs, description).forEach(lines -> lines.forEach(output));
        var failure = matching(failures, description);
        if (!failure.isEmpty()) {
            throw failure.get(0);
        }
    }

    List<ActionInvocation> getInvocations() {
        return invocations;
    }

    List<String> getDescriptions() {
        return invocations.stream().map(ActionInvocation::description).collect(Collectors.toList());
    }

    ActionInvocation getInvocation(String description) {
        return invocations.stream()
                .filter(invocation -> invocation.description().equals(description))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No invocation " + description + " in " + getDescriptions()));
    }

    /**
     * Whether the cancel flag was raised when the action with the given index ran.
     */
    boolean sawCanceled(int index) {
        return cancelableFlags.get(index);
    }

    String getFileContent(String description) {
        return fileContents.get(description);
    }

    private static <T> List<T> matching(Map<String, T> byPrefix, String description) {
        return byPrefix.entrySet()
                .stream()
                .filter(entry -> description.startsWith(entry.getKey()))
                .map(Map.Entry::getValue)
                .collect(Collectors.toList());
    }
}
