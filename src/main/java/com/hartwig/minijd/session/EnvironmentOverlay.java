package com.hartwig.minijd.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stack of environment variable changes, one frame per entered environment. Every change returns a new overlay, so a
 * snapshot handed to a running action never changes under it.
 */
public final class EnvironmentOverlay {
    private static final EnvironmentOverlay EMPTY = new EnvironmentOverlay(List.of());

    private final List<Frame> frames;

    private EnvironmentOverlay(final List<Frame> frames) {
        this.frames = frames;
    }

    public static EnvironmentOverlay empty() {
        return EMPTY;
    }

    /**
     * Adds a frame on top that sets the given variables.
     */
    public EnvironmentOverlay push(String environmentName, Map<String, String> variables) {
        var changes = new LinkedHashMap<String, Optional<String>>();
        variables.forEach((name, value) -> changes.put(name, Optional.of(value)));
        var copy = new ArrayList<>(frames);
        copy.add(new Frame(environmentName, changes));
        return new EnvironmentOverlay(Collections.unmodifiableList(copy));
    }

    public EnvironmentOverlay pop() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("No environment to pop");
        }
        return new EnvironmentOverlay(List.copyOf(frames.subList(0, frames.size() - 1)));
    }

    /**
     * Sets a variable in the top frame.
     */
    public EnvironmentOverlay set(String name, String value) {
        return withTopChange(name, Optional.of(value));
    }

    /**
     * Removes a variable from the environment of the top frame, including values inherited from lower frames or the host.
     */
    public EnvironmentOverlay unset(String name) {
        return withTopChange(name, Optional.empty());
    }

    private EnvironmentOverlay withTopChange(String name, Optional<String> value) {
        if (frames.isEmpty()) {
            throw new IllegalStateException("No environment entered to change variable " + name);
        }
        var top = frames.get(frames.size() - 1);
        var changes = new LinkedHashMap<>(top.changes);
        // re-insert so the latest change wins regardless of earlier order
        changes.remove(name);
        changes.put(name, value);
        var copy = new ArrayList<>(frames.subList(0, frames.size() - 1));
        copy.add(new Frame(top.environmentName, changes));
        return new EnvironmentOverlay(Collections.unmodifiableList(copy));
    }

    /**
     * Applies every frame, bottom to top, on top of the base environment.
     */
    public Map<String, String> resolve(Map<String, String> base) {
        var environment = new LinkedHashMap<>(base);
        for (Frame frame : frames) {
            frame.changes.forEach((name, value) -> {
                if (value.isPresent()) {
                    environment.put(name, value.get());
                } else {
                    environment.remove(name);
                }
            });
        }
        return environment;
    }

    public int depth() {
        return frames.size();
    }

    public Optional<String> topEnvironmentName() {
        return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(frames.size() - 1).environmentName);
    }

    private static final class Frame {
        private final String environmentName;
        private final Map<String, Optional<String>> changes;

        private Frame(final String environmentName, final Map<String, Optional<String>> changes) {
            this.environmentName = environmentName;
            this.changes = Collections.unmodifiableMap(changes);
        }
    }
}
