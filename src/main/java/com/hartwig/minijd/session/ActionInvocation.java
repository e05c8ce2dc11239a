package com.hartwig.minijd.session;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.hartwig.minijd.template.CancelationMode;

import org.immutables.value.Value;

/**
 * A fully resolved action, ready to be started as a process.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ActionInvocation {
    /**
     * Short description for logs, such as {@code onEnter of Conda}.
     */
    String description();

    String command();

    List<String> args();

    Path workingDirectory();

    /**
     * Complete process environment.
     */
    Map<String, String> environment();

    Optional<Duration> timeout();

    @Value.Default
    default CancelationMode cancelationMode() {
        return CancelationMode.TERMINATE;
    }

    /**
     * Time between the polite termination request and the forced kill, NOTIFY_THEN_TERMINATE only.
     */
    @Value.Default
    default Duration notifyPeriod() {
        return Duration.ofSeconds(120);
    }

    @Value.Derived
    default List<String> commandLine() {
        var commandLine = new ArrayList<String>();
        commandLine.add(command());
        commandLine.addAll(args());
        return commandLine;
    }

    static ImmutableActionInvocation.Builder builder() {
        return ImmutableActionInvocation.builder();
    }
}
