package com.hartwig.minijd.session;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

/**
 * Settings for running sessions on this host. Every field has a default, so an empty document is a valid configuration.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableSessionConfiguration.class)
@JsonSerialize(as = ImmutableSessionConfiguration.class)
public interface SessionConfiguration {
    /**
     * Directory under which each session creates its own working directory.
     */
    @Value.Default
    default String workingDirectoryRoot() {
        return System.getProperty("java.io.tmpdir");
    }

    /**
     * Leave session working directories in place after the session ends, for debugging.
     */
    @Value.Default
    default boolean keepWorkingDirectory() {
        return false;
    }

    /**
     * Grace period for NOTIFY_THEN_TERMINATE cancellations that do not set their own.
     */
    @Value.Default
    default int defaultNotifyPeriodSeconds() {
        return 120;
    }

    @Value.Default
    default int maxConcurrentSessions() {
        return 4;
    }

    /**
     * Number of task runs of a step handed to one session.
     */
    @Value.Default
    default int tasksPerSession() {
        return 1;
    }

    @Value.Check
    default void check() {
        if (defaultNotifyPeriodSeconds() <= 0 || maxConcurrentSessions() <= 0 || tasksPerSession() <= 0) {
            throw new IllegalArgumentException(String.format(
                    "defaultNotifyPeriodSeconds, maxConcurrentSessions and tasksPerSession must be positive, but were %d, %d and %d",
                    defaultNotifyPeriodSeconds(),
                    maxConcurrentSessions(),
                    tasksPerSession()));
        }
    }

    static SessionConfiguration defaults() {
        return ImmutableSessionConfiguration.builder().build();
    }

    static ImmutableSessionConfiguration.Builder builder() {
        return ImmutableSessionConfiguration.builder();
    }
}
