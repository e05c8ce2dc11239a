package com.hartwig.minijd.session;

/**
 * Receives session events as they happen. Output events arrive on a reader thread, all others on the session thread.
 */
@FunctionalInterface
public interface SessionEventListener {
    void onEvent(SessionEvent event);

    static SessionEventListener none() {
        return event -> {
        };
    }
}
