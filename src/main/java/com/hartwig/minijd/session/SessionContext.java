package com.hartwig.minijd.session;

import java.nio.file.Path;

import com.hartwig.minijd.format.SymbolTable;

/**
 * What an action of a session sees: the working directory, the symbols it may reference and the environment overlay.
 */
public final class SessionContext {
    private final String sessionId;
    private final Path workingDirectory;
    private final SymbolTable symbols;
    private final EnvironmentOverlay overlay;

    public SessionContext(final String sessionId, final Path workingDirectory, final SymbolTable symbols,
            final EnvironmentOverlay overlay) {
        this.sessionId = sessionId;
        this.workingDirectory = workingDirectory;
        this.symbols = symbols;
        this.overlay = overlay;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public SymbolTable getSymbols() {
        return symbols;
    }

    public EnvironmentOverlay getOverlay() {
        return overlay;
    }

    public SessionContext withSymbols(SymbolTable newSymbols) {
        return new SessionContext(sessionId, workingDirectory, newSymbols, overlay);
    }

    public SessionContext withOverlay(EnvironmentOverlay newOverlay) {
        return new SessionContext(sessionId, workingDirectory, symbols, newOverlay);
    }
}
