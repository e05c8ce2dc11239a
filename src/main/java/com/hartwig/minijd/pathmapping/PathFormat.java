package com.hartwig.minijd.pathmapping;

import java.io.File;
import java.util.regex.Pattern;

public enum PathFormat {
    POSIX('/'),
    WINDOWS('\\');

    private static final Pattern WINDOWS_DRIVE = Pattern.compile("^[A-Za-z]:([\\\\/].*)?$");

    private final char separator;

    PathFormat(final char separator) {
        this.separator = separator;
    }

    public char getSeparator() {
        return separator;
    }

    /**
     * Path convention of the machine this JVM runs on.
     */
    public static PathFormat host() {
        return File.separatorChar == '\\' ? WINDOWS : POSIX;
    }

    /**
     * Guesses the convention a path was written in from its root: a drive letter or UNC prefix means WINDOWS.
     * Backslashes elsewhere are legal POSIX file name characters.
     */
    public static PathFormat infer(String path) {
        if (WINDOWS_DRIVE.matcher(path).matches() || path.startsWith("\\\\")) {
            return WINDOWS;
        }
        return POSIX;
    }

    boolean isAbsolute(String path) {
        if (this == POSIX) {
            return path.startsWith("/");
        }
        return path.startsWith("\\\\") || path.startsWith("//") || path.matches("^[A-Za-z]:[\\\\/].*");
    }

    boolean isSeparator(char c) {
        return this == POSIX ? c == '/' : c == '/' || c == '\\';
    }
}
