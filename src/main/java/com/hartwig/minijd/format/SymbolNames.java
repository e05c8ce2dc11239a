package com.hartwig.minijd.format;

/**
 * Names of the symbols available to format strings.
 */
public final class SymbolNames {
    public static final String SESSION_WORKING_DIRECTORY = "Session.WorkingDirectory";
    public static final String SESSION_HAS_PATH_MAPPING_RULES = "Session.HasPathMappingRules";
    public static final String SESSION_PATH_MAPPING_RULES_FILE = "Session.PathMappingRulesFile";

    private SymbolNames() {
    }

    public static String param(String name) {
        return "Param." + name;
    }

    public static String rawParam(String name) {
        return "RawParam." + name;
    }

    public static String taskParam(String name) {
        return "Task.Param." + name;
    }

    public static String taskRawParam(String name) {
        return "Task.RawParam." + name;
    }

    public static String taskFile(String name) {
        return "Task.File." + name;
    }

    public static String envFile(String name) {
        return "Env.File." + name;
    }
}
