package org.slngen.module;

import java.util.List;
import java.util.Locale;

/**
 * Build category of a module, used to decide which modules survive into a platform variant.
 */
public enum ModuleCategory {
    RUNTIME,
    EDITOR,
    TEST;

    private static final String TESTS_DEFINE = "UNITY_INCLUDE_TESTS";
    private static final String EDITOR_DEFINE = "UNITY_EDITOR";
    private static final String EDITOR_PLATFORM = "Editor";

    /**
     * Infers the category from a declaration's platform list and define constraints.
     * Test constraints win over editor-only platform restrictions.
     */
    public static ModuleCategory infer(List<String> includePlatforms, List<String> defineConstraints) {
        if (defineConstraints.contains(TESTS_DEFINE)) {
            return TEST;
        }
        if (includePlatforms.size() == 1 && EDITOR_PLATFORM.equals(includePlatforms.get(0))) {
            return EDITOR;
        }
        if (defineConstraints.contains(EDITOR_DEFINE)) {
            return EDITOR;
        }
        return RUNTIME;
    }

    /**
     * Guesses the category of a project known only by name, as listed in an existing solution.
     */
    public static ModuleCategory inferFromName(String projectName) {
        String lower = projectName.toLowerCase(Locale.ROOT);
        if (lower.contains("editor")) {
            return EDITOR;
        }
        if (lower.contains(".tests.") || lower.contains("testrunner")) {
            return TEST;
        }
        return RUNTIME;
    }

    /**
     * Lenient parse of the lowercase names used in the project registry. Unknown or absent values mean runtime.
     */
    public static ModuleCategory fromRegistryName(String value) {
        if (value == null) {
            return RUNTIME;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "editor" -> EDITOR;
            case "test" -> TEST;
            default -> RUNTIME;
        };
    }

    public String registryName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
