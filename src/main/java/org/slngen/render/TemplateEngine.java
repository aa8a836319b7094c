package org.slngen.render;

import java.util.Map;

/**
 * Placeholder substitution for descriptor templates.
 */
public final class TemplateEngine {

    public static final String SOURCE_FOLDERS = "{{SOURCE_FOLDERS}}";
    public static final String PROJECT_REFERENCES = "{{PROJECT_REFERENCES}}";
    public static final String PROJECT_ROOT = "{{PROJECT_ROOT}}";
    public static final String UNITY_VERSION = "{{UNITY_VER}}";
    public static final String PROJECT_ENTRIES = "{{PROJECT_ENTRIES}}";
    public static final String PROJECT_CONFIGS = "{{PROJECT_CONFIGS}}";

    private TemplateEngine() {
    }

    /**
     * Replaces every occurrence of each key with its value, in the map's iteration order.
     */
    public static String render(String template, Map<String, String> replacements) {
        String result = template;
        for (Map.Entry<String, String> replacement : replacements.entrySet()) {
            result = result.replace(replacement.getKey(), replacement.getValue());
        }
        return result;
    }
}
