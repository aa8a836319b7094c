package org.slngen.variant;

import java.util.Locale;

/**
 * Build configurations of a variant.
 * <ul>
 *   <li>{@code editor} keeps every project and every define.</li>
 *   <li>{@code dev} keeps runtime projects only and drops editor defines.</li>
 *   <li>{@code prod} additionally drops {@code DEBUG} and {@code TRACE}.</li>
 * </ul>
 */
public enum BuildConfiguration {
    EDITOR("editor"),
    DEV("dev"),
    PROD("prod");

    private final String cliName;

    BuildConfiguration(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    public boolean includesAllProjects() {
        return this == EDITOR;
    }

    public boolean keepsEditorDefines() {
        return this == EDITOR;
    }

    public boolean keepsDebugDefines() {
        return this != PROD;
    }

    public static BuildConfiguration fromCliName(String value) {
        for (BuildConfiguration configuration : values()) {
            if (configuration.cliName.equals(value.toLowerCase(Locale.ROOT))) {
                return configuration;
            }
        }
        throw new IllegalArgumentException("Unknown configuration '" + value + "' (expected editor, dev or prod)");
    }
}
