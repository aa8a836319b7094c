package org.slngen.render;

import java.util.Locale;

/**
 * How a project's sources are determined.
 */
public enum ProjectKind {
    /** Backed by a module declaration; sources come from its ownership roots. */
    ASMDEF,
    /** One of the fixed fallback assemblies; sources come from unowned directories. */
    LEGACY;

    public String registryName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ProjectKind fromRegistryName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Project kind is missing");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "asmdef" -> ASMDEF;
            case "legacy" -> LEGACY;
            default -> throw new IllegalArgumentException("Unknown project kind: " + value);
        };
    }
}
