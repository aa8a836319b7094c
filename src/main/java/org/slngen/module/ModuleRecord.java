package org.slngen.module;

import java.util.List;
import java.util.Set;

/**
 * A module declared by one declaration file.
 *
 * @param name              The globally unique module name.
 * @param directory         The directory holding the declaration file; the module's ownership root.
 * @param declarationPath   The declaration file itself, relative to the project root.
 * @param guid              The identifier from the declaration's {@code .meta} sibling, lowercase, or {@code null}.
 * @param references        Raw reference tokens in declaration order.
 * @param category          The inferred build category.
 * @param includedPlatforms Platforms the module is restricted to; empty means unrestricted.
 * @param excludedPlatforms Platforms the module is excluded from.
 */
public record ModuleRecord(
        String name,
        String directory,
        String declarationPath,
        String guid,
        List<String> references,
        ModuleCategory category,
        Set<String> includedPlatforms,
        Set<String> excludedPlatforms
) {

    public ModuleRecord {
        references = List.copyOf(references);
        includedPlatforms = Set.copyOf(includedPlatforms);
        excludedPlatforms = Set.copyOf(excludedPlatforms);
    }

    /**
     * Whether this module compiles for the given platform name (e.g. {@code iOS}).
     */
    public boolean admitsPlatform(String platformName) {
        if (!includedPlatforms.isEmpty()) {
            return includedPlatforms.contains(platformName);
        }
        return !excludedPlatforms.contains(platformName);
    }
}
