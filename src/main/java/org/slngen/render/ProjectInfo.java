package org.slngen.render;

import java.util.Set;

import org.slngen.module.ModuleCategory;

/**
 * A project to render: one descriptor file built from one template.
 *
 * @param name              The project (module) name.
 * @param descriptorPath    Output path of the descriptor, relative to the project root.
 * @param templatePath      Path of the template, relative to the project root.
 * @param guid              The braced, uppercase project identifier.
 * @param kind              Whether the project is declaration-backed or a legacy assembly.
 * @param category          Build category used for variant filtering.
 * @param includedPlatforms Platform restriction; empty means unrestricted.
 * @param excludedPlatforms Platforms the project never builds for.
 */
public record ProjectInfo(
        String name,
        String descriptorPath,
        String templatePath,
        String guid,
        ProjectKind kind,
        ModuleCategory category,
        Set<String> includedPlatforms,
        Set<String> excludedPlatforms
) {

    public ProjectInfo {
        includedPlatforms = Set.copyOf(includedPlatforms);
        excludedPlatforms = Set.copyOf(excludedPlatforms);
    }

    public boolean admitsPlatform(String platformName) {
        if (!includedPlatforms.isEmpty()) {
            return includedPlatforms.contains(platformName);
        }
        return !excludedPlatforms.contains(platformName);
    }
}
