package org.slngen.manifest;

/**
 * A project line of an existing solution file.
 *
 * @param typeGuid    Project type identifier.
 * @param name        Project name.
 * @param csprojPath  Descriptor path as listed in the solution.
 * @param projectGuid Project identifier.
 */
public record SolutionProjectEntry(String typeGuid, String name, String csprojPath, String projectGuid) {
}
