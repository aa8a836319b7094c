package org.slngen.ownership;

import java.util.List;
import java.util.Map;

/**
 * Source directories grouped by the project that compiles them.
 *
 * @param directoriesByOwner   Owned source directories per project name, each list sorted.
 * @param unresolvedDirectories Source directories with no owner, sorted.
 */
public record SourceAssignment(Map<String, List<String>> directoriesByOwner, List<String> unresolvedDirectories) {

    public List<String> directoriesOf(String projectName) {
        return directoriesByOwner.getOrDefault(projectName, List.of());
    }
}
