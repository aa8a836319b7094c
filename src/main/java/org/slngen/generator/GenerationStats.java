package org.slngen.generator;

import java.util.Map;

/**
 * Summary of how sources were mapped to projects.
 *
 * @param sourceFileCountByProject    Source files compiled by each project.
 * @param patternCountByProject       Compile patterns emitted for each project.
 * @param unresolvedDirectoryCount    Source directories without an owner.
 */
public record GenerationStats(
        Map<String, Integer> sourceFileCountByProject,
        Map<String, Integer> patternCountByProject,
        int unresolvedDirectoryCount
) {
}
