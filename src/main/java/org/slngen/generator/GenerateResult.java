package org.slngen.generator;

import java.util.List;

import org.slngen.render.ProjectInfo;
import org.slngen.render.SolutionInfo;

/**
 * Outcome of a generation run.
 *
 * @param updatedFiles Root-relative descriptors written in this run, sorted. Empty when nothing changed.
 * @param warnings     Soft problems, in the order they were found.
 * @param stats        Mapping summary.
 * @param projects     Every rendered project.
 * @param solution     The rendered solution.
 */
public record GenerateResult(
        List<String> updatedFiles,
        List<String> warnings,
        GenerationStats stats,
        List<ProjectInfo> projects,
        SolutionInfo solution
) {

    public GenerateResult {
        updatedFiles = List.copyOf(updatedFiles);
        warnings = List.copyOf(warnings);
        projects = List.copyOf(projects);
    }
}
