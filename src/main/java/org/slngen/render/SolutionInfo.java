package org.slngen.render;

/**
 * The solution descriptor of a run.
 *
 * @param solutionPath    Output path, relative to the project root.
 * @param templatePath    Template path, relative to the project root.
 * @param projectTypeGuid Project type identifier written into every solution entry.
 */
public record SolutionInfo(String solutionPath, String templatePath, String projectTypeGuid) {
}
