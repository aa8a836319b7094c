package org.slngen.manifest;

import java.util.List;

/**
 * JSON project registry: the explicit list of projects to generate, with their identifiers.
 *
 * @param projectTypeGuid      Project type identifier written into every solution entry.
 * @param projects             Registered projects, in solution order.
 * @param solutionPath         Root-relative path of the solution to write.
 * @param solutionTemplatePath Root-relative path of the solution template.
 */
public record GeneratorManifest(
        String projectTypeGuid,
        List<Entry> projects,
        String solutionPath,
        String solutionTemplatePath
) {

    /**
     * One registered project.
     *
     * @param category     {@code runtime}, {@code editor} or {@code test}; absent means runtime.
     * @param csprojPath   Root-relative descriptor path.
     * @param guid         Braced project identifier.
     * @param kind         {@code asmdef} or {@code legacy}.
     * @param name         Project name.
     * @param templatePath Root-relative template path.
     */
    public record Entry(
            String category,
            String csprojPath,
            String guid,
            String kind,
            String name,
            String templatePath
    ) {
    }
}
