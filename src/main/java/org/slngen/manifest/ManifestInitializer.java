package org.slngen.manifest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slngen.generator.GeneratorException;
import org.slngen.module.ModuleCategory;
import org.slngen.render.ProjectKind;

/**
 * Bootstraps a project registry from the solution an IDE last generated.
 */
public final class ManifestInitializer {

    private static final Logger log = LoggerFactory.getLogger(ManifestInitializer.class);

    private final String templatesDirectory;

    /**
     * @param templatesDirectory root-relative directory the registered templates live in.
     */
    public ManifestInitializer(String templatesDirectory) {
        this.templatesDirectory = templatesDirectory;
    }

    /**
     * Builds a registry listing every root-level project of the solution in {@code projectRoot}.
     *
     * @param projectRoot  the project root.
     * @param hasDeclaration tells whether a module declaration with the given name exists.
     * @return the registry; projects keep the solution's order and identifiers.
     * @throws GeneratorException if no solution exists or it lists no root-level projects.
     * @throws IOException        if the solution cannot be read.
     */
    public GeneratorManifest initialize(Path projectRoot, Predicate<String> hasDeclaration) throws IOException {
        Path solutionFile = SolutionFileParser.findSolutionFile(projectRoot);
        List<SolutionProjectEntry> solutionEntries =
                SolutionFileParser.parseProjects(Files.readString(solutionFile, StandardCharsets.UTF_8));
        if (solutionEntries.isEmpty()) {
            throw new GeneratorException("No projects found in solution " + solutionFile);
        }

        List<GeneratorManifest.Entry> entries = new ArrayList<>(solutionEntries.size());
        for (SolutionProjectEntry solutionEntry : solutionEntries) {
            ProjectKind kind = hasDeclaration.test(solutionEntry.name()) ? ProjectKind.ASMDEF : ProjectKind.LEGACY;
            entries.add(new GeneratorManifest.Entry(
                    ModuleCategory.inferFromName(solutionEntry.name()).registryName(),
                    solutionEntry.csprojPath(),
                    solutionEntry.projectGuid(),
                    kind.registryName(),
                    solutionEntry.name(),
                    templatesDirectory + "/" + solutionEntry.csprojPath() + ".template"));
        }

        String solutionName = solutionFile.getFileName().toString();
        log.debug("Registering {} projects from {}", entries.size(), solutionName);
        return new GeneratorManifest(
                solutionEntries.get(0).typeGuid(),
                entries,
                solutionName,
                templatesDirectory + "/" + solutionName + ".template");
    }
}
