package org.slngen.templates;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slngen.generator.GeneratorException;
import org.slngen.manifest.SolutionFileParser;
import org.slngen.manifest.SolutionProjectEntry;
import org.slngen.render.IncrementalWriter;
import org.slngen.render.TemplateEngine;

/**
 * Turns the descriptors an IDE generated into reusable templates.
 * <p>
 * Machine-specific paths and the editor version become placeholders, compile items and project
 * references collapse into a single placeholder each, and comments and {@code <None>} items are dropped.
 */
public final class TemplateExtractor {

    private static final Logger log = LoggerFactory.getLogger(TemplateExtractor.class);

    private static final String TEMPLATE_SUFFIX = ".template";

    private final Path projectRoot;
    private final String templatesDirectory;
    private final IncrementalWriter writer;

    /**
     * @param projectRoot        the project root holding the solution and its descriptors.
     * @param templatesDirectory root-relative directory receiving the templates.
     * @param writer             writes templates that changed.
     */
    public TemplateExtractor(Path projectRoot, String templatesDirectory, IncrementalWriter writer) {
        this.projectRoot = projectRoot;
        this.templatesDirectory = templatesDirectory;
        this.writer = writer;
    }

    /**
     * Extracts templates for the solution in the project root and each root-level project it lists.
     * Projects whose descriptor is missing on disk are skipped.
     *
     * @param unityVersion editor version to replace by its placeholder; empty disables the replacement.
     * @return root-relative paths of the templates written, sorted.
     * @throws GeneratorException if there is no solution or it lists no root-level projects.
     * @throws IOException        if a file cannot be read or written.
     */
    public List<String> extract(String unityVersion) throws IOException {
        Path solutionFile = SolutionFileParser.findSolutionFile(projectRoot);
        String solutionContent = Files.readString(solutionFile, StandardCharsets.UTF_8);
        List<SolutionProjectEntry> entries = SolutionFileParser.parseProjects(solutionContent);
        if (entries.isEmpty()) {
            throw new GeneratorException("No projects found in solution " + solutionFile);
        }

        Set<String> rootSpellings = rootSpellings(projectRoot);
        List<String> updated = new ArrayList<>();

        for (SolutionProjectEntry entry : entries) {
            Path descriptor = projectRoot.resolve(entry.csprojPath());
            if (!Files.isRegularFile(descriptor)) {
                log.debug("Skipping {}: descriptor not found", entry.csprojPath());
                continue;
            }
            String template = templatizeProject(
                    Files.readString(descriptor, StandardCharsets.UTF_8), rootSpellings, unityVersion);
            String templatePath = templatesDirectory + "/" + entry.csprojPath() + TEMPLATE_SUFFIX;
            if (writer.writeIfChanged(projectRoot.resolve(templatePath), template)) {
                updated.add(templatePath);
            }
        }

        String solutionTemplate = templatizeSolution(solutionContent, entries.get(0).typeGuid());
        String solutionTemplatePath = templatesDirectory + "/" + solutionFile.getFileName() + TEMPLATE_SUFFIX;
        if (writer.writeIfChanged(projectRoot.resolve(solutionTemplatePath), solutionTemplate)) {
            updated.add(solutionTemplatePath);
        }

        updated.sort(null);
        log.info("Extracted templates for {} projects, {} file(s) updated", entries.size(), updated.size());
        return updated;
    }

    static String templatizeProject(String content, Set<String> rootSpellings, String unityVersion) {
        List<String> lines = new ArrayList<>();
        boolean sourcesEmitted = false;
        boolean referencesEmitted = false;
        boolean inReference = false;
        boolean inComment = false;

        for (String raw : content.split("\n", -1)) {
            String line = raw;
            for (String root : rootSpellings) {
                line = line.replace(root, TemplateEngine.PROJECT_ROOT);
            }
            if (!unityVersion.isEmpty()) {
                line = line.replace(unityVersion, TemplateEngine.UNITY_VERSION);
            }

            if (inComment) {
                inComment = !line.contains("-->");
                continue;
            }
            if (line.contains("<!--")) {
                inComment = !line.contains("-->");
                continue;
            }
            if (line.contains("<None Include=\"")) {
                continue;
            }
            if (inReference) {
                inReference = !line.contains("</ProjectReference>");
                continue;
            }
            if (line.contains("<ProjectReference Include=\"")) {
                if (!referencesEmitted) {
                    lines.add(TemplateEngine.PROJECT_REFERENCES);
                    referencesEmitted = true;
                }
                inReference = !line.contains("</ProjectReference>") && !line.trim().endsWith("/>");
                continue;
            }
            if (line.contains("<Compile Include=\"")) {
                if (!sourcesEmitted) {
                    lines.add(TemplateEngine.SOURCE_FOLDERS);
                    sourcesEmitted = true;
                }
                continue;
            }
            lines.add(line);
        }
        return String.join("\n", lines);
    }

    static String templatizeSolution(String content, String projectTypeGuid) {
        String projectPrefix = "Project(\"" + projectTypeGuid + "\") = ";
        List<String> lines = new ArrayList<>();
        boolean entriesEmitted = false;
        boolean configsEmitted = false;
        boolean inProjects = false;

        for (String raw : content.split("\n", -1)) {
            String line = stripCarriageReturn(raw);
            if (line.startsWith(projectPrefix)) {
                if (!entriesEmitted) {
                    lines.add(TemplateEngine.PROJECT_ENTRIES);
                    entriesEmitted = true;
                }
                inProjects = true;
                continue;
            }
            if (inProjects) {
                if (line.equals("Global")) {
                    inProjects = false;
                    lines.add(raw);
                }
                continue;
            }
            String trimmed = line.trim();
            if (trimmed.startsWith("{") && trimmed.contains(".Debug|Any CPU.")
                    && (trimmed.contains("ActiveCfg") || trimmed.contains("Build.0"))) {
                if (!configsEmitted) {
                    lines.add(TemplateEngine.PROJECT_CONFIGS);
                    configsEmitted = true;
                }
                continue;
            }
            lines.add(raw);
        }
        return String.join("\n", lines);
    }

    /**
     * The absolute and the symlink-resolved spelling of the root, longest first so that neither
     * replacement clips the other.
     */
    static Set<String> rootSpellings(Path projectRoot) {
        List<String> spellings = new ArrayList<>();
        spellings.add(projectRoot.toAbsolutePath().normalize().toString());
        try {
            spellings.add(projectRoot.toRealPath().toString());
        } catch (IOException e) {
            log.debug("Cannot resolve real path of {}: {}", projectRoot, e.getMessage());
        }
        spellings.sort((a, b) -> Integer.compare(b.length(), a.length()));
        return new LinkedHashSet<>(spellings);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
