package org.slngen.render;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slngen.generator.MissingTemplateException;
import org.slngen.patterns.CompilePattern;
import org.slngen.util.XmlText;

/**
 * Renders project and solution descriptors from templates.
 * <p>
 * Rendering is pure: templates are read, but nothing is written. Callers collect every
 * {@link RenderedDescriptor} first and hand them to {@link IncrementalWriter} afterwards.
 */
public final class DescriptorRenderer {

    private static final String INDENT = "    ";

    private final Path projectRoot;
    private final String unityVersion;

    /**
     * @param projectRoot  substituted for {@value TemplateEngine#PROJECT_ROOT}.
     * @param unityVersion substituted for {@value TemplateEngine#UNITY_VERSION}.
     */
    public DescriptorRenderer(Path projectRoot, String unityVersion) {
        this.projectRoot = projectRoot;
        this.unityVersion = unityVersion;
    }

    /**
     * Loads a template relative to the project root.
     *
     * @throws MissingTemplateException if the template does not exist.
     * @throws IOException              if the template exists but cannot be read.
     */
    public String loadTemplate(String relativePath) throws IOException {
        Path template = projectRoot.resolve(relativePath);
        if (!Files.isRegularFile(template)) {
            throw new MissingTemplateException(template);
        }
        return Files.readString(template, StandardCharsets.UTF_8);
    }

    public RenderedDescriptor renderProject(ProjectInfo project,
                                            String template,
                                            List<CompilePattern> patterns,
                                            List<ProjectInfo> references) {
        Map<String, String> replacements = new LinkedHashMap<>();
        replacements.put(TemplateEngine.UNITY_VERSION, unityVersion);
        replacements.put(TemplateEngine.PROJECT_ROOT, projectRoot.toString());
        replacements.put(TemplateEngine.SOURCE_FOLDERS, renderCompilePatterns(patterns));
        replacements.put(TemplateEngine.PROJECT_REFERENCES, renderProjectReferences(references));
        return new RenderedDescriptor(project.descriptorPath(), TemplateEngine.render(template, replacements));
    }

    public RenderedDescriptor renderSolution(String solutionPath,
                                             String template,
                                             String projectTypeGuid,
                                             List<ProjectInfo> projects) {
        Map<String, String> replacements = new LinkedHashMap<>();
        replacements.put(TemplateEngine.PROJECT_ENTRIES, renderSolutionEntries(projectTypeGuid, projects));
        replacements.put(TemplateEngine.PROJECT_CONFIGS, renderSolutionConfigs(projects));
        return new RenderedDescriptor(solutionPath, TemplateEngine.render(template, replacements));
    }

    static String renderCompilePatterns(List<CompilePattern> patterns) {
        List<String> lines = new ArrayList<>(patterns.size());
        for (CompilePattern pattern : patterns) {
            String include = XmlText.escape(pattern.include());
            if (pattern.exclude().isEmpty()) {
                lines.add(INDENT + "<Compile Include=\"" + include + "\" />");
            } else {
                String exclude = XmlText.escape(String.join(";", pattern.exclude()));
                lines.add(INDENT + "<Compile Include=\"" + include + "\" Exclude=\"" + exclude + "\" />");
            }
        }
        return String.join("\n", lines);
    }

    static String renderProjectReferences(List<ProjectInfo> references) {
        List<String> blocks = new ArrayList<>(references.size());
        for (ProjectInfo reference : references) {
            blocks.add(String.join("\n",
                    INDENT + "<ProjectReference Include=\"" + XmlText.escape(reference.descriptorPath()) + "\">",
                    INDENT + "  <Project>" + reference.guid() + "</Project>",
                    INDENT + "  <Name>" + XmlText.escape(reference.name()) + "</Name>",
                    INDENT + "</ProjectReference>"));
        }
        return String.join("\n", blocks);
    }

    static String renderSolutionEntries(String projectTypeGuid, List<ProjectInfo> projects) {
        List<String> entries = new ArrayList<>(projects.size());
        for (ProjectInfo project : projects) {
            entries.add("Project(\"" + projectTypeGuid + "\") = \"" + project.name() + "\", \""
                    + project.descriptorPath() + "\", \"" + project.guid() + "\"\nEndProject");
        }
        return String.join("\n", entries);
    }

    static String renderSolutionConfigs(List<ProjectInfo> projects) {
        List<String> lines = new ArrayList<>(projects.size() * 2);
        for (ProjectInfo project : projects) {
            lines.add("\t\t" + project.guid() + ".Debug|Any CPU.ActiveCfg = Debug|Any CPU");
            lines.add("\t\t" + project.guid() + ".Debug|Any CPU.Build.0 = Debug|Any CPU");
        }
        return String.join("\n", lines);
    }
}
