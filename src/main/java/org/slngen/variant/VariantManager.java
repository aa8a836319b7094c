package org.slngen.variant;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slngen.module.ModuleCategory;
import org.slngen.render.DescriptorRenderer;
import org.slngen.render.IncrementalWriter;
import org.slngen.render.ProjectInfo;
import org.slngen.render.RenderedDescriptor;
import org.slngen.render.SolutionInfo;
import org.slngen.util.PathUtils;
import org.slngen.util.XmlText;

/**
 * Derives platform/configuration variants from the base descriptors on disk.
 * <p>
 * A variant descriptor sits next to its source as {@code <Name>.v.<platform>-<config>.csproj}, with a
 * {@code -debug} tail when the debug flag keeps defines the configuration would otherwise strip.
 * It is regenerated only when it is missing or older than its source; the modification time is the
 * only state carried between runs. The variant solution and the properties file are written only
 * when their content changes.
 */
public final class VariantManager {

    private static final Logger log = LoggerFactory.getLogger(VariantManager.class);

    private static final String PROPS_FILE_NAME = "Variant.props";

    private final Path projectRoot;
    private final String templateRoot;
    private final DescriptorRenderer renderer;
    private final IncrementalWriter writer;

    /**
     * @param projectRoot  root the descriptor paths are relative to.
     * @param templateRoot root-relative directory receiving the per-variant properties and build caches.
     * @param renderer     renders the variant solution.
     * @param writer       writes variant files.
     */
    public VariantManager(Path projectRoot, String templateRoot, DescriptorRenderer renderer, IncrementalWriter writer) {
        this.projectRoot = projectRoot;
        this.templateRoot = templateRoot;
        this.renderer = renderer;
        this.writer = writer;
    }

    /**
     * Prepares the variant of {@code projects} for one platform and configuration.
     *
     * @param projects      every base project, whether or not it survives into the variant.
     * @param solution      the base solution; its template renders the variant solution.
     * @param platform      target platform.
     * @param configuration target configuration.
     * @param debug         keep {@code DEBUG}/{@code TRACE} even in {@code prod}.
     * @return generated and skipped descriptors plus the variant solution path.
     * @throws IOException if a descriptor cannot be read or written.
     */
    public VariantResult prepare(List<ProjectInfo> projects,
                                 SolutionInfo solution,
                                 BuildPlatform platform,
                                 BuildConfiguration configuration,
                                 boolean debug) throws IOException {
        String variantName = variantName(platform, configuration, debug);
        String suffix = ".v." + variantName;

        List<ProjectInfo> survivors = new ArrayList<>();
        List<String> removedPaths = new ArrayList<>();
        for (ProjectInfo project : projects) {
            if (survives(project, platform, configuration)) {
                survivors.add(project);
            } else {
                removedPaths.add(project.descriptorPath());
            }
        }

        String solutionTemplate = renderer.loadTemplate(solution.templatePath());

        List<ProjectInfo> present = new ArrayList<>();
        for (ProjectInfo project : survivors) {
            if (Files.isRegularFile(projectRoot.resolve(project.descriptorPath()))) {
                present.add(project);
            } else {
                log.debug("No base descriptor for '{}', leaving it out of variant {}", project.name(), variantName);
                removedPaths.add(project.descriptorPath());
            }
        }

        List<String> generated = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<ProjectInfo> variantProjects = new ArrayList<>();

        for (ProjectInfo project : present) {
            Path source = projectRoot.resolve(project.descriptorPath());

            String variantPath = variantPath(project.descriptorPath(), suffix);
            variantProjects.add(withDescriptorPath(project, variantPath));
            Path target = projectRoot.resolve(variantPath);

            if (isFresh(target, source)) {
                skipped.add(variantPath);
                continue;
            }

            String content = Files.readString(source, StandardCharsets.UTF_8);
            content = rewrite(content, platform, configuration, debug, removedPaths, suffix);
            writer.write(target, content.getBytes(StandardCharsets.UTF_8));
            generated.add(variantPath);
        }

        String solutionPath = variantPath(solution.solutionPath(), suffix);
        RenderedDescriptor variantSolution = renderer.renderSolution(
                solutionPath, solutionTemplate, solution.projectTypeGuid(), variantProjects);
        writer.writeIfChanged(projectRoot.resolve(solutionPath), variantSolution.content());

        String propsPath = PathUtils.join(PathUtils.join(templateRoot, variantName), PROPS_FILE_NAME);
        writer.writeIfChanged(projectRoot.resolve(propsPath), renderProps(variantName, platform, configuration, debug));

        generated.sort(null);
        skipped.sort(null);
        log.info("Variant {}: {} generated, {} up to date, {} projects filtered out",
                variantName, generated.size(), skipped.size(), removedPaths.size());
        return new VariantResult(generated, skipped, solutionPath, propsPath, suffix);
    }

    /**
     * {@code <platform>-<config>}, plus {@code -debug} when {@code debug} changes the rewritten defines.
     * Copies with and without debug defines must never share a cache entry.
     */
    static String variantName(BuildPlatform platform, BuildConfiguration configuration, boolean debug) {
        String name = platform.cliName() + "-" + configuration.cliName();
        return debug && !configuration.keepsDebugDefines() ? name + "-debug" : name;
    }

    static boolean survives(ProjectInfo project, BuildPlatform platform, BuildConfiguration configuration) {
        if (configuration.includesAllProjects()) {
            return true;
        }
        return project.category() == ModuleCategory.RUNTIME && project.admitsPlatform(platform.unityName());
    }

    static String rewrite(String content,
                          BuildPlatform platform,
                          BuildConfiguration configuration,
                          boolean debug,
                          List<String> removedPaths,
                          String suffix) {
        String result = content;
        if (!configuration.keepsEditorDefines()) {
            result = DefineRewriter.stripEditorDefines(result);
        }
        if (!debug && !configuration.keepsDebugDefines()) {
            result = DefineRewriter.stripDebugDefines(result);
        }
        result = DefineRewriter.swapPlatformDefines(result, platform);
        result = DefineRewriter.stripReferences(result, removedPaths);
        return DefineRewriter.rewriteReferenceSuffix(result, suffix);
    }

    /**
     * A copy is fresh when it exists and is not older than its source.
     */
    static boolean isFresh(Path copy, Path source) throws IOException {
        if (!Files.isRegularFile(copy)) {
            return false;
        }
        FileTime copyTime = Files.getLastModifiedTime(copy);
        FileTime sourceTime = Files.getLastModifiedTime(source);
        return copyTime.compareTo(sourceTime) >= 0;
    }

    /**
     * Inserts {@code suffix} before the file extension: {@code Game.csproj} becomes {@code Game.v.ios-prod.csproj}.
     */
    static String variantPath(String path, String suffix) {
        String fileName = PathUtils.fileName(path);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return path + suffix;
        }
        int split = path.length() - fileName.length() + dot;
        return path.substring(0, split) + suffix + path.substring(split);
    }

    private String renderProps(String variantName, BuildPlatform platform, BuildConfiguration configuration, boolean debug) {
        String defines = String.join(";", DefineRewriter.variantDefines(platform, configuration, debug));
        String cacheDirectory = XmlText.escape(projectRoot.resolve(templateRoot).resolve(variantName).toString());
        return String.join("\n",
                "<Project>",
                "  <PropertyGroup>",
                "    <SolutionGeneratorVariant>" + variantName + "</SolutionGeneratorVariant>",
                "    <VariantDefineConstants>" + defines + "</VariantDefineConstants>",
                "    <BaseIntermediateOutputPath>" + cacheDirectory + "/obj/</BaseIntermediateOutputPath>",
                "    <OutputPath>" + cacheDirectory + "/bin/</OutputPath>",
                "  </PropertyGroup>",
                "</Project>",
                "");
    }

    private static ProjectInfo withDescriptorPath(ProjectInfo project, String descriptorPath) {
        return new ProjectInfo(project.name(), descriptorPath, project.templatePath(), project.guid(),
                project.kind(), project.category(), project.includedPlatforms(), project.excludedPlatforms());
    }
}
