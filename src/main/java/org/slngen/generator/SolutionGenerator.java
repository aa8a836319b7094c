package org.slngen.generator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slngen.manifest.GeneratorManifest;
import org.slngen.manifest.ManifestInitializer;
import org.slngen.manifest.ManifestStore;
import org.slngen.module.DeclarationLoader;
import org.slngen.module.ModuleCategory;
import org.slngen.module.ModuleIndex;
import org.slngen.module.ModuleRecord;
import org.slngen.module.ReferenceExtensionRecord;
import org.slngen.ownership.LegacyFallback;
import org.slngen.ownership.OwnershipMap;
import org.slngen.ownership.OwnershipResolver;
import org.slngen.ownership.SourceAssignment;
import org.slngen.patterns.CompilePattern;
import org.slngen.patterns.CompilePatternSynthesizer;
import org.slngen.render.DescriptorRenderer;
import org.slngen.render.IncrementalWriter;
import org.slngen.render.ProjectIdentifiers;
import org.slngen.render.ProjectInfo;
import org.slngen.render.ProjectKind;
import org.slngen.render.RenderedDescriptor;
import org.slngen.render.SolutionInfo;
import org.slngen.scanner.ProjectScanner;
import org.slngen.scanner.ScanSnapshot;
import org.slngen.templates.TemplateExtractor;
import org.slngen.util.PathUtils;
import org.slngen.variant.BuildConfiguration;
import org.slngen.variant.BuildPlatform;
import org.slngen.variant.VariantManager;
import org.slngen.variant.VariantResult;

/**
 * Regenerates project descriptors and the solution index of a project tree.
 * <p>
 * A run scans the tree once, resolves every source directory to the project that owns it,
 * synthesizes compile patterns, and renders every descriptor in memory. Only when all rendering
 * succeeded are the descriptors written, each only if its content changed. Any fatal condition
 * therefore leaves the tree untouched.
 * <p>
 * Projects are discovered from module declarations and legacy fallbacks, or taken from a JSON
 * project registry when {@link GenerateOptions#manifestPath()} is set.
 */
public class SolutionGenerator {

    private static final Logger log = LoggerFactory.getLogger(SolutionGenerator.class);

    static final String VERSION_FILE = "ProjectSettings/ProjectVersion.txt";
    private static final String VERSION_KEY = "m_EditorVersion:";
    private static final String DESCRIPTOR_SUFFIX = ".csproj";
    private static final String TEMPLATE_SUFFIX = ".template";
    private static final String SOLUTION_TEMPLATE_GLOB = "*.sln" + TEMPLATE_SUFFIX;

    private final GeneratorSettings settings;
    private final Path projectRoot;
    private final IncrementalWriter writer = new IncrementalWriter();

    public SolutionGenerator(GeneratorSettings settings) {
        this.settings = settings;
        this.projectRoot = settings.projectRoot().toAbsolutePath().normalize();
    }

    /**
     * Generates every descriptor and the solution.
     *
     * @param options registry and verbosity of this run.
     * @return written files, warnings and mapping statistics.
     * @throws GeneratorException on any fatal condition, before anything is written.
     */
    public GenerateResult generate(GenerateOptions options) {
        try {
            return doGenerate(options);
        } catch (IOException e) {
            throw new GeneratorException("I/O failure while generating " + projectRoot + ": " + e.getMessage(), e);
        }
    }

    /**
     * Derives a platform/configuration variant from a completed generation.
     *
     * @param base          the result of {@link #generate(GenerateOptions)}.
     * @param platform      target platform.
     * @param configuration target configuration.
     * @param debug         keep debug defines in {@code prod}.
     * @return the variant's solution and descriptor paths.
     * @throws GeneratorException if the variant cannot be written.
     */
    public VariantResult prepareVariant(GenerateResult base,
                                        BuildPlatform platform,
                                        BuildConfiguration configuration,
                                        boolean debug) {
        DescriptorRenderer renderer = new DescriptorRenderer(projectRoot, "");
        VariantManager variants = new VariantManager(projectRoot, settings.templateRoot(), renderer, writer);
        try {
            return variants.prepare(base.projects(), base.solution(), platform, configuration, debug);
        } catch (IOException e) {
            throw new GeneratorException("I/O failure while preparing variant " + platform.cliName() + "-"
                    + configuration.cliName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Extracts templates from the solution and descriptors an IDE generated in the project root.
     *
     * @return root-relative paths of the templates written.
     * @throws GeneratorException if there is no usable solution or a file cannot be read or written.
     */
    public List<String> extractTemplates() {
        try {
            String unityVersion = readUnityVersion(projectRoot, new ArrayList<>());
            return new TemplateExtractor(projectRoot, settings.templatesDirectory(), writer).extract(unityVersion);
        } catch (IOException e) {
            throw new GeneratorException("I/O failure while extracting templates: " + e.getMessage(), e);
        }
    }

    /**
     * Writes a project registry listing the projects of the existing solution.
     *
     * @param manifestPath root-relative path of the registry to write.
     * @return absolute path of the registry.
     * @throws GeneratorException if there is no usable solution or a file cannot be read or written.
     */
    public Path initManifest(String manifestPath) {
        try {
            ScanSnapshot scan = newScanner().scan(projectRoot, settings.scanRoots());
            ModuleIndex modules = ModuleIndex.of(
                    new DeclarationLoader(scan.realRoot()).loadDeclarations(scan.declarationPaths()));

            GeneratorManifest manifest = new ManifestInitializer(settings.templatesDirectory())
                    .initialize(projectRoot, modules::contains);
            Path manifestFile = projectRoot.resolve(manifestPath);
            new ManifestStore().save(manifestFile, manifest, writer);
            log.info("Registered {} projects in {}", manifest.projects().size(), manifestFile);
            return manifestFile;
        } catch (IOException e) {
            throw new GeneratorException("I/O failure while initializing manifest: " + e.getMessage(), e);
        }
    }

    private GenerateResult doGenerate(GenerateOptions options) throws IOException {
        List<String> warnings = new ArrayList<>();

        GeneratorManifest manifest = null;
        if (options.manifestDriven()) {
            manifest = new ManifestStore().load(projectRoot.resolve(options.manifestPath()));
        }
        String unityVersion = readUnityVersion(projectRoot, warnings);

        ScanSnapshot scan = newScanner().scan(projectRoot, settings.scanRoots());
        DeclarationLoader loader = new DeclarationLoader(scan.realRoot());
        List<ModuleRecord> declarations = loader.loadDeclarations(scan.declarationPaths());
        if (declarations.isEmpty()) {
            throw new GeneratorException("No module declarations (*" + settings.declarationSuffix()
                    + ") found under " + settings.scanRoots() + " in " + projectRoot);
        }
        ModuleIndex modules = ModuleIndex.of(declarations);
        List<ReferenceExtensionRecord> extensions = loader.loadReferenceExtensions(scan.referencePaths());

        Predicate<String> registered = manifest == null ? name -> true : registeredNames(manifest)::contains;
        OwnershipMap ownership = OwnershipMap.build(modules, extensions, registered);
        for (String directory : ownership.conflicts()) {
            warnings.add("Directory '" + directory + "' has both a module declaration and a reference extension;"
                    + " the declaration wins");
        }

        OwnershipResolver resolver = new OwnershipResolver(ownership, new LegacyFallback(settings.legacyRoot()));
        SourceAssignment assignment = resolver.assign(scan.sourceDirectories(), registered);

        List<ProjectInfo> projects;
        SolutionInfo solution;
        if (manifest == null) {
            projects = discoverProjects(modules, assignment);
            solution = findSolutionTemplate();
        } else {
            projects = registeredProjects(manifest, modules);
            solution = new SolutionInfo(manifest.solutionPath(), manifest.solutionTemplatePath(),
                    manifest.projectTypeGuid());
        }
        Map<String, ProjectInfo> projectsByName = new LinkedHashMap<>();
        for (ProjectInfo project : projects) {
            projectsByName.put(project.name(), project);
        }

        boolean recursive = settings.recursivePatterns() || manifest != null;
        CompilePatternSynthesizer synthesizer = new CompilePatternSynthesizer(settings.sourceSuffix());
        DescriptorRenderer renderer = new DescriptorRenderer(projectRoot, unityVersion);

        Map<String, Integer> sourceCounts = new TreeMap<>();
        Map<String, Integer> patternCounts = new TreeMap<>();
        List<RenderedDescriptor> rendered = new ArrayList<>();

        for (ProjectInfo project : projects) {
            List<String> directories = assignment.directoriesOf(project.name());
            List<CompilePattern> patterns = patternsFor(project, directories, ownership, scan, synthesizer, recursive);
            List<ProjectInfo> references = referencesOf(project, modules, projectsByName);

            sourceCounts.put(project.name(), directories.stream().mapToInt(scan::sourceFileCount).sum());
            patternCounts.put(project.name(), patterns.size());

            String template = renderer.loadTemplate(project.templatePath());
            rendered.add(renderer.renderProject(project, template, patterns, references));
        }

        String solutionTemplate = renderer.loadTemplate(solution.templatePath());
        rendered.add(renderer.renderSolution(solution.solutionPath(), solutionTemplate,
                solution.projectTypeGuid(), projects));

        List<String> updated = new ArrayList<>();
        for (RenderedDescriptor descriptor : rendered) {
            if (writer.writeIfChanged(projectRoot.resolve(descriptor.relativePath()), descriptor.content())) {
                updated.add(descriptor.relativePath());
            }
        }
        updated.sort(null);

        List<String> unresolved = assignment.unresolvedDirectories();
        if (!unresolved.isEmpty()) {
            warnings.add("Unresolved source directories: " + unresolved.size());
            if (options.verbose()) {
                unresolved.stream()
                        .limit(settings.unresolvedSampleSize())
                        .forEach(directory -> warnings.add("Unresolved: " + directory));
            }
        }

        log.info("Generated {} projects, {} file(s) updated", projects.size(), updated.size());
        return new GenerateResult(updated, warnings,
                new GenerationStats(sourceCounts, patternCounts, unresolved.size()), projects, solution);
    }

    private List<ProjectInfo> discoverProjects(ModuleIndex modules, SourceAssignment assignment) {
        List<ProjectInfo> projects = new ArrayList<>();
        for (ModuleRecord record : modules.records()) {
            projects.add(new ProjectInfo(
                    record.name(),
                    record.name() + DESCRIPTOR_SUFFIX,
                    templatePathFor(record.name()),
                    ProjectIdentifiers.forName(record.name()),
                    ProjectKind.ASMDEF,
                    record.category(),
                    record.includedPlatforms(),
                    record.excludedPlatforms()));
        }
        for (String legacyName : LegacyFallback.NAMES) {
            if (assignment.directoriesOf(legacyName).isEmpty() || modules.contains(legacyName)) {
                continue;
            }
            projects.add(new ProjectInfo(
                    legacyName,
                    legacyName + DESCRIPTOR_SUFFIX,
                    templatePathFor(legacyName),
                    ProjectIdentifiers.forName(legacyName),
                    ProjectKind.LEGACY,
                    LegacyFallback.isEditorName(legacyName) ? ModuleCategory.EDITOR : ModuleCategory.RUNTIME,
                    Set.of(),
                    Set.of()));
        }
        projects.sort((a, b) -> a.name().compareTo(b.name()));
        return projects;
    }

    private static List<ProjectInfo> registeredProjects(GeneratorManifest manifest, ModuleIndex modules) {
        List<ProjectInfo> projects = new ArrayList<>();
        for (GeneratorManifest.Entry entry : manifest.projects()) {
            ProjectKind kind = ProjectKind.fromRegistryName(entry.kind());
            ModuleCategory category = ModuleCategory.fromRegistryName(entry.category());
            Set<String> included = Set.of();
            Set<String> excluded = Set.of();
            if (kind == ProjectKind.ASMDEF) {
                ModuleRecord record = modules.get(entry.name()).orElseThrow(() -> new GeneratorException(
                        "Registered project '" + entry.name() + "' has kind asmdef but no module declaration"));
                included = record.includedPlatforms();
                excluded = record.excludedPlatforms();
            }
            projects.add(new ProjectInfo(entry.name(), entry.csprojPath(), entry.templatePath(), entry.guid(),
                    kind, category, included, excluded));
        }
        return projects;
    }

    private static Set<String> registeredNames(GeneratorManifest manifest) {
        return manifest.projects().stream().map(GeneratorManifest.Entry::name).collect(Collectors.toSet());
    }

    private static List<CompilePattern> patternsFor(ProjectInfo project,
                                                    List<String> directories,
                                                    OwnershipMap ownership,
                                                    ScanSnapshot scan,
                                                    CompilePatternSynthesizer synthesizer,
                                                    boolean recursive) {
        if (project.kind() == ProjectKind.LEGACY || !recursive) {
            return synthesizer.flat(directories);
        }
        List<String> ownRoots = ownership.rootsOf(project.name());
        if (ownRoots.isEmpty()) {
            return synthesizer.flat(directories);
        }
        return synthesizer.recursive(ownRoots, ownership.rootsNotOf(project.name()), scan.ignoredDirectories());
    }

    /**
     * Resolved references of a declaration-backed project, in declaration order, without duplicates,
     * limited to projects being generated. Legacy projects reference nothing.
     */
    private static List<ProjectInfo> referencesOf(ProjectInfo project,
                                                  ModuleIndex modules,
                                                  Map<String, ProjectInfo> projectsByName) {
        if (project.kind() == ProjectKind.LEGACY) {
            return List.of();
        }
        Optional<ModuleRecord> record = modules.get(project.name());
        if (record.isEmpty()) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (String token : record.get().references()) {
            modules.resolveReference(token)
                    .filter(projectsByName::containsKey)
                    .ifPresent(names::add);
        }
        List<ProjectInfo> references = new ArrayList<>();
        for (String name : PathUtils.deduplicatePreservingOrder(names)) {
            references.add(projectsByName.get(name));
        }
        return references;
    }

    private String templatePathFor(String projectName) {
        return settings.templatesDirectory() + "/" + projectName + DESCRIPTOR_SUFFIX + TEMPLATE_SUFFIX;
    }

    private SolutionInfo findSolutionTemplate() throws IOException {
        Path templatesDirectory = projectRoot.resolve(settings.templatesDirectory());
        List<String> candidates = new ArrayList<>();
        if (Files.isDirectory(templatesDirectory)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(templatesDirectory, SOLUTION_TEMPLATE_GLOB)) {
                for (Path entry : entries) {
                    candidates.add(entry.getFileName().toString());
                }
            }
        }
        if (candidates.isEmpty()) {
            throw new MissingTemplateException("No solution template (" + SOLUTION_TEMPLATE_GLOB + ") found in "
                    + templatesDirectory, templatesDirectory);
        }
        candidates.sort(null);
        if (candidates.size() > 1) {
            log.warn("Found {} solution templates in {}, using {}", candidates.size(), templatesDirectory,
                    candidates.get(0));
        }
        String templateName = candidates.get(0);
        String solutionName = templateName.substring(0, templateName.length() - TEMPLATE_SUFFIX.length());
        return new SolutionInfo(solutionName, settings.templatesDirectory() + "/" + templateName,
                settings.projectTypeGuid());
    }

    private ProjectScanner newScanner() {
        return new ProjectScanner(settings.sourceSuffix(), settings.declarationSuffix(), settings.referenceSuffix(),
                settings.scanThreads());
    }

    /**
     * Reads {@code m_EditorVersion} from the project's version file.
     *
     * @param warnings receives a warning if the file is missing, in which case the version is empty.
     * @throws GeneratorException if the file exists but carries no editor version.
     */
    static String readUnityVersion(Path projectRoot, List<String> warnings) throws IOException {
        Path versionFile = projectRoot.resolve(VERSION_FILE);
        if (!Files.isRegularFile(versionFile)) {
            warnings.add(VERSION_FILE + " not found; editor version left empty");
            return "";
        }
        for (String line : Files.readAllLines(versionFile, StandardCharsets.UTF_8)) {
            if (line.startsWith(VERSION_KEY)) {
                String version = line.substring(VERSION_KEY.length()).trim();
                if (!version.isEmpty()) {
                    return version;
                }
            }
        }
        throw new GeneratorException("Invalid project version file: " + versionFile);
    }
}
