package org.slngen.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slngen.cli.CommandLineInterface;
import org.slngen.generator.GenerateOptions;
import org.slngen.generator.GenerateResult;
import org.slngen.generator.GeneratorSettings;
import org.slngen.generator.SolutionGenerator;
import org.slngen.variant.BuildConfiguration;
import org.slngen.variant.BuildPlatform;
import org.slngen.variant.VariantResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Regenerates every descriptor and the solution, and optionally a platform variant of them.
 * <p>
 * Without a platform the command prints the updated files and a per-project pattern summary. With a
 * platform it prints the variant solution followed by every variant descriptor, one path per line,
 * so the output can be piped into a build driver.
 */
@Command(
    name = "generate",
    description = "Generate .csproj/.sln files from the module layout and templates"
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Parameters(
        index = "0",
        arity = "0..1",
        defaultValue = ".",
        description = "Project root (default: current directory)"
    )
    private Path projectRoot;

    @Parameters(
        index = "1",
        arity = "0..1",
        description = "Variant platform: ios or android"
    )
    private String platform;

    @Parameters(
        index = "2",
        arity = "0..1",
        defaultValue = "dev",
        description = "Variant configuration: editor, dev or prod (default: ${DEFAULT-VALUE})"
    )
    private String configuration;

    @Option(
        names = {"--template-root"},
        description = "Template root relative to the project root (default: slngen.template-root)"
    )
    private String templateRoot;

    @Option(
        names = {"--manifest"},
        description = "Project registry relative to the project root; only registered projects are generated"
    )
    private String manifestPath;

    @Option(
        names = {"--recursive"},
        description = "Emit recursive compile globs for module projects"
    )
    private boolean recursive;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log progress and list unresolved source directories"
    )
    private boolean verbose;

    @Option(
        names = {"-d", "--debug"},
        description = "Keep DEBUG/TRACE defines in prod variants"
    )
    private boolean debug;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            if (verbose) {
                CommandLineInterface.enableVerboseLogging();
            }
            BuildPlatform variantPlatform = platform == null ? null : BuildPlatform.fromCliName(platform);
            BuildConfiguration variantConfiguration = BuildConfiguration.fromCliName(configuration);

            GeneratorSettings settings = GeneratorSettings.fromConfig(parent.getConfig(), projectRoot);
            if (templateRoot != null) {
                settings = settings.withTemplateRoot(templateRoot);
            }
            if (recursive) {
                settings = settings.withRecursivePatterns(true);
            }

            SolutionGenerator generator = new SolutionGenerator(settings);
            GenerateResult result = generator.generate(new GenerateOptions(manifestPath, verbose));

            if (variantPlatform == null) {
                printSummary(result, out);
            } else {
                VariantResult variant = generator.prepareVariant(result, variantPlatform, variantConfiguration, debug);
                printVariant(variant, out, err);
            }

            for (String warning : result.warnings()) {
                err.println("warning: " + warning);
            }
            out.flush();
            err.flush();
            return 0;

        } catch (Exception e) {
            log.error("Generation failed: {}", e.getMessage());
            log.debug("Generation failure", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void printSummary(GenerateResult result, PrintWriter out) {
        if (result.updatedFiles().isEmpty()) {
            out.println("No changes.");
        } else {
            out.printf("Updated %d file(s):%n", result.updatedFiles().size());
            for (String file : result.updatedFiles()) {
                out.println("  - " + file);
            }
        }

        out.println("Source mapping summary:");
        Map<String, Integer> sourceCounts = result.stats().sourceFileCountByProject();
        result.stats().patternCountByProject().forEach((project, patterns) ->
                out.printf("  - %s: %d patterns, %d sources%n", project, patterns, sourceCounts.getOrDefault(project, 0)));

        if (result.stats().unresolvedDirectoryCount() > 0) {
            out.printf("Unresolved directories: %d%n", result.stats().unresolvedDirectoryCount());
        }
    }

    private static void printVariant(VariantResult variant, PrintWriter out, PrintWriter err) {
        if (!variant.skipped().isEmpty()) {
            err.printf("Skipped %d up-to-date csproj(s)%n", variant.skipped().size());
        }
        out.println(variant.solutionPath());
        for (String path : variant.generated()) {
            out.println(path);
        }
        for (String path : variant.skipped()) {
            out.println(path);
        }
    }
}
