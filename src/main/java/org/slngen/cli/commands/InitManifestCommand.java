package org.slngen.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slngen.cli.CommandLineInterface;
import org.slngen.generator.GeneratorSettings;
import org.slngen.generator.SolutionGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Writes a project registry listing the projects of the existing solution.
 */
@Command(
    name = "init-manifest",
    description = "Create a project registry from the existing .sln file"
)
public class InitManifestCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitManifestCommand.class);

    @Parameters(
        index = "0",
        arity = "0..1",
        defaultValue = ".",
        description = "Project root (default: current directory)"
    )
    private Path projectRoot;

    @Option(
        names = {"--template-root"},
        description = "Template root relative to the project root (default: slngen.template-root)"
    )
    private String templateRoot;

    @Option(
        names = {"--manifest"},
        description = "Registry path relative to the project root (default: <template-root>/manifest.json)"
    )
    private String manifestPath;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            GeneratorSettings settings = GeneratorSettings.fromConfig(parent.getConfig(), projectRoot);
            if (templateRoot != null) {
                settings = settings.withTemplateRoot(templateRoot);
            }
            String target = manifestPath != null ? manifestPath : settings.templateRoot() + "/manifest.json";

            Path written = new SolutionGenerator(settings).initManifest(target);
            out.println("Wrote " + written);
            out.flush();
            return 0;

        } catch (Exception e) {
            log.error("Manifest initialization failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
