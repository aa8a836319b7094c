package org.slngen.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
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
 * Turns the solution and project files last written by the editor into generator templates.
 */
@Command(
    name = "extract-templates",
    description = "Extract templates from editor-generated .csproj/.sln files"
)
public class ExtractTemplatesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractTemplatesCommand.class);

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

            List<String> updated = new SolutionGenerator(settings).extractTemplates();
            if (updated.isEmpty()) {
                out.println("No changes.");
            } else {
                out.printf("Extracted %d template(s):%n", updated.size());
                for (String file : updated) {
                    out.println("  - " + file);
                }
            }
            out.flush();
            return 0;

        } catch (Exception e) {
            log.error("Template extraction failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
