package org.slngen.generator;

import java.nio.file.Path;

/**
 * Thrown when a project or solution template required for rendering does not exist.
 */
public class MissingTemplateException extends GeneratorException {

    private final Path templatePath;

    public MissingTemplateException(Path templatePath) {
        super("Missing template file: " + templatePath);
        this.templatePath = templatePath;
    }

    public MissingTemplateException(String message, Path templatePath) {
        super(message);
        this.templatePath = templatePath;
    }

    public Path getTemplatePath() {
        return templatePath;
    }
}
