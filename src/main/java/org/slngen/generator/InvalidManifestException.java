package org.slngen.generator;

import java.nio.file.Path;

/**
 * Thrown when the project registry is missing or cannot be parsed.
 */
public class InvalidManifestException extends GeneratorException {

    public InvalidManifestException(String message, Path manifestPath) {
        super(message + ": " + manifestPath);
    }

    public InvalidManifestException(String message, Path manifestPath, Throwable cause) {
        super(message + ": " + manifestPath, cause);
    }
}
