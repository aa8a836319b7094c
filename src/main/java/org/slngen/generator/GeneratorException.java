package org.slngen.generator;

/**
 * Thrown when generation cannot continue.
 * <p>
 * Every fatal condition is detected before the first descriptor is written, so a run that ends with
 * this exception leaves the descriptor set on disk untouched. Possible causes include:
 * <ul>
 *   <li>Two module declarations with the same name</li>
 *   <li>A missing project or solution template</li>
 *   <li>A missing or unreadable project registry</li>
 *   <li>No module declarations in the scanned tree</li>
 * </ul>
 */
public class GeneratorException extends RuntimeException {

    public GeneratorException(String message) {
        super(message);
    }

    public GeneratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
