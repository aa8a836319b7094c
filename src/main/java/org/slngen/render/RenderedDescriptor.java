package org.slngen.render;

/**
 * A fully rendered descriptor waiting to be written.
 *
 * @param relativePath Output path relative to the project root.
 * @param content      The complete file content.
 */
public record RenderedDescriptor(String relativePath, String content) {
}
