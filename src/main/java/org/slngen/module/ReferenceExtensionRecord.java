package org.slngen.module;

/**
 * A reference extension file binding its directory to an existing module.
 *
 * @param directory The directory holding the extension file.
 * @param reference The raw token naming the extended module.
 */
public record ReferenceExtensionRecord(String directory, String reference) {
}
