package org.slngen.generator;

/**
 * Per-invocation options of {@link SolutionGenerator#generate(GenerateOptions)}.
 *
 * @param manifestPath Root-relative project registry; {@code null} discovers projects from the scan.
 * @param verbose      Whether to sample unresolved directories into the warnings.
 */
public record GenerateOptions(String manifestPath, boolean verbose) {

    public static GenerateOptions discover(boolean verbose) {
        return new GenerateOptions(null, verbose);
    }

    public boolean manifestDriven() {
        return manifestPath != null;
    }
}
