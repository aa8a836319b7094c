package org.slngen.variant;

import java.util.List;

/**
 * Outcome of preparing one variant.
 *
 * @param generated    Variant descriptors written in this run, sorted.
 * @param skipped      Variant descriptors that were already newer than their source, sorted.
 * @param solutionPath The variant solution, relative to the project root.
 * @param propsPath    The variant properties file, relative to the project root.
 * @param suffix       The name suffix of this variant, e.g. {@code .v.ios-prod}.
 */
public record VariantResult(
        List<String> generated,
        List<String> skipped,
        String solutionPath,
        String propsPath,
        String suffix
) {

    public VariantResult {
        generated = List.copyOf(generated);
        skipped = List.copyOf(skipped);
    }
}
