package org.slngen.generator;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import com.typesafe.config.Config;

/**
 * Every tunable of a generator run, resolved once and passed explicitly to each stage.
 *
 * @param projectRoot          Root of the source tree; descriptors are written relative to it.
 * @param templateRoot         Root-relative directory holding {@code templates/} and variant caches.
 * @param scanRoots            Root-relative directories to scan.
 * @param legacyRoot           Top-level directory whose unowned sources fall back to legacy assemblies.
 * @param sourceSuffix         Suffix of compilable sources.
 * @param declarationSuffix    Suffix of module declarations.
 * @param referenceSuffix      Suffix of reference extensions.
 * @param projectTypeGuid      Project type identifier for solution entries.
 * @param recursivePatterns    Whether declaration-backed projects use recursive globs.
 * @param scanThreads          Worker threads of the scan; 0 means available processors.
 * @param unresolvedSampleSize Unresolved directories listed in verbose mode.
 */
public record GeneratorSettings(
        Path projectRoot,
        String templateRoot,
        List<String> scanRoots,
        String legacyRoot,
        String sourceSuffix,
        String declarationSuffix,
        String referenceSuffix,
        String projectTypeGuid,
        boolean recursivePatterns,
        int scanThreads,
        int unresolvedSampleSize
) {

    private static final String PREFIX = "slngen.";
    private static final String TEMPLATES_DIRECTORY = "templates";

    public GeneratorSettings {
        scanRoots = List.copyOf(scanRoots);
    }

    /**
     * Reads the {@code slngen} section of the application configuration.
     *
     * @param config      the resolved configuration, with {@code reference.conf} defaults.
     * @param projectRoot the project root chosen on the command line.
     * @return the settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     * @throws IllegalArgumentException            if {@code compile-patterns} is neither flat nor recursive.
     */
    public static GeneratorSettings fromConfig(Config config, Path projectRoot) {
        String patternMode = config.getString(PREFIX + "compile-patterns").toLowerCase(Locale.ROOT);
        if (!patternMode.equals("flat") && !patternMode.equals("recursive")) {
            throw new IllegalArgumentException(
                    "slngen.compile-patterns must be 'flat' or 'recursive', got '" + patternMode + "'");
        }
        return new GeneratorSettings(
                projectRoot,
                config.getString(PREFIX + "template-root"),
                config.getStringList(PREFIX + "scan-roots"),
                config.getString(PREFIX + "legacy-root"),
                config.getString(PREFIX + "extensions.source"),
                config.getString(PREFIX + "extensions.declaration"),
                config.getString(PREFIX + "extensions.reference"),
                config.getString(PREFIX + "project-type-guid"),
                patternMode.equals("recursive"),
                config.getInt(PREFIX + "scan-threads"),
                config.getInt(PREFIX + "unresolved-sample-size"));
    }

    /**
     * Root-relative directory containing the per-project and solution templates.
     */
    public String templatesDirectory() {
        return templateRoot + "/" + TEMPLATES_DIRECTORY;
    }

    public GeneratorSettings withTemplateRoot(String value) {
        return new GeneratorSettings(projectRoot, value, scanRoots, legacyRoot, sourceSuffix, declarationSuffix,
                referenceSuffix, projectTypeGuid, recursivePatterns, scanThreads, unresolvedSampleSize);
    }

    public GeneratorSettings withRecursivePatterns(boolean value) {
        return new GeneratorSettings(projectRoot, templateRoot, scanRoots, legacyRoot, sourceSuffix, declarationSuffix,
                referenceSuffix, projectTypeGuid, value, scanThreads, unresolvedSampleSize);
    }
}
