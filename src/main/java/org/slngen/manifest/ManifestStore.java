package org.slngen.manifest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slngen.generator.InvalidManifestException;
import org.slngen.render.IncrementalWriter;
import org.slngen.render.ProjectKind;

/**
 * Reads and writes the JSON project registry.
 */
public final class ManifestStore {

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    /**
     * Loads and validates a registry.
     *
     * @param manifestFile absolute path of the registry.
     * @return the registry.
     * @throws InvalidManifestException if the file is missing, unreadable, not valid JSON, or lacks required fields.
     */
    public GeneratorManifest load(Path manifestFile) {
        if (!Files.isRegularFile(manifestFile)) {
            throw new InvalidManifestException("Missing manifest", manifestFile);
        }

        GeneratorManifest manifest;
        try {
            manifest = gson.fromJson(Files.readString(manifestFile, StandardCharsets.UTF_8), GeneratorManifest.class);
        } catch (IOException e) {
            throw new InvalidManifestException("Cannot read manifest", manifestFile, e);
        } catch (JsonParseException e) {
            throw new InvalidManifestException("Invalid manifest JSON", manifestFile, e);
        }

        validate(manifest, manifestFile);
        return manifest;
    }

    /**
     * Writes the registry as pretty-printed JSON, leaving an identical file untouched.
     *
     * @return {@code true} if the file was written.
     * @throws IOException if the file cannot be written.
     */
    public boolean save(Path manifestFile, GeneratorManifest manifest, IncrementalWriter writer) throws IOException {
        return writer.writeIfChanged(manifestFile, gson.toJson(manifest) + "\n");
    }

    private static void validate(GeneratorManifest manifest, Path manifestFile) {
        if (manifest == null) {
            throw new InvalidManifestException("Empty manifest", manifestFile);
        }
        requireField(manifest.solutionPath(), "solutionPath", manifestFile);
        requireField(manifest.solutionTemplatePath(), "solutionTemplatePath", manifestFile);
        requireField(manifest.projectTypeGuid(), "projectTypeGuid", manifestFile);
        if (manifest.projects() == null) {
            throw new InvalidManifestException("Manifest has no 'projects' list", manifestFile);
        }

        Set<String> names = new HashSet<>();
        for (GeneratorManifest.Entry entry : manifest.projects()) {
            if (entry == null) {
                throw new InvalidManifestException("Manifest contains a null project", manifestFile);
            }
            requireField(entry.name(), "name", manifestFile);
            requireField(entry.csprojPath(), "csprojPath", manifestFile);
            requireField(entry.templatePath(), "templatePath", manifestFile);
            requireField(entry.guid(), "guid", manifestFile);
            requireField(entry.kind(), "kind", manifestFile);
            try {
                ProjectKind.fromRegistryName(entry.kind());
            } catch (IllegalArgumentException e) {
                throw new InvalidManifestException("Project '" + entry.name() + "' has unknown kind '"
                        + entry.kind() + "'", manifestFile, e);
            }
            if (!names.add(entry.name())) {
                throw new InvalidManifestException("Project '" + entry.name() + "' is registered twice", manifestFile);
            }
        }
    }

    private static void requireField(String value, String field, Path manifestFile) {
        if (value == null || value.isBlank()) {
            throw new InvalidManifestException("Manifest field '" + field + "' is missing", manifestFile);
        }
    }
}
