package org.slngen.module;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slngen.util.PathUtils;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Reads module declaration ({@code .asmdef}) and reference extension ({@code .asmref}) files.
 * <p>
 * Only the fields needed for ownership and categorisation are extracted. A file that is not valid
 * JSON, or lacks its key field, is skipped.
 */
public final class DeclarationLoader {

    private static final Logger log = LoggerFactory.getLogger(DeclarationLoader.class);

    private static final String META_SUFFIX = ".meta";
    private static final String META_GUID_KEY = "guid:";

    private final Gson gson = new Gson();
    private final Path realRoot;

    /**
     * @param realRoot the root the relative declaration paths are resolved against.
     */
    public DeclarationLoader(Path realRoot) {
        this.realRoot = realRoot;
    }

    /**
     * Loads every declaration in {@code relativePaths}, preserving order and skipping unreadable ones.
     *
     * @throws IOException if a declaration file exists but cannot be read.
     */
    public List<ModuleRecord> loadDeclarations(List<String> relativePaths) throws IOException {
        List<ModuleRecord> records = new ArrayList<>(relativePaths.size());
        for (String path : relativePaths) {
            loadDeclaration(path).ifPresent(records::add);
        }
        return records;
    }

    /**
     * Loads every reference extension in {@code relativePaths}.
     *
     * @throws IOException if an extension file exists but cannot be read.
     */
    public List<ReferenceExtensionRecord> loadReferenceExtensions(List<String> relativePaths) throws IOException {
        List<ReferenceExtensionRecord> records = new ArrayList<>(relativePaths.size());
        for (String path : relativePaths) {
            loadReferenceExtension(path).ifPresent(records::add);
        }
        return records;
    }

    public Optional<ModuleRecord> loadDeclaration(String relativePath) throws IOException {
        Path file = realRoot.resolve(relativePath);
        RawDeclaration raw = parse(file, RawDeclaration.class);
        if (raw == null || raw.name == null || raw.name.isBlank()) {
            log.debug("Ignoring declaration without a name: {}", relativePath);
            return Optional.empty();
        }

        List<String> includePlatforms = orEmpty(raw.includePlatforms);
        List<String> excludePlatforms = orEmpty(raw.excludePlatforms);
        List<String> defineConstraints = orEmpty(raw.defineConstraints);

        return Optional.of(new ModuleRecord(
                raw.name,
                PathUtils.parentDirectory(relativePath),
                relativePath,
                loadMetaGuid(file).orElse(null),
                orEmpty(raw.references),
                ModuleCategory.infer(includePlatforms, defineConstraints),
                new HashSet<>(includePlatforms),
                new HashSet<>(excludePlatforms)));
    }

    public Optional<ReferenceExtensionRecord> loadReferenceExtension(String relativePath) throws IOException {
        RawReferenceExtension raw = parse(realRoot.resolve(relativePath), RawReferenceExtension.class);
        if (raw == null || raw.reference == null || raw.reference.isBlank()) {
            log.debug("Ignoring reference extension without a reference: {}", relativePath);
            return Optional.empty();
        }
        return Optional.of(new ReferenceExtensionRecord(PathUtils.parentDirectory(relativePath), raw.reference));
    }

    /**
     * Reads the lowercase {@code guid:} value from the {@code .meta} file that sits next to an asset.
     *
     * @throws IOException if the meta file exists but cannot be read.
     */
    static Optional<String> loadMetaGuid(Path assetFile) throws IOException {
        Path meta = assetFile.resolveSibling(assetFile.getFileName() + META_SUFFIX);
        if (!Files.isRegularFile(meta)) {
            return Optional.empty();
        }
        for (String line : Files.readAllLines(meta, StandardCharsets.UTF_8)) {
            if (line.startsWith(META_GUID_KEY)) {
                String guid = line.substring(META_GUID_KEY.length()).trim();
                return guid.isEmpty() ? Optional.empty() : Optional.of(guid.toLowerCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    private <T> T parse(Path file, Class<T> type) throws IOException {
        String json = Files.readString(file, StandardCharsets.UTF_8);
        try {
            return gson.fromJson(json, type);
        } catch (JsonParseException e) {
            log.debug("Cannot parse {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static List<String> orEmpty(List<String> values) {
        if (values == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>(values.size());
        for (String value : values) {
            if (value != null) {
                result.add(value);
            }
        }
        return result;
    }

    /** Subset of the declaration schema; unknown keys are ignored. */
    private static final class RawDeclaration {
        String name;
        List<String> references;
        List<String> includePlatforms;
        List<String> excludePlatforms;
        List<String> defineConstraints;
    }

    private static final class RawReferenceExtension {
        String reference;
    }
}
