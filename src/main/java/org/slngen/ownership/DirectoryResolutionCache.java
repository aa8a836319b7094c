package org.slngen.ownership;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Memo of nearest-ancestor lookups: directory to owning module, or to "unresolved".
 * <p>
 * Not thread-safe. Each resolver owns one instance.
 */
final class DirectoryResolutionCache {

    private final Map<String, Optional<String>> results = new HashMap<>();

    boolean contains(String directory) {
        return results.containsKey(directory);
    }

    /**
     * The cached owner of {@code directory}; empty when it resolved to no module.
     *
     * @throws IllegalStateException if the directory has not been resolved yet.
     */
    Optional<String> get(String directory) {
        Optional<String> result = results.get(directory);
        if (result == null) {
            throw new IllegalStateException("Directory not resolved yet: " + directory);
        }
        return result;
    }

    void putAll(List<String> directories, Optional<String> result) {
        for (String directory : directories) {
            results.put(directory, result);
        }
    }

    int size() {
        return results.size();
    }
}
