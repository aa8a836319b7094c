package org.slngen.ownership;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slngen.util.PathUtils;

/**
 * Resolves source directories to the project that compiles them.
 * <p>
 * A directory belongs to the module bound at its nearest ancestor (itself included) in the
 * {@link OwnershipMap}. Every directory visited by a walk is memoized with the walk's result, so
 * siblings sharing an ancestor resolve in constant time. Directories without an owning module fall
 * back to {@link LegacyFallback}.
 * <p>
 * Instances are single-threaded.
 */
public final class OwnershipResolver {

    private static final Logger log = LoggerFactory.getLogger(OwnershipResolver.class);

    private final OwnershipMap ownershipMap;
    private final LegacyFallback legacyFallback;
    private final DirectoryResolutionCache cache = new DirectoryResolutionCache();

    public OwnershipResolver(OwnershipMap ownershipMap, LegacyFallback legacyFallback) {
        this.ownershipMap = ownershipMap;
        this.legacyFallback = legacyFallback;
    }

    /**
     * The module owning {@code directory} through its nearest ownership root, ignoring legacy fallback.
     */
    public Optional<String> nearestOwner(String directory) {
        List<String> walked = new ArrayList<>();
        String current = directory;

        while (true) {
            if (cache.contains(current)) {
                Optional<String> cached = cache.get(current);
                cache.putAll(walked, cached);
                return cached;
            }

            walked.add(current);
            Optional<String> owner = ownershipMap.ownerAt(current);
            if (owner.isPresent()) {
                cache.putAll(walked, owner);
                return owner;
            }

            if (current.isEmpty()) {
                break;
            }
            current = PathUtils.parentDirectory(current);
        }

        cache.putAll(walked, Optional.empty());
        return Optional.empty();
    }

    /**
     * The project owning {@code directory}: its nearest module, else the matching legacy assembly.
     */
    public Optional<String> resolve(String directory) {
        Optional<String> owner = nearestOwner(directory);
        if (owner.isPresent()) {
            return owner;
        }
        return legacyFallback.resolve(directory);
    }

    public SourceAssignment assign(Collection<String> sourceDirectories) {
        return assign(sourceDirectories, name -> true);
    }

    /**
     * Groups source directories by owner.
     *
     * @param sourceDirectories directories directly containing sources.
     * @param acceptLegacy      whether a legacy assembly name may receive sources; rejected ones leave the directory unresolved.
     */
    public SourceAssignment assign(Collection<String> sourceDirectories, Predicate<String> acceptLegacy) {
        Map<String, List<String>> byOwner = new TreeMap<>();
        List<String> unresolved = new ArrayList<>();

        for (String directory : sourceDirectories) {
            Optional<String> owner = nearestOwner(directory);
            if (owner.isEmpty()) {
                owner = legacyFallback.resolve(directory).filter(acceptLegacy);
            }
            if (owner.isPresent()) {
                byOwner.computeIfAbsent(owner.get(), k -> new ArrayList<>()).add(directory);
            } else {
                unresolved.add(directory);
            }
        }

        for (List<String> directories : byOwner.values()) {
            directories.sort(null);
        }
        unresolved.sort(null);

        log.debug("Assigned {} source directories to {} projects ({} unresolved, {} cached lookups)",
                sourceDirectories.size(), byOwner.size(), unresolved.size(), cache.size());

        Map<String, List<String>> frozen = new TreeMap<>();
        byOwner.forEach((owner, directories) -> frozen.put(owner, List.copyOf(directories)));
        return new SourceAssignment(Collections.unmodifiableMap(frozen), List.copyOf(unresolved));
    }
}
