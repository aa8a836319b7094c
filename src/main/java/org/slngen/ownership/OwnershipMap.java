package org.slngen.ownership;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slngen.module.ModuleIndex;
import org.slngen.module.ModuleRecord;
import org.slngen.module.ReferenceExtensionRecord;

/**
 * Ownership roots of a scan: each entry binds a directory to the module compiling it.
 * <p>
 * Declaration directories are bound first. Reference extensions then bind their directory to the
 * module their token resolves to, unless a declaration already owns that directory. Extensions with
 * unresolvable tokens are dropped. Immutable once built.
 */
public final class OwnershipMap {

    private static final Logger log = LoggerFactory.getLogger(OwnershipMap.class);

    private final Map<String, String> ownerByDirectory;
    private final List<String> conflicts;

    private OwnershipMap(Map<String, String> ownerByDirectory, List<String> conflicts) {
        this.ownerByDirectory = ownerByDirectory;
        this.conflicts = conflicts;
    }

    public static OwnershipMap build(ModuleIndex modules, List<ReferenceExtensionRecord> extensions) {
        return build(modules, extensions, name -> true);
    }

    /**
     * Builds the map, binding only modules accepted by {@code includeModule}.
     *
     * @param modules       all declared modules.
     * @param extensions    all reference extensions of the scan.
     * @param includeModule filter on module names, used when only registered projects may own sources.
     */
    public static OwnershipMap build(ModuleIndex modules,
                                     List<ReferenceExtensionRecord> extensions,
                                     Predicate<String> includeModule) {
        Map<String, String> owners = new TreeMap<>();
        for (ModuleRecord record : modules.records()) {
            if (includeModule.test(record.name())) {
                owners.put(record.directory(), record.name());
            }
        }

        List<String> conflicts = new ArrayList<>();
        for (ReferenceExtensionRecord extension : extensions) {
            Optional<String> resolved = modules.resolveReference(extension.reference());
            if (resolved.isEmpty()) {
                log.debug("Dropping reference extension in '{}': unknown module '{}'",
                        extension.directory(), extension.reference());
                continue;
            }
            String moduleName = resolved.get();
            if (!includeModule.test(moduleName)) {
                continue;
            }
            String existing = owners.putIfAbsent(extension.directory(), moduleName);
            if (existing != null && !existing.equals(moduleName)) {
                conflicts.add(extension.directory());
                log.debug("Directory '{}' is owned by '{}'; ignoring reference extension to '{}'",
                        extension.directory(), existing, moduleName);
            }
        }

        return new OwnershipMap(Collections.unmodifiableMap(owners), List.copyOf(conflicts));
    }

    /**
     * The module bound exactly at {@code directory}, without walking to ancestors.
     */
    public Optional<String> ownerAt(String directory) {
        return Optional.ofNullable(ownerByDirectory.get(directory));
    }

    /**
     * All ownership roots, sorted by directory.
     */
    public Map<String, String> roots() {
        return ownerByDirectory;
    }

    /**
     * The ownership roots of one module, sorted.
     */
    public List<String> rootsOf(String moduleName) {
        List<String> roots = new ArrayList<>();
        for (Map.Entry<String, String> entry : ownerByDirectory.entrySet()) {
            if (entry.getValue().equals(moduleName)) {
                roots.add(entry.getKey());
            }
        }
        return roots;
    }

    /**
     * Ownership roots of every module other than {@code moduleName}, sorted.
     */
    public List<String> rootsNotOf(String moduleName) {
        List<String> roots = new ArrayList<>();
        for (Map.Entry<String, String> entry : ownerByDirectory.entrySet()) {
            if (!entry.getValue().equals(moduleName)) {
                roots.add(entry.getKey());
            }
        }
        return roots;
    }

    /**
     * Directories holding both a declaration and a reference extension to a different module.
     * The declaration owns such a directory.
     */
    public List<String> conflicts() {
        return conflicts;
    }
}
