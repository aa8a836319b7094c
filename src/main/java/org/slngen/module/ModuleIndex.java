package org.slngen.module;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slngen.generator.DuplicateModuleNameException;

/**
 * Lookup of declared modules by name and by identifier.
 * <p>
 * Reference tokens are resolved in this order: exact module name, {@code GUID:}-prefixed identifier,
 * bare 32-character identifier. Identifier lookups are case-insensitive.
 */
public final class ModuleIndex {

    public static final String GUID_PREFIX = "GUID:";
    private static final int GUID_LENGTH = 32;

    private final Map<String, ModuleRecord> byName;
    private final Map<String, String> nameByGuid;

    private ModuleIndex(Map<String, ModuleRecord> byName, Map<String, String> nameByGuid) {
        this.byName = byName;
        this.nameByGuid = nameByGuid;
    }

    /**
     * Indexes the given records.
     *
     * @throws DuplicateModuleNameException if two records share a name.
     */
    public static ModuleIndex of(List<ModuleRecord> records) {
        Map<String, ModuleRecord> byName = new LinkedHashMap<>();
        Map<String, String> nameByGuid = new HashMap<>();
        for (ModuleRecord record : records) {
            ModuleRecord previous = byName.putIfAbsent(record.name(), record);
            if (previous != null) {
                throw new DuplicateModuleNameException(record.name(), previous.declarationPath(), record.declarationPath());
            }
            if (record.guid() != null) {
                nameByGuid.put(record.guid().toLowerCase(Locale.ROOT), record.name());
            }
        }
        return new ModuleIndex(Collections.unmodifiableMap(byName), Collections.unmodifiableMap(nameByGuid));
    }

    public Optional<ModuleRecord> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    public Collection<ModuleRecord> records() {
        return byName.values();
    }

    public int size() {
        return byName.size();
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    /**
     * Resolves a raw reference token to a module name.
     *
     * @param token a module name, {@code GUID:<id>} or a bare identifier.
     * @return the referenced module's name, or empty if nothing matches.
     */
    public Optional<String> resolveReference(String token) {
        if (byName.containsKey(token)) {
            return Optional.of(token);
        }
        if (token.startsWith(GUID_PREFIX)) {
            String guid = token.substring(GUID_PREFIX.length()).toLowerCase(Locale.ROOT);
            return Optional.ofNullable(nameByGuid.get(guid));
        }
        if (token.length() == GUID_LENGTH) {
            return Optional.ofNullable(nameByGuid.get(token.toLowerCase(Locale.ROOT)));
        }
        return Optional.empty();
    }
}
