package org.slngen.render;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;

/**
 * Deterministic project identifiers.
 * <p>
 * The identifier is a name-based UUID of the project name, so descriptors regenerated in any order
 * or on any machine reference each other consistently.
 */
public final class ProjectIdentifiers {

    private ProjectIdentifiers() {
    }

    /**
     * @return the identifier in solution form, e.g. {@code {3F2504E0-4F89-31D3-9A0C-0305E82C3301}}.
     */
    public static String forName(String projectName) {
        UUID uuid = UUID.nameUUIDFromBytes(projectName.getBytes(StandardCharsets.UTF_8));
        return "{" + uuid.toString().toUpperCase(Locale.ROOT) + "}";
    }
}
