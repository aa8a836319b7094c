package org.slngen.ownership;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slngen.util.PathUtils;

/**
 * Assigns sources without an owning module to the fixed legacy assemblies.
 * <p>
 * Only directories under the legacy root qualify. The name is picked by two flags: whether any
 * path component is {@code Editor}, and whether the second component is a first-pass directory.
 */
public final class LegacyFallback {

    public static final String RUNTIME = "Assembly-CSharp";
    public static final String RUNTIME_FIRST_PASS = "Assembly-CSharp-firstpass";
    public static final String EDITOR = "Assembly-CSharp-Editor";
    public static final String EDITOR_FIRST_PASS = "Assembly-CSharp-Editor-firstpass";

    public static final List<String> NAMES = List.of(RUNTIME, RUNTIME_FIRST_PASS, EDITOR, EDITOR_FIRST_PASS);

    private static final String EDITOR_DIRECTORY = "Editor";
    private static final Set<String> FIRST_PASS_DIRECTORIES = Set.of("Plugins", "Standard Assets", "Pro Standard Assets");

    private final String legacyRoot;

    /**
     * @param legacyRoot the top-level directory whose unowned sources fall back, usually {@code Assets}.
     */
    public LegacyFallback(String legacyRoot) {
        this.legacyRoot = legacyRoot;
    }

    public Optional<String> resolve(String directory) {
        List<String> components = PathUtils.components(directory);
        if (components.isEmpty() || !components.get(0).equals(legacyRoot)) {
            return Optional.empty();
        }

        boolean editor = components.contains(EDITOR_DIRECTORY);
        boolean firstPass = components.size() > 1 && FIRST_PASS_DIRECTORIES.contains(components.get(1));

        if (editor) {
            return Optional.of(firstPass ? EDITOR_FIRST_PASS : EDITOR);
        }
        return Optional.of(firstPass ? RUNTIME_FIRST_PASS : RUNTIME);
    }

    public static boolean isLegacyName(String name) {
        return NAMES.contains(name);
    }

    /**
     * Legacy assemblies compiled only inside the editor.
     */
    public static boolean isEditorName(String name) {
        return EDITOR.equals(name) || EDITOR_FIRST_PASS.equals(name);
    }
}
