package org.slngen.ownership;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slngen.module.ModuleCategory;
import org.slngen.module.ModuleIndex;
import org.slngen.module.ModuleRecord;
import org.slngen.module.ReferenceExtensionRecord;

@Tag("unit")
class OwnershipMapTest {

    static ModuleRecord module(String name, String directory, String guid) {
        return new ModuleRecord(name, directory, directory + "/" + name + ".asmdef", guid, List.of(),
                ModuleCategory.RUNTIME, Set.of(), Set.of());
    }

    private final ModuleIndex modules = ModuleIndex.of(List.of(
            module("Game", "Assets/Game", "11111111111111111111111111111111"),
            module("Core", "Assets/Core", null)));

    @Test
    void build_bindsDeclarationsAndResolvedExtensions() {
        OwnershipMap map = OwnershipMap.build(modules, List.of(
                new ReferenceExtensionRecord("Assets/Plugins/GameExtra", "GUID:11111111111111111111111111111111"),
                new ReferenceExtensionRecord("Assets/Misc", "Core")));

        assertThat(map.roots()).containsExactly(
                entry("Assets/Core", "Core"),
                entry("Assets/Game", "Game"),
                entry("Assets/Misc", "Core"),
                entry("Assets/Plugins/GameExtra", "Game"));
        assertThat(map.rootsOf("Core")).containsExactly("Assets/Core", "Assets/Misc");
        assertThat(map.rootsNotOf("Core")).containsExactly("Assets/Game", "Assets/Plugins/GameExtra");
        assertThat(map.conflicts()).isEmpty();
    }

    @Test
    void build_dropsUnresolvableExtensions() {
        OwnershipMap map = OwnershipMap.build(modules, List.of(new ReferenceExtensionRecord("Assets/Lost", "Nobody")));

        assertThat(map.ownerAt("Assets/Lost")).isEmpty();
        assertThat(map.roots()).hasSize(2);
    }

    @Test
    void build_declarationWinsOverExtensionInSameDirectory() {
        OwnershipMap map = OwnershipMap.build(modules, List.of(new ReferenceExtensionRecord("Assets/Game", "Core")));

        assertThat(map.ownerAt("Assets/Game")).contains("Game");
        assertThat(map.conflicts()).containsExactly("Assets/Game");
    }

    @Test
    void build_filterExcludesUnregisteredModules() {
        OwnershipMap map = OwnershipMap.build(modules,
                List.of(new ReferenceExtensionRecord("Assets/Misc", "Core")),
                "Game"::equals);

        assertThat(map.roots()).containsOnlyKeys("Assets/Game");
    }
}
