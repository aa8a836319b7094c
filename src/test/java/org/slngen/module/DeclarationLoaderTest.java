package org.slngen.module;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slngen.testutil.ProjectTree;

@Tag("unit")
class DeclarationLoaderTest {

    @TempDir
    Path tempDir;

    private ProjectTree tree;
    private DeclarationLoader loader;

    @BeforeEach
    void setUp() {
        tree = new ProjectTree(tempDir);
        loader = new DeclarationLoader(tempDir);
    }

    @Test
    void loadDeclaration_readsNameReferencesAndDirectory() throws IOException {
        tree.declaration("Assets/Game", "Game", "Core", "GUID:0123456789abcdef0123456789abcdef");

        ModuleRecord record = loader.loadDeclaration("Assets/Game/Game.asmdef").orElseThrow();

        assertThat(record.name()).isEqualTo("Game");
        assertThat(record.directory()).isEqualTo("Assets/Game");
        assertThat(record.declarationPath()).isEqualTo("Assets/Game/Game.asmdef");
        assertThat(record.references()).containsExactly("Core", "GUID:0123456789abcdef0123456789abcdef");
        assertThat(record.category()).isEqualTo(ModuleCategory.RUNTIME);
        assertThat(record.guid()).isNull();
    }

    @Test
    void loadDeclaration_readsGuidFromMetaFileInLowercase() throws IOException {
        tree.declarationWithGuid("Assets/Core", "Core", "AABBCCDDEEFF00112233445566778899");

        ModuleRecord record = loader.loadDeclaration("Assets/Core/Core.asmdef").orElseThrow();

        assertThat(record.guid()).isEqualTo("aabbccddeeff00112233445566778899");
    }

    @Test
    void loadDeclaration_infersCategoryAndPlatforms() throws IOException {
        tree.file("Assets/Tools/Editor/Tools.asmdef",
                "{ \"name\": \"Tools\", \"includePlatforms\": [\"Editor\"] }");
        tree.file("Assets/Tests/Tests.asmdef",
                "{ \"name\": \"Tests\", \"defineConstraints\": [\"UNITY_INCLUDE_TESTS\"], \"includePlatforms\": [\"Editor\"] }");
        tree.file("Assets/Mobile/Mobile.asmdef",
                "{ \"name\": \"Mobile\", \"excludePlatforms\": [\"Android\"] }");

        ModuleRecord tools = loader.loadDeclaration("Assets/Tools/Editor/Tools.asmdef").orElseThrow();
        ModuleRecord tests = loader.loadDeclaration("Assets/Tests/Tests.asmdef").orElseThrow();
        ModuleRecord mobile = loader.loadDeclaration("Assets/Mobile/Mobile.asmdef").orElseThrow();

        assertThat(tools.category()).isEqualTo(ModuleCategory.EDITOR);
        assertThat(tests.category()).isEqualTo(ModuleCategory.TEST);
        assertThat(mobile.category()).isEqualTo(ModuleCategory.RUNTIME);
        assertThat(mobile.admitsPlatform("iOS")).isTrue();
        assertThat(mobile.admitsPlatform("Android")).isFalse();
    }

    @Test
    void loadDeclaration_skipsMalformedOrNamelessFiles() throws IOException {
        tree.file("Assets/Broken/Broken.asmdef", "{ this is not json");
        tree.file("Assets/Nameless/Nameless.asmdef", "{ \"references\": [] }");
        tree.file("Assets/Empty/Empty.asmdef", "");

        assertThat(loader.loadDeclaration("Assets/Broken/Broken.asmdef")).isEmpty();
        assertThat(loader.loadDeclaration("Assets/Nameless/Nameless.asmdef")).isEmpty();
        assertThat(loader.loadDeclaration("Assets/Empty/Empty.asmdef")).isEmpty();
    }

    @Test
    void loadReferenceExtensions_keepsOnlyUsableRecords() throws IOException {
        tree.referenceExtension("Assets/Game/Extra", "Extra", "Game");
        tree.file("Assets/Other/Other.asmref", "{ }");

        List<ReferenceExtensionRecord> records = loader.loadReferenceExtensions(
                List.of("Assets/Game/Extra/Extra.asmref", "Assets/Other/Other.asmref"));

        assertThat(records).containsExactly(new ReferenceExtensionRecord("Assets/Game/Extra", "Game"));
    }

    @Test
    void loadMetaGuid_emptyWithoutMetaFile() throws IOException {
        tree.declaration("Assets/Game", "Game");

        Optional<String> guid = DeclarationLoader.loadMetaGuid(tempDir.resolve("Assets/Game/Game.asmdef"));

        assertThat(guid).isEmpty();
    }
}
