package org.slngen.variant;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slngen.module.ModuleCategory;
import org.slngen.render.DescriptorRenderer;
import org.slngen.render.IncrementalWriter;
import org.slngen.render.ProjectIdentifiers;
import org.slngen.render.ProjectInfo;
import org.slngen.render.ProjectKind;
import org.slngen.render.SolutionInfo;
import org.slngen.testutil.ProjectTree;

@Tag("integration")
class VariantManagerTest {

    private static final String TEMPLATE_ROOT = "Library/Gen";

    @TempDir
    Path tempDir;

    private ProjectTree tree;
    private VariantManager manager;
    private SolutionInfo solution;
    private List<ProjectInfo> projects;

    private static ProjectInfo project(String name, ModuleCategory category, Set<String> excluded) {
        return new ProjectInfo(name, name + ".csproj", TEMPLATE_ROOT + "/templates/" + name + ".csproj.template",
                ProjectIdentifiers.forName(name), ProjectKind.ASMDEF, category, Set.of(), excluded);
    }

    private static String descriptor(String... references) {
        StringBuilder sb = new StringBuilder("<Project>\n  <DefineConstants>UNITY_EDITOR;UNITY_ANDROID;DEBUG;TRACE;</DefineConstants>\n");
        for (String reference : references) {
            sb.append("    <ProjectReference Include=\"").append(reference).append(".csproj\">\n")
                    .append("      <Name>").append(reference).append("</Name>\n")
                    .append("    </ProjectReference>\n");
        }
        return sb.append("</Project>\n").toString();
    }

    @BeforeEach
    void setUp() {
        tree = new ProjectTree(tempDir)
                .solutionTemplate(TEMPLATE_ROOT, "MyGame")
                .file("Game.csproj", descriptor("Core", "Tools"))
                .file("Core.csproj", descriptor())
                .file("Tools.csproj", descriptor("Core"))
                .file("AndroidOnly.csproj", descriptor());
        manager = new VariantManager(tempDir, TEMPLATE_ROOT, new DescriptorRenderer(tempDir, ""), new IncrementalWriter());
        solution = new SolutionInfo("MyGame.sln", TEMPLATE_ROOT + "/templates/MyGame.sln.template", "{TYPE}");
        projects = List.of(
                project("AndroidOnly", ModuleCategory.RUNTIME, Set.of("iOS")),
                project("Core", ModuleCategory.RUNTIME, Set.of()),
                project("Game", ModuleCategory.RUNTIME, Set.of()),
                project("Tools", ModuleCategory.EDITOR, Set.of()));
    }

    @Test
    void prepare_prodKeepsRuntimeProjectsForPlatformAndRewritesThem() throws IOException {
        VariantResult result = manager.prepare(projects, solution, BuildPlatform.IOS, BuildConfiguration.PROD, false);

        assertThat(result.suffix()).isEqualTo(".v.ios-prod");
        assertThat(result.generated()).containsExactly("Core.v.ios-prod.csproj", "Game.v.ios-prod.csproj");
        assertThat(result.skipped()).isEmpty();
        assertThat(result.solutionPath()).isEqualTo("MyGame.v.ios-prod.sln");
        assertThat(result.propsPath()).isEqualTo(TEMPLATE_ROOT + "/ios-prod/Variant.props");

        String game = tree.read("Game.v.ios-prod.csproj");
        assertThat(game)
                .contains("<DefineConstants>UNITY_IOS;</DefineConstants>")
                .contains("<ProjectReference Include=\"Core.v.ios-prod.csproj\">")
                .doesNotContain("Tools");

        String sln = tree.read("MyGame.v.ios-prod.sln");
        assertThat(sln).contains("\"Core.v.ios-prod.csproj\"").contains("\"Game.v.ios-prod.csproj\"")
                .doesNotContain("Tools").doesNotContain("AndroidOnly");

        assertThat(tree.read(result.propsPath()))
                .contains("<SolutionGeneratorVariant>ios-prod</SolutionGeneratorVariant>")
                .contains("<VariantDefineConstants>UNITY_IOS</VariantDefineConstants>");
    }

    @Test
    void prepare_editorKeepsEverythingAndEditorDefines() throws IOException {
        VariantResult result = manager.prepare(projects, solution, BuildPlatform.ANDROID, BuildConfiguration.EDITOR, false);

        assertThat(result.generated()).hasSize(4);
        assertThat(tree.read("Tools.v.android-editor.csproj"))
                .contains("UNITY_EDITOR;UNITY_ANDROID;DEBUG;TRACE;");
    }

    @Test
    void prepare_debugFlagKeepsDebugDefinesInProd() throws IOException {
        VariantResult result = manager.prepare(projects, solution, BuildPlatform.ANDROID, BuildConfiguration.PROD, true);

        assertThat(result.suffix()).isEqualTo(".v.android-prod-debug");
        assertThat(result.propsPath()).isEqualTo(TEMPLATE_ROOT + "/android-prod-debug/Variant.props");
        assertThat(tree.read("Core.v.android-prod-debug.csproj"))
                .contains("<DefineConstants>UNITY_ANDROID;DEBUG;TRACE;</DefineConstants>");
    }

    @Test
    void prepare_togglingDebugNeverReusesCopiesOfTheOtherMode() throws IOException {
        manager.prepare(projects, solution, BuildPlatform.IOS, BuildConfiguration.PROD, false);

        VariantResult debug = manager.prepare(projects, solution, BuildPlatform.IOS, BuildConfiguration.PROD, true);

        assertThat(debug.skipped()).isEmpty();
        assertThat(debug.generated()).contains("Core.v.ios-prod-debug.csproj");
        assertThat(tree.read("Core.v.ios-prod-debug.csproj")).contains("DEBUG;TRACE;");
        assertThat(tree.read(debug.propsPath())).contains("<VariantDefineConstants>UNITY_IOS;DEBUG;TRACE</VariantDefineConstants>");
        assertThat(tree.read("Core.v.ios-prod.csproj")).doesNotContain("DEBUG");
    }

    @Test
    void variantName_addsDebugTailOnlyWhenDefinesDiffer() {
        assertThat(VariantManager.variantName(BuildPlatform.IOS, BuildConfiguration.PROD, false)).isEqualTo("ios-prod");
        assertThat(VariantManager.variantName(BuildPlatform.IOS, BuildConfiguration.PROD, true)).isEqualTo("ios-prod-debug");
        assertThat(VariantManager.variantName(BuildPlatform.IOS, BuildConfiguration.DEV, true)).isEqualTo("ios-dev");
        assertThat(VariantManager.variantName(BuildPlatform.ANDROID, BuildConfiguration.EDITOR, true)).isEqualTo("android-editor");
    }

    @Test
    void prepare_skipsUpToDateCopiesUntilSourceChanges() throws IOException {
        manager.prepare(projects, solution, BuildPlatform.IOS, BuildConfiguration.DEV, false);
        Path source = tempDir.resolve("Core.csproj");
        Path copy = tempDir.resolve("Core.v.ios-dev.csproj");
        Files.setLastModifiedTime(source, FileTime.fromMillis(1_000_000L));
        Files.setLastModifiedTime(copy, FileTime.fromMillis(2_000_000L));

        VariantResult cached = manager.prepare(projects, solution, BuildPlatform.IOS, BuildConfiguration.DEV, false);

        assertThat(cached.skipped()).contains("Core.v.ios-dev.csproj");

        Files.setLastModifiedTime(source, FileTime.fromMillis(3_000_000L));
        VariantResult refreshed = manager.prepare(projects, solution, BuildPlatform.IOS, BuildConfiguration.DEV, false);

        assertThat(refreshed.generated()).contains("Core.v.ios-dev.csproj");
        assertThat(refreshed.skipped()).doesNotContain("Core.v.ios-dev.csproj");
    }

    @Test
    void prepare_leavesOutProjectsWithoutBaseDescriptor() throws IOException {
        Files.delete(tempDir.resolve("Core.csproj"));

        VariantResult result = manager.prepare(projects, solution, BuildPlatform.IOS, BuildConfiguration.PROD, false);

        assertThat(result.generated()).containsExactly("Game.v.ios-prod.csproj");
        assertThat(tree.read("MyGame.v.ios-prod.sln")).doesNotContain("Core");
        assertThat(tree.read("Game.v.ios-prod.csproj")).doesNotContain("Core");
    }

    @Test
    void variantPath_insertsSuffixBeforeExtension() {
        assertThat(VariantManager.variantPath("Game.csproj", ".v.ios-dev")).isEqualTo("Game.v.ios-dev.csproj");
        assertThat(VariantManager.variantPath("Sub/My.Game.sln", ".v.ios-dev")).isEqualTo("Sub/My.Game.v.ios-dev.sln");
    }
}
