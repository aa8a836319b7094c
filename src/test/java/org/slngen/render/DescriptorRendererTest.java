package org.slngen.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slngen.generator.MissingTemplateException;
import org.slngen.module.ModuleCategory;
import org.slngen.patterns.CompilePattern;

@Tag("unit")
class DescriptorRendererTest {

    @TempDir
    Path tempDir;

    private static ProjectInfo project(String name) {
        return new ProjectInfo(name, name + ".csproj", "templates/" + name + ".csproj.template",
                ProjectIdentifiers.forName(name), ProjectKind.ASMDEF, ModuleCategory.RUNTIME, Set.of(), Set.of());
    }

    @Test
    void renderProject_fillsEveryPlaceholder() {
        DescriptorRenderer renderer = new DescriptorRenderer(Path.of("/work/MyGame"), "2022.3.10f1");
        ProjectInfo core = project("Core");
        String template = "<Root>{{PROJECT_ROOT}}</Root><V>{{UNITY_VER}}</V>\n{{SOURCE_FOLDERS}}\n{{PROJECT_REFERENCES}}";

        RenderedDescriptor rendered = renderer.renderProject(project("Game"), template,
                List.of(new CompilePattern("Assets/Game/**/*.cs", List.of("Assets/Game/Core/**/*.cs"))),
                List.of(core));

        assertThat(rendered.relativePath()).isEqualTo("Game.csproj");
        assertThat(rendered.content())
                .contains("<Root>" + Path.of("/work/MyGame") + "</Root>")
                .contains("<V>2022.3.10f1</V>")
                .contains("    <Compile Include=\"Assets/Game/**/*.cs\" Exclude=\"Assets/Game/Core/**/*.cs\" />")
                .contains("    <ProjectReference Include=\"Core.csproj\">\n"
                        + "      <Project>" + core.guid() + "</Project>\n"
                        + "      <Name>Core</Name>\n"
                        + "    </ProjectReference>")
                .doesNotContain("{{");
    }

    @Test
    void renderCompilePatterns_escapesAndJoinsExcludes() {
        String block = DescriptorRenderer.renderCompilePatterns(List.of(
                CompilePattern.of("Assets/R&D/*.cs"),
                new CompilePattern("Assets/Game/**/*.cs", List.of("Assets/Game/A/**/*.cs", "Assets/Game/B~/**/*.cs"))));

        assertThat(block).isEqualTo(
                "    <Compile Include=\"Assets/R&amp;D/*.cs\" />\n"
                        + "    <Compile Include=\"Assets/Game/**/*.cs\" Exclude=\"Assets/Game/A/**/*.cs;Assets/Game/B~/**/*.cs\" />");
    }

    @Test
    void renderSolution_listsEntriesAndDebugConfigurations() {
        DescriptorRenderer renderer = new DescriptorRenderer(tempDir, "");
        ProjectInfo game = project("Game");
        String typeGuid = "{FAE04EC0-301F-11D3-BF4B-00C04F79EFBC}";

        RenderedDescriptor rendered = renderer.renderSolution("MyGame.sln",
                "Header\n{{PROJECT_ENTRIES}}\nGlobal\n{{PROJECT_CONFIGS}}\nEndGlobal", typeGuid, List.of(game));

        assertThat(rendered.relativePath()).isEqualTo("MyGame.sln");
        assertThat(rendered.content()).isEqualTo("Header\n"
                + "Project(\"" + typeGuid + "\") = \"Game\", \"Game.csproj\", \"" + game.guid() + "\"\nEndProject\n"
                + "Global\n"
                + "\t\t" + game.guid() + ".Debug|Any CPU.ActiveCfg = Debug|Any CPU\n"
                + "\t\t" + game.guid() + ".Debug|Any CPU.Build.0 = Debug|Any CPU\n"
                + "EndGlobal");
    }

    @Test
    void loadTemplate_missingTemplateIsFatal() {
        DescriptorRenderer renderer = new DescriptorRenderer(tempDir, "");

        assertThatThrownBy(() -> renderer.loadTemplate("templates/Missing.csproj.template"))
                .isInstanceOf(MissingTemplateException.class)
                .hasMessageContaining("Missing.csproj.template");
    }
}
