package org.slngen.testutil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Builds small Unity-style project trees inside a test's temporary directory.
 */
public final class ProjectTree {

    public static final String PROJECT_TEMPLATE = String.join("\n",
            "<Project>",
            "  <PropertyGroup>",
            "    <Root>{{PROJECT_ROOT}}</Root>",
            "    <Unity>{{UNITY_VER}}</Unity>",
            "    <DefineConstants>UNITY_EDITOR;UNITY_ANDROID;DEBUG;TRACE;</DefineConstants>",
            "  </PropertyGroup>",
            "  <ItemGroup>",
            "{{SOURCE_FOLDERS}}",
            "  </ItemGroup>",
            "  <ItemGroup>",
            "{{PROJECT_REFERENCES}}",
            "  </ItemGroup>",
            "</Project>",
            "");

    public static final String SOLUTION_TEMPLATE = String.join("\n",
            "Microsoft Visual Studio Solution File, Format Version 11.00",
            "{{PROJECT_ENTRIES}}",
            "Global",
            "\tGlobalSection(ProjectConfigurationPlatforms) = postSolution",
            "{{PROJECT_CONFIGS}}",
            "\tEndGlobalSection",
            "EndGlobal",
            "");

    private final Path root;

    public ProjectTree(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    public ProjectTree file(String relativePath, String content) {
        Path file = root.resolve(relativePath);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public ProjectTree source(String relativePath) {
        return file(relativePath, "class " + Path.of(relativePath).getFileName().toString().replace(".cs", "") + " {}\n");
    }

    public ProjectTree declaration(String directory, String name, String... references) {
        String refs = Arrays.stream(references).map(r -> "\"" + r + "\"").collect(Collectors.joining(", "));
        return file(directory + "/" + name + ".asmdef", "{ \"name\": \"" + name + "\", \"references\": [" + refs + "] }");
    }

    public ProjectTree declarationWithGuid(String directory, String name, String guid, String... references) {
        declaration(directory, name, references);
        return file(directory + "/" + name + ".asmdef.meta", "fileFormatVersion: 2\nguid: " + guid + "\n");
    }

    public ProjectTree referenceExtension(String directory, String fileName, String reference) {
        return file(directory + "/" + fileName + ".asmref", "{ \"reference\": \"" + reference + "\" }");
    }

    public ProjectTree version(String version) {
        return file("ProjectSettings/ProjectVersion.txt",
                "m_EditorVersion: " + version + "\nm_EditorVersionWithRevision: " + version + " (abc)\n");
    }

    public ProjectTree projectTemplate(String templateRoot, String projectName) {
        return file(templateRoot + "/templates/" + projectName + ".csproj.template", PROJECT_TEMPLATE);
    }

    public ProjectTree solutionTemplate(String templateRoot, String solutionName) {
        return file(templateRoot + "/templates/" + solutionName + ".sln.template", SOLUTION_TEMPLATE);
    }

    public String read(String relativePath) {
        try {
            return Files.readString(root.resolve(relativePath), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public boolean exists(String relativePath) {
        return Files.exists(root.resolve(relativePath));
    }
}
