package org.slngen.variant;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slngen.util.XmlText;

/**
 * Textual rewrites applied to a descriptor when deriving a variant.
 */
public final class DefineRewriter {

    private static final Pattern EDITOR_DEFINES = Pattern.compile("(?<![A-Za-z0-9_])UNITY_EDITOR(?:_64|_OSX)?;");
    private static final Pattern DEBUG_DEFINES = Pattern.compile("(?<![A-Za-z0-9_])(?:DEBUG|TRACE);");
    private static final Pattern REFERENCE_TARGET = Pattern.compile("(<ProjectReference Include=\")([^\"]+)(\\.csproj\">)");

    private static final String IPHONE_DEFINE = "UNITY_IPHONE;";

    private DefineRewriter() {
    }

    /**
     * Removes {@code UNITY_EDITOR}, {@code UNITY_EDITOR_64} and {@code UNITY_EDITOR_OSX}.
     */
    public static String stripEditorDefines(String content) {
        return EDITOR_DEFINES.matcher(content).replaceAll("");
    }

    /**
     * Removes {@code DEBUG} and {@code TRACE}.
     */
    public static String stripDebugDefines(String content) {
        return DEBUG_DEFINES.matcher(content).replaceAll("");
    }

    /**
     * Replaces the other platform's define with the target's. For Android the legacy iPhone alias is dropped first.
     */
    public static String swapPlatformDefines(String content, BuildPlatform platform) {
        return switch (platform) {
            case IOS -> content.replace(BuildPlatform.ANDROID.define() + ";", BuildPlatform.IOS.define() + ";");
            case ANDROID -> content
                    .replace(IPHONE_DEFINE, "")
                    .replace(BuildPlatform.IOS.define() + ";", BuildPlatform.ANDROID.define() + ";");
        };
    }

    /**
     * Removes whole {@code <ProjectReference>} blocks whose include target is one of {@code descriptorPaths}.
     */
    public static String stripReferences(String content, Collection<String> descriptorPaths) {
        if (descriptorPaths.isEmpty()) {
            return content;
        }
        String alternation = descriptorPaths.stream()
                .sorted()
                .map(XmlText::escape)
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        Pattern block = Pattern.compile(
                "[ \\t]*<ProjectReference Include=\"(?:" + alternation + ")\">.*?</ProjectReference>[ \\t]*(?:\\r?\\n)?",
                Pattern.DOTALL);
        return block.matcher(content).replaceAll("");
    }

    /**
     * Points every remaining {@code <ProjectReference>} at the suffixed variant descriptor.
     */
    public static String rewriteReferenceSuffix(String content, String suffix) {
        return REFERENCE_TARGET.matcher(content)
                .replaceAll("$1$2" + Matcher.quoteReplacement(suffix) + "$3");
    }

    /**
     * Defines a variant adds on top of the descriptor's own set.
     */
    public static List<String> variantDefines(BuildPlatform platform, BuildConfiguration configuration, boolean debug) {
        List<String> defines = new ArrayList<>();
        defines.add(platform.define());
        if (configuration.keepsEditorDefines()) {
            defines.add("UNITY_EDITOR");
        }
        if (debug || configuration.keepsDebugDefines()) {
            defines.add("DEBUG");
            defines.add("TRACE");
        }
        return defines;
    }
}
