package org.slngen.manifest;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slngen.generator.GeneratorException;

/**
 * Reads the project list of an existing solution file.
 * <p>
 * Only lines of the form {@code Project("{type}") = "Name", "Name.csproj", "{id}"} are considered, and only
 * descriptors sitting directly in the project root are returned.
 */
public final class SolutionFileParser {

    private static final String SOLUTION_SUFFIX = ".sln";
    private static final String DESCRIPTOR_SUFFIX = ".csproj";
    private static final String PROJECT_PREFIX = "Project(\"";

    private SolutionFileParser() {
    }

    /**
     * Finds the solution file in {@code projectRoot}, picking the alphabetically first one if there are several.
     *
     * @throws GeneratorException if the directory holds no visible solution file.
     * @throws IOException        if the directory cannot be listed.
     */
    public static Path findSolutionFile(Path projectRoot) throws IOException {
        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(projectRoot, "*" + SOLUTION_SUFFIX)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (!name.startsWith(".") && Files.isRegularFile(entry)) {
                    candidates.add(entry);
                }
            }
        }
        if (candidates.isEmpty()) {
            throw new GeneratorException("No solution file found in " + projectRoot);
        }
        candidates.sort(null);
        return candidates.get(0);
    }

    public static List<SolutionProjectEntry> parseProjects(String content) {
        List<SolutionProjectEntry> entries = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (!line.startsWith(PROJECT_PREFIX)) {
                continue;
            }
            List<String> quoted = quotedValues(line);
            if (quoted.size() < 4) {
                continue;
            }
            String csprojPath = quoted.get(2);
            if (!csprojPath.endsWith(DESCRIPTOR_SUFFIX) || csprojPath.contains("/") || csprojPath.contains("\\")) {
                continue;
            }
            entries.add(new SolutionProjectEntry(quoted.get(0), quoted.get(1), csprojPath, quoted.get(3)));
        }
        return entries;
    }

    private static List<String> quotedValues(String line) {
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                if (inQuote) {
                    values.add(current.toString());
                    current.setLength(0);
                }
                inQuote = !inQuote;
            } else if (inQuote) {
                current.append(ch);
            }
        }
        return values;
    }
}
