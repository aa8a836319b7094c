package org.slngen.scanner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Private result buffer of a single scan worker. Never shared between threads until the merge.
 */
final class ScanBucket {

    final Map<String, List<String>> sourceFiles = new LinkedHashMap<>();
    final List<String> declarationPaths = new ArrayList<>();
    final List<String> referencePaths = new ArrayList<>();
    final List<String> ignoredDirectories = new ArrayList<>();

    void addSourceFile(String directory, String fileName) {
        sourceFiles.computeIfAbsent(directory, k -> new ArrayList<>()).add(fileName);
    }

    void mergeInto(ScanBucket target) {
        for (Map.Entry<String, List<String>> entry : sourceFiles.entrySet()) {
            target.sourceFiles.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).addAll(entry.getValue());
        }
        target.declarationPaths.addAll(declarationPaths);
        target.referencePaths.addAll(referencePaths);
        target.ignoredDirectories.addAll(ignoredDirectories);
    }
}
