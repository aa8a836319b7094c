package org.slngen.scanner;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of one filesystem scan. All paths are relative to {@link #realRoot()} and use {@code /} separators.
 *
 * @param realRoot               The symlink-resolved project root the paths are relative to.
 * @param sourceFilesByDirectory Source file names keyed by the directory that directly contains them, sorted by directory.
 * @param declarationPaths       Module declaration files, sorted.
 * @param referencePaths         Reference extension files, sorted.
 * @param ignoredDirectories     Pruned {@code ~}-suffixed or {@code .}-prefixed directories, sorted.
 */
public record ScanSnapshot(
        Path realRoot,
        Map<String, List<String>> sourceFilesByDirectory,
        List<String> declarationPaths,
        List<String> referencePaths,
        List<String> ignoredDirectories
) {

    /**
     * Directories that directly contain at least one source file.
     */
    public Set<String> sourceDirectories() {
        return sourceFilesByDirectory.keySet();
    }

    public int sourceFileCount(String directory) {
        List<String> files = sourceFilesByDirectory.get(directory);
        return files == null ? 0 : files.size();
    }
}
