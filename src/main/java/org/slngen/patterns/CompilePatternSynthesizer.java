package org.slngen.patterns;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

import org.slngen.util.PathUtils;

/**
 * Turns a project's owned directories into compile globs.
 * <p>
 * Flat mode emits one single-directory glob per owned source directory. Recursive mode collapses the
 * ownership roots to those not already covered by another own root and emits one recursive glob per
 * root, excluding the roots of other modules and ignored directories nested below it. An own root
 * sitting below a foreign root is not covered by the outer own root, since the foreign exclude would
 * hide it. Recursive globs also exclude dot-prefixed source files, which the scanner never reports,
 * so both modes compile the same set. Output is sorted by include glob.
 */
public final class CompilePatternSynthesizer {

    private final String sourceSuffix;

    /**
     * @param sourceSuffix the source file suffix, e.g. {@code .cs}.
     */
    public CompilePatternSynthesizer(String sourceSuffix) {
        this.sourceSuffix = sourceSuffix;
    }

    /**
     * One {@code dir/*.cs} per directory.
     */
    public List<CompilePattern> flat(Collection<String> directories) {
        List<CompilePattern> patterns = new ArrayList<>();
        for (String directory : new TreeSet<>(directories)) {
            patterns.add(CompilePattern.of(flatGlob(directory)));
        }
        patterns.sort(Comparator.comparing(CompilePattern::include));
        return patterns;
    }

    /**
     * One {@code root/**&#47;*.cs} per covering ownership root with nested foreign, ignored and hidden-file excludes.
     *
     * @param ownRoots           ownership roots of the project.
     * @param foreignRoots       ownership roots of every other module.
     * @param ignoredDirectories directories pruned by the scanner.
     */
    public List<CompilePattern> recursive(Collection<String> ownRoots,
                                          Collection<String> foreignRoots,
                                          Collection<String> ignoredDirectories) {
        List<String> sortedForeign = new ArrayList<>(new TreeSet<>(foreignRoots));
        List<CompilePattern> patterns = new ArrayList<>();

        for (String root : coveringRoots(ownRoots, sortedForeign)) {
            List<String> excludes = new ArrayList<>();
            for (String foreign : sortedForeign) {
                if (PathUtils.isDescendantOrSame(foreign, root)) {
                    excludes.add(recursiveGlob(foreign));
                }
            }
            for (String ignored : ignoredDirectories) {
                if (PathUtils.isDescendantOrSame(ignored, root)) {
                    excludes.add(recursiveGlob(ignored));
                }
            }
            excludes.add(hiddenGlob(root));
            patterns.add(new CompilePattern(recursiveGlob(root), PathUtils.deduplicatePreservingOrder(excludes)));
        }

        patterns.sort(Comparator.comparing(CompilePattern::include));
        return patterns;
    }

    /**
     * Drops every own root whose recursive glob would already be matched by another own root's glob,
     * returning the rest sorted. A root is covered by its nearest own ancestor unless a foreign root
     * lies between them.
     */
    static List<String> coveringRoots(Collection<String> ownRoots, Collection<String> foreignRoots) {
        List<String> byDepth = new ArrayList<>(new TreeSet<>(ownRoots));
        byDepth.sort(Comparator.comparingInt(PathUtils::depth).thenComparing(Comparator.naturalOrder()));

        List<String> result = new ArrayList<>();
        for (String root : byDepth) {
            String nearestOwn = null;
            for (String kept : result) {
                if (PathUtils.isDescendantOrSame(root, kept)
                        && (nearestOwn == null || PathUtils.depth(kept) > PathUtils.depth(nearestOwn))) {
                    nearestOwn = kept;
                }
            }
            if (nearestOwn == null || isSeparatedByForeignRoot(root, nearestOwn, foreignRoots)) {
                result.add(root);
            }
        }
        result.sort(null);
        return result;
    }

    private static boolean isSeparatedByForeignRoot(String root, String ownAncestor, Collection<String> foreignRoots) {
        for (String foreign : foreignRoots) {
            if (!foreign.equals(ownAncestor)
                    && PathUtils.isDescendantOrSame(foreign, ownAncestor)
                    && PathUtils.isDescendantOrSame(root, foreign)) {
                return true;
            }
        }
        return false;
    }

    String flatGlob(String directory) {
        return directory.isEmpty() ? "*" + sourceSuffix : directory + "/*" + sourceSuffix;
    }

    String recursiveGlob(String directory) {
        return directory.isEmpty() ? "**/*" + sourceSuffix : directory + "/**/*" + sourceSuffix;
    }

    String hiddenGlob(String directory) {
        return directory.isEmpty() ? "**/.*" + sourceSuffix : directory + "/**/.*" + sourceSuffix;
    }
}
