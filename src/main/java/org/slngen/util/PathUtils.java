package org.slngen.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers for the project-relative, {@code /}-separated path strings used throughout the generator.
 * <p>
 * The empty string denotes the project root itself.
 */
public final class PathUtils {

    private PathUtils() {
    }

    /**
     * Returns the parent of a relative path, or the empty string for a top-level entry.
     *
     * @param path a relative path such as {@code Assets/Game/Foo.cs}.
     * @return the parent path, e.g. {@code Assets/Game}.
     */
    public static String parentDirectory(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    /**
     * Returns the last component of a relative path.
     */
    public static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    /**
     * Number of components in a relative path; the root has depth 0.
     */
    public static int depth(String path) {
        if (path.isEmpty()) {
            return 0;
        }
        int count = 1;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == '/') {
                count++;
            }
        }
        return count;
    }

    /**
     * Splits a relative path into its components. The root yields an empty list.
     */
    public static List<String> components(String path) {
        List<String> parts = new ArrayList<>();
        if (path.isEmpty()) {
            return parts;
        }
        for (String part : path.split("/")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts;
    }

    /**
     * Tests whether {@code child} lies at or below {@code ancestor}. Every path descends from the root.
     */
    public static boolean isDescendantOrSame(String child, String ancestor) {
        return ancestor.isEmpty() || child.equals(ancestor) || child.startsWith(ancestor + "/");
    }

    /**
     * Joins two relative path fragments, treating the empty string as the root.
     */
    public static String join(String base, String child) {
        if (base.isEmpty()) {
            return child;
        }
        if (child.isEmpty()) {
            return base;
        }
        return base + "/" + child;
    }

    /**
     * Removes repeated values while keeping the position of each first occurrence.
     */
    public static List<String> deduplicatePreservingOrder(Collection<String> values) {
        Set<String> seen = new LinkedHashSet<>(values);
        return new ArrayList<>(seen);
    }
}
