package org.slngen.scanner;

/**
 * Classification of a single directory entry during the scan.
 */
enum EntryKind {
    DIRECTORY,
    /** A directory named {@code .*} or {@code *~}; its subtree is never entered. */
    IGNORED_DIRECTORY,
    FILE,
    SKIPPED
}
