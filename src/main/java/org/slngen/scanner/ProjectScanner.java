package org.slngen.scanner;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the configured scan roots of a project and classifies every visible file.
 * <p>
 * The immediate children of each scan root are listed on the calling thread. Every child directory
 * is then walked by its own task on a fixed-size pool, each task filling a private {@link ScanBucket}.
 * The buckets are merged on the calling thread once all tasks have finished, so no collection is
 * ever written concurrently.
 * <p>
 * Entries whose name starts with {@code .} or ends with {@code ~} are skipped; such directories are
 * pruned and reported in {@link ScanSnapshot#ignoredDirectories()}. Directories that cannot be read
 * contribute nothing.
 */
public final class ProjectScanner {

    private static final Logger log = LoggerFactory.getLogger(ProjectScanner.class);

    private final String sourceSuffix;
    private final String declarationSuffix;
    private final String referenceSuffix;
    private final int threads;

    /**
     * @param sourceSuffix      suffix of compilable source files, e.g. {@code .cs}.
     * @param declarationSuffix suffix of module declaration files, e.g. {@code .asmdef}.
     * @param referenceSuffix   suffix of reference extension files, e.g. {@code .asmref}.
     * @param threads           worker count for the subtree walk; values below 1 use the available processors.
     */
    public ProjectScanner(String sourceSuffix, String declarationSuffix, String referenceSuffix, int threads) {
        this.sourceSuffix = sourceSuffix;
        this.declarationSuffix = declarationSuffix;
        this.referenceSuffix = referenceSuffix;
        this.threads = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    /**
     * Scans {@code scanRoots} below {@code projectRoot}.
     *
     * @param projectRoot the project root; resolved to its real path before scanning.
     * @param scanRoots   root-relative directories to scan, e.g. {@code Assets} and {@code Packages}.
     * @return the merged, sorted scan result.
     * @throws IOException if the scan is interrupted.
     */
    public ScanSnapshot scan(Path projectRoot, List<String> scanRoots) throws IOException {
        Path realRoot = resolveRealRoot(projectRoot);

        ScanBucket rootBucket = new ScanBucket();
        List<Path> walkTargets = new ArrayList<>();

        for (String scanRoot : scanRoots) {
            Path rootDir = realRoot.resolve(scanRoot);
            if (!Files.isDirectory(rootDir)) {
                log.debug("Scan root {} does not exist, skipping", rootDir);
                continue;
            }
            try (DirectoryStream<Path> children = Files.newDirectoryStream(rootDir)) {
                for (Path child : children) {
                    EntryKind kind = classify(child);
                    switch (kind) {
                        case DIRECTORY -> walkTargets.add(child);
                        case IGNORED_DIRECTORY -> rootBucket.ignoredDirectories.add(relativize(realRoot, child));
                        case FILE -> collectFile(realRoot, child, rootBucket);
                        default -> {
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("Cannot list scan root {}: {}", rootDir, e.getMessage());
            }
        }

        List<ScanBucket> buckets = walkInParallel(realRoot, walkTargets);

        ScanBucket merged = new ScanBucket();
        rootBucket.mergeInto(merged);
        for (ScanBucket bucket : buckets) {
            bucket.mergeInto(merged);
        }

        Map<String, List<String>> sourceFiles = new TreeMap<>();
        for (Map.Entry<String, List<String>> entry : merged.sourceFiles.entrySet()) {
            List<String> files = new ArrayList<>(entry.getValue());
            files.sort(null);
            sourceFiles.put(entry.getKey(), List.copyOf(files));
        }

        log.debug("Scanned {} subtrees: {} source directories, {} declarations, {} reference extensions",
                walkTargets.size(), sourceFiles.size(), merged.declarationPaths.size(), merged.referencePaths.size());

        return new ScanSnapshot(
                realRoot,
                Collections.unmodifiableMap(sourceFiles),
                sorted(merged.declarationPaths),
                sorted(merged.referencePaths),
                sorted(merged.ignoredDirectories));
    }

    private List<ScanBucket> walkInParallel(Path realRoot, List<Path> targets) throws IOException {
        if (targets.isEmpty()) {
            return List.of();
        }

        List<Callable<ScanBucket>> tasks = new ArrayList<>(targets.size());
        for (Path target : targets) {
            tasks.add(() -> {
                ScanBucket bucket = new ScanBucket();
                walk(realRoot, target, bucket, new HashSet<>());
                return bucket;
            });
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, targets.size()), new ScanThreadFactory());
        try {
            List<Future<ScanBucket>> futures = executor.invokeAll(tasks);
            List<ScanBucket> buckets = new ArrayList<>(futures.size());
            for (Future<ScanBucket> future : futures) {
                buckets.add(future.get());
            }
            return buckets;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while scanning " + realRoot, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Scan worker failed", cause);
        } finally {
            executor.shutdown();
        }
    }

    private void walk(Path realRoot, Path directory, ScanBucket bucket, Set<Path> linkedDirectories) {
        try (DirectoryStream<Path> children = Files.newDirectoryStream(directory)) {
            for (Path child : children) {
                EntryKind kind = classify(child);
                switch (kind) {
                    case DIRECTORY -> {
                        if (enterOnce(child, linkedDirectories)) {
                            walk(realRoot, child, bucket, linkedDirectories);
                        }
                    }
                    case IGNORED_DIRECTORY -> bucket.ignoredDirectories.add(relativize(realRoot, child));
                    case FILE -> collectFile(realRoot, child, bucket);
                    default -> {
                    }
                }
            }
        } catch (IOException e) {
            log.debug("Skipping unreadable directory {}: {}", directory, e.getMessage());
        }
    }

    private void collectFile(Path realRoot, Path file, ScanBucket bucket) {
        String name = file.getFileName().toString();
        if (name.endsWith(sourceSuffix)) {
            bucket.addSourceFile(relativize(realRoot, file.getParent()), name);
        } else if (name.endsWith(declarationSuffix)) {
            bucket.declarationPaths.add(relativize(realRoot, file));
        } else if (name.endsWith(referenceSuffix)) {
            bucket.referencePaths.add(relativize(realRoot, file));
        }
    }

    /**
     * Symbolic links to directories are followed, but each link target is entered at most once per
     * worker so that cyclic links terminate.
     */
    private static boolean enterOnce(Path directory, Set<Path> linkedDirectories) {
        if (!Files.isSymbolicLink(directory)) {
            return true;
        }
        try {
            return linkedDirectories.add(directory.toRealPath());
        } catch (IOException e) {
            return false;
        }
    }

    static EntryKind classify(Path entry) {
        String name = entry.getFileName().toString();
        boolean hidden = name.startsWith(".") || name.endsWith("~");

        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            if (attributes.isSymbolicLink() || attributes.isOther()) {
                attributes = Files.readAttributes(entry, BasicFileAttributes.class);
            }
        } catch (IOException e) {
            return EntryKind.SKIPPED;
        }

        if (attributes.isDirectory()) {
            return hidden ? EntryKind.IGNORED_DIRECTORY : EntryKind.DIRECTORY;
        }
        if (attributes.isRegularFile() && !hidden) {
            return EntryKind.FILE;
        }
        return EntryKind.SKIPPED;
    }

    private static Path resolveRealRoot(Path projectRoot) {
        try {
            return projectRoot.toRealPath();
        } catch (IOException e) {
            log.debug("Cannot resolve real path of {}: {}", projectRoot, e.getMessage());
            return projectRoot.toAbsolutePath().normalize();
        }
    }

    private static String relativize(Path realRoot, Path path) {
        return realRoot.relativize(path).toString().replace('\\', '/');
    }

    private static List<String> sorted(List<String> values) {
        List<String> copy = new ArrayList<>(values);
        copy.sort(null);
        return List.copyOf(copy);
    }

    private static final class ScanThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "slngen-scan-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
