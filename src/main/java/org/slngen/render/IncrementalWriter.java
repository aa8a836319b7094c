package org.slngen.render;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes files only when their content changes.
 * <p>
 * Leaving unchanged files untouched keeps their modification time stable, which both the external
 * build and the variant cache rely on.
 */
public final class IncrementalWriter {

    private static final Logger log = LoggerFactory.getLogger(IncrementalWriter.class);

    private int writes;

    /**
     * Writes {@code content} to {@code target} unless the file already holds exactly these bytes.
     *
     * @return {@code true} if the file was written.
     * @throws IOException if the file cannot be read or written.
     */
    public boolean writeIfChanged(Path target, String content) throws IOException {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        if (Files.isRegularFile(target) && Arrays.equals(Files.readAllBytes(target), bytes)) {
            log.debug("Unchanged: {}", target);
            return false;
        }

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        write(target, bytes);
        writes++;
        log.debug("Wrote {}", target);
        return true;
    }

    /**
     * Writes unconditionally, replacing the target atomically where the filesystem allows it.
     *
     * @throws IOException if the file cannot be written.
     */
    public void write(Path target, byte[] bytes) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path temp = absolute.resolveSibling(absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after write failure: {}", temp, cleanupEx);
            }
            throw e;
        }
    }

    /**
     * Number of files written by this instance.
     */
    public int writeCount() {
        return writes;
    }
}
