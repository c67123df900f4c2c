package de.bsommerfeld.mandump.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Deletes output files that the current run no longer produces.
 *
 * <p>Paths come from a cache file, which may have been edited by hand. Absolute paths and
 * paths with a {@code ..} segment are never deleted, so a crafted cache cannot reach
 * outside the output root. Deletion is best effort: failures are logged and the next path
 * is tried.
 */
public final class StaleFileRemover {

    private static final Logger LOG = LoggerFactory.getLogger(StaleFileRemover.class);

    private final Path outputRoot;

    public StaleFileRemover(Path outputRoot) {
        this.outputRoot = outputRoot.toAbsolutePath().normalize();
    }

    /**
     * Removes every safe path in {@code stale} and returns the number of files deleted.
     * Directories left empty are removed as well, but never the output root.
     */
    public int remove(Collection<String> stale) {
        int removed = 0;
        // Sorted so that logs and directory pruning are reproducible
        List<String> ordered = stale.stream().sorted().collect(Collectors.toList());
        for (String relative : ordered) {
            try (MDC.MDCCloseable ignored = MDC.putCloseable("file", relative)) {
                if (!isSafe(relative)) {
                    LOG.debug("Skipping removal of unsafe file path");
                    continue;
                }
                if (removeFile(outputRoot.resolve(relative))) {
                    removed++;
                }
            }
        }
        return removed;
    }

    private boolean removeFile(Path file) {
        LOG.debug("Removing unused file");
        try {
            Files.delete(file);
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            LOG.error("Error removing old file", e);
            return false;
        }

        // Walk up and remove empty directories, but never the output root
        Path parent = file.getParent();
        while (parent != null && !parent.equals(outputRoot) && parent.startsWith(outputRoot)
                && isEmptyDirectory(parent)) {
            try {
                Files.delete(parent);
            } catch (IOException e) {
                LOG.debug("Unable to remove empty directory {}", parent, e);
                break;
            }
            parent = parent.getParent();
        }
        return true;
    }

    /**
     * Returns whether {@code relative} stays inside the output root: it must not be absolute
     * and must not contain a {@code ..} segment.
     */
    static boolean isSafe(String relative) {
        if (relative.isEmpty() || relative.startsWith("/") || relative.startsWith("\\")) {
            return false;
        }
        Path path;
        try {
            path = Paths.get(relative);
        } catch (InvalidPathException e) {
            return false;
        }
        if (path.isAbsolute()) {
            return false;
        }
        for (String segment : relative.replace('\\', '/').split("/")) {
            if (segment.equals("..")) {
                return false;
            }
        }
        return true;
    }

    private static boolean isEmptyDirectory(Path dir) {
        if (!Files.isDirectory(dir)) return false;
        try (var entries = Files.list(dir)) {
            return entries.findFirst().isEmpty();
        } catch (IOException e) {
            return false;
        }
    }
}
