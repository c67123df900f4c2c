package de.bsommerfeld.mandump.extract;

import java.util.List;

/**
 * What a package worker produced for one archive.
 *
 * @param sha256  archive SHA-256, the cache key
 * @param paths   output paths relative to the output root, with {@code /} separators
 * @param outcome which branch of the worker produced the result
 */
public record ExtractionResult(String sha256, List<String> paths, Outcome outcome) {

    public enum Outcome {
        /** Files were extracted from the archive (possibly none). */
        EXTRACTED,
        /** The archive hash was cached; the recorded paths were reused. */
        CACHED,
        /** Debug or secondary-architecture package; never opened. */
        SKIPPED,
        /** The archive has no manifest or nothing under the target directory. */
        IRRELEVANT,
        /** The archive file does not exist. */
        MISSING
    }

    public ExtractionResult {
        paths = List.copyOf(paths);
    }

    public static ExtractionResult empty(String sha256, Outcome outcome) {
        return new ExtractionResult(sha256, List.of(), outcome);
    }
}
