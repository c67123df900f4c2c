package de.bsommerfeld.mandump.cache;

import de.bsommerfeld.mandump.extract.ExtractionResult;
import de.bsommerfeld.mandump.extract.ExtractionResult.Outcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DumpCache: recording, carry-forward and stale-set computation.
 */
class DumpCacheTest {

    private static ExtractionResult extracted(String sha, String... paths) {
        return new ExtractionResult(sha, List.of(paths), Outcome.EXTRACTED);
    }

    // -- record --

    @Test
    void record_shouldKeepExplicitEmptyList() {
        DumpCache cache = new DumpCache(Map.of());

        cache.record(ExtractionResult.empty("a", Outcome.IRRELEVANT));
        cache.record(ExtractionResult.empty("b", Outcome.MISSING));

        assertEquals(Map.of("a", List.of(), "b", List.of()), cache.pending());
    }

    @Test
    void record_shouldAppendWithoutDuplicates() {
        DumpCache cache = new DumpCache(Map.of());

        cache.record(extracted("a", "man1/a.1"));
        cache.record(extracted("a", "man1/a.1", "man1/b.1"));

        assertEquals(List.of("man1/a.1", "man1/b.1"), cache.pending().get("a"));
    }

    @Test
    void record_shouldIgnoreUnknownSkippedPackages() {
        DumpCache cache = new DumpCache(Map.of());

        cache.record(ExtractionResult.empty("dbg", Outcome.SKIPPED));

        assertTrue(cache.pending().isEmpty());
    }

    @Test
    void record_shouldConfirmCachedSkippedPackages() {
        DumpCache cache = new DumpCache(Map.of("dbg", List.of("man1/x.1")));

        cache.record(new ExtractionResult("dbg", List.of("man1/x.1"), Outcome.SKIPPED));

        assertEquals(List.of("man1/x.1"), cache.pending().get("dbg"));
        assertTrue(cache.reconcile(true).isEmpty());
    }

    @Test
    void record_shouldBeSafeUnderConcurrentWriters() throws Exception {
        DumpCache cache = new DumpCache(Map.of());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 1000; i++) {
                String sha = "sha" + (i % 100);
                String path = "man1/p" + i + ".1";
                executor.submit(() -> cache.record(extracted(sha, path)));
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        }

        Map<String, List<String>> pending = cache.pending();
        assertEquals(100, pending.size());
        assertEquals(1000, pending.values().stream().mapToInt(List::size).sum());
    }

    // -- reconcile --

    @Test
    void reconcile_shouldDeleteFilesOfPackageThatLostItsPages() {
        DumpCache cache = new DumpCache(Map.of("hashA", List.of("man1/a.1")));
        cache.record(ExtractionResult.empty("hashA", Outcome.IRRELEVANT));

        Set<String> stale = cache.reconcile(true);

        assertEquals(Set.of("man1/a.1"), stale);
        assertEquals(Map.of("hashA", List.of()), cache.pending());
    }

    @Test
    void reconcile_shouldCarryForwardUntouchedEntries() {
        DumpCache cache = new DumpCache(Map.of(
                "old", List.of("man1/old.1"),
                "kept", List.of("man1/kept.1")));
        cache.record(new ExtractionResult("kept", List.of("man1/kept.1"), Outcome.CACHED));

        Set<String> stale = cache.reconcile(false);

        assertTrue(stale.isEmpty());
        assertEquals(List.of("man1/old.1"), cache.pending().get("old"));
    }

    @Test
    void reconcile_shouldPruneUntouchedEntriesWhenRemovingOldFiles() {
        DumpCache cache = new DumpCache(Map.of(
                "old", List.of("man1/old.1"),
                "kept", List.of("man1/kept.1")));
        cache.record(new ExtractionResult("kept", List.of("man1/kept.1"), Outcome.CACHED));

        Set<String> stale = cache.reconcile(true);

        assertEquals(Set.of("man1/old.1"), stale);
        assertFalse(cache.pending().containsKey("old"));
    }

    @Test
    void reconcile_shouldKeepPathsClaimedByAnotherPackage() {
        // A page moved from one package to its replacement
        DumpCache cache = new DumpCache(Map.of("v1", List.of("man1/tool.1")));
        cache.record(extracted("v2", "man1/tool.1"));

        assertTrue(cache.reconcile(true).isEmpty());
    }

    @Test
    void toRecords_shouldUseCurrentVersion() {
        DumpCache cache = new DumpCache(Map.of());
        cache.record(extracted("b", "man1/b.1"));
        cache.record(extracted("a", "man1/a.1"));

        CacheRecords records = cache.toRecords();

        assertEquals(CacheRecords.CURRENT_VERSION, records.version());
        assertEquals(List.of("a", "b"), List.copyOf(records.cache().keySet()));
    }
}
