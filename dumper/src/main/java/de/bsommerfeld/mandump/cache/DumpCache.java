package de.bsommerfeld.mandump.cache;

import de.bsommerfeld.mandump.extract.ExtractionResult;
import de.bsommerfeld.mandump.extract.ExtractionResult.Outcome;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Tracks which output files belong to which package archive across runs.
 *
 * <p>Two maps are kept, both keyed by archive SHA-256:
 * <ul>
 * <li><strong>prior</strong>: loaded from the previous run's cache, never modified</li>
 * <li><strong>pending</strong>: built during this run from {@link ExtractionResult}s</li>
 * </ul>
 * A package that was processed but produced nothing is recorded with an explicit empty
 * list, so "ran, found nothing" and "not run" stay distinguishable in the persisted cache.
 *
 * <h3>Threading</h3>
 * {@link #record} may be called from any number of workers; it holds a single lock only
 * for the map update. {@link #reconcile} must run after all workers have finished.
 */
public final class DumpCache {

    private final Map<String, List<String>> prior;

    private final Object lock = new Object();
    private final Map<String, Set<String>> pending = new TreeMap<>();

    public DumpCache(Map<String, List<String>> prior) {
        this.prior = Map.copyOf(prior);
    }

    public static DumpCache from(CacheRecords records) {
        return new DumpCache(records.cache());
    }

    /**
     * Returns the paths recorded for {@code sha256} by the previous run.
     */
    public Optional<List<String>> prior(String sha256) {
        return Optional.ofNullable(sha256 == null ? null : prior.get(sha256));
    }

    public boolean isCached(String sha256) {
        return sha256 != null && prior.containsKey(sha256);
    }

    /**
     * Records a worker result. Skipped packages are only recorded when the previous run
     * knew their archive, which keeps their earlier output alive.
     */
    public void record(ExtractionResult result) {
        if (result.outcome() == Outcome.SKIPPED && !isCached(result.sha256())) {
            return;
        }
        recordChange(result.sha256(), result.paths());
    }

    void recordChange(String sha256, List<String> paths) {
        synchronized (lock) {
            Set<String> recorded = pending.get(sha256);
            if (recorded == null) {
                recorded = new LinkedHashSet<>();
                pending.put(sha256, recorded);
            }
            recorded.addAll(paths);
        }
    }

    /**
     * Finishes the run: unless {@code removeOldFiles} is set, entries of the previous run
     * that no worker touched are carried forward unchanged. Returns every path referenced
     * by the previous run but not by the final pending cache.
     */
    public Set<String> reconcile(boolean removeOldFiles) {
        synchronized (lock) {
            if (!removeOldFiles) {
                for (Map.Entry<String, List<String>> e : prior.entrySet()) {
                    pending.computeIfAbsent(e.getKey(), k -> new LinkedHashSet<>(e.getValue()));
                }
            }

            Set<String> stale = new HashSet<>();
            for (List<String> files : prior.values()) {
                stale.addAll(files);
            }
            for (Set<String> files : pending.values()) {
                stale.removeAll(files);
            }
            return stale;
        }
    }

    /**
     * Returns a snapshot of the pending cache, ordered by key.
     */
    public Map<String, List<String>> pending() {
        synchronized (lock) {
            Map<String, List<String>> snapshot = new TreeMap<>();
            for (Map.Entry<String, Set<String>> e : pending.entrySet()) {
                snapshot.put(e.getKey(), new ArrayList<>(e.getValue()));
            }
            return snapshot;
        }
    }

    /**
     * Returns the pending cache in its persisted form.
     */
    public CacheRecords toRecords() {
        return new CacheRecords(CacheRecords.CURRENT_VERSION, pending());
    }
}
