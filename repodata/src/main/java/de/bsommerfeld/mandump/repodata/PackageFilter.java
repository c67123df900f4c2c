package de.bsommerfeld.mandump.repodata;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Predicate;

/**
 * Selects packages matching a predicate, splitting large catalogs across an executor.
 *
 * <p>Catalogs below {@link #MIN_SPLIT_SIZE} packages are filtered on the calling thread.
 * Larger ones are cut into chunks of {@link #SPLIT_SIZE}; each chunk marks its matches in
 * a bit set of catalog positions, the sets are unioned, and the result is emitted by
 * ascending position. The output order is therefore always the input order, however the
 * chunks are scheduled.
 *
 * <p>Predicates must not modify the packages they inspect and must be safe to call from
 * several threads.
 */
public final class PackageFilter {

    static final int MIN_SPLIT_SIZE = 3000;
    static final int SPLIT_SIZE = 2000;

    private final Executor executor;

    public PackageFilter(Executor executor) {
        this.executor = executor;
    }

    /**
     * Returns the elements of {@code packages} matching {@code filter}, in their original
     * order.
     */
    public <T> List<T> filter(List<T> packages, Predicate<? super T> filter) {
        if (packages.size() < MIN_SPLIT_SIZE) {
            return sequentialFilter(packages, filter);
        }
        return splitFilter(packages, filter);
    }

    private static <T> List<T> sequentialFilter(List<T> packages, Predicate<? super T> filter) {
        List<T> matched = new ArrayList<>();
        for (T p : packages) {
            if (filter.test(p)) {
                matched.add(p);
            }
        }
        return matched;
    }

    private <T> List<T> splitFilter(List<T> packages, Predicate<? super T> filter) {
        List<CompletableFuture<BitSet>> chunks = new ArrayList<>();
        for (int start = 0; start < packages.size(); start += SPLIT_SIZE) {
            int from = start;
            int to = Math.min(start + SPLIT_SIZE, packages.size());
            chunks.add(CompletableFuture.supplyAsync(() -> {
                BitSet matches = new BitSet(to);
                for (int i = from; i < to; i++) {
                    if (filter.test(packages.get(i))) {
                        matches.set(i);
                    }
                }
                return matches;
            }, executor));
        }

        BitSet union = new BitSet(packages.size());
        try {
            for (CompletableFuture<BitSet> chunk : chunks) {
                union.or(chunk.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }

        List<T> matched = new ArrayList<>(union.cardinality());
        for (int i = union.nextSetBit(0); i >= 0; i = union.nextSetBit(i + 1)) {
            matched.add(packages.get(i));
        }
        return matched;
    }
}
