package de.bsommerfeld.mandump;

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.mandump.cache.CacheRecords;
import de.bsommerfeld.mandump.cache.CacheStore;
import de.bsommerfeld.mandump.cache.DumpCache;
import de.bsommerfeld.mandump.cache.StaleFileRemover;
import de.bsommerfeld.mandump.concurrent.Cancellation;
import de.bsommerfeld.mandump.concurrent.OpenFileBudget;
import de.bsommerfeld.mandump.concurrent.TaskGroup;
import de.bsommerfeld.mandump.config.DumpConfig;
import de.bsommerfeld.mandump.event.DumpEventBus;
import de.bsommerfeld.mandump.event.DumpSummary;
import de.bsommerfeld.mandump.extract.ExtractionResult;
import de.bsommerfeld.mandump.extract.PackageDumper;
import de.bsommerfeld.mandump.repodata.RepoData;
import de.bsommerfeld.mandump.repodata.RepoDataException;
import de.bsommerfeld.mandump.repodata.RepoPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs a complete dump: reads every repodata file, extracts all of their packages under the
 * open-file budget, then reconciles and persists the cache.
 *
 * <h3>Task layout</h3>
 * <pre>
 * run group
 *  ├─ repodata task (one per file, not budgeted)
 *  │   └─ package group
 *  │       ├─ package task (holds {@value OpenFileBudget#PACKAGE_WEIGHT} budget units)
 *  │       └─ ...
 *  └─ ...
 * </pre>
 * The first failure anywhere cancels the whole run. Budget waits and archive reads observe
 * the cancellation, and the failure is rethrown from {@link #run(List)}. In that case the
 * cache is neither reconciled nor written; files already extracted stay on disk.
 */
@Singleton
public class ManDumper {

    private static final Logger LOG = LoggerFactory.getLogger(ManDumper.class);

    private final DumpConfig config;
    private final DumpCache cache;
    private final PackageDumper dumper;
    private final OpenFileBudget budget;
    private final StaleFileRemover remover;
    private final CacheStore store;
    private final ExecutorService executor;
    private final DumpEventBus events;
    private final OutputStream cacheSink;

    @Inject
    public ManDumper(DumpConfig config, DumpCache cache, PackageDumper dumper, OpenFileBudget budget,
            StaleFileRemover remover, CacheStore store, ExecutorService executor, DumpEventBus events,
            @Named("cacheSink") OutputStream cacheSink) {
        this.config = config;
        this.cache = cache;
        this.dumper = dumper;
        this.budget = budget;
        this.remover = remover;
        this.store = store;
        this.executor = executor;
        this.events = events;
        this.cacheSink = cacheSink;
    }

    /**
     * Dumps all packages of {@code repodataFiles}, then reconciles and writes the cache.
     *
     * @return outcome counts of the run
     * @throws RepoDataException    if a repodata file is malformed
     * @throws DumpException        if a package cannot be extracted
     * @throws IOException          on filesystem errors or when the cache cannot be written
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public DumpSummary run(List<Path> repodataFiles)
            throws RepoDataException, DumpException, IOException, InterruptedException {
        DumpSummary summary = new DumpSummary();
        events.register(summary);
        Stopwatch timer = Stopwatch.createStarted();
        try {
            dumpAll(repodataFiles);
            finish();
        } finally {
            events.unregister(summary);
        }
        summary.log();
        LOG.info("Done (elapsed {})", timer);
        return summary;
    }

    /**
     * Processes all repodata files concurrently and waits for every package worker.
     */
    void dumpAll(List<Path> repodataFiles)
            throws RepoDataException, DumpException, IOException, InterruptedException {
        TaskGroup run = new TaskGroup(executor);
        for (Path file : repodataFiles) {
            run.submit(() -> processRepoData(file, run));
        }

        try {
            run.await();
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        }
    }

    private void processRepoData(Path file, TaskGroup run) throws Exception {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("repodata", file.toString())) {
            RepoData rd = readRepoData(file);
            if (rd == null) {
                return;
            }

            if (LOG.isDebugEnabled()) {
                List<RepoPackage> uncached = rd.filter(p -> !cache.isCached(p.filenameSha256()), executor);
                LOG.debug("{} of {} packages not in cache", uncached.size(), rd.size());
            }

            Path dir = file.toAbsolutePath().getParent();
            TaskGroup packages = run.child();
            try {
                for (RepoPackage pkg : rd.index()) {
                    Path archive = dir.resolve(pkg.archiveFileName());
                    budget.acquire(OpenFileBudget.PACKAGE_WEIGHT, packages);
                    submitPackage(packages, file, pkg, archive);
                }
            } catch (CancellationException e) {
                // Surfaces the package failure that cancelled the group, if any
                packages.await();
                throw e;
            }
            packages.await();
        }
    }

    private void submitPackage(TaskGroup packages, Path repodata, RepoPackage pkg, Path archive) {
        try {
            packages.submit(() -> {
                try (MDC.MDCCloseable ignored = MDC.putCloseable("repodata", repodata.toString())) {
                    processPackage(pkg, archive, packages);
                } finally {
                    budget.release(OpenFileBudget.PACKAGE_WEIGHT);
                }
            });
        } catch (CancellationException e) {
            budget.release(OpenFileBudget.PACKAGE_WEIGHT);
            throw e;
        }
    }

    private RepoData readRepoData(Path file) throws IOException, RepoDataException {
        LOG.info("Processing repodata");
        Stopwatch timer = Stopwatch.createStarted();
        try {
            RepoData rd = new RepoData();
            rd.loadRepo(file, null);
            LOG.debug("Read {} packages, etag {}", rd.size(), rd.etag());
            return rd;
        } catch (NoSuchFileException e) {
            LOG.warn("File does not exist");
            return null;
        } catch (IOException | RepoDataException e) {
            LOG.error("Unable to read repodata: {}", e.getMessage());
            throw e;
        } finally {
            LOG.info("Finished processing repodata (elapsed {})", timer);
        }
    }

    private void processPackage(RepoPackage pkg, Path archive, Cancellation cancellation)
            throws IOException, DumpException {
        ExtractionResult result = dumper.dump(pkg, archive, cancellation);
        cache.record(result);
        events.packageDumped(pkg.repository(), pkg.pkgver(), result);
    }

    /**
     * Reconciles the cache, removes stale files and persists the new cache.
     */
    void finish() throws IOException, DumpException {
        Set<String> stale = cache.reconcile(config.removeOldFiles());
        int removed = remover.remove(stale);
        LOG.debug("Removed {} of {} stale files", removed, stale.size());

        CacheRecords records = cache.toRecords();
        Path cacheFile = config.cacheFile();
        if (cacheFile != null) {
            store.save(records, cacheFile);
        } else {
            store.write(records, cacheSink);
        }
    }

    private static DumpException propagate(Throwable cause)
            throws RepoDataException, DumpException, IOException, InterruptedException {
        if (cause instanceof RepoDataException) throw (RepoDataException) cause;
        if (cause instanceof DumpException) throw (DumpException) cause;
        if (cause instanceof IOException) throw (IOException) cause;
        if (cause instanceof InterruptedException) throw (InterruptedException) cause;
        if (cause instanceof RuntimeException) throw (RuntimeException) cause;
        if (cause instanceof Error) throw (Error) cause;
        return new DumpException("Fatal error processing files: " + Strings.nullToEmpty(cause.getMessage()), cause);
    }
}
