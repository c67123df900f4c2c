package de.bsommerfeld.mandump.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Names;
import de.bsommerfeld.mandump.cache.CacheRecords;
import de.bsommerfeld.mandump.cache.DumpCache;
import de.bsommerfeld.mandump.cache.StaleFileRemover;
import de.bsommerfeld.mandump.concurrent.OpenFileBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Guice module for a single dump run.
 *
 * <p>Everything run-scoped (settings, previous cache, cache sink) is handed in by the
 * caller, so no component reads global state.
 */
public class DumperModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(DumperModule.class);

    private final DumpConfig config;
    private final CacheRecords prior;
    private final OutputStream cacheSink;

    public DumperModule(DumpConfig config, CacheRecords prior, OutputStream cacheSink) {
        this.config = config;
        this.prior = prior;
        this.cacheSink = cacheSink;
    }

    @Override
    protected void configure() {
        LOG.debug("Configuring dump: mode {}, limit {}, output {}",
                DirMode.format(config.dirMode()), config.openLimit(), config.outputRoot());

        bind(DumpConfig.class).toInstance(config);
        bind(DumpCache.class).toInstance(DumpCache.from(prior));
        bind(OutputStream.class).annotatedWith(Names.named("cacheSink")).toInstance(cacheSink);
    }

    @Provides
    @Singleton
    OpenFileBudget provideOpenFileBudget(DumpConfig config) {
        return new OpenFileBudget(config.openLimit());
    }

    @Provides
    @Singleton
    StaleFileRemover provideStaleFileRemover(DumpConfig config) {
        return new StaleFileRemover(config.outputRoot());
    }

    /**
     * Unbounded pool; concurrency of package workers is limited by {@link OpenFileBudget},
     * and repodata tasks are few.
     */
    @Provides
    @Singleton
    ExecutorService provideExecutor() {
        return Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("mandump-%d")
                .setDaemon(true)
                .build());
    }
}
