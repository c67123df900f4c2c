package de.bsommerfeld.mandump.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.mandump.DumpException;
import de.bsommerfeld.mandump.ManDumper;
import de.bsommerfeld.mandump.cache.CacheRecords;
import de.bsommerfeld.mandump.cache.CacheStore;
import de.bsommerfeld.mandump.config.ConfigurationException;
import de.bsommerfeld.mandump.config.DirMode;
import de.bsommerfeld.mandump.config.DumpConfig;
import de.bsommerfeld.mandump.config.DumperModule;
import de.bsommerfeld.mandump.config.FileLimit;
import de.bsommerfeld.mandump.repodata.RepoDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/**
 * CLI command: mandump [options] REPODATA...
 *
 * <p>Extracts manual pages of every package listed in the given repodata files into the
 * output directory and prints or stores the updated cache.
 */
@Command(name = "mandump", mixinStandardHelpOptions = true, version = "mandump 1.0",
        description = "Extract manual pages from XBPS package archives")
public class MandumpCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(MandumpCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIG = 2;

    @Parameters(paramLabel = "REPODATA", arity = "0..*", description = "Repodata files to process")
    private List<Path> repodataFiles = new ArrayList<>();

    @Option(names = {"-c", "--cache"}, paramLabel = "FILE",
            description = "Cache file; the cache is written to stdout if unset")
    private Path cacheFile;

    @Option(names = {"-m", "--mode"}, paramLabel = "OCTAL",
            description = "Directory permissions (default: those of the working directory)")
    private String mode;

    @Option(names = {"-L", "--limit"}, paramLabel = "N", description = "Concurrent file limit")
    private Long limit;

    @Option(names = {"-b", "--remove-old"}, description = "Remove files of packages not seen in this run")
    private boolean removeOldFiles;

    @Option(names = {"-o", "--output"}, paramLabel = "DIR", description = "Output directory (default: .)")
    private Path output = Paths.get(".");

    @Option(names = {"-v", "--log-level"}, paramLabel = "LEVEL", defaultValue = "warn",
            description = "Log level: off, error, warn, info, debug, trace (default: ${DEFAULT-VALUE})")
    private String logLevel;

    private final OutputStream stdout;
    private final long fileCeiling;

    public MandumpCommand() {
        this(System.out, FileLimit.discover());
    }

    MandumpCommand(OutputStream stdout, long fileCeiling) {
        this.stdout = stdout;
        this.fileCeiling = fileCeiling;
    }

    @Override
    public Integer call() {
        try {
            LogLevels.apply(LogLevels.parse(logLevel));
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid log level: {}", logLevel);
            return EXIT_CONFIG;
        }

        DumpConfig config;
        CacheRecords prior;
        try {
            config = DumpConfig.of(
                    mode != null ? mode : DirMode.of(output),
                    limit != null ? limit : FileLimit.defaultBudget(fileCeiling),
                    fileCeiling, cacheFile, removeOldFiles, output);
            prior = new CacheStore().load(cacheFile);
        } catch (ConfigurationException e) {
            LOG.error(e.getMessage());
            return EXIT_CONFIG;
        }

        Injector injector = Guice.createInjector(new DumperModule(config, prior, stdout));
        try {
            injector.getInstance(ManDumper.class).run(repodataFiles);
            return EXIT_OK;
        } catch (RepoDataException | DumpException | IOException e) {
            LOG.error("Fatal error processing files: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Interrupted");
            return EXIT_FAILURE;
        } finally {
            injector.getInstance(ExecutorService.class).shutdownNow();
        }
    }
}
