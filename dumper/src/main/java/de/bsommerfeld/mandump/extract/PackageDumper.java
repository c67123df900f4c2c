package de.bsommerfeld.mandump.extract;

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.mandump.DumpException;
import de.bsommerfeld.mandump.cache.DumpCache;
import de.bsommerfeld.mandump.concurrent.CancellableInputStream;
import de.bsommerfeld.mandump.concurrent.Cancellation;
import de.bsommerfeld.mandump.config.DumpConfig;
import de.bsommerfeld.mandump.extract.ExtractionResult.Outcome;
import de.bsommerfeld.mandump.repodata.RepoPackage;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts the target tree (manual pages by default) of a single XBPS package archive
 * into the output root.
 *
 * <h3>Per-package flow</h3>
 * <ol>
 * <li>Debug ({@code -dbg}) and 32-bit ({@code -32bit}) packages are skipped.</li>
 * <li>An archive hash already in the previous cache reuses its recorded paths; the
 * archive is not opened.</li>
 * <li>The archive's compression is sniffed from its magic bytes (xz or zstd).</li>
 * <li>Tar entries are scanned for {@code files.plist}. Without one, or without any
 * declared directory under the target tree, the package produces nothing.</li>
 * <li>The remaining entries are read until every target file and link named by the
 * manifest has been seen. Files are copied, links recreated.</li>
 * </ol>
 *
 * <p>Every call returns exactly one {@link ExtractionResult}; a missing archive is a
 * {@link Outcome#MISSING} result, not an error. Decode and filesystem errors propagate.
 */
@Singleton
public class PackageDumper {

    private static final Logger LOG = LoggerFactory.getLogger(PackageDumper.class);

    private static final List<String> SKIPPED_SUFFIXES = List.of("-dbg", "-32bit");

    private final Path outputRoot;
    private final Set<PosixFilePermission> dirMode;
    private final DumpCache cache;
    private final DumpTarget target;

    @Inject
    public PackageDumper(DumpConfig config, DumpCache cache) {
        this(config.outputRoot(), config.dirMode(), cache, DumpTarget.MAN_PAGES);
    }

    public PackageDumper(Path outputRoot, Set<PosixFilePermission> dirMode, DumpCache cache, DumpTarget target) {
        this.outputRoot = outputRoot.toAbsolutePath().normalize();
        this.dirMode = Set.copyOf(dirMode);
        this.cache = cache;
        this.target = target;
    }

    /**
     * Processes the archive of {@code pkg} located at {@code archive}.
     *
     * @param cancellation polled while the archive is read
     * @throws UnsupportedCompressionException if the archive is neither xz nor zstd
     * @throws DumpException                   if the manifest cannot be decoded
     * @throws IOException                     on read, decompression or filesystem errors
     */
    public ExtractionResult dump(RepoPackage pkg, Path archive, Cancellation cancellation)
            throws IOException, DumpException {
        String sha256 = Strings.nullToEmpty(pkg.filenameSha256());

        try (MDC.MDCCloseable ignored = MDC.putCloseable("file", archive.toString())) {
            if (isSkipped(pkg.name())) {
                LOG.debug("Ignored debug/32-bit package");
                return new ExtractionResult(sha256, cache.prior(sha256).orElse(List.of()), Outcome.SKIPPED);
            }

            var cached = cache.prior(sha256);
            if (cached.isPresent()) {
                LOG.debug("Package already dumped");
                return new ExtractionResult(sha256, cached.get(), Outcome.CACHED);
            }

            LOG.info("Processing file");
            Stopwatch timer = Stopwatch.createStarted();
            try {
                return extract(sha256, archive, cancellation);
            } finally {
                LOG.info("Finished processing file (elapsed {})", timer);
            }
        }
    }

    static boolean isSkipped(String name) {
        for (String suffix : SKIPPED_SUFFIXES) {
            if (name.endsWith(suffix)) return true;
        }
        return false;
    }

    private ExtractionResult extract(String sha256, Path archive, Cancellation cancellation)
            throws IOException, DumpException {
        InputStream raw;
        try {
            raw = Files.newInputStream(archive);
        } catch (NoSuchFileException e) {
            LOG.warn("File does not exist");
            return ExtractionResult.empty(sha256, Outcome.MISSING);
        }

        try (InputStream in = new BufferedInputStream(new CancellableInputStream(raw, cancellation))) {
            Compression compression = Compression.sniff(in);
            if (compression == Compression.UNSUPPORTED) {
                throw new UnsupportedCompressionException(archive.toString());
            }
            LOG.trace("Detected {} compression", compression);

            try (TarArchiveInputStream tar = new TarArchiveInputStream(compression.decoder(in))) {
                return extractTar(sha256, tar);
            }
        }
    }

    private ExtractionResult extractTar(String sha256, TarArchiveInputStream tar) throws IOException, DumpException {
        PackageFiles files = readManifest(tar);
        if (files == null || files.isEmpty()) {
            LOG.debug("Package has no manifest or no directories");
            return ExtractionResult.empty(sha256, Outcome.IRRELEVANT);
        }
        if (!files.touches(target)) {
            return ExtractionResult.empty(sha256, Outcome.IRRELEVANT);
        }

        Set<String> wanted = new HashSet<>(files.targetEntries(target));
        List<String> written = new ArrayList<>();

        TarArchiveEntry entry;
        while (!wanted.isEmpty() && (entry = tar.getNextEntry()) != null) {
            String name = DumpTarget.normalize(entry.getName());
            if (!wanted.remove(name)) {
                continue;
            }
            try (MDC.MDCCloseable ignored = MDC.putCloseable("pkgfile", entry.getName())) {
                String relative = extractEntry(entry, name, tar);
                if (relative != null) {
                    written.add(relative);
                }
            }
        }

        return new ExtractionResult(sha256, written, Outcome.EXTRACTED);
    }

    /**
     * Scans forward to {@link PackageFiles#MANIFEST}. Returns {@code null} if the archive
     * ends first; the stream is then exhausted.
     */
    private PackageFiles readManifest(TarArchiveInputStream tar) throws IOException, DumpException {
        TarArchiveEntry entry;
        while ((entry = tar.getNextEntry()) != null) {
            if (!isRegular(entry)) continue;
            if (!PackageFiles.MANIFEST.equals(DumpTarget.normalize(entry.getName()))) continue;
            return PackageFiles.decode(tar.readAllBytes());
        }
        return null;
    }

    /**
     * Writes a regular file or recreates a symlink. Returns the recorded output path, or
     * {@code null} for entry types that are ignored or paths outside the output root.
     */
    private String extractEntry(TarArchiveEntry entry, String name, InputStream content) throws IOException {
        boolean symlink;
        if (entry.isSymbolicLink()) {
            LOG.debug("Found symlink");
            symlink = true;
        } else if (isRegular(entry)) {
            LOG.debug("Found manpage");
            symlink = false;
        } else {
            return null;
        }

        Path relative = Paths.get(target.outputPath(name)).normalize();
        if (relative.isAbsolute() || relative.startsWith("..") || relative.toString().isEmpty()) {
            LOG.warn("Skipping entry outside the output root: {}", name);
            return null;
        }
        String recorded = relative.toString().replace('\\', '/');

        try (MDC.MDCCloseable ignored = MDC.putCloseable("dumpfile", recorded)) {
            Path dest = outputRoot.resolve(relative);
            createDirectories(dest.getParent());

            if (symlink) {
                // Replace whatever is there, a stale file or an older link
                Files.deleteIfExists(dest);
                Files.createSymbolicLink(dest, Paths.get(entry.getLinkName()));
            } else {
                Files.copy(content, dest, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        return recorded;
    }

    /**
     * {@link TarArchiveEntry#isFile()} also holds for hard links and device nodes, which
     * carry no content.
     */
    static boolean isRegular(TarArchiveEntry entry) {
        return entry.isFile() && !entry.isLink() && !entry.isSymbolicLink()
                && !entry.isCharacterDevice() && !entry.isBlockDevice() && !entry.isFIFO();
    }

    private void createDirectories(Path dir) throws IOException {
        if (dir == null || Files.isDirectory(dir)) return;
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            FileAttribute<Set<PosixFilePermission>> attr = PosixFilePermissions.asFileAttribute(dirMode);
            Files.createDirectories(dir, attr);
        } else {
            Files.createDirectories(dir);
        }
    }
}
