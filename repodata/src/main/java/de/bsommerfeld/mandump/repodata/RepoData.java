package de.bsommerfeld.mandump.repodata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.collect.ImmutableList;
import de.bsommerfeld.mandump.repodata.hash.HashUtil;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.zstandard.ZstdCompressorInputStream;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.function.Predicate;

/**
 * In-memory catalog of an XBPS repository.
 *
 * <p>A catalog starts empty and is populated by one or more calls to
 * {@link #readRepo(InputStream, String)}. Each read merges the decoded index into the
 * catalog: packages already present are replaced in place, new packages are appended.
 * Packages are never removed. After every merge the catalog is sorted by name, positions
 * are reassigned and the aggregate {@link #etag()} is recomputed.
 *
 * <h3>Fingerprints</h3>
 * Every package carries an etag derived from its pkgver and a SHA-1 over the JSON form of
 * its record. The catalog etag is a SHA-1 over the package count followed by, for each
 * package in order, the combined length of pkgver and etag and then both strings. Equal
 * index content therefore always yields an equal catalog etag.
 *
 * <h3>Threading</h3>
 * Merging is not thread-safe. Once populated, a catalog may be read from any number of
 * threads; callers must not modify the returned lists or packages.
 */
public final class RepoData {

    /** Name of the index entry inside a repodata archive. */
    public static final String INDEX_FILE = "index.plist";

    /** Repository label used when the caller supplies none. */
    public static final String DEFAULT_REPOSITORY = "current";

    private static final ObjectMapper FINGERPRINT_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    private final Map<String, RepoPackage> root = new HashMap<>();
    private List<RepoPackage> index = List.of();
    private List<String> nameIndex = List.of();
    private String etag;

    public RepoData() {
        this.etag = computeEtag(index);
    }

    /**
     * Opens the repodata file at {@code path} and merges it.
     *
     * @see #readRepo(InputStream, String)
     */
    public void loadRepo(Path path, String repository) throws IOException, RepoDataException {
        try (InputStream in = Files.newInputStream(path)) {
            readRepo(in, repository);
        }
    }

    /**
     * Reads a zstd-compressed repodata tar stream, locates {@link #INDEX_FILE} and merges it.
     *
     * @param repository label assigned to every package read; {@link #DEFAULT_REPOSITORY} if
     *                   {@code null} or empty
     * @throws NoIndexException if the archive has no index entry
     */
    public void readRepo(InputStream in, String repository) throws IOException, RepoDataException {
        try (TarArchiveInputStream tar = new TarArchiveInputStream(
                new ZstdCompressorInputStream(new BufferedInputStream(in)))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                if (entry.isFile() && INDEX_FILE.equals(normalizeEntryName(entry.getName()))) {
                    readRepoIndex(tar, repository);
                    return;
                }
            }
        }
        throw new NoIndexException(INDEX_FILE);
    }

    /**
     * Decodes an index property list from {@code in} and merges it into this catalog.
     * The stream is read to its end but not closed.
     *
     * <p>All records are decoded and validated before the catalog is touched, so a failed
     * merge leaves the catalog unchanged.
     *
     * @throws MalformedPkgVerException if any record's pkgver cannot be parsed
     */
    public void readRepoIndex(InputStream in, String repository) throws IOException, RepoDataException {
        String repo = repository == null || repository.isEmpty() ? DEFAULT_REPOSITORY : repository;

        Map<String, PackageMetadata> decoded = PlistPackageDecoder.decode(in.readAllBytes());

        List<RepoPackage> staged = new ArrayList<>(decoded.size());
        for (Map.Entry<String, PackageMetadata> e : decoded.entrySet()) {
            String pkgver = e.getValue().pkgver();
            if (pkgver == null) {
                throw new MalformedPkgVerException(e.getKey(), MalformedPkgVerException.Reason.NO_VERSION);
            }
            PkgVer parsed = PkgVer.parse(pkgver);
            staged.add(new RepoPackage(e.getKey(), parsed, repo, e.getValue(),
                    computePackageEtag(e.getKey(), parsed, repo, e.getValue())));
        }

        merge(staged);
    }

    private void merge(List<RepoPackage> staged) {
        List<RepoPackage> merged = new ArrayList<>(index);
        for (RepoPackage p : staged) {
            RepoPackage old = root.put(p.name(), p);
            if (old != null) {
                merged.set(old.index(), p);
            } else {
                merged.add(p);
            }
        }

        merged.sort(Comparator.comparing(RepoPackage::name));

        List<String> names = new ArrayList<>(merged.size());
        for (int i = 0; i < merged.size(); i++) {
            RepoPackage p = merged.get(i);
            p.setIndex(i);
            names.add(p.name());
        }

        this.index = ImmutableList.copyOf(merged);
        this.nameIndex = ImmutableList.copyOf(names);
        this.etag = computeEtag(this.index);
    }

    // -- Queries --

    /**
     * Returns all packages ordered by name. The list is immutable.
     */
    public List<RepoPackage> index() {
        return index;
    }

    /**
     * Returns the names of all packages, in catalog order.
     */
    public List<String> nameIndex() {
        return nameIndex;
    }

    /**
     * Returns the package with the given name (without version), or {@code null}.
     */
    public RepoPackage packageNamed(String name) {
        return root.get(name);
    }

    public int size() {
        return index.size();
    }

    /**
     * Returns the aggregate fingerprint of the catalog.
     */
    public String etag() {
        return etag;
    }

    /**
     * Returns the packages matching {@code filter}, in catalog order.
     *
     * @see PackageFilter
     */
    public List<RepoPackage> filter(Predicate<? super RepoPackage> filter, Executor executor) {
        return new PackageFilter(executor).filter(index, filter);
    }

    // -- Fingerprints --

    private static String computePackageEtag(String name, PkgVer pkgver, String repository,
            PackageMetadata metadata) throws RepoDataException {
        byte[] metadataHash;
        try {
            metadataHash = HashUtil.sha1(FINGERPRINT_MAPPER.writeValueAsBytes(
                    new FingerprintDocument(name, pkgver.version(), pkgver.revision(), repository, metadata)));
        } catch (JsonProcessingException e) {
            throw new RepoDataException("Unable to serialize package " + name + " for fingerprinting", e);
        }

        MessageDigest digest = HashUtil.sha1();
        HashUtil.updateLong(digest, metadata.pkgver().length());
        HashUtil.updateString(digest, metadata.pkgver());
        digest.update(metadataHash);
        return HashUtil.etag(digest.digest());
    }

    private static String computeEtag(List<RepoPackage> packages) {
        MessageDigest digest = HashUtil.sha1();
        HashUtil.updateLong(digest, packages.size());
        for (RepoPackage p : packages) {
            HashUtil.updateLong(digest, p.pkgver().length() + p.etag().length());
            HashUtil.updateString(digest, p.pkgver());
            HashUtil.updateString(digest, p.etag());
        }
        return HashUtil.etag(digest.digest());
    }

    static String normalizeEntryName(String name) {
        String n = name;
        while (n.startsWith("./")) {
            n = n.substring(2);
        }
        return n;
    }

    /** Serialized form of a package that its metadata hash is computed over. */
    record FingerprintDocument(String name, String version, int revision, String repository,
            PackageMetadata metadata) {
    }
}
