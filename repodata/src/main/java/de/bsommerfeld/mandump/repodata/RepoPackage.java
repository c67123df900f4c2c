package de.bsommerfeld.mandump.repodata;

import java.util.Objects;

/**
 * A package in a {@link RepoData} catalog. Everything except the catalog position is
 * fixed when the record is decoded; a later merge that replaces the package installs a
 * new instance, while {@link #index()} is reassigned on every merge as the catalog is
 * re-sorted.
 */
public final class RepoPackage {

    private final String name;
    private final String version;
    private final int revision;
    private final String repository;
    private final PackageMetadata metadata;
    private final String etag;

    private int index;

    RepoPackage(String name, PkgVer pkgver, String repository, PackageMetadata metadata, String etag) {
        this.name = Objects.requireNonNull(name, "name");
        this.version = pkgver.version();
        this.revision = pkgver.revision();
        this.repository = repository;
        this.metadata = metadata;
        this.etag = etag;
    }

    /** Package name without version and revision. */
    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public int revision() {
        return revision;
    }

    /** Combined {@code <name>-<version>_<revision>} string as written in the index. */
    public String pkgver() {
        return metadata.pkgver();
    }

    public String architecture() {
        return metadata.architecture();
    }

    /** Label of the repository this package was read from. */
    public String repository() {
        return repository;
    }

    /** SHA-256 of the package archive; stable for as long as the archive is unchanged. */
    public String filenameSha256() {
        return metadata.filenameSha256();
    }

    public PackageMetadata metadata() {
        return metadata;
    }

    /** Fingerprint over the pkgver and all recorded metadata. */
    public String etag() {
        return etag;
    }

    /** Position of this package in the catalog, by name. */
    public int index() {
        return index;
    }

    void setIndex(int index) {
        this.index = index;
    }

    /**
     * Returns the archive file name of this package, {@code <pkgver>.<arch>.xbps}.
     */
    public String archiveFileName() {
        return pkgver() + "." + architecture() + ".xbps";
    }

    @Override
    public String toString() {
        return "RepoPackage[" + pkgver() + " " + architecture() + " @" + repository + "]";
    }
}
