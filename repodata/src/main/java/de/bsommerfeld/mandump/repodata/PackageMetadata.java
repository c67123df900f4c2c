package de.bsommerfeld.mandump.repodata;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Metadata of a single package as recorded in a repository's {@code index.plist}.
 * Property names follow the index keys; the JSON form produced from these names is
 * what the package fingerprint is computed over.
 *
 * @param pkgver          combined {@code <name>-<version>_<revision>} string
 * @param filenameSha256  SHA-256 of the package archive, the cache identity key
 * @param filenameSize    size of the package archive in bytes
 * @param alternatives    alternatives group to link list, empty when absent
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PackageMetadata(
        @JsonProperty("pkgver") String pkgver,
        @JsonProperty("architecture") String architecture,
        @JsonProperty("build_date") Instant buildDate,
        @JsonProperty("build_options") String buildOptions,
        @JsonProperty("filename_sha256") String filenameSha256,
        @JsonProperty("filename_size") long filenameSize,
        @JsonProperty("homepage") URI homepage,
        @JsonProperty("installed_size") long installedSize,
        @JsonProperty("license") String license,
        @JsonProperty("maintainer") String maintainer,
        @JsonProperty("short_desc") String shortDesc,
        @JsonProperty("preserve") boolean preserve,
        @JsonProperty("source_revisions") String sourceRevisions,
        @JsonProperty("run_depends") List<String> runDepends,
        @JsonProperty("shlib_requires") List<String> shlibRequires,
        @JsonProperty("shlib_provides") List<String> shlibProvides,
        @JsonProperty("conflicts") List<String> conflicts,
        @JsonProperty("reverts") List<String> reverts,
        @JsonProperty("replaces") List<String> replaces,
        @JsonProperty("alternatives") Map<String, List<String>> alternatives,
        @JsonProperty("conf_files") List<String> confFiles) {

    public PackageMetadata {
        runDepends = List.copyOf(runDepends);
        shlibRequires = List.copyOf(shlibRequires);
        shlibProvides = List.copyOf(shlibProvides);
        conflicts = List.copyOf(conflicts);
        reverts = List.copyOf(reverts);
        replaces = List.copyOf(replaces);
        alternatives = Map.copyOf(alternatives);
        confFiles = List.copyOf(confFiles);
    }
}
