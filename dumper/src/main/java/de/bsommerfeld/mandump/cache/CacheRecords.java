package de.bsommerfeld.mandump.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Persisted form of the dump cache.
 *
 * <pre>{@code
 * {
 *   "version": 1,
 *   "cache-v1": {
 *     "9f1c...": ["man1/mandoc.1", "man7/roff.7"],
 *     "0ab3...": []
 *   }
 * }
 * }</pre>
 *
 * @param version format version; 0 when the file predates versioning
 * @param cache   archive SHA-256 to the relative paths extracted from that archive
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheRecords(
        @JsonProperty("version") int version,
        @JsonProperty("cache-v1") Map<String, List<String>> cache) {

    /** The only format version written. */
    public static final int CURRENT_VERSION = 1;

    public CacheRecords {
        cache = cache == null ? Map.of() : cache;
    }

    public static CacheRecords empty() {
        return new CacheRecords(0, Map.of());
    }
}
