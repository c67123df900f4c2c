package de.bsommerfeld.mandump.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import de.bsommerfeld.mandump.DumpException;
import de.bsommerfeld.mandump.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes {@link CacheRecords} as JSON.
 *
 * <p>Writes go to a {@code .tmp} sibling that is renamed over the target, so an
 * interrupted run never leaves a truncated cache behind. The file is restricted to its
 * owner where POSIX permissions are available.
 */
public final class CacheStore {

    private static final Logger LOG = LoggerFactory.getLogger(CacheStore.class);

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    /**
     * Loads the cache at {@code file}. A missing file yields an empty cache.
     *
     * <p>Versions 0 and {@link CacheRecords#CURRENT_VERSION} are read as is; any other
     * version is passed through without migration.
     *
     * @throws ConfigurationException if the file exists but cannot be read or parsed, or
     *                                holds a null path list or path
     */
    public CacheRecords load(Path file) throws ConfigurationException {
        if (file == null) {
            return CacheRecords.empty();
        }

        byte[] data;
        try {
            data = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            LOG.warn("Cache file not found: {}", file);
            return CacheRecords.empty();
        } catch (IOException e) {
            throw new ConfigurationException("Invalid cache file " + file + ": " + e.getMessage(), e);
        }

        CacheRecords records;
        try {
            records = mapper.readValue(data, CacheRecords.class);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid cache file " + file + ": " + e.getMessage(), e);
        }
        if (records == null) {
            throw new ConfigurationException("Invalid cache file " + file + ": empty document");
        }
        checkEntries(file, records);

        if (records.version() != 0 && records.version() != CacheRecords.CURRENT_VERSION) {
            LOG.warn("Cache file {} has unknown version {}, reading as is", file, records.version());
        }
        LOG.debug("Loaded {} cache entries from {}", records.cache().size(), file);
        return records;
    }

    private static void checkEntries(Path file, CacheRecords records) throws ConfigurationException {
        for (Map.Entry<String, List<String>> entry : records.cache().entrySet()) {
            if (entry.getValue() == null) {
                throw new ConfigurationException("Invalid cache file " + file + ": no path list for " + entry.getKey());
            }
            if (entry.getValue().contains(null)) {
                throw new ConfigurationException("Invalid cache file " + file + ": null path for " + entry.getKey());
            }
        }
    }

    /**
     * Writes {@code records} to {@code file}, replacing it.
     */
    public void save(CacheRecords records, Path file) throws IOException, DumpException {
        byte[] data = encode(records);

        Path absolute = file.toAbsolutePath();
        if (absolute.getParent() != null) {
            Files.createDirectories(absolute.getParent());
        }
        Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        Files.write(temp, data);
        restrictToOwner(temp);
        try {
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
        }
        LOG.debug("Wrote {} cache entries to {}", records.cache().size(), absolute);
    }

    /**
     * Writes {@code records} to {@code out} without closing it.
     */
    public void write(CacheRecords records, OutputStream out) throws IOException, DumpException {
        out.write(encode(records));
        out.flush();
    }

    private byte[] encode(CacheRecords records) throws DumpException {
        try {
            return mapper.writeValueAsBytes(records);
        } catch (JsonProcessingException e) {
            throw new DumpException("Error encoding cache", e);
        }
    }

    private static void restrictToOwner(Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            LOG.trace("No POSIX permissions for {}", file);
        }
    }
}
