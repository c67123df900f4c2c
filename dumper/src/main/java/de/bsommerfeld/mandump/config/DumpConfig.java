package de.bsommerfeld.mandump.config;

import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;

/**
 * Validated settings of a dump run.
 *
 * @param dirMode        permissions for directories created under the output root
 * @param openLimit      number of file handles that may be open at once
 * @param cacheFile      cache location; {@code null} to read no cache and print the new one
 * @param removeOldFiles whether files of packages not seen in this run are deleted
 * @param outputRoot     directory that extracted files are written below
 */
public record DumpConfig(Set<PosixFilePermission> dirMode, int openLimit, Path cacheFile,
        boolean removeOldFiles, Path outputRoot) {

    public DumpConfig {
        dirMode = Set.copyOf(dirMode);
    }

    /**
     * Validates raw option values.
     *
     * @param mode    octal directory mode
     * @param limit   requested open-file budget
     * @param ceiling open-file ceiling of the process
     * @throws ConfigurationException if the mode is invalid or the limit is outside
     *                                {@code [2, ceiling]}
     */
    public static DumpConfig of(String mode, long limit, long ceiling, Path cacheFile,
            boolean removeOldFiles, Path outputRoot) throws ConfigurationException {
        Set<PosixFilePermission> perms = DirMode.parse(mode);

        if (limit < FileLimit.MIN_BUDGET) {
            throw new ConfigurationException("Invalid limit -- must be >= " + FileLimit.MIN_BUDGET + ": " + limit);
        }
        if (limit > ceiling) {
            throw new ConfigurationException("Invalid limit -- must be <= nofiles (" + ceiling + "): " + limit);
        }
        if (limit > Integer.MAX_VALUE) {
            throw new ConfigurationException("Invalid limit -- too large: " + limit);
        }

        return new DumpConfig(perms, (int) limit, cacheFile, removeOldFiles,
                outputRoot.toAbsolutePath().normalize());
    }
}
