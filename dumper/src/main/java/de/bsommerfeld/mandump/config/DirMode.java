package de.bsommerfeld.mandump.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/**
 * Conversion between octal permission strings ({@code "755"}) and
 * {@link PosixFilePermission} sets.
 */
public final class DirMode {

    /** Used when the working directory's own mode cannot be read. */
    public static final String FALLBACK = "755";

    // Bit 8 (0400) down to bit 0 (0001), matching PosixFilePermission declaration order
    private static final PosixFilePermission[] BITS = PosixFilePermission.values();

    private DirMode() {
    }

    /**
     * Parses an octal mode. Only the permission bits (0777) are kept.
     *
     * @throws ConfigurationException if the string is not octal or the mode is zero
     */
    public static Set<PosixFilePermission> parse(String octal) throws ConfigurationException {
        int mode;
        try {
            mode = Integer.parseInt(octal, 8);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid file mode: cannot be parsed: " + octal, e);
        }
        if (mode == 0) {
            throw new ConfigurationException("Invalid file mode: may not be 0");
        }
        if (mode < 0 || mode > 07777) {
            throw new ConfigurationException("Invalid file mode: out of range: " + octal);
        }

        Set<PosixFilePermission> perms = EnumSet.noneOf(PosixFilePermission.class);
        for (int i = 0; i < BITS.length; i++) {
            if ((mode & (0400 >> i)) != 0) {
                perms.add(BITS[i]);
            }
        }
        return perms;
    }

    /**
     * Formats a permission set as a three-digit octal string.
     */
    public static String format(Set<PosixFilePermission> perms) {
        int mode = 0;
        for (int i = 0; i < BITS.length; i++) {
            if (perms.contains(BITS[i])) {
                mode |= 0400 >> i;
            }
        }
        return String.format("%03o", mode);
    }

    /**
     * Returns the mode of {@code dir} as an octal string, or {@link #FALLBACK} if the file
     * system has no POSIX permissions.
     */
    public static String of(Path dir) {
        try {
            return format(Files.getPosixFilePermissions(dir));
        } catch (IOException | UnsupportedOperationException e) {
            return FALLBACK;
        }
    }
}
