package de.bsommerfeld.mandump.config;

import com.sun.management.UnixOperatingSystemMXBean;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Open-file ceiling of the running process.
 */
public final class FileLimit {

    /** Upper bound for the default concurrent-file budget. */
    public static final long DEFAULT_BUDGET = 20;

    /** Smallest usable budget: one package worker. */
    public static final long MIN_BUDGET = 2;

    private FileLimit() {
    }

    /**
     * Returns the soft {@code RLIMIT_NOFILE} of this process, or {@link Long#MAX_VALUE} on
     * platforms that do not report it.
     */
    public static long discover() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof UnixOperatingSystemMXBean) {
            long max = ((UnixOperatingSystemMXBean) os).getMaxFileDescriptorCount();
            if (max > 0) return max;
        }
        return Long.MAX_VALUE;
    }

    /**
     * Returns the default budget for a given ceiling.
     */
    public static long defaultBudget(long ceiling) {
        return Math.min(DEFAULT_BUDGET, ceiling);
    }
}
