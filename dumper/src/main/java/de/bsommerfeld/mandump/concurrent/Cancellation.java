package de.bsommerfeld.mandump.concurrent;

import java.util.concurrent.CancellationException;

/**
 * Read side of a run-scoped cancellation signal. Blocking operations poll it so that a
 * failure elsewhere in the run stops them promptly.
 */
@FunctionalInterface
public interface Cancellation {

    /** A signal that is never raised. */
    Cancellation NONE = () -> false;

    boolean isCancelled();

    /**
     * @throws CancellationException if the signal has been raised
     */
    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("run cancelled");
        }
    }
}
