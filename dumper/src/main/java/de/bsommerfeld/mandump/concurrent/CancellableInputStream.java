package de.bsommerfeld.mandump.concurrent;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;

/**
 * Input stream that fails every read once its {@link Cancellation} is raised, so archive
 * decoding stops at the next buffer refill.
 */
public final class CancellableInputStream extends FilterInputStream {

    private final Cancellation cancellation;

    public CancellableInputStream(InputStream in, Cancellation cancellation) {
        super(in);
        this.cancellation = cancellation;
    }

    private void check() throws InterruptedIOException {
        if (cancellation.isCancelled()) {
            throw new InterruptedIOException("read cancelled");
        }
    }

    @Override
    public int read() throws IOException {
        check();
        return super.read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        check();
        return super.read(b, off, len);
    }

    @Override
    public long skip(long n) throws IOException {
        check();
        return super.skip(n);
    }
}
