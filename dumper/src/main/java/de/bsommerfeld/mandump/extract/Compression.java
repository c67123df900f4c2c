package de.bsommerfeld.mandump.extract;

import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;
import org.apache.commons.compress.compressors.xz.XZUtils;
import org.apache.commons.compress.compressors.zstandard.ZstdCompressorInputStream;
import org.apache.commons.compress.compressors.zstandard.ZstdUtils;

import java.io.IOException;
import java.io.InputStream;

/**
 * Compression formats of XBPS package archives, detected from the leading magic bytes
 * rather than the file name.
 */
public enum Compression {

    XZ {
        @Override
        public InputStream decoder(InputStream in) throws IOException {
            return new XZCompressorInputStream(in);
        }
    },

    ZSTD {
        @Override
        public InputStream decoder(InputStream in) throws IOException {
            return new ZstdCompressorInputStream(in);
        }
    },

    UNSUPPORTED {
        @Override
        public InputStream decoder(InputStream in) throws IOException {
            throw new IOException("no decoder for unsupported compression");
        }
    };

    /** Bytes needed to tell the formats apart. */
    static final int SIGNATURE_LENGTH = 6;

    /**
     * Wraps {@code in} in a decompressing stream for this format.
     */
    public abstract InputStream decoder(InputStream in) throws IOException;

    /**
     * Identifies the format of {@code in} without consuming it. The stream must support
     * {@link InputStream#mark(int)}.
     */
    public static Compression sniff(InputStream in) throws IOException {
        if (!in.markSupported()) {
            throw new IllegalArgumentException("stream must support mark/reset");
        }
        in.mark(SIGNATURE_LENGTH);
        byte[] signature = in.readNBytes(SIGNATURE_LENGTH);
        in.reset();

        if (XZUtils.matches(signature, signature.length)) {
            return XZ;
        }
        if (ZstdUtils.matches(signature, signature.length)) {
            return ZSTD;
        }
        return UNSUPPORTED;
    }
}
