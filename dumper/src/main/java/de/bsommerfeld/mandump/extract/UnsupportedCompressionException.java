package de.bsommerfeld.mandump.extract;

import de.bsommerfeld.mandump.DumpException;

/**
 * Thrown when a package archive is neither xz- nor zstd-compressed.
 */
public class UnsupportedCompressionException extends DumpException {

    public UnsupportedCompressionException(String file) {
        super("Compression format for " + file + " is not supported");
    }
}
