package de.bsommerfeld.mandump;

/**
 * Thrown when dumping a repository or package fails unrecoverably.
 */
public class DumpException extends Exception {

    public DumpException(String message) {
        super(message);
    }

    public DumpException(String message, Throwable cause) {
        super(message, cause);
    }
}
