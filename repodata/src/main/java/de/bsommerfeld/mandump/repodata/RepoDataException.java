package de.bsommerfeld.mandump.repodata;

/**
 * Thrown when repository data cannot be read or merged.
 */
public class RepoDataException extends Exception {

    public RepoDataException(String message) {
        super(message);
    }

    public RepoDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
