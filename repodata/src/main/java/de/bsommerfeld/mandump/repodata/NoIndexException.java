package de.bsommerfeld.mandump.repodata;

/**
 * Thrown when a repodata archive has no index property list.
 */
public class NoIndexException extends RepoDataException {

    public NoIndexException(String indexName) {
        super("index not found: " + indexName);
    }
}
