package de.bsommerfeld.mandump.config;

import de.bsommerfeld.mandump.DumpException;

/**
 * Thrown for invalid options or an unreadable cache file. Always raised before any
 * repository is read.
 */
public class ConfigurationException extends DumpException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
