package org.dxworks.lintframe;

/**
 * A configuration value is missing its expected shape. Raised while analyzers are constructed,
 * before any file is read.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
