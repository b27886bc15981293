package de.bsommerfeld.g11n.core.config;

import de.bsommerfeld.g11n.core.G11nException;

/**
 * Thrown when a {@link G11nConfig} is incomplete or self-contradictory, or
 * when a configuration source cannot be read.
 */
public class ConfigurationException extends G11nException {

    public static final String CODE = "INVALID_CONFIG";

    public ConfigurationException(String message) {
        super(message, CODE);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
