package de.bsommerfeld.g11n.runtime;

import de.bsommerfeld.g11n.core.G11nException;

/**
 * Thrown when translations are requested before {@link G11n#init()} has
 * completed.
 */
public class NotInitializedException extends G11nException {

    public static final String CODE = "NOT_INITIALIZED";

    public NotInitializedException(String message) {
        super(message, CODE);
    }
}
