package de.bsommerfeld.g11n.core;

/**
 * Base type for every condition the library raises to its caller. Each
 * subclass carries a stable, machine-readable {@link #getCode() code} next to
 * the human-readable message.
 *
 * <p>
 * Only configuration misuse is exception-worthy. Missing keys, missing
 * interpolation variables and missing plural forms degrade to visible output
 * instead and never surface as a {@code G11nException}.
 */
public class G11nException extends RuntimeException {

    private final String code;

    public G11nException(String message, String code) {
        super(message);
        this.code = code;
    }

    public G11nException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /** Returns the machine-readable error code, e.g. {@code INVALID_LOCALE}. */
    public String getCode() {
        return code;
    }
}
