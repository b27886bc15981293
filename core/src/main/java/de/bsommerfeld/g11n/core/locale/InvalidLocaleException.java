package de.bsommerfeld.g11n.core.locale;

import de.bsommerfeld.g11n.core.G11nException;

import java.util.List;

/**
 * Thrown when a locale is requested that is not in the configured supported
 * set once normalized.
 */
public class InvalidLocaleException extends G11nException {

    public static final String CODE = "INVALID_LOCALE";

    private final String locale;
    private final List<String> supportedLocales;

    public InvalidLocaleException(String locale, List<String> supportedLocales) {
        super("Invalid locale: " + locale + ". Supported locales: " + String.join(", ", supportedLocales), CODE);
        this.locale = locale;
        this.supportedLocales = List.copyOf(supportedLocales);
    }

    public String getLocale() {
        return locale;
    }

    public List<String> getSupportedLocales() {
        return supportedLocales;
    }
}
