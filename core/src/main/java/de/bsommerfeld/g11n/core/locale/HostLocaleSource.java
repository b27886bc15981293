package de.bsommerfeld.g11n.core.locale;

import java.util.List;

/**
 * Locale preferences reported by the host environment, most preferred first.
 * Entries are raw tags such as {@code de-AT} or {@code pt_BR}.
 */
@FunctionalInterface
public interface HostLocaleSource {

    List<String> preferredLocales();
}
