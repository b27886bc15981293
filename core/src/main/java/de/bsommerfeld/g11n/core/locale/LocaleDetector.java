package de.bsommerfeld.g11n.core.locale;

import java.util.List;

/**
 * Picks the best supported locale from a list of preferences ordered from
 * most to least preferred.
 */
public final class LocaleDetector {

    private LocaleDetector() {
    }

    /**
     * Returns the first preference whose primary language is supported. When
     * none matches, every subtag of every preference is tried in order, so
     * {@code zh-Hant-TW} can still match a supported {@code tw}. Falls back to
     * {@code fallbackLocale} when nothing matches.
     */
    public static String findBestMatchingLocale(List<String> candidates, List<String> supportedLocales,
            String fallbackLocale) {
        for (String candidate : candidates) {
            String normalized = LocaleCodes.normalize(candidate);
            if (supportedLocales.contains(normalized)) {
                return normalized;
            }
        }

        for (String candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            for (String part : LocaleCodes.parts(candidate)) {
                if (supportedLocales.contains(part)) {
                    return part;
                }
            }
        }

        return fallbackLocale;
    }

    /** Whether the normalized form of {@code locale} is in the supported list. */
    public static boolean isLocaleSupported(String locale, List<String> supportedLocales) {
        return supportedLocales.contains(LocaleCodes.normalize(locale));
    }
}
