package de.bsommerfeld.g11n.core.locale;

import com.google.common.base.Splitter;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization of locale tags to the primary-language granularity the
 * library works with.
 */
public final class LocaleCodes {

    private static final Splitter TAG_SPLITTER = Splitter.on(Pattern.compile("[-_]"));

    private LocaleCodes() {
    }

    /**
     * Lower-cases the tag and keeps only its primary language subtag, so
     * {@code en-US}, {@code en_GB} and {@code EN} all become {@code en}.
     *
     * @param locale the raw tag, may be {@code null}
     * @return the normalized code, or an empty string for null or empty input
     */
    public static String normalize(String locale) {
        if (locale == null || locale.isEmpty()) {
            return "";
        }
        return parts(locale).get(0);
    }

    /** Lower-cased subtags of the given tag, split on {@code -} and {@code _}. */
    public static List<String> parts(String locale) {
        return TAG_SPLITTER.splitToList(locale.toLowerCase(Locale.ROOT));
    }
}
