package de.bsommerfeld.g11n.core.plural;

import de.bsommerfeld.g11n.core.locale.LocaleCodes;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of plural rules keyed by language family (the normalized primary
 * language, e.g. {@code fr} for {@code fr-CA}). Families without an entry use
 * the English rule.
 *
 * <p>
 * Built-in families:
 * <pre>
 * en  cardinal: one (1), other
 *     ordinal:  one (1, 21, 31, ...), two (2, 22, ...), few (3, 23, ...),
 *               other (4th, 11th-13th, ...)
 * es  cardinal: one (1), other;            ordinal: other
 * fr  cardinal: one (0, 1), other;         ordinal: one (1), other
 * ar  cardinal: zero (0), one (1), two (2), few (3-10 mod 100),
 *               many (11-99 mod 100), other; ordinal: other
 * </pre>
 *
 * Fractional counts never match a specific integer or an integer range, so
 * {@code 1.5} is {@code other} in English and {@code 3.5} is {@code other}
 * in Arabic.
 */
public final class PluralRules {

    /**
     * Counts probed by {@link #getPluralForms} and {@link #hasPluralForm}.
     * Forms reachable only outside this set are not reported.
     */
    static final long[] PROBE_COUNTS = { 0, 1, 2, 3, 4, 5, 10, 11, 20, 21, 22, 23, 100, 101, 102, 103 };

    public static final PluralRule ENGLISH = (count, ordinal) -> {
        if (ordinal) {
            if (!isWhole(count)) {
                return PluralForm.OTHER;
            }
            double mod10 = count % 10;
            double mod100 = count % 100;
            if (mod10 == 1 && mod100 != 11) {
                return PluralForm.ONE;
            }
            if (mod10 == 2 && mod100 != 12) {
                return PluralForm.TWO;
            }
            if (mod10 == 3 && mod100 != 13) {
                return PluralForm.FEW;
            }
            return PluralForm.OTHER;
        }
        return count == 1 ? PluralForm.ONE : PluralForm.OTHER;
    };

    public static final PluralRule SPANISH = (count, ordinal) -> {
        if (ordinal) {
            return PluralForm.OTHER;
        }
        return count == 1 ? PluralForm.ONE : PluralForm.OTHER;
    };

    public static final PluralRule FRENCH = (count, ordinal) -> {
        if (ordinal) {
            return count == 1 ? PluralForm.ONE : PluralForm.OTHER;
        }
        // zero is singular in French
        return count == 0 || count == 1 ? PluralForm.ONE : PluralForm.OTHER;
    };

    public static final PluralRule ARABIC = (count, ordinal) -> {
        if (ordinal) {
            return PluralForm.OTHER;
        }
        if (count == 0) {
            return PluralForm.ZERO;
        }
        if (count == 1) {
            return PluralForm.ONE;
        }
        if (count == 2) {
            return PluralForm.TWO;
        }
        if (!isWhole(count)) {
            return PluralForm.OTHER;
        }
        double mod100 = count % 100;
        if (mod100 >= 3 && mod100 <= 10) {
            return PluralForm.FEW;
        }
        if (mod100 >= 11 && mod100 <= 99) {
            return PluralForm.MANY;
        }
        return PluralForm.OTHER;
    };

    private static final Map<String, PluralRule> RULES = new ConcurrentHashMap<>(Map.of(
            "en", ENGLISH,
            "es", SPANISH,
            "fr", FRENCH,
            "ar", ARABIC));

    private PluralRules() {
    }

    static boolean isWhole(double count) {
        return !Double.isInfinite(count) && count == Math.rint(count);
    }

    /** Rule for the locale's family, the English rule if the family is unknown. */
    public static PluralRule forLocale(String locale) {
        String family = LocaleCodes.normalize(locale);
        if (family.isEmpty()) {
            return ENGLISH;
        }
        return RULES.getOrDefault(family, ENGLISH);
    }

    /**
     * Adds or replaces the rule of a language family.
     *
     * @param family primary language code; normalized before use
     */
    public static void register(String family, PluralRule rule) {
        String normalized = LocaleCodes.normalize(family);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Plural rule family must not be empty");
        }
        RULES.put(normalized, rule);
    }

    /** Whether a dedicated rule exists for the locale's family. */
    public static boolean hasRule(String locale) {
        return RULES.containsKey(LocaleCodes.normalize(locale));
    }

    public static PluralForm select(String locale, double count, boolean ordinal) {
        return forLocale(locale).select(count, ordinal);
    }

    /** Whether any probe count maps to {@code form} in the locale's rule. */
    public static boolean hasPluralForm(String locale, PluralForm form, boolean ordinal) {
        PluralRule rule = forLocale(locale);
        for (long count : PROBE_COUNTS) {
            if (rule.select(count, ordinal) == form) {
                return true;
            }
        }
        return false;
    }

    /** Distinct forms produced by the probe counts, in first-seen order. */
    public static List<PluralForm> getPluralForms(String locale, boolean ordinal) {
        PluralRule rule = forLocale(locale);
        Set<PluralForm> forms = new LinkedHashSet<>();
        for (long count : PROBE_COUNTS) {
            forms.add(rule.select(count, ordinal));
        }
        return new ArrayList<>(forms);
    }
}
