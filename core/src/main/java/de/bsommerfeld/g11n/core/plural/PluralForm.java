package de.bsommerfeld.g11n.core.plural;

import java.util.Locale;

/**
 * CLDR plural categories.
 *
 * @see <a href="https://cldr.unicode.org/index/cldr-spec/plural-rules">CLDR Plural Rules</a>
 */
public enum PluralForm {

    ZERO,
    ONE,
    TWO,
    FEW,
    MANY,
    OTHER;

    /** The key used in bundle documents, e.g. {@code "few"}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a bundle key back into a form.
     *
     * @return the form, or {@code null} if {@code key} is not a CLDR category
     */
    public static PluralForm fromKey(String key) {
        for (PluralForm form : values()) {
            if (form.key().equals(key)) {
                return form;
            }
        }
        return null;
    }
}
