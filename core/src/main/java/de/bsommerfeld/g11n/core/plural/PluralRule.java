package de.bsommerfeld.g11n.core.plural;

/**
 * Plural rule of one language family.
 */
@FunctionalInterface
public interface PluralRule {

    /**
     * Selects the category for {@code count}.
     *
     * @param count   the number being described; may carry a fraction
     * @param ordinal {@code true} for ordinal rules (1st, 2nd, ...),
     *                {@code false} for cardinal rules (1 item, 2 items)
     * @return the category, never {@code null}
     */
    PluralForm select(double count, boolean ordinal);
}
