package de.bsommerfeld.g11n.core.interpolation;

import java.util.List;

/**
 * Outcome of one interpolation pass.
 *
 * @param text    the template with every resolvable placeholder replaced
 * @param missing placeholder names without a value, in order of appearance,
 *                without duplicates
 */
public record InterpolationResult(String text, List<String> missing) {

    public InterpolationResult {
        missing = List.copyOf(missing);
    }

    public boolean isComplete() {
        return missing.isEmpty();
    }
}
