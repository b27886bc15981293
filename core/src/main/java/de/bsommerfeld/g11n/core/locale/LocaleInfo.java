package de.bsommerfeld.g11n.core.locale;

/**
 * Display metadata for a supported locale.
 *
 * @param code       normalized locale code, e.g. {@code fr}
 * @param name       English name of the language
 * @param nativeName the language's name for itself
 * @param direction  writing direction
 */
public record LocaleInfo(String code, String name, String nativeName, TextDirection direction) {

    public boolean isRightToLeft() {
        return direction == TextDirection.RTL;
    }
}
