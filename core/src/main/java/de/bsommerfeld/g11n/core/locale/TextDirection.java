package de.bsommerfeld.g11n.core.locale;

/** Writing direction of a locale's script. */
public enum TextDirection {

    LTR,
    RTL;

    /** Value for the HTML {@code dir} attribute. */
    public String attributeValue() {
        return name().toLowerCase();
    }
}
