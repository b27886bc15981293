package de.bsommerfeld.g11n.core.locale;

/** Callback for locale changes; receives the new normalized locale code. */
@FunctionalInterface
public interface LocaleChangeListener {

    void onLocaleChanged(String locale);
}
