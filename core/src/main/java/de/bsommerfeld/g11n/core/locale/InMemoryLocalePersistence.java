package de.bsommerfeld.g11n.core.locale;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the locale choice for the lifetime of the process only.
 */
public class InMemoryLocalePersistence implements LocalePersistence {

    private final AtomicReference<String> value = new AtomicReference<>();

    public InMemoryLocalePersistence() {
    }

    public InMemoryLocalePersistence(String initial) {
        value.set(initial);
    }

    @Override
    public String get() {
        return value.get();
    }

    @Override
    public boolean set(String locale) {
        value.set(locale);
        return true;
    }

    @Override
    public boolean clear() {
        value.set(null);
        return true;
    }
}
