package de.bsommerfeld.g11n.core.locale;

/** Handle returned by a subscribe call. Unsubscribing twice is harmless. */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
