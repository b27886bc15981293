package de.bsommerfeld.g11n.core.locale;

/**
 * Remembers the user's locale choice across sessions.
 *
 * <p>
 * Implementations must catch and swallow every storage failure (quota,
 * permissions, unavailable medium) and report it through the return value.
 * A failure only means the choice is not remembered; the current session
 * keeps working.
 */
public interface LocalePersistence {

    /** Returns the stored locale code, or {@code null} if none or unreadable. */
    String get();

    /** Stores the locale code; returns {@code false} if it could not be written. */
    boolean set(String locale);

    /** Forgets the stored code; returns {@code false} if it could not be removed. */
    boolean clear();
}
