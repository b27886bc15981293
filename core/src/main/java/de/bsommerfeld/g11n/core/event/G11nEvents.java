package de.bsommerfeld.g11n.core.event;

import java.util.List;

/**
 * Events posted on the {@link G11nEventBus}. None of them influence the
 * outcome of a translation; they exist for listeners and diagnostics.
 */
public class G11nEvents {

    /**
     * Fired after the current locale changed and the new choice was handed to
     * persistence.
     */
    public record LocaleChangedEvent(String previousLocale, String locale) {
    }

    /**
     * Fired when a key could not be resolved in the requested nor the fallback
     * locale and the translator returned the default value or the key itself.
     */
    public record MissingTranslationEvent(String locale, String namespace, String key) {
    }

    /**
     * Fired once per interpolation pass that left placeholders untouched.
     */
    public record MissingVariablesEvent(String template, List<String> variables) {
        public MissingVariablesEvent {
            variables = List.copyOf(variables);
        }
    }

    /**
     * Fired when a namespace has been committed to the cache. {@code empty} is
     * true when the loader produced nothing, typically because it failed.
     */
    public record NamespaceLoadedEvent(String locale, String namespace, boolean empty) {
    }
}
