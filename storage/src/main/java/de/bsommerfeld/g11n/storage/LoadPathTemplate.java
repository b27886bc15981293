package de.bsommerfeld.g11n.storage;

import com.google.common.base.Preconditions;
import de.bsommerfeld.g11n.core.config.G11nConfig;

/**
 * Load-path pattern such as {@code locales/{{locale}}/{{namespace}}.json}.
 *
 * <p>
 * {@code {{locale}}} and its alias {@code {{lng}}} expand to the locale code,
 * {@code {{namespace}}} and {@code {{ns}}} to the namespace. Every occurrence
 * is replaced; other text is kept as is.
 */
public final class LoadPathTemplate {

    private final String pattern;

    public LoadPathTemplate(String pattern) {
        Preconditions.checkArgument(pattern != null && !pattern.isBlank(), "load path must not be blank");
        this.pattern = pattern;
    }

    public static LoadPathTemplate defaultTemplate() {
        return new LoadPathTemplate(G11nConfig.DEFAULT_LOAD_PATH);
    }

    public String resolve(String locale, String namespace) {
        return pattern
                .replace("{{locale}}", locale)
                .replace("{{lng}}", locale)
                .replace("{{namespace}}", namespace)
                .replace("{{ns}}", namespace);
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
