package de.bsommerfeld.g11n.core.translate;

import com.google.inject.Singleton;
import de.bsommerfeld.g11n.core.bundle.BundleEntry;
import de.bsommerfeld.g11n.core.bundle.TranslationStore;
import de.bsommerfeld.g11n.core.config.G11nConfig;
import de.bsommerfeld.g11n.core.event.Diagnostics;
import de.bsommerfeld.g11n.core.interpolation.Interpolator;
import de.bsommerfeld.g11n.core.plural.Pluralizer;
import jakarta.inject.Inject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves keys to display strings against the cached bundles.
 *
 * <p>
 * A key is looked up in the requested locale, then once in the configured
 * fallback locale. When both miss, the caller's default value or the key
 * itself is returned and the miss is reported through {@link Diagnostics}.
 * The translator never loads bundles; namespaces must be cached beforehand.
 */
@Singleton
public class Translator {

    private final TranslationStore store;
    private final Interpolator interpolator;
    private final Pluralizer pluralizer;
    private final Diagnostics diagnostics;
    private final String fallbackLocale;
    private final String defaultNamespace;

    @Inject
    public Translator(TranslationStore store, Interpolator interpolator, Pluralizer pluralizer, G11nConfig config,
            Diagnostics diagnostics) {
        this.store = store;
        this.interpolator = interpolator;
        this.pluralizer = pluralizer;
        this.diagnostics = diagnostics;
        this.fallbackLocale = config.getFallbackLocale();
        this.defaultNamespace = config.getDefaultNamespace();
    }

    public String translate(String locale, String key) {
        return translate(locale, key, TranslationOptions.none());
    }

    public String translate(String locale, String key, TranslationOptions options) {
        if (options == null) {
            options = TranslationOptions.none();
        }
        String namespace = namespaceOf(options);

        String result = resolve(locale, namespace, key, options);
        if (result == null && fallbackLocale != null && !fallbackLocale.equals(locale)) {
            result = resolve(fallbackLocale, namespace, key, options);
        }
        if (result != null) {
            return result;
        }

        diagnostics.missingTranslation(locale, namespace, key);
        return options.getDefaultValue() != null ? options.getDefaultValue() : key;
    }

    /**
     * Whether {@code key} resolves to a text or plural entry in
     * {@code locale} or the fallback locale. Nothing is logged or recorded.
     *
     * @param namespace the namespace, or {@code null} for the default one
     */
    public boolean exists(String locale, String key, String namespace) {
        String ns = namespace != null ? namespace : defaultNamespace;
        if (isResolvable(store.lookup(locale, ns, key))) {
            return true;
        }
        return fallbackLocale != null && !fallbackLocale.equals(locale)
                && isResolvable(store.lookup(fallbackLocale, ns, key));
    }

    private String resolve(String locale, String namespace, String key, TranslationOptions options) {
        if (options.hasCount()) {
            return resolvePlural(locale, namespace, key, options);
        }

        String template = store.getTranslation(locale, namespace, key);
        if (template == null) {
            return null;
        }
        Map<String, Object> values = options.interpolationValues();
        return values.isEmpty() ? template : interpolator.interpolate(template, values);
    }

    private String resolvePlural(String locale, String namespace, String key, TranslationOptions options) {
        BundleEntry entry = store.lookup(locale, namespace, key);
        if (!isResolvable(entry)) {
            return null;
        }

        Number count = options.getCount();
        String template;
        if (entry instanceof BundleEntry.Text text) {
            template = text.value();
        } else {
            template = pluralizer.pluralize(locale, count.doubleValue(), entry, options.isOrdinal(),
                    options.getContext());
        }
        return interpolator.interpolate(template, withCount(options.interpolationValues(), count));
    }

    private static boolean isResolvable(BundleEntry entry) {
        return entry != null && !(entry instanceof BundleEntry.Branch);
    }

    private static Map<String, Object> withCount(Map<String, Object> values, Number count) {
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.put("count", count);
        return merged;
    }

    private String namespaceOf(TranslationOptions options) {
        String ns = options.getNs();
        return ns != null && !ns.isEmpty() ? ns : defaultNamespace;
    }
}
