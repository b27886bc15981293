package de.bsommerfeld.g11n.runtime;

import com.google.inject.Guice;
import com.google.inject.Singleton;
import de.bsommerfeld.g11n.core.bundle.TranslationStore;
import de.bsommerfeld.g11n.core.config.G11nConfig;
import de.bsommerfeld.g11n.core.locale.InvalidLocaleException;
import de.bsommerfeld.g11n.core.locale.LocaleChangeListener;
import de.bsommerfeld.g11n.core.locale.LocaleCodes;
import de.bsommerfeld.g11n.core.locale.LocaleInfo;
import de.bsommerfeld.g11n.core.locale.LocaleManager;
import de.bsommerfeld.g11n.core.locale.Subscription;
import de.bsommerfeld.g11n.core.locale.TextDirection;
import de.bsommerfeld.g11n.core.translate.TranslationOptions;
import de.bsommerfeld.g11n.core.translate.Translator;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for translating in the current locale.
 *
 * <h3>Lifecycle</h3>
 * A new instance is {@link G11nState#UNINITIALIZED}. {@link #init()} preloads
 * the configured namespaces for the current locale and moves to
 * {@link G11nState#READY}; every other operation throws
 * {@link NotInitializedException} before that.
 *
 * <h3>Switching locales</h3>
 * {@link #changeLocale(String)} loads the target's namespaces before the
 * switch becomes visible, so subscribers never observe a locale whose bundles
 * are missing. When several switches overlap only the most recent request is
 * committed; earlier ones complete without touching the locale.
 */
@Singleton
public class G11n {

    private static final Logger LOG = LoggerFactory.getLogger(G11n.class);

    private final G11nConfig config;
    private final LocaleManager localeManager;
    private final TranslationStore store;
    private final Translator translator;

    private final AtomicLong latestLocaleRequest = new AtomicLong();

    private volatile G11nState state = G11nState.UNINITIALIZED;
    private CompletableFuture<Void> initialization;

    @Inject
    public G11n(G11nConfig config, LocaleManager localeManager, TranslationStore store, Translator translator) {
        this.config = config;
        this.localeManager = localeManager;
        this.store = store;
        this.translator = translator;
    }

    /** Builds an uninitialized instance through {@link G11nModule}. */
    public static G11n create(G11nConfig config) {
        return create(new G11nModule(config));
    }

    public static G11n create(G11nModule module) {
        return Guice.createInjector(module).getInstance(G11n.class);
    }

    /**
     * Loads the configured namespaces for the current locale.
     *
     * @return a future that completes when the instance is ready; repeated
     *         calls return the first call's future
     */
    public synchronized CompletableFuture<Void> init() {
        if (state != G11nState.UNINITIALIZED) {
            LOG.warn("g11n already initialized (state: {})", state);
            return initialization;
        }

        state = G11nState.INITIALIZING;
        String locale = localeManager.getCurrentLocale();
        LOG.info("Initializing g11n for locale {} with namespaces {}", locale, config.getNamespaces());

        initialization = store.preloadLocale(locale, config.getNamespaces())
                .whenComplete((ignored, error) -> {
                    state = G11nState.READY;
                    LOG.info("g11n ready");
                });
        return initialization;
    }

    public G11nState getState() {
        return state;
    }

    public boolean isReady() {
        return state == G11nState.READY;
    }

    /** Translates {@code key} in the current locale. */
    public String t(String key) {
        return t(key, TranslationOptions.none());
    }

    public String t(String key, TranslationOptions options) {
        requireReady();
        return translator.translate(localeManager.getCurrentLocale(), key, options);
    }

    /** Translates with a flat option map, see {@link TranslationOptions#fromMap(Map)}. */
    public String t(String key, Map<String, ?> options) {
        return t(key, TranslationOptions.fromMap(options));
    }

    /** Whether {@code key} resolves in the current or fallback locale. */
    public boolean exists(String key, String namespace) {
        requireReady();
        return translator.exists(localeManager.getCurrentLocale(), key, namespace);
    }

    public String getLocale() {
        requireReady();
        return localeManager.getCurrentLocale();
    }

    public List<LocaleInfo> getSupportedLocales() {
        requireReady();
        return localeManager.getSupportedLocales();
    }

    /**
     * Switches to {@code locale} once its namespaces are loaded.
     *
     * @return a future with the locale that is current after this request
     *         settles; if a newer request superseded this one, that is not
     *         necessarily {@code locale}
     * @throws InvalidLocaleException if the locale is not supported; thrown
     *                                before anything is loaded
     */
    public CompletableFuture<String> changeLocale(String locale) {
        requireReady();
        String normalized = LocaleCodes.normalize(locale);
        if (!localeManager.isLocaleSupported(normalized)) {
            throw new InvalidLocaleException(normalized, localeManager.getSupportedLocaleCodes());
        }

        long request = latestLocaleRequest.incrementAndGet();
        return store.preloadLocale(normalized, config.getNamespaces())
                .thenApply(ignored -> commitLocale(request, normalized));
    }

    private synchronized String commitLocale(long request, String locale) {
        if (request != latestLocaleRequest.get()) {
            LOG.debug("Discarding locale change to {}, superseded by a newer request", locale);
        } else {
            localeManager.setLocale(locale);
        }
        return localeManager.getCurrentLocale();
    }

    public Subscription subscribe(LocaleChangeListener listener) {
        requireReady();
        return localeManager.subscribe(listener);
    }

    /** Loads additional namespaces for the current locale. */
    public CompletableFuture<Void> loadNamespaces(Collection<String> namespaces) {
        requireReady();
        return store.preloadLocale(localeManager.getCurrentLocale(), namespaces);
    }

    public List<String> getMissingKeys() {
        requireReady();
        return store.getMissingKeys();
    }

    public TextDirection getTextDirection() {
        requireReady();
        return localeManager.getTextDirection();
    }

    /** The underlying locale state, for collaborators that need more than this facade. */
    public LocaleManager getLocaleManager() {
        return localeManager;
    }

    public TranslationStore getStore() {
        return store;
    }

    private void requireReady() {
        if (state != G11nState.READY) {
            throw new NotInitializedException("g11n not initialized (state: " + state + "). Call init() first.");
        }
    }
}
