package de.bsommerfeld.g11n.core.locale;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import de.bsommerfeld.g11n.core.config.G11nConfig;
import de.bsommerfeld.g11n.core.event.G11nEventBus;
import de.bsommerfeld.g11n.core.event.G11nEvents.LocaleChangedEvent;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds the current locale and is the only place it changes.
 *
 * <p>
 * The initial locale is chosen once, at construction, in this order:
 * <ol>
 * <li>the explicit initial locale, if supported</li>
 * <li>the persisted choice from {@link LocalePersistence}, if supported</li>
 * <li>the host preference from {@link HostLocaleSource}, if it differs from
 * the default</li>
 * <li>the configured default locale</li>
 * </ol>
 *
 * <p>
 * {@link #setLocale(String)} is the single mutation path. It validates,
 * skips no-op changes, persists the choice and then notifies subscribers
 * synchronously in registration order. Subscribers registered here receive
 * the new code; the shared {@link G11nEventBus} additionally receives a
 * {@link LocaleChangedEvent}.
 *
 * <p>
 * This class does not load translations. Callers that switch locales are
 * responsible for preloading the new locale's namespaces first.
 */
@Singleton
public class LocaleManager {

    private static final Logger LOG = LoggerFactory.getLogger(LocaleManager.class);

    private final List<String> supportedLocales;
    private final String defaultLocale;
    private final String fallbackLocale;
    private final boolean debug;
    private final LocalePersistence persistence;
    private final HostLocaleSource hostLocaleSource;
    private final G11nEventBus eventBus;

    /** Private bus so subscribers only ever see this manager's changes. */
    private final G11nEventBus listenerBus = new G11nEventBus();
    private final List<ListenerAdapter> listeners = new CopyOnWriteArrayList<>();

    private volatile String currentLocale;

    @Inject
    public LocaleManager(G11nConfig config, LocalePersistence persistence, HostLocaleSource hostLocaleSource,
            G11nEventBus eventBus) {
        this(config, persistence, hostLocaleSource, eventBus, null);
    }

    public LocaleManager(G11nConfig config, LocalePersistence persistence, HostLocaleSource hostLocaleSource,
            G11nEventBus eventBus, String initialLocale) {
        this.supportedLocales = List.copyOf(config.getSupportedLocales());
        this.defaultLocale = config.getDefaultLocale();
        this.fallbackLocale = config.getFallbackLocale();
        this.debug = config.isDebug();
        this.persistence = persistence;
        this.hostLocaleSource = hostLocaleSource;
        this.eventBus = eventBus;
        this.currentLocale = determineInitialLocale(initialLocale);
        LOG.info("LocaleManager initialized with locale: {}", currentLocale);
    }

    private String determineInitialLocale(String initialLocale) {
        if (initialLocale != null && !initialLocale.isEmpty()) {
            String normalized = LocaleCodes.normalize(initialLocale);
            if (isLocaleSupported(normalized)) {
                return normalized;
            }
            LOG.warn("Initial locale '{}' is not supported. Falling back.", initialLocale);
        }

        String persisted = readPersisted();
        if (persisted != null && !persisted.isEmpty()) {
            String normalized = LocaleCodes.normalize(persisted);
            if (isLocaleSupported(normalized)) {
                LOG.debug("Using persisted locale: {}", normalized);
                return normalized;
            }
        }

        String detected = LocaleDetector.findBestMatchingLocale(hostPreferences(), supportedLocales, defaultLocale);
        if (!detected.equals(defaultLocale)) {
            LOG.debug("Using detected host locale: {}", detected);
            return detected;
        }

        LOG.debug("Using default locale: {}", defaultLocale);
        return defaultLocale;
    }

    /** Returns the current normalized locale code. */
    public String getCurrentLocale() {
        return currentLocale;
    }

    /** Whether {@code locale}, once normalized, is in the supported set. */
    public boolean isLocaleSupported(String locale) {
        return LocaleDetector.isLocaleSupported(locale, supportedLocales);
    }

    /** Normalized supported locale codes in configured order. */
    public List<String> getSupportedLocaleCodes() {
        return supportedLocales;
    }

    public String getFallbackLocale() {
        return fallbackLocale;
    }

    /**
     * Switches the current locale.
     *
     * @param locale the requested locale, any tag form ({@code es-MX} works)
     * @throws InvalidLocaleException if the normalized code is not supported
     */
    public synchronized void setLocale(String locale) {
        String normalized = LocaleCodes.normalize(locale);
        if (!isLocaleSupported(normalized)) {
            throw new InvalidLocaleException(normalized, supportedLocales);
        }

        if (normalized.equals(currentLocale)) {
            LOG.debug("Locale is already set to: {}", normalized);
            return;
        }

        String previous = currentLocale;
        currentLocale = normalized;
        LOG.info("Switching locale from {} to {}", previous, normalized);

        persist(normalized);

        listenerBus.post(new LocaleChangedEvent(previous, normalized));
        if (eventBus != null) {
            eventBus.post(new LocaleChangedEvent(previous, normalized));
        }
    }

    /** Sets the locale back to the configured fallback locale. */
    public void resetToDefault() {
        setLocale(fallbackLocale);
    }

    /**
     * Returns the first host preference that is supported, or the configured
     * fallback locale if none is.
     */
    public String detectPreferredLocale() {
        return LocaleDetector.findBestMatchingLocale(hostPreferences(), supportedLocales, fallbackLocale);
    }

    /**
     * Registers a listener for locale changes.
     *
     * @return a handle that removes the listener again
     */
    public Subscription subscribe(LocaleChangeListener listener) {
        ListenerAdapter adapter = new ListenerAdapter(listener);
        listeners.add(adapter);
        listenerBus.register(adapter);
        return () -> {
            if (listeners.remove(adapter)) {
                listenerBus.unregister(adapter);
            }
        };
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public List<LocaleInfo> getSupportedLocales() {
        List<LocaleInfo> infos = new ArrayList<>(supportedLocales.size());
        for (String code : supportedLocales) {
            infos.add(getLocaleInfo(code));
        }
        return infos;
    }

    public LocaleInfo getLocaleInfo(String locale) {
        return LocaleMetadata.lookup(locale);
    }

    public TextDirection getTextDirection() {
        return getTextDirectionForLocale(currentLocale);
    }

    public TextDirection getTextDirectionForLocale(String locale) {
        return getLocaleInfo(locale).direction();
    }

    private void persist(String locale) {
        boolean stored;
        try {
            stored = persistence.set(locale);
        } catch (RuntimeException e) {
            LOG.warn("Locale persistence threw while storing '{}'", locale, e);
            return;
        }
        if (!stored) {
            if (debug) {
                LOG.warn("Failed to persist locale '{}'", locale);
            } else {
                LOG.debug("Failed to persist locale '{}'", locale);
            }
        }
    }

    private String readPersisted() {
        try {
            return persistence.get();
        } catch (RuntimeException e) {
            LOG.warn("Locale persistence threw while reading", e);
            return null;
        }
    }

    private List<String> hostPreferences() {
        try {
            List<String> preferences = hostLocaleSource.preferredLocales();
            return preferences == null ? List.of() : preferences;
        } catch (RuntimeException e) {
            LOG.warn("Host locale source failed", e);
            return List.of();
        }
    }

    static final class ListenerAdapter {

        private final LocaleChangeListener listener;

        ListenerAdapter(LocaleChangeListener listener) {
            this.listener = listener;
        }

        @Subscribe
        public void onLocaleChanged(LocaleChangedEvent event) {
            listener.onLocaleChanged(event.locale());
        }
    }
}
