package de.bsommerfeld.g11n.core.bundle;

import com.google.common.collect.ImmutableList;
import com.google.inject.Singleton;
import de.bsommerfeld.g11n.core.event.G11nEventBus;
import de.bsommerfeld.g11n.core.event.G11nEvents.NamespaceLoadedEvent;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory cache of loaded bundles keyed by locale and namespace.
 *
 * <h3>Loading</h3>
 * {@link #loadNamespace} returns immediately for cached namespaces. For
 * anything else the first caller registers an in-flight future and invokes
 * the {@link BundleLoader}; every concurrent caller asking for the same
 * (locale, namespace) receives that same future, so the loader runs once per
 * pair. The in-flight future is registered before the loader is called and
 * loader code never runs inside a map operation.
 *
 * <h3>Failures</h3>
 * A load that fails, throws or completes exceptionally is cached as an empty
 * bundle and not retried until the cache is cleared. Futures returned from
 * this class never complete exceptionally.
 *
 * <h3>Invalidation</h3>
 * Cached bundles never change in place. {@link #clearCache()} and
 * {@link #clearLocaleCache(String)} drop entries and bump a per-locale
 * generation; a load still in flight at that moment completes its waiters but
 * does not commit its result.
 *
 * <h3>Missing-key ledger</h3>
 * {@link #getTranslation} records every absent path as
 * {@code locale:namespace:key}, once per distinct path, until the next
 * {@link #clearCache()}. The ledger is for diagnostics and never influences
 * resolution.
 */
@Singleton
public class TranslationStore {

    private static final Logger LOG = LoggerFactory.getLogger(TranslationStore.class);

    private final BundleLoader loader;
    private final G11nEventBus eventBus;

    private final Map<String, Map<String, Bundle>> bundles = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> loading = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();
    private final Set<String> missingKeys = new LinkedHashSet<>();

    @Inject
    public TranslationStore(BundleLoader loader, G11nEventBus eventBus) {
        this.loader = loader;
        this.eventBus = eventBus;
    }

    public TranslationStore(BundleLoader loader) {
        this(loader, null);
    }

    /**
     * Makes sure the namespace is cached for the locale.
     *
     * @return a future that completes once the namespace is cached, possibly
     *         as an empty bundle; it never completes exceptionally
     */
    public CompletableFuture<Void> loadNamespace(String locale, String namespace) {
        if (hasNamespace(locale, namespace)) {
            return CompletableFuture.completedFuture(null);
        }

        String key = cacheKey(locale, namespace);
        CompletableFuture<Void> pending = new CompletableFuture<>();
        CompletableFuture<Void> inFlight = loading.putIfAbsent(key, pending);
        if (inFlight != null) {
            return inFlight;
        }

        // a commit may have landed between the first check and the registration
        if (hasNamespace(locale, namespace)) {
            loading.remove(key, pending);
            pending.complete(null);
            return pending;
        }

        long generation = generation(locale).get();
        fetch(locale, namespace).whenComplete((tree, error) -> {
            try {
                commit(locale, namespace, generation, tree, error);
            } finally {
                loading.remove(key, pending);
                pending.complete(null);
            }
        });
        return pending;
    }

    /**
     * Loads all given namespaces in parallel and completes when every one of
     * them is cached. A failing namespace is cached empty and does not affect
     * its siblings.
     */
    public CompletableFuture<Void> preloadLocale(String locale, Collection<String> namespaces) {
        CompletableFuture<?>[] loads = namespaces.stream()
                .map(namespace -> loadNamespace(locale, namespace))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(loads);
    }

    public boolean hasNamespace(String locale, String namespace) {
        Map<String, Bundle> localeBundles = bundles.get(locale);
        return localeBundles != null && localeBundles.containsKey(namespace);
    }

    /** Whether a load for the pair is currently in flight. */
    public boolean isLoading(String locale, String namespace) {
        return loading.containsKey(cacheKey(locale, namespace));
    }

    /** The cached bundle, or {@code null} when the namespace was never loaded. */
    public Bundle getBundle(String locale, String namespace) {
        Map<String, Bundle> localeBundles = bundles.get(locale);
        return localeBundles == null ? null : localeBundles.get(namespace);
    }

    /**
     * Returns the string at {@code key} (a dot path), or {@code null} when the
     * path is absent or leads to anything other than a string, plural objects
     * included. Absent paths are recorded in the missing-key ledger. A
     * namespace that was never loaded yields {@code null} without a ledger
     * entry.
     */
    public String getTranslation(String locale, String namespace, String key) {
        Bundle bundle = getBundle(locale, namespace);
        if (bundle == null) {
            return null;
        }
        String value = bundle.text(key);
        if (value == null) {
            trackMissingKey(locale + ":" + namespace + ":" + key);
        }
        return value;
    }

    /**
     * Returns the classified node at {@code key}, or {@code null} when the
     * namespace is not loaded or the path is absent. Nothing is recorded in
     * the ledger.
     */
    public BundleEntry lookup(String locale, String namespace, String key) {
        Bundle bundle = getBundle(locale, namespace);
        return bundle == null ? null : bundle.lookup(key);
    }

    /** Missing {@code locale:namespace:key} entries in the order first seen. */
    public List<String> getMissingKeys() {
        synchronized (missingKeys) {
            return ImmutableList.copyOf(missingKeys);
        }
    }

    /** Drops every cached bundle, every in-flight registration and the ledger. */
    public void clearCache() {
        generations.values().forEach(AtomicLong::incrementAndGet);
        bundles.clear();
        loading.clear();
        synchronized (missingKeys) {
            missingKeys.clear();
        }
        LOG.debug("Translation cache cleared");
    }

    /** Drops the cached bundles and in-flight registrations of one locale. */
    public void clearLocaleCache(String locale) {
        generation(locale).incrementAndGet();
        bundles.remove(locale);
        loading.keySet().removeIf(key -> key.startsWith(locale + ":"));
        LOG.debug("Translation cache cleared for locale {}", locale);
    }

    private CompletableFuture<Map<String, Object>> fetch(String locale, String namespace) {
        try {
            CompletableFuture<Map<String, Object>> future = loader.load(locale, namespace);
            return future == null ? CompletableFuture.completedFuture(Map.of()) : future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void commit(String locale, String namespace, long generation, Map<String, Object> tree,
            Throwable error) {
        String key = cacheKey(locale, namespace);
        if (generation(locale).get() != generation) {
            LOG.debug("Discarding result for {}, cache was cleared while loading", key);
            return;
        }

        Bundle bundle;
        if (error != null) {
            LOG.error("Failed to load namespace: {}", key, error);
            bundle = Bundle.empty();
        } else {
            bundle = Bundle.of(tree);
        }

        bundles.computeIfAbsent(locale, k -> new ConcurrentHashMap<>()).put(namespace, bundle);
        LOG.debug("Cached namespace {} ({} top-level keys)", key, bundle.asMap().size());
        if (eventBus != null) {
            eventBus.post(new NamespaceLoadedEvent(locale, namespace, bundle.isEmpty()));
        }
    }

    private AtomicLong generation(String locale) {
        return generations.computeIfAbsent(locale, k -> new AtomicLong());
    }

    private void trackMissingKey(String key) {
        synchronized (missingKeys) {
            missingKeys.add(key);
        }
    }

    private static String cacheKey(String locale, String namespace) {
        return locale + ":" + namespace;
    }
}
