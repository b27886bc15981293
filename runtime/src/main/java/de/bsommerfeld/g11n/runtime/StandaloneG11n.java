package de.bsommerfeld.g11n.runtime;

import de.bsommerfeld.g11n.core.config.G11nConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide access to one {@link G11n} for code that cannot receive it
 * through injection.
 *
 * <pre>
 * StandaloneG11n.init(ConfigLoader.fromClasspath("g11n.json")).join();
 * String title = StandaloneG11n.get().t("app.title");
 * </pre>
 */
public final class StandaloneG11n {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneG11n.class);

    private static final AtomicReference<G11n> INSTANCE = new AtomicReference<>();

    private StandaloneG11n() {
    }

    /**
     * Creates, installs and initializes the shared instance. A second call
     * keeps the installed instance and returns its initialization.
     */
    public static CompletableFuture<G11n> init(G11nConfig config) {
        return init(new G11nModule(config));
    }

    public static synchronized CompletableFuture<G11n> init(G11nModule module) {
        G11n current = INSTANCE.get();
        if (current != null) {
            LOG.warn("StandaloneG11n already initialized, ignoring new configuration");
            return current.init().thenApply(ignored -> current);
        }
        G11n created = G11n.create(module);
        INSTANCE.set(created);
        return created.init().thenApply(ignored -> created);
    }

    /**
     * @throws NotInitializedException if nothing is installed
     */
    public static G11n get() {
        G11n current = INSTANCE.get();
        if (current == null) {
            throw new NotInitializedException("StandaloneG11n not initialized. Call StandaloneG11n.init() first.");
        }
        return current;
    }

    public static boolean isInstalled() {
        return INSTANCE.get() != null;
    }

    /** Installs an instance built elsewhere, e.g. by the application's injector. */
    public static void install(G11n g11n) {
        INSTANCE.set(g11n);
    }

    /** Removes the installed instance. */
    public static void reset() {
        INSTANCE.set(null);
    }
}
