package de.bsommerfeld.g11n.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.g11n.core.bundle.BundleLoader;
import de.bsommerfeld.g11n.core.config.G11nConfig;
import de.bsommerfeld.g11n.core.locale.HostLocaleSource;
import de.bsommerfeld.g11n.core.locale.InMemoryLocalePersistence;
import de.bsommerfeld.g11n.core.locale.LocalePersistence;
import de.bsommerfeld.g11n.core.locale.SystemHostLocaleSource;
import de.bsommerfeld.g11n.storage.ClasspathBundleLoader;
import de.bsommerfeld.g11n.storage.FileLocalePersistence;
import de.bsommerfeld.g11n.storage.LoadPathTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Guice wiring for the translation services.
 *
 * <pre>
 * Injector injector = Guice.createInjector(new G11nModule(ConfigLoader.fromClasspath("g11n.json")));
 * G11n g11n = injector.getInstance(G11n.class);
 * g11n.init().join();
 * </pre>
 *
 * Bundles are read from the classpath unless a different
 * {@link BundleLoader} is supplied. In {@link ApplicationMode#TEST} the
 * locale choice lives in memory and the host locale is ignored; in PROD it is
 * stored in the OS data directory of {@code appName}.
 */
public class G11nModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(G11nModule.class);

    static final String DEFAULT_APP_NAME = "g11n";

    private final G11nConfig config;
    private final BundleLoader loader;
    private final String appName;
    private final ApplicationMode mode;

    public G11nModule(G11nConfig config) {
        this(config, null, DEFAULT_APP_NAME, ApplicationMode.get());
    }

    public G11nModule(G11nConfig config, BundleLoader loader) {
        this(config, loader, DEFAULT_APP_NAME, ApplicationMode.get());
    }

    /**
     * @param loader  bundle loader, or {@code null} for classpath loading
     *                along the configured load path
     * @param appName directory name for the persisted locale in PROD mode
     */
    public G11nModule(G11nConfig config, BundleLoader loader, String appName, ApplicationMode mode) {
        this.config = config.validate();
        this.loader = loader;
        this.appName = appName;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(G11nConfig.class).toInstance(config);
        LOG.info("g11n mode initialized: {}", mode);

        if (mode.isTest()) {
            bind(LocalePersistence.class).to(InMemoryLocalePersistence.class);
            bind(HostLocaleSource.class).toInstance(List::of);
        } else {
            bind(LocalePersistence.class).toInstance(FileLocalePersistence.forApplication(appName));
            bind(HostLocaleSource.class).to(SystemHostLocaleSource.class);
        }

        if (loader != null) {
            bind(BundleLoader.class).toInstance(loader);
        } else {
            bind(BundleLoader.class).to(ClasspathBundleLoader.class);
        }
    }

    @Provides
    @Singleton
    ObjectMapper provideObjectMapper() {
        return new ObjectMapper();
    }

    @Provides
    @Singleton
    LoadPathTemplate provideLoadPathTemplate(G11nConfig config) {
        return new LoadPathTemplate(config.getLoadPath());
    }

    @Provides
    @Singleton
    ClasspathBundleLoader provideClasspathLoader(LoadPathTemplate template, ObjectMapper mapper, G11nConfig config) {
        return new ClasspathBundleLoader(template, mapper, config.isDebug());
    }

    public G11nConfig getConfig() {
        return config;
    }

    public ApplicationMode getMode() {
        return mode;
    }
}
