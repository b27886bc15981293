package de.bsommerfeld.g11n.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Running mode of the embedding application. In {@link #TEST} mode the
 * locale choice is kept in memory and host preferences are ignored, so test
 * runs neither read nor write the user's data directory.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    static final String PROPERTY = "g11n.mode";
    static final String ENV = "G11N_MODE";

    /**
     * Resolves the mode from the {@code g11n.mode} system property or the
     * {@code G11N_MODE} environment variable. Defaults to PROD if neither is
     * set or the value is unknown.
     */
    public static ApplicationMode get() {
        return resolve(System.getProperty(PROPERTY), System.getenv(ENV));
    }

    static ApplicationMode resolve(String property, String env) {
        String mode = property;
        if (mode == null || mode.isEmpty()) {
            mode = env;
        }

        if (mode == null || mode.isEmpty()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown g11n mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
