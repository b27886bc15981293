package de.bsommerfeld.g11n.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.g11n.core.locale.LocaleCodes;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration of the translation system.
 *
 * <p>
 * Only {@link #getDefaultLocale() defaultLocale} and
 * {@link #getSupportedLocales() supportedLocales} are required. Every other
 * field falls back to a documented default when left unset, so a minimal
 * {@code g11n.json} looks like:
 *
 * <pre>
 * {
 *   "defaultLocale": "en",
 *   "supportedLocales": ["en", "es", "fr"]
 * }
 * </pre>
 *
 * Call {@link #validate()} before handing a programmatically built instance
 * to the services; the runtime loader does so automatically.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class G11nConfig {

    public static final String DEFAULT_NAMESPACE = "common";
    public static final String DEFAULT_LOAD_PATH = "locales/{{locale}}/{{namespace}}.json";

    @JsonProperty("defaultLocale")
    private String defaultLocale;

    @JsonProperty("supportedLocales")
    private List<String> supportedLocales = new ArrayList<>();

    @JsonProperty("fallbackLocale")
    private String fallbackLocale;

    @JsonProperty("namespaces")
    private List<String> namespaces;

    @JsonProperty("defaultNamespace")
    private String defaultNamespace;

    @JsonProperty("loadPath")
    private String loadPath;

    @JsonProperty("debug")
    private boolean debug = false;

    @JsonProperty("interpolation")
    private InterpolationConfig interpolation = new InterpolationConfig();

    @JsonProperty("pluralization")
    private PluralizationConfig pluralization = new PluralizationConfig();

    public G11nConfig() {
    }

    public G11nConfig(String defaultLocale, List<String> supportedLocales) {
        this.defaultLocale = defaultLocale;
        this.supportedLocales = new ArrayList<>(supportedLocales);
    }

    /**
     * Checks the required fields and the relation between default, fallback
     * and supported locales.
     *
     * @return this instance, for chaining
     * @throws ConfigurationException if the configuration cannot be used
     */
    public G11nConfig validate() {
        if (defaultLocale == null || defaultLocale.isBlank()) {
            throw new ConfigurationException("defaultLocale is required");
        }
        if (supportedLocales == null || supportedLocales.isEmpty()) {
            throw new ConfigurationException("supportedLocales must contain at least one locale");
        }
        List<String> supported = getSupportedLocales();
        if (!supported.contains(getDefaultLocale())) {
            throw new ConfigurationException("defaultLocale '" + defaultLocale
                    + "' is not one of the supported locales " + supported);
        }
        if (!supported.contains(getFallbackLocale())) {
            throw new ConfigurationException("fallbackLocale '" + fallbackLocale
                    + "' is not one of the supported locales " + supported);
        }
        return this;
    }

    /** Normalized default locale, e.g. {@code en} for {@code en-US}. */
    public String getDefaultLocale() {
        return defaultLocale == null ? null : LocaleCodes.normalize(defaultLocale);
    }

    public void setDefaultLocale(String defaultLocale) {
        this.defaultLocale = defaultLocale;
    }

    /** Normalized supported locales in configured order, without duplicates. */
    public List<String> getSupportedLocales() {
        List<String> normalized = new ArrayList<>();
        if (supportedLocales == null) {
            return normalized;
        }
        for (String code : supportedLocales) {
            String n = LocaleCodes.normalize(code);
            if (!n.isEmpty() && !normalized.contains(n)) {
                normalized.add(n);
            }
        }
        return normalized;
    }

    public void setSupportedLocales(List<String> supportedLocales) {
        this.supportedLocales = supportedLocales == null ? new ArrayList<>() : new ArrayList<>(supportedLocales);
    }

    /** Configured fallback locale, or the default locale when none is set. */
    public String getFallbackLocale() {
        if (fallbackLocale == null || fallbackLocale.isBlank()) {
            return getDefaultLocale();
        }
        return LocaleCodes.normalize(fallbackLocale);
    }

    public void setFallbackLocale(String fallbackLocale) {
        this.fallbackLocale = fallbackLocale;
    }

    /** Namespaces preloaded on init and on every locale change. */
    public List<String> getNamespaces() {
        if (namespaces == null || namespaces.isEmpty()) {
            return List.of(getDefaultNamespace());
        }
        return List.copyOf(namespaces);
    }

    public void setNamespaces(List<String> namespaces) {
        this.namespaces = namespaces == null ? null : new ArrayList<>(namespaces);
    }

    public String getDefaultNamespace() {
        return defaultNamespace == null || defaultNamespace.isBlank() ? DEFAULT_NAMESPACE : defaultNamespace;
    }

    public void setDefaultNamespace(String defaultNamespace) {
        this.defaultNamespace = defaultNamespace;
    }

    public String getLoadPath() {
        return loadPath == null || loadPath.isBlank() ? DEFAULT_LOAD_PATH : loadPath;
    }

    public void setLoadPath(String loadPath) {
        this.loadPath = loadPath;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public InterpolationConfig getInterpolation() {
        return interpolation;
    }

    public void setInterpolation(InterpolationConfig interpolation) {
        this.interpolation = interpolation == null ? new InterpolationConfig() : interpolation;
    }

    public PluralizationConfig getPluralization() {
        return pluralization;
    }

    public void setPluralization(PluralizationConfig pluralization) {
        this.pluralization = pluralization == null ? new PluralizationConfig() : pluralization;
    }
}
