package de.bsommerfeld.g11n.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Placeholder delimiters and output escaping for the interpolator.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InterpolationConfig {

    @JsonProperty("prefix")
    private String prefix = "{{";

    @JsonProperty("suffix")
    private String suffix = "}}";

    @JsonProperty("escapeValue")
    private boolean escapeValue = true;

    public InterpolationConfig() {
    }

    public InterpolationConfig(String prefix, String suffix, boolean escapeValue) {
        this.prefix = prefix;
        this.suffix = suffix;
        this.escapeValue = escapeValue;
    }

    public String getPrefix() {
        return prefix == null || prefix.isEmpty() ? "{{" : prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public String getSuffix() {
        return suffix == null || suffix.isEmpty() ? "}}" : suffix;
    }

    public void setSuffix(String suffix) {
        this.suffix = suffix;
    }

    public boolean isEscapeValue() {
        return escapeValue;
    }

    public void setEscapeValue(boolean escapeValue) {
        this.escapeValue = escapeValue;
    }
}
