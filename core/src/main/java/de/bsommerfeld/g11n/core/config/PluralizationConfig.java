package de.bsommerfeld.g11n.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pluralization switches. {@code simplifyPluralSuffix} is accepted for
 * compatibility with existing configuration files and has no effect yet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PluralizationConfig {

    @JsonProperty("simplifyPluralSuffix")
    private boolean simplifyPluralSuffix = true;

    public boolean isSimplifyPluralSuffix() {
        return simplifyPluralSuffix;
    }

    public void setSimplifyPluralSuffix(boolean simplifyPluralSuffix) {
        this.simplifyPluralSuffix = simplifyPluralSuffix;
    }
}
