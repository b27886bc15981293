package de.bsommerfeld.g11n.core.translate;

import com.google.common.collect.ImmutableSet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-call options of a translation.
 *
 * <p>
 * Build with {@link #builder()} or convert a flat option map with
 * {@link #fromMap(Map)}. Anything that is not one of the reserved option
 * names becomes an interpolation variable.
 */
public final class TranslationOptions {

    /** Option names that never reach the template as variables. */
    public static final Set<String> RESERVED = ImmutableSet.of(
            "count", "ordinal", "context", "defaultValue", "ns", "interpolation");

    private static final TranslationOptions NONE = builder().build();

    private final Number count;
    private final boolean ordinal;
    private final String context;
    private final String defaultValue;
    private final String ns;
    private final Map<String, Object> interpolation;
    private final Map<String, Object> variables;

    private TranslationOptions(Builder builder) {
        this.count = builder.count;
        this.ordinal = builder.ordinal;
        this.context = builder.context;
        this.defaultValue = builder.defaultValue;
        this.ns = builder.ns;
        this.interpolation = builder.interpolation == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.interpolation));
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
    }

    public static TranslationOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Splits a flat option map into reserved options and variables.
     * {@code count} accepts any finite {@link Number}, kept as given, or a
     * numeric string such as {@code "5"} or {@code "1.5"};
     * {@code interpolation} must be a map to take effect.
     *
     * @throws IllegalArgumentException if {@code count} is not numeric
     */
    @SuppressWarnings("unchecked")
    public static TranslationOptions fromMap(Map<String, ?> options) {
        Builder builder = builder();
        if (options == null) {
            return builder.build();
        }
        options.forEach((name, value) -> {
            switch (name) {
                case "count":
                    builder.count(toCount(value));
                    break;
                case "ordinal":
                    builder.ordinal(Boolean.TRUE.equals(value) || "true".equals(value));
                    break;
                case "context":
                    builder.context(value == null ? null : String.valueOf(value));
                    break;
                case "defaultValue":
                    builder.defaultValue(value == null ? null : String.valueOf(value));
                    break;
                case "ns":
                    builder.ns(value == null ? null : String.valueOf(value));
                    break;
                case "interpolation":
                    if (value instanceof Map<?, ?> map) {
                        builder.interpolation((Map<String, ?>) map);
                    }
                    break;
                default:
                    builder.var(name, value);
            }
        });
        return builder.build();
    }

    private static Number toCount(Object value) {
        if (value == null || value instanceof Number) {
            return (Number) value;
        }
        String text = String.valueOf(value).trim();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException notWhole) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("count must be numeric, got: " + value, e);
            }
        }
    }

    /** The count as given, or {@code null}. Fractions are preserved. */
    public Number getCount() {
        return count;
    }

    public boolean hasCount() {
        return count != null;
    }

    public boolean isOrdinal() {
        return ordinal;
    }

    public String getContext() {
        return context;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public String getNs() {
        return ns;
    }

    /** The explicit interpolation map, or {@code null} if none was given. */
    public Map<String, Object> getInterpolation() {
        return interpolation;
    }

    /** Variables collected from non-reserved option names. */
    public Map<String, Object> getVariables() {
        return variables;
    }

    /**
     * The variable bag handed to the interpolator: the explicit
     * interpolation map when present, the collected variables otherwise.
     */
    public Map<String, Object> interpolationValues() {
        return interpolation != null ? interpolation : variables;
    }

    @Override
    public String toString() {
        return "TranslationOptions{count=" + count + ", ordinal=" + ordinal + ", context=" + context
                + ", ns=" + ns + ", variables=" + interpolationValues().keySet() + "}";
    }

    public static final class Builder {

        private Number count;
        private boolean ordinal;
        private String context;
        private String defaultValue;
        private String ns;
        private Map<String, ?> interpolation;
        private final Map<String, Object> variables = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if {@code count} is NaN or infinite
         */
        public Builder count(Number count) {
            if (count != null && !Double.isFinite(count.doubleValue())) {
                throw new IllegalArgumentException("count must be finite, got: " + count);
            }
            this.count = count;
            return this;
        }

        public Builder count(long count) {
            return count(Long.valueOf(count));
        }

        public Builder count(double count) {
            return count(Double.valueOf(count));
        }

        public Builder ordinal(boolean ordinal) {
            this.ordinal = ordinal;
            return this;
        }

        public Builder context(String context) {
            this.context = context;
            return this;
        }

        public Builder defaultValue(String defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder ns(String ns) {
            this.ns = ns;
            return this;
        }

        public Builder interpolation(Map<String, ?> interpolation) {
            this.interpolation = interpolation;
            return this;
        }

        /**
         * Adds a template variable.
         *
         * @throws IllegalArgumentException if {@code name} is a reserved option
         */
        public Builder var(String name, Object value) {
            if (RESERVED.contains(name)) {
                throw new IllegalArgumentException("'" + name + "' is a reserved option name");
            }
            variables.put(name, value);
            return this;
        }

        public TranslationOptions build() {
            return new TranslationOptions(this);
        }
    }
}
