package de.bsommerfeld.g11n.core.interpolation;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Singleton;
import de.bsommerfeld.g11n.core.config.G11nConfig;
import de.bsommerfeld.g11n.core.config.InterpolationConfig;
import de.bsommerfeld.g11n.core.event.Diagnostics;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code {{name}}} placeholders in templates.
 *
 * <p>
 * Placeholder names are trimmed and may address nested values with dots
 * ({@code {{user.name}}}). A placeholder without a value stays in the output
 * verbatim and is reported through {@link Diagnostics}. Values are HTML
 * escaped unless {@link InterpolationConfig#isEscapeValue()} is off.
 */
@Singleton
public class Interpolator {

    private static final Map<Character, String> ESCAPES = ImmutableMap.<Character, String>builder()
            .put('&', "&amp;")
            .put('<', "&lt;")
            .put('>', "&gt;")
            .put('"', "&quot;")
            .put('\'', "&#39;")
            .put('/', "&#x2F;")
            .build();

    private final Pattern placeholder;
    private final boolean escapeValue;
    private final Diagnostics diagnostics;

    @Inject
    public Interpolator(G11nConfig config, Diagnostics diagnostics) {
        this(config.getInterpolation(), diagnostics);
    }

    public Interpolator(InterpolationConfig config, Diagnostics diagnostics) {
        this.placeholder = compile(config.getPrefix(), config.getSuffix());
        this.escapeValue = config.isEscapeValue();
        this.diagnostics = diagnostics;
    }

    public Interpolator() {
        this(new InterpolationConfig(), Diagnostics.silent());
    }

    public String interpolate(String template, Map<String, ?> values) {
        return interpolateDetailed(template, values).text();
    }

    public InterpolationResult interpolateDetailed(String template, Map<String, ?> values) {
        if (template == null || template.isEmpty()) {
            return new InterpolationResult(template, List.of());
        }

        List<String> missing = new ArrayList<>();
        Matcher matcher = placeholder.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            Object value = resolve(values, name);
            String replacement;
            if (value == null) {
                if (!missing.contains(name)) {
                    missing.add(name);
                }
                replacement = matcher.group();
            } else {
                String text = stringify(value);
                replacement = escapeValue ? escape(text) : text;
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);

        if (!missing.isEmpty()) {
            diagnostics.missingVariables(template, missing);
        }
        return new InterpolationResult(out.toString(), missing);
    }

    /** HTML-escapes {@code & < > " ' /} in a single pass. */
    public static String escape(String text) {
        StringBuilder out = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String escaped = ESCAPES.get(c);
            if (escaped != null) {
                if (out == null) {
                    out = new StringBuilder(text.length() + 16).append(text, 0, i);
                }
                out.append(escaped);
            } else if (out != null) {
                out.append(c);
            }
        }
        return out == null ? text : out.toString();
    }

    private static Object resolve(Map<String, ?> values, String path) {
        if (values == null) {
            return null;
        }
        Object current = values;
        for (String segment : path.split("\\.", -1)) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Text of a value as it appears in a template. Whole doubles and floats
     * drop their fraction ({@code 3.0} becomes {@code "3"}), other fractions
     * are kept ({@code "1.5"}).
     */
    public static String stringify(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
        }
        return String.valueOf(value);
    }

    private static Pattern compile(String prefix, String suffix) {
        StringBuilder excluded = new StringBuilder();
        for (char c : suffix.toCharArray()) {
            if (!Character.isLetterOrDigit(c)) {
                excluded.append('\\');
            }
            excluded.append(c);
        }
        return Pattern.compile(Pattern.quote(prefix) + "\\s*([^" + excluded + "]+?)\\s*" + Pattern.quote(suffix));
    }
}
