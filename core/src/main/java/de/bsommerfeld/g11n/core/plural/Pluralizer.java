package de.bsommerfeld.g11n.core.plural;

import com.google.inject.Singleton;
import de.bsommerfeld.g11n.core.bundle.BundleEntry;
import de.bsommerfeld.g11n.core.interpolation.Interpolator;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the template for a count out of a plural entry.
 *
 * <p>
 * Resolution order, first hit wins:
 * <ol>
 * <li>an exact count key ({@code "0"}, {@code "7"}, {@code "1.5"}) written
 * the way the count is rendered into templates, or, failing that, the
 * first interval key in document order whose range contains the count
 * ({@code "2-5"} inclusive, {@code "10+"})</li>
 * <li>the CLDR form inside the forms of the requested grammatical context,
 * when the entry has one</li>
 * <li>the CLDR form of the outer forms, then their {@code other} form</li>
 * <li>the count itself as text</li>
 * </ol>
 */
@Singleton
public class Pluralizer {

    private static final Pattern RANGE = Pattern.compile("^(\\d+)-(\\d+)$");
    private static final Pattern OPEN_RANGE = Pattern.compile("^(\\d+)\\+$");

    public String pluralize(String locale, double count, BundleEntry entry, boolean ordinal, String context) {
        if (entry instanceof BundleEntry.Forms forms) {
            return pluralize(locale, count, forms.forms(), Map.of(), ordinal, context);
        }
        if (entry instanceof BundleEntry.Context contextual) {
            return pluralize(locale, count, contextual.forms(), contextual.contexts(), ordinal, context);
        }
        if (entry instanceof BundleEntry.Text text) {
            return text.value();
        }
        return Interpolator.stringify(count);
    }

    public String pluralize(String locale, double count, Map<String, String> forms, boolean ordinal) {
        return pluralize(locale, count, forms, Map.of(), ordinal, null);
    }

    private String pluralize(String locale, double count, Map<String, String> forms,
            Map<String, BundleEntry.Forms> contexts, boolean ordinal, String context) {
        String override = findOverride(count, forms);
        if (override != null) {
            return override;
        }

        PluralForm form = getPluralForm(locale, count, ordinal);

        if (context != null) {
            BundleEntry.Forms contextForms = contexts.get(context);
            if (contextForms != null) {
                String selected = select(form, contextForms.forms());
                if (selected != null) {
                    return selected;
                }
            }
        }

        String selected = select(form, forms);
        return selected != null ? selected : Interpolator.stringify(count);
    }

    public PluralForm getPluralForm(String locale, double count, boolean ordinal) {
        return PluralRules.select(locale, count, ordinal);
    }

    private static String select(PluralForm form, Map<String, String> forms) {
        String value = forms.get(form.key());
        if (value == null && form != PluralForm.OTHER) {
            value = forms.get(PluralForm.OTHER.key());
        }
        return value;
    }

    static String findOverride(double count, Map<String, String> forms) {
        String exact = forms.get(Interpolator.stringify(count));
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, String> entry : forms.entrySet()) {
            if (inInterval(count, entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static boolean inInterval(double count, String key) {
        Matcher range = RANGE.matcher(key);
        if (range.matches()) {
            Long min = parse(range.group(1));
            Long max = parse(range.group(2));
            return min != null && max != null && count >= min && count <= max;
        }
        Matcher open = OPEN_RANGE.matcher(key);
        if (open.matches()) {
            Long min = parse(open.group(1));
            return min != null && count >= min;
        }
        return false;
    }

    private static Long parse(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            // longer than a long can hold; the interval can never match
            return null;
        }
    }
}
