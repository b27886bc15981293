package de.bsommerfeld.g11n.core.bundle;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * A node of a {@link Bundle}, classified once when it is looked up.
 *
 * <ul>
 * <li>{@link Text}: a plain template string</li>
 * <li>{@link Forms}: plural forms, exact counts or intervals mapped to
 * templates</li>
 * <li>{@link Context}: plural forms plus grammatical-context sub-forms such
 * as {@code male}/{@code female}</li>
 * <li>{@link Branch}: any other inner node; not translatable on its own</li>
 * </ul>
 *
 * Maps keep document order, which decides which interval key wins when
 * several contain the same count.
 */
public interface BundleEntry {

    record Text(String value) implements BundleEntry {
    }

    /**
     * @param forms form name ({@code one}, {@code "3"}, {@code "2-5"}, ...)
     *              to template
     */
    record Forms(Map<String, String> forms) implements BundleEntry {
        public Forms {
            forms = ImmutableMap.copyOf(forms);
        }
    }

    /**
     * @param forms    string-valued forms at the outer level
     * @param contexts context name to its own plural forms
     */
    record Context(Map<String, String> forms, Map<String, Forms> contexts) implements BundleEntry {
        public Context {
            forms = ImmutableMap.copyOf(forms);
            contexts = ImmutableMap.copyOf(contexts);
        }
    }

    /** An inner node whose children are not all plural forms. */
    record Branch(Map<String, Object> children) implements BundleEntry {
        public Branch {
            children = ImmutableMap.copyOf(children);
        }
    }
}
