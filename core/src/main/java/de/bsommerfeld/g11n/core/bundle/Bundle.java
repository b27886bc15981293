package de.bsommerfeld.g11n.core.bundle;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable key tree loaded for one (locale, namespace) pair.
 *
 * <p>
 * Leaves are strings. Numbers and booleans from the source document are
 * stored in their textual form; arrays and nulls are dropped. Inner nodes are
 * maps in document order. Keys are addressed with dot paths such as
 * {@code auth.login.title}.
 */
public final class Bundle {

    private static final Bundle EMPTY = new Bundle(ImmutableMap.of());
    private static final Splitter PATH_SPLITTER = Splitter.on('.');

    private final ImmutableMap<String, Object> root;

    private Bundle(ImmutableMap<String, Object> root) {
        this.root = root;
    }

    public static Bundle empty() {
        return EMPTY;
    }

    /** Copies {@code tree} into an immutable bundle; {@code null} yields an empty one. */
    public static Bundle of(Map<String, ?> tree) {
        if (tree == null || tree.isEmpty()) {
            return EMPTY;
        }
        return new Bundle(freeze(tree));
    }

    public boolean isEmpty() {
        return root.isEmpty();
    }

    /** The whole tree: string leaves and nested immutable maps. */
    public Map<String, Object> asMap() {
        return root;
    }

    /**
     * Descends along {@code dotPath} and returns the raw node, a
     * {@code String} or a {@code Map}, or {@code null} if any segment is
     * absent or a leaf is reached before the path ends.
     */
    public Object node(String dotPath) {
        Object current = root;
        for (String segment : PATH_SPLITTER.split(dotPath)) {
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

    /** Returns the string leaf at {@code dotPath}, or {@code null} for anything else. */
    public String text(String dotPath) {
        return node(dotPath) instanceof String s ? s : null;
    }

    /** Classifies the node at {@code dotPath}; {@code null} if absent. */
    public BundleEntry lookup(String dotPath) {
        Object node = node(dotPath);
        if (node == null) {
            return null;
        }
        return classify(node);
    }

    @SuppressWarnings("unchecked")
    static BundleEntry classify(Object node) {
        if (node instanceof String s) {
            return new BundleEntry.Text(s);
        }
        Map<String, Object> map = (Map<String, Object>) node;
        Map<String, String> forms = new LinkedHashMap<>();
        Map<String, BundleEntry.Forms> contexts = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String s) {
                forms.put(entry.getKey(), s);
            } else if (isFlat((Map<String, Object>) value)) {
                contexts.put(entry.getKey(), new BundleEntry.Forms(flatten((Map<String, Object>) value)));
            } else {
                return new BundleEntry.Branch(map);
            }
        }
        if (contexts.isEmpty()) {
            return new BundleEntry.Forms(forms);
        }
        return new BundleEntry.Context(forms, contexts);
    }

    private static boolean isFlat(Map<String, Object> map) {
        for (Object value : map.values()) {
            if (!(value instanceof String)) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, String> flatten(Map<String, Object> map) {
        Map<String, String> strings = new LinkedHashMap<>();
        map.forEach((key, value) -> strings.put(key, (String) value));
        return strings;
    }

    private static ImmutableMap<String, Object> freeze(Map<String, ?> tree) {
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        for (Map.Entry<String, ?> entry : tree.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            Object value = entry.getValue();
            if (value instanceof String s) {
                builder.put(entry.getKey(), s);
            } else if (value instanceof Number || value instanceof Boolean) {
                builder.put(entry.getKey(), String.valueOf(value));
            } else if (value instanceof Map<?, ?> nested) {
                builder.put(entry.getKey(), freeze(asStringKeyed(nested)));
            }
        }
        return builder.buildKeepingLast();
    }

    private static Map<String, Object> asStringKeyed(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            if (key != null) {
                copy.put(String.valueOf(key), value);
            }
        });
        return copy;
    }

    @Override
    public String toString() {
        return "Bundle" + root;
    }
}
