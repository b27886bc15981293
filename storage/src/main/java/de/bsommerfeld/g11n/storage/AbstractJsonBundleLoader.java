package de.bsommerfeld.g11n.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.g11n.core.bundle.BundleLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base for loaders that read one JSON document per (locale, namespace).
 *
 * <p>
 * Subclasses only fetch raw bytes for a resolved path. Parsing, tracing and
 * the failure policy live here: a missing document, unreadable bytes, a
 * non-object root or any exception all yield an empty tree, so the returned
 * future never completes exceptionally.
 */
public abstract class AbstractJsonBundleLoader implements BundleLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractJsonBundleLoader.class);

    private static final TypeReference<LinkedHashMap<String, Object>> TREE = new TypeReference<>() {
    };

    private final LoadPathTemplate template;
    private final ObjectMapper mapper;
    private final boolean debug;

    protected AbstractJsonBundleLoader(LoadPathTemplate template, ObjectMapper mapper, boolean debug) {
        this.template = template;
        this.mapper = mapper;
        this.debug = debug;
    }

    @Override
    public CompletableFuture<Map<String, Object>> load(String locale, String namespace) {
        String path = template.resolve(locale, namespace);
        if (debug) {
            LOG.info("Loading {}:{} from {}", locale, namespace, describe(path));
        }

        CompletableFuture<byte[]> read;
        try {
            read = read(path);
        } catch (RuntimeException e) {
            read = CompletableFuture.failedFuture(e);
        }

        return read.thenApply(bytes -> parse(path, bytes))
                .exceptionally(error -> {
                    LOG.warn("Failed to load translations from {}", describe(path), error);
                    return new LinkedHashMap<>();
                });
    }

    /**
     * Reads the raw document.
     *
     * @param path the resolved load path
     * @return a future with the document bytes, or {@code null} bytes when
     *         no document exists at {@code path}
     */
    protected abstract CompletableFuture<byte[]> read(String path);

    /** Human-readable location of {@code path} for log lines. */
    protected String describe(String path) {
        return path;
    }

    protected ObjectMapper mapper() {
        return mapper;
    }

    private Map<String, Object> parse(String path, byte[] bytes) {
        if (bytes == null) {
            LOG.warn("No translations found at {}", describe(path));
            return new LinkedHashMap<>();
        }
        try {
            JsonNode root = mapper.readTree(bytes);
            if (root == null || !root.isObject()) {
                LOG.warn("Translations at {} are not a JSON object", describe(path));
                return new LinkedHashMap<>();
            }
            Map<String, Object> tree = mapper.convertValue(root, TREE);
            if (debug) {
                LOG.info("Loaded {} top-level keys from {}", tree.size(), describe(path));
            }
            return tree;
        } catch (IOException e) {
            LOG.warn("Malformed translations at {}", describe(path), e);
            return new LinkedHashMap<>();
        }
    }
}
