package de.bsommerfeld.g11n.storage;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;

/**
 * Reads bundles from classpath resources, e.g.
 * {@code locales/en/common.json} inside the application jar.
 */
public class ClasspathBundleLoader extends AbstractJsonBundleLoader {

    private final ClassLoader classLoader;

    public ClasspathBundleLoader(LoadPathTemplate template, ObjectMapper mapper, boolean debug) {
        this(template, mapper, debug, ClasspathBundleLoader.class.getClassLoader());
    }

    public ClasspathBundleLoader(LoadPathTemplate template, ObjectMapper mapper, boolean debug,
            ClassLoader classLoader) {
        super(template, mapper, debug);
        this.classLoader = classLoader;
    }

    public ClasspathBundleLoader(LoadPathTemplate template) {
        this(template, new ObjectMapper(), false);
    }

    @Override
    protected CompletableFuture<byte[]> read(String path) {
        String resource = path.startsWith("/") ? path.substring(1) : path;
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.completedFuture(in.readAllBytes());
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new UncheckedIOException("Failed to read resource: " + resource, e));
        }
    }

    @Override
    protected String describe(String path) {
        return "classpath:" + path;
    }
}
