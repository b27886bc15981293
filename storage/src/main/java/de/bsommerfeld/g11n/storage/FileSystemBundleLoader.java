package de.bsommerfeld.g11n.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Reads bundles from a base directory on disk. File reads run on the given
 * executor so callers never block on I/O. Paths that normalize to a location
 * outside the base directory are treated as missing.
 */
public class FileSystemBundleLoader extends AbstractJsonBundleLoader {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemBundleLoader.class);

    private final Path baseDir;
    private final Executor executor;

    public FileSystemBundleLoader(Path baseDir, LoadPathTemplate template, ObjectMapper mapper, boolean debug,
            Executor executor) {
        super(template, mapper, debug);
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.executor = executor;
    }

    public FileSystemBundleLoader(Path baseDir, LoadPathTemplate template) {
        this(baseDir, template, new ObjectMapper(), false, ForkJoinPool.commonPool());
    }

    @Override
    protected CompletableFuture<byte[]> read(String path) {
        Path file = resolve(path);
        if (!file.startsWith(baseDir)) {
            LOG.warn("Refusing to read {} outside of {}", file, baseDir);
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.supplyAsync(() -> {
            if (!Files.isRegularFile(file)) {
                return null;
            }
            try {
                return Files.readAllBytes(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + file, e);
            }
        }, executor);
    }

    @Override
    protected String describe(String path) {
        return resolve(path).toString();
    }

    public Path getBaseDir() {
        return baseDir;
    }

    private Path resolve(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return baseDir.resolve(relative).normalize();
    }
}
