package de.bsommerfeld.g11n.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemBundleLoaderTest {

    @TempDir
    Path baseDir;

    private void write(String relative, String content) throws Exception {
        Path file = baseDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    @Test
    void load_shouldReadBundleFromBaseDirectory() throws Exception {
        write("locales/es/common.json", "{\"app\": {\"title\": \"Inventario\"}}");
        var loader = new FileSystemBundleLoader(baseDir, LoadPathTemplate.defaultTemplate());

        Map<String, Object> tree = loader.load("es", "common").get(1, TimeUnit.SECONDS);

        assertEquals(Map.of("title", "Inventario"), tree.get("app"));
    }

    @Test
    void load_shouldUseGivenExecutor() throws Exception {
        write("fr.json", "{\"hello\": \"Bonjour\"}");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            var loader = new FileSystemBundleLoader(baseDir, new LoadPathTemplate("{{locale}}.json"),
                    new ObjectMapper(), true, executor);

            assertEquals("Bonjour", loader.load("fr", "common").get(1, TimeUnit.SECONDS).get("hello"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void load_shouldYieldEmptyTreeForMissingFile() throws Exception {
        var loader = new FileSystemBundleLoader(baseDir, LoadPathTemplate.defaultTemplate());

        assertTrue(loader.load("de", "common").get(1, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void load_shouldYieldEmptyTreeForMalformedFile() throws Exception {
        write("locales/en/common.json", "{ \"app\": ");
        var loader = new FileSystemBundleLoader(baseDir, LoadPathTemplate.defaultTemplate());

        assertTrue(loader.load("en", "common").get(1, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void load_shouldYieldEmptyTreeWhenPathIsDirectory() throws Exception {
        Files.createDirectories(baseDir.resolve("locales/en/common.json"));
        var loader = new FileSystemBundleLoader(baseDir, LoadPathTemplate.defaultTemplate());

        assertTrue(loader.load("en", "common").get(1, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void load_shouldNotReadFilesOutsideBaseDirectory() throws Exception {
        write("secret.json", "{\"token\": \"s3cr3t\"}");
        Path bundles = Files.createDirectories(baseDir.resolve("bundles"));
        var loader = new FileSystemBundleLoader(bundles, LoadPathTemplate.defaultTemplate());

        assertTrue(loader.load("en", "../../../secret").get(1, TimeUnit.SECONDS).isEmpty());
        assertTrue(loader.load("../..", "secret").get(1, TimeUnit.SECONDS).isEmpty());
    }
}
