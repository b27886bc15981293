package de.bsommerfeld.g11n.storage;

import de.bsommerfeld.g11n.core.locale.LocalePersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Remembers the chosen locale in a properties file under the key
 * {@value #KEY}. Other keys in the file are preserved. I/O failures are
 * logged and reported through the return values, never thrown.
 */
public class FileLocalePersistence implements LocalePersistence {

    private static final Logger LOG = LoggerFactory.getLogger(FileLocalePersistence.class);

    public static final String KEY = "i18n_locale";

    private final Path file;

    public FileLocalePersistence(Path file) {
        this.file = file;
    }

    /** Persistence in the OS application data directory of {@code appName}. */
    public static FileLocalePersistence forApplication(String appName) {
        return new FileLocalePersistence(AppDataDirectories.getPreferencesFile(appName));
    }

    @Override
    public synchronized String get() {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return read().getProperty(KEY);
        } catch (IOException e) {
            LOG.warn("Failed to read persisted locale from {}", file, e);
            return null;
        }
    }

    @Override
    public synchronized boolean set(String locale) {
        try {
            Properties properties = Files.isRegularFile(file) ? read() : new Properties();
            properties.setProperty(KEY, locale);
            write(properties);
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to persist locale to {}", file, e);
            return false;
        }
    }

    @Override
    public synchronized boolean clear() {
        if (!Files.isRegularFile(file)) {
            return true;
        }
        try {
            Properties properties = read();
            if (properties.remove(KEY) != null) {
                write(properties);
            }
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to clear persisted locale in {}", file, e);
            return false;
        }
    }

    public Path getFile() {
        return file;
    }

    private Properties read() throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return properties;
    }

    private void write(Properties properties) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            properties.store(writer, "g11n preferences");
        }
    }
}
