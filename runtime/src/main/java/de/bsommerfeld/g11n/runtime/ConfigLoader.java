package de.bsommerfeld.g11n.runtime;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.g11n.core.config.ConfigurationException;
import de.bsommerfeld.g11n.core.config.G11nConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and validates {@link G11nConfig} from JSON documents.
 *
 * <pre>
 * G11nConfig config = ConfigLoader.fromClasspath("g11n.json");
 * </pre>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "g11n.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ConfigLoader() {
    }

    /**
     * @throws ConfigurationException if the file is missing, unreadable,
     *                                malformed or fails validation
     */
    public static G11nConfig fromFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file.toAbsolutePath());
        }
        LOG.info("Loading g11n configuration from: {}", file.toAbsolutePath());
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file: " + file, e);
        }
    }

    public static G11nConfig fromClasspath(String resource) {
        return fromClasspath(resource, ConfigLoader.class.getClassLoader());
    }

    /**
     * @throws ConfigurationException if the resource is missing, malformed or
     *                                fails validation
     */
    public static G11nConfig fromClasspath(String resource, ClassLoader classLoader) {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            LOG.info("Loading g11n configuration from classpath: {}", resource);
            return read(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration resource: " + resource, e);
        }
    }

    /** Parses and validates a JSON string. */
    public static G11nConfig fromJson(String json) {
        G11nConfig config;
        try {
            config = MAPPER.readValue(json, G11nConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Malformed g11n configuration", e);
        }
        return validated(config, "JSON string");
    }

    private static G11nConfig read(InputStream in, String source) throws IOException {
        G11nConfig config;
        try {
            config = MAPPER.readValue(in, G11nConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Malformed g11n configuration in " + source, e);
        }
        return validated(config, source);
    }

    private static G11nConfig validated(G11nConfig config, String source) {
        // a literal JSON null maps to no object at all
        if (config == null) {
            throw new ConfigurationException("Empty g11n configuration in " + source);
        }
        return config.validate();
    }
}
