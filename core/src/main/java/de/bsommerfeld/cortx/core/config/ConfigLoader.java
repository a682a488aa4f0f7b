package de.bsommerfeld.cortx.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Loads a configuration POJO from a JSON file on top of its defaults.
 *
 * <p>
 * Keys present in the file overwrite the defaults created by the supplier;
 * keys absent from the file keep their default value. When the file does not
 * exist yet, the defaults are written to it so users have a template to edit.
 *
 * <pre>
 * SupervisorConfig config = ConfigLoader.from(path).load(SupervisorConfig::new);
 * </pre>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path path;
    private final ObjectMapper mapper;

    private ConfigLoader(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static ConfigLoader from(Path path) {
        return new ConfigLoader(path);
    }

    /**
     * @param defaults creates the instance holding default values
     * @return the merged configuration
     * @throws IllegalStateException if the file exists but cannot be parsed
     */
    public <T> T load(Supplier<T> defaults) {
        T config = defaults.get();
        if (!Files.exists(path)) {
            LOG.info("No configuration at {}, writing defaults", path);
            save(config);
            return config;
        }

        try {
            return mapper.readerForUpdating(config).readValue(path.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration from " + path, e);
        }
    }

    /**
     * Writes the configuration to disk. Failures are logged; a read-only
     * location must not prevent the application from starting.
     */
    public void save(Object config) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(path.toFile(), config);
        } catch (IOException e) {
            LOG.warn("Could not write configuration to {}", path, e);
        }
    }
}
