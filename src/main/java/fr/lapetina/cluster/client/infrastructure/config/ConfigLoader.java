package fr.lapetina.cluster.client.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads a {@link ClientConfig} from YAML.
 *
 * The path is looked up on the file system first, then on the classpath.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ClientConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    public ClientConfig load() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private ClientConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public ClientConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private ClientConfig parse(InputStream inputStream, String source) {
        try {
            ClientConfig config = yaml.load(inputStream);
            // An empty document yields no object
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Creates a default configuration.
     */
    public static ClientConfig createDefault() {
        return new ClientConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
