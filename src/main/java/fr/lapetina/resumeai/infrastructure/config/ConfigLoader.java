package fr.lapetina.resumeai.infrastructure.config;

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
 * Loads the orchestrator configuration from YAML.
 *
 * Looks on the file system first, then on the classpath.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(OrchestratorConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if the file is missing, unreadable or malformed
     */
    public OrchestratorConfig load() {
        // Try file system first
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        // Try classpath
        String classpathResource = configPath.toString();
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

    /**
     * Loads configuration from an input stream.
     */
    public OrchestratorConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private OrchestratorConfig parse(InputStream is, String source) {
        OrchestratorConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Configuration is empty: " + source);
        }
        log.debug("Configuration loaded: source={}, providers={}", source, config.getProviders().size());
        return config;
    }

    /**
     * Creates a default configuration.
     */
    public static OrchestratorConfig createDefault() {
        return new OrchestratorConfig();
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
