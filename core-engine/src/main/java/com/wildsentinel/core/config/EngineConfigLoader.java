package com.wildsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the engine tuning ({@link EngineConfig}) from YAML.
 *
 * <p>
 * A deployment points {@value #ENV_CONFIG_PATH} at its own file; without it
 * the {@value #DEFAULT_RESOURCE} bundled on the classpath is used. Keys left
 * out of the YAML keep the defaults of the settings classes, and an empty
 * document yields a configuration made only of defaults.
 * </p>
 *
 * <p>
 * Duplicate YAML keys are rejected. Every loaded configuration goes through
 * {@link EngineConfig#validate()}, which reports all problems at once, before
 * it is returned.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);

    /** Names a YAML file that replaces the bundled configuration. */
    public static final String ENV_CONFIG_PATH = "ENGINE_CONFIG_PATH";

    /** Bundled configuration on the classpath. */
    public static final String DEFAULT_RESOURCE = "engine.yml";

    private EngineConfigLoader() {
    }

    /**
     * Read the file named by {@value #ENV_CONFIG_PATH}, or the bundled
     * resource when the variable is unset or names no existing file.
     *
     * @throws IllegalStateException if the YAML is malformed or invalid
     */
    public static EngineConfig load() {
        String configured = System.getenv(ENV_CONFIG_PATH);
        if (configured != null && !configured.isBlank()) {
            if (Files.isRegularFile(Path.of(configured))) {
                return fromFile(configured);
            }
            LOG.warn("{} points at missing file {}, falling back to bundled {}",
                    ENV_CONFIG_PATH, configured, DEFAULT_RESOURCE);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file on disk
     * @throws IllegalArgumentException if there is no such file
     * @throws IllegalStateException    on I/O errors, malformed YAML or failed
     *                                  validation
     */
    public static EngineConfig fromFile(String path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            return read(in, path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Engine configuration " + path + " not found", e);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read engine configuration " + path, e);
        }
    }

    /**
     * @param resource resource name relative to the classpath root
     * @throws IllegalArgumentException if there is no such resource
     * @throws IllegalStateException    on I/O errors, malformed YAML or failed
     *                                  validation
     */
    public static EngineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Engine configuration resource " + resource + " not found");
        }
        try (in) {
            return read(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read engine configuration classpath:" + resource, e);
        }
    }

    private static EngineConfig read(InputStream in, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        EngineConfig config;
        try {
            config = new Yaml(new Constructor(EngineConfig.class, options)).load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed engine configuration in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("{} is empty; running on built-in defaults", source);
            config = new EngineConfig();
        }
        config.validate();
        LOG.info("Engine configuration read from {} ({} species profile(s))", source, config.getSpecies().size());
        return config;
    }
}
