package com.logsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link SentinelSettings} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * All {@code load*} methods call {@link SentinelSettings#validate()} after
 * parsing, so an invalid configuration stops start-up.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "PIPELINE_CONFIG_PATH";

    /** Classpath fallback. */
    public static final String DEFAULT_RESOURCE = "pipeline.yml";

    private SettingsLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load settings using automatic resolution.
     *
     * @return parsed and validated settings
     * @throws IllegalStateException if validation fails
     */
    public static SentinelSettings load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    /**
     * @param path file system path, or {@code null}/blank for the classpath
     *             fallback; a path that does not exist also falls back
     * @return parsed and validated settings
     */
    public static SentinelSettings load(String path) {
        if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
            LOG.info("Loading pipeline settings from path: {}", path);
            return fromFile(path);
        }
        LOG.info("Loading pipeline settings from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path absolute or relative path to the YAML file
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static SentinelSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static SentinelSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static SentinelSettings parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(SentinelSettings.class, options));
        SentinelSettings settings = yaml.load(is);

        if (settings == null) {
            LOG.warn("Empty pipeline configuration, using defaults");
            settings = new SentinelSettings();
        }
        settings.validate();

        LOG.info("Loaded pipeline settings: {}", settings);
        return settings;
    }
}
