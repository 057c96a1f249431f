package com.rcasentinel.core.config;

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
 * Loads and validates {@link RcaSettings} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * An empty document yields the built-in defaults. Anything else is validated
 * before it is returned, so a bad threshold stops start-up.
 * </p>
 *
 * @since 1.0.0
 */
public final class RcaSettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RcaSettingsLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "RCA_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "rca.yml";

    private RcaSettingsLoader() {
    }

    /**
     * Load settings from {@code RCA_CONFIG_PATH} when it points to an existing
     * file, otherwise from {@code rca.yml} on the classpath.
     *
     * @return parsed and validated settings
     * @throws IllegalStateException if validation fails
     */
    public static RcaSettings load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    static RcaSettings load(String overridePath) {
        if (overridePath != null && !overridePath.isBlank() && Files.exists(Path.of(overridePath))) {
            LOG.info("Loading RCA settings from override path: {}", overridePath);
            return fromFile(overridePath);
        }
        LOG.info("Loading RCA settings from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file path; must not be {@code null}
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static RcaSettings fromFile(String path) {
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
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static RcaSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RcaSettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static RcaSettings parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(RcaSettings.class, options));
        RcaSettings settings = yaml.load(is);

        if (settings == null) {
            LOG.warn("Empty RCA settings document, using defaults");
            settings = new RcaSettings();
        }
        settings.validate();

        LOG.info("Loaded {}", settings);
        return settings;
    }
}
