package com.kpisentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the per-metric forecasting parameters ({@code metrics.yml}).
 *
 * <p>
 * {@link #load()} prefers the file named by {@value #ENV_MODEL_PARAMS_PATH}
 * and falls back to the bundled {@value #DEFAULT_RESOURCE}. Duplicate YAML
 * keys are rejected, and every parsed file goes through
 * {@link ModelParametersConfig#validate()}: a bad method name, an out-of-range
 * confidence level or a repeated kpi stops the run before the metric history
 * is read. A file without metrics yields an empty configuration.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModelParametersLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ModelParametersLoader.class);

    /** Path of a metrics file that replaces the bundled one. */
    public static final String ENV_MODEL_PARAMS_PATH = "MODEL_PARAMS_PATH";

    /** Bundled metrics file. */
    public static final String DEFAULT_RESOURCE = "metrics.yml";

    private ModelParametersLoader() {
        // utility class
    }

    /**
     * @return parameters from {@value #ENV_MODEL_PARAMS_PATH} when that file
     *         exists, else from the bundled {@value #DEFAULT_RESOURCE}
     */
    public static ModelParametersConfig load() {
        String envPath = System.getenv(ENV_MODEL_PARAMS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading metric parameters from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading metric parameters from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path metrics file
     * @return validated parameters
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    on unreadable or malformed YAML, or
     *                                  invalid parameters
     */
    public static ModelParametersConfig fromFile(String path) {
        Objects.requireNonNull(path, "Metrics file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Metrics file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read metrics file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return validated parameters
     * @throws IllegalArgumentException if the resource is missing
     * @throws IllegalStateException    on malformed YAML or invalid parameters
     */
    public static ModelParametersConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ModelParametersLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static ModelParametersConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(ModelParametersConfig.class, options));
        ModelParametersConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed metrics configuration in " + source
                    + ": " + e.getMessage(), e);
        }

        if (config == null || config.getMetrics().isEmpty()) {
            LOG.warn("No metrics defined in {}", source);
            config = new ModelParametersConfig();
        } else {
            config.validate();
        }

        LOG.info("Loaded parameters for {} metric(s)", config.getMetrics().size());
        return config;
    }
}
