package com.changesentinel.core.config;

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
 * Reads the detection profiles a run will apply.
 *
 * <p>
 * A profiles file set through {@value #ENV_PROFILES_PATH} wins over one named
 * by the caller, which wins over the bundled {@value #DEFAULT_RESOURCE}.
 * Repeated YAML keys inside a profile are a parse error rather than a silent
 * overwrite, and a file without profiles loads as an empty set with a warning
 * so the runner can refuse it with its own message. Any other problem
 * surfaces as an {@link IllegalStateException} before a series is touched.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProfilesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ProfilesLoader.class);

    /** Path of a profiles file that overrides every other source. */
    public static final String ENV_PROFILES_PATH = "CHANGE_SENTINEL_PROFILES";

    public static final String DEFAULT_RESOURCE = "profiles.yml";

    private ProfilesLoader() {
    }

    /**
     * Profiles from the environment override, else the bundled defaults.
     */
    public static ProfilesConfig load() {
        return load(null);
    }

    /**
     * @param explicitPath profiles file to use when the environment override is
     *                     absent; {@code null} or blank falls through to the
     *                     bundled defaults
     */
    public static ProfilesConfig load(String explicitPath) {
        String envPath = System.getenv(ENV_PROFILES_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading profiles from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (explicitPath != null && !explicitPath.isBlank()) {
            LOG.info("Loading profiles from file: {}", explicitPath);
            return fromFile(explicitPath);
        }
        LOG.info("Loading profiles from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if no file exists at {@code path}
     * @throws IllegalStateException    if the file is unreadable, malformed or
     *                                  holds an invalid profile
     */
    public static ProfilesConfig fromFile(String path) {
        Objects.requireNonNull(path, "Profiles file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Profiles file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read profiles file: " + path, e);
        }
    }

    /**
     * Profiles bundled with the application or a test fixture.
     *
     * @throws IllegalArgumentException if the resource is missing
     */
    public static ProfilesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ProfilesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static ProfilesConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(ProfilesConfig.class, options));
        ProfilesConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed profiles YAML: " + e.getMessage(), e);
        }

        if (config == null || config.getProfiles().isEmpty()) {
            LOG.warn("No detection profiles defined in configuration");
            config = new ProfilesConfig();
        } else {
            config.validate();
        }

        LOG.info("Loaded {} detection profile(s)", config.getProfiles().size());
        return config;
    }
}
