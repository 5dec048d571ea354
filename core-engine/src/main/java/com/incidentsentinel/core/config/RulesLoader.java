package com.incidentsentinel.core.config;

import com.incidentsentinel.core.model.RuleDefinition;
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
import java.util.List;
import java.util.Objects;

/**
 * Loads and validates the incident rules from YAML.
 *
 * <h3>Where rules come from</h3>
 * <ol>
 * <li>An explicit path, usually {@code ServiceConfig#getRulesConfigPath()}</li>
 * <li>Otherwise the {@value #ENV_RULES_PATH} environment variable</li>
 * <li>Otherwise {@value #DEFAULT_RESOURCE} on the classpath, which holds the
 * CPU, memory and network defaults</li>
 * </ol>
 * <p>
 * A configured path that does not exist is an error; there is no silent
 * fallback to the defaults.
 * </p>
 *
 * <p>
 * Every rule is validated after parsing, so a bad threshold, window or type
 * stops the service at startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    /** Environment variable naming a rules file. */
    public static final String ENV_RULES_PATH = "RULES_CONFIG_PATH";

    /** Classpath resource with the default rules. */
    public static final String DEFAULT_RESOURCE = "rules.yml";

    private RulesLoader() {
    }

    /**
     * Load rules from {@value #ENV_RULES_PATH} or the classpath defaults.
     *
     * @return parsed and validated rules configuration
     */
    public static RulesConfig load() {
        return resolve(null);
    }

    /**
     * Load rules from {@code explicitPath} when it is set, else from
     * {@value #ENV_RULES_PATH}, else from the classpath defaults.
     *
     * @param explicitPath rules file path; {@code null} or blank means unset
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if a configured file does not exist
     * @throws IllegalStateException    if parsing or rule validation fails
     */
    public static RulesConfig resolve(String explicitPath) {
        return resolve(explicitPath, System.getenv(ENV_RULES_PATH));
    }

    static RulesConfig resolve(String explicitPath, String envPath) {
        if (isSet(explicitPath)) {
            LOG.info("Loading rules from {}", explicitPath);
            return fromFile(explicitPath);
        }
        if (isSet(envPath)) {
            LOG.info("Loading rules from {} ({})", envPath, ENV_RULES_PATH);
            return fromFile(envPath);
        }
        LOG.info("Loading default rules from classpath {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load rules from a YAML file.
     *
     * @param path rules file path; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RulesConfig fromFile(String path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        Path file = Path.of(path);
        try (InputStream is = Files.newInputStream(file)) {
            return parse(is, file.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load rules from a classpath resource such as {@value #DEFAULT_RESOURCE}.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource " + resource, e);
        }
    }

    /**
     * Resolve rules as {@link #resolve(String)} does and insist on at least
     * one, since a detector without rules can never raise an incident.
     *
     * @throws IllegalStateException if the resolved configuration is empty
     */
    public static List<RuleDefinition> requireRules(String explicitPath) {
        List<RuleDefinition> rules = resolve(explicitPath).getRules();
        if (rules.isEmpty()) {
            throw new IllegalStateException("No incident rules defined. Set " + ENV_RULES_PATH
                    + " to a rules file or ship " + DEFAULT_RESOURCE + " on the classpath.");
        }
        return rules;
    }

    private static boolean isSet(String path) {
        return path != null && !path.isBlank();
    }

    private static RulesConfig parse(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(RulesConfig.class, options));

        RulesConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed rules YAML in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            config = new RulesConfig();
        }
        config.validate();

        if (config.getRules().isEmpty()) {
            LOG.warn("{} defines no incident rules", source);
        } else {
            LOG.info("Loaded {} incident rule(s) from {}", config.getRules().size(), source);
        }
        return config;
    }
}
