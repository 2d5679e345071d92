package pvcmigrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * Loads migrator configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code pvc-migrator.properties} on the classpath</li>
 *   <li>{@code pvc-migrator.yml} on the classpath</li>
 * </ol>
 * If neither is present the built-in {@link MigratorConfig#DEFAULTS} apply.
 *
 * <p>System properties override file-based configuration. Use the
 * {@code pvcmigrator.} prefix (e.g., {@code -Dpvcmigrator.poll.interval=5}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code pvcmigrator.image} - transfer pod image</li>
 *   <li>{@code pvcmigrator.timeout.phase} - backup/restore timeout in seconds</li>
 *   <li>{@code pvcmigrator.timeout.readiness} - pod readiness timeout in seconds</li>
 *   <li>{@code pvcmigrator.timeout.deletion} - custom resource deletion timeout in seconds</li>
 *   <li>{@code pvcmigrator.timeout.exec} - remote command timeout in seconds</li>
 *   <li>{@code pvcmigrator.poll.interval} - status poll interval in seconds</li>
 *   <li>{@code pvcmigrator.volume.fallback.capacity} - e.g. {@code 20Gi}</li>
 *   <li>{@code pvcmigrator.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see MigratorConfig
 */
public final class MigratorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigratorConfigLoader.class);

    static final String PROPERTIES_NAME = "pvc-migrator.properties";
    static final String YAML_NAME = "pvc-migrator.yml";

    private MigratorConfigLoader() {}

    /**
     * Load from classpath ({@value #PROPERTIES_NAME} or {@value #YAML_NAME}),
     * falling back to defaults plus system properties.
     */
    public static MigratorConfig load() {
        InputStream is = getResource(PROPERTIES_NAME);
        if (is != null) {
            try (InputStream in = is) {
                return loadProperties(in, PROPERTIES_NAME);
            } catch (IOException e) {
                throw new MigrationConfigException("Failed to load " + PROPERTIES_NAME, e);
            }
        }

        is = getResource(YAML_NAME);
        if (is != null) {
            try (InputStream in = is) {
                return loadYaml(in, YAML_NAME);
            } catch (IOException e) {
                throw new MigrationConfigException("Failed to load " + YAML_NAME, e);
            }
        }

        log.debug("No {} or {} on classpath, using defaults", PROPERTIES_NAME, YAML_NAME);
        return parse(new Properties());
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigrationConfigException if the configuration is invalid
     */
    public static MigratorConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return MigratorConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigratorConfig loadProperties(InputStream is, String source) {
        try {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigratorConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(is);
        } catch (YAMLException | ClassCastException e) {
            throw new MigrationConfigException("Invalid YAML in " + source, e);
        }
        Properties props = new Properties();
        if (root != null) {
            flatten("", root, props);
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static MigratorConfig parse(Properties props) {
        MigratorConfig.Builder b = MigratorConfig.builder();

        getString(props, "pvcmigrator.image").filter(v -> !v.isEmpty()).ifPresent(b::image);

        getLong(props, "pvcmigrator.timeout.phase").ifPresent(v -> applyPositive("timeout.phase", v, b::phaseTimeoutSeconds));
        getLong(props, "pvcmigrator.timeout.readiness").ifPresent(v -> applyPositive("timeout.readiness", v, b::readinessTimeoutSeconds));
        getLong(props, "pvcmigrator.timeout.deletion").ifPresent(v -> applyPositive("timeout.deletion", v, b::deletionTimeoutSeconds));
        getLong(props, "pvcmigrator.timeout.exec").ifPresent(v -> applyPositive("timeout.exec", v, b::execTimeoutSeconds));
        getLong(props, "pvcmigrator.poll.interval").ifPresent(v -> applyPositive("poll.interval", v, b::pollIntervalSeconds));

        getString(props, "pvcmigrator.volume.fallback.capacity").filter(v -> !v.isEmpty()).ifPresent(b::fallbackCapacity);

        getString(props, "pvcmigrator.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static void applyPositive(String key, long value, Consumer<Long> setter) {
        if (value > 0) {
            setter.accept(value);
        } else {
            log.warn("Ignoring non-positive {}: {}", key, value);
        }
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
