package pvcmigrator.config;

import java.time.Duration;

/**
 * Central configuration for a migration run.
 *
 * <p>This class encapsulates the tunables that are not part of a single
 * {@link MigrationRequest}:
 * <ul>
 *   <li>Default transfer pod image</li>
 *   <li>Timeouts for phase completion, pod readiness, deletion and remote commands</li>
 *   <li>Poll interval used while waiting for custom resources</li>
 *   <li>Capacity used when the source claim reports none, and the alert level</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code pvc-migrator.properties} or
 * {@code pvc-migrator.yml} using {@link MigratorConfigLoader}.
 *
 * @see MigratorConfigLoader
 * @see pvcmigrator.engine.MigrationTimeouts#from(MigratorConfig)
 */
public final class MigratorConfig {

    public static final MigratorConfig DEFAULTS = builder().build();

    private final String image;
    private final Duration phaseTimeout;
    private final Duration readinessTimeout;
    private final Duration pollInterval;
    private final Duration deletionTimeout;
    private final Duration execTimeout;
    private final String fallbackCapacity;
    private final AlertLevel alertLevel;

    private MigratorConfig(Builder b) {
        this.image = b.image;
        this.phaseTimeout = b.phaseTimeout;
        this.readinessTimeout = b.readinessTimeout;
        this.pollInterval = b.pollInterval;
        this.deletionTimeout = b.deletionTimeout;
        this.execTimeout = b.execTimeout;
        this.fallbackCapacity = b.fallbackCapacity;
        this.alertLevel = b.alertLevel;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the image used for both transfer pods unless the run overrides it. */
    public String image() { return image; }

    /** Returns how long a backup or restore may take to report success. */
    public Duration phaseTimeout() { return phaseTimeout; }

    /** Returns how long a transfer pod may take to become Ready. */
    public Duration readinessTimeout() { return readinessTimeout; }

    /** Returns the fixed delay between two status polls. */
    public Duration pollInterval() { return pollInterval; }

    /** Returns how long to wait for a replaced custom resource to disappear. */
    public Duration deletionTimeout() { return deletionTimeout; }

    /** Returns the upper bound for a single remote command. */
    public Duration execTimeout() { return execTimeout; }

    /** Returns the capacity requested when the source claim reports none. */
    public String fallbackCapacity() { return fallbackCapacity; }

    /** Returns the alert level for logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "MigratorConfig{" +
                "image=" + image +
                ", phaseTimeout=" + phaseTimeout.toSeconds() + "s" +
                ", readinessTimeout=" + readinessTimeout.toSeconds() + "s" +
                ", pollInterval=" + pollInterval.toSeconds() + "s" +
                ", fallbackCapacity=" + fallbackCapacity +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link MigratorConfig} instances.
     */
    public static final class Builder {
        private String image = MigrationRequest.DEFAULT_IMAGE;
        private Duration phaseTimeout = Duration.ofMinutes(30);
        private Duration readinessTimeout = Duration.ofSeconds(300);
        private Duration pollInterval = Duration.ofSeconds(10);
        private Duration deletionTimeout = Duration.ofSeconds(120);
        private Duration execTimeout = Duration.ofMinutes(60);
        private String fallbackCapacity = "20Gi";
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder image(String image) {
            if (image == null || image.isBlank()) throw new IllegalArgumentException("image must not be blank");
            this.image = image.trim();
            return this;
        }

        public Builder phaseTimeoutSeconds(long seconds) {
            this.phaseTimeout = positive(seconds, "phaseTimeout");
            return this;
        }

        public Builder readinessTimeoutSeconds(long seconds) {
            this.readinessTimeout = positive(seconds, "readinessTimeout");
            return this;
        }

        public Builder pollIntervalSeconds(long seconds) {
            this.pollInterval = positive(seconds, "pollInterval");
            return this;
        }

        public Builder deletionTimeoutSeconds(long seconds) {
            this.deletionTimeout = positive(seconds, "deletionTimeout");
            return this;
        }

        public Builder execTimeoutSeconds(long seconds) {
            this.execTimeout = positive(seconds, "execTimeout");
            return this;
        }

        public Builder fallbackCapacity(String capacity) {
            if (capacity == null || capacity.isBlank()) throw new IllegalArgumentException("fallbackCapacity must not be blank");
            this.fallbackCapacity = capacity.trim();
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public MigratorConfig build() {
            return new MigratorConfig(this);
        }

        private static Duration positive(long seconds, String name) {
            if (seconds <= 0) throw new IllegalArgumentException(name + " must be positive");
            return Duration.ofSeconds(seconds);
        }
    }
}
