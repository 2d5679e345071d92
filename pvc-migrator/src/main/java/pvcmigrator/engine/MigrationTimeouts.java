package pvcmigrator.engine;

import pvcmigrator.config.MigratorConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Time budgets for the blocking waits of a run.
 *
 * <ul>
 *   <li>phase: backup or restore reaching its success condition (30 min)</li>
 *   <li>readiness: a transfer pod becoming Ready (300 s)</li>
 *   <li>pollInterval: delay between two status reads (10 s)</li>
 *   <li>deletion: a replaced custom resource disappearing (120 s)</li>
 *   <li>exec: one remote command (60 min)</li>
 * </ul>
 *
 * <h2>Example:</h2>
 * <pre>
 * MigrationTimeouts timeouts = MigrationTimeouts.builder()
 *     .phaseTimeout(Duration.ofMinutes(45))
 *     .pollInterval(Duration.ofSeconds(5))
 *     .build();
 * </pre>
 */
public final class MigrationTimeouts {

    public static final MigrationTimeouts DEFAULTS = builder().build();

    private final Duration phaseTimeout;
    private final Duration readinessTimeout;
    private final Duration pollInterval;
    private final Duration deletionTimeout;
    private final Duration execTimeout;

    private MigrationTimeouts(Builder b) {
        this.phaseTimeout = b.phaseTimeout;
        this.readinessTimeout = b.readinessTimeout;
        this.pollInterval = b.pollInterval;
        this.deletionTimeout = b.deletionTimeout;
        this.execTimeout = b.execTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MigrationTimeouts from(MigratorConfig config) {
        return builder()
                .phaseTimeout(config.phaseTimeout())
                .readinessTimeout(config.readinessTimeout())
                .pollInterval(config.pollInterval())
                .deletionTimeout(config.deletionTimeout())
                .execTimeout(config.execTimeout())
                .build();
    }

    public Duration phaseTimeout() { return phaseTimeout; }

    public Duration readinessTimeout() { return readinessTimeout; }

    public Duration pollInterval() { return pollInterval; }

    public Duration deletionTimeout() { return deletionTimeout; }

    public Duration execTimeout() { return execTimeout; }

    @Override
    public String toString() {
        return "MigrationTimeouts{" +
                "phase=" + phaseTimeout.toSeconds() + "s" +
                ", readiness=" + readinessTimeout.toSeconds() + "s" +
                ", pollInterval=" + pollInterval.toSeconds() + "s" +
                ", deletion=" + deletionTimeout.toSeconds() + "s" +
                ", exec=" + execTimeout.toSeconds() + "s" +
                '}';
    }

    /**
     * Builder for {@link MigrationTimeouts}.
     */
    public static final class Builder {
        private Duration phaseTimeout = Duration.ofMinutes(30);
        private Duration readinessTimeout = Duration.ofSeconds(300);
        private Duration pollInterval = Duration.ofSeconds(10);
        private Duration deletionTimeout = Duration.ofSeconds(120);
        private Duration execTimeout = Duration.ofMinutes(60);

        private Builder() {}

        public Builder phaseTimeout(Duration timeout) {
            this.phaseTimeout = positive(timeout, "phaseTimeout");
            return this;
        }

        public Builder readinessTimeout(Duration timeout) {
            this.readinessTimeout = positive(timeout, "readinessTimeout");
            return this;
        }

        public Builder pollInterval(Duration interval) {
            this.pollInterval = positive(interval, "pollInterval");
            return this;
        }

        public Builder deletionTimeout(Duration timeout) {
            this.deletionTimeout = positive(timeout, "deletionTimeout");
            return this;
        }

        public Builder execTimeout(Duration timeout) {
            this.execTimeout = positive(timeout, "execTimeout");
            return this;
        }

        public MigrationTimeouts build() {
            return new MigrationTimeouts(this);
        }

        private static Duration positive(Duration d, String name) {
            Objects.requireNonNull(d, name);
            if (d.isNegative() || d.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return d;
        }
    }
}
