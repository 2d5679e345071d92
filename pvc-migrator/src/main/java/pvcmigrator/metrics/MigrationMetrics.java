package pvcmigrator.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable metrics collected during one migration run.
 *
 * <p>Captures:
 * <ul>
 *   <li>Timing information (total duration, per-phase durations)</li>
 *   <li>Transfer method and block counts measured on both transfer pods</li>
 *   <li>Outcome of the post-copy size check</li>
 * </ul>
 *
 * <p>Use {@link #summary()} for a human-readable summary, or {@link #toMap()}
 * for structured output.
 *
 * @see MigrationMetricsCollector
 */
public record MigrationMetrics(
        String runId,
        Instant startTime,
        Instant endTime,
        Map<Phase, Long> phaseDurations,
        long totalDurationMs,
        String transferMethod,
        long sourceBlocks,
        long destinationBlocks,
        String sizeCheck
) {
    /**
     * Migration phases for timing breakdown, in execution order.
     */
    public enum Phase {
        /** Session checks and namespace existence checks */
        PREFLIGHT,
        /** Backup custom resource on the source cluster */
        BACKUP,
        /** Storage resolution and destination claim */
        PROVISION,
        /** Transfer pods launched and Ready */
        LAUNCH,
        /** Data copy between transfer pods */
        TRANSFER,
        /** Size comparison after copy */
        VERIFY,
        /** Restore custom resource on the destination cluster */
        RESTORE,
        /** Pod and claim cleanup */
        TEARDOWN
    }

    /**
     * Returns the total run duration as a Duration object.
     */
    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * Returns the duration of a specific phase.
     *
     * @param phase the phase to query
     * @return duration in milliseconds, or 0 if phase not recorded
     */
    public long phaseDuration(Phase phase) {
        return phaseDurations.getOrDefault(phase, 0L);
    }

    /**
     * Returns a human-readable summary of the run.
     */
    public String summary() {
        return String.format(Locale.ROOT,
                "Migration %s in %dms | Method: %s | Blocks: %d -> %d | Size check: %s",
                runId, totalDurationMs, transferMethod != null ? transferMethod : "n/a",
                sourceBlocks, destinationBlocks, sizeCheck != null ? sizeCheck : "n/a");
    }

    /**
     * Converts the metrics to a Map for structured output.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("runId", runId);
        map.put("startTime", startTime.toString());
        map.put("endTime", endTime.toString());
        map.put("totalDurationMs", totalDurationMs);
        map.put("transferMethod", transferMethod);
        map.put("sourceBlocks", sourceBlocks);
        map.put("destinationBlocks", destinationBlocks);
        map.put("sizeCheck", sizeCheck);
        phaseDurations.forEach((phase, duration) ->
                map.put(phase.name().toLowerCase(Locale.ROOT) + "DurationMs", duration));
        return map;
    }

    /**
     * Creates a new builder for constructing MigrationMetrics.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing {@link MigrationMetrics} instances.
     */
    public static class Builder {
        private String runId;
        private Instant startTime;
        private Instant endTime;
        private final Map<Phase, Long> phaseDurations = new EnumMap<>(Phase.class);
        private long totalDurationMs;
        private String transferMethod;
        private long sourceBlocks = -1;
        private long destinationBlocks = -1;
        private String sizeCheck;

        public Builder runId(String id) { this.runId = id; return this; }
        public Builder startTime(Instant t) { this.startTime = t; return this; }
        public Builder endTime(Instant t) { this.endTime = t; return this; }

        public Builder phaseDurations(Map<Phase, Long> durations) {
            this.phaseDurations.putAll(durations);
            return this;
        }

        public Builder totalDurationMs(long v) { this.totalDurationMs = v; return this; }
        public Builder transferMethod(String v) { this.transferMethod = v; return this; }
        public Builder sourceBlocks(long v) { this.sourceBlocks = v; return this; }
        public Builder destinationBlocks(long v) { this.destinationBlocks = v; return this; }
        public Builder sizeCheck(String v) { this.sizeCheck = v; return this; }

        public MigrationMetrics build() {
            return new MigrationMetrics(
                    runId, startTime, endTime,
                    new EnumMap<>(phaseDurations),
                    totalDurationMs, transferMethod, sourceBlocks, destinationBlocks, sizeCheck
            );
        }
    }
}
