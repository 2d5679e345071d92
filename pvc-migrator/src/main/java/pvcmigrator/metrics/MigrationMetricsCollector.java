package pvcmigrator.metrics;

import pvcmigrator.metrics.MigrationMetrics.Phase;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Collects timing and transfer figures during a migration run.
 *
 * <p>This collector tracks:
 * <ul>
 *   <li>Per-phase timing using functional-style {@link #timed(Phase, ThrowingRunnable)}</li>
 *   <li>The phase currently executing, for failure reporting</li>
 *   <li>Transfer method, block counts and size check outcome</li>
 * </ul>
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationMetricsCollector collector = new MigrationMetricsCollector();
 * collector.start(runId);
 *
 * BackupResult backup = collector.timed(Phase.BACKUP, () -&gt; backupController.run());
 * collector.blocks(srcBlocks, dstBlocks);
 *
 * MigrationMetrics metrics = collector.finish();
 * </pre>
 *
 * @see MigrationMetrics
 */
public final class MigrationMetricsCollector {

    private final Clock clock;
    private final Map<Phase, Long> phaseDurations = new EnumMap<>(Phase.class);
    private MigrationMetrics.Builder builder;

    private Instant startTime;
    private Phase currentPhase;

    public MigrationMetricsCollector() {
        this(Clock.systemUTC());
    }

    public MigrationMetricsCollector(Clock clock) {
        this.clock = clock;
    }

    /**
     * Starts metrics collection for a new run.
     *
     * @param runId the run identifier
     * @return this collector for method chaining
     */
    public MigrationMetricsCollector start(String runId) {
        this.startTime = clock.instant();
        this.phaseDurations.clear();
        this.currentPhase = null;
        this.builder = MigrationMetrics.builder()
                .runId(runId)
                .startTime(startTime);
        return this;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Time a phase and run the action (can throw checked exceptions).
     */
    public <E extends Exception> void timed(Phase phase, ThrowingRunnable<E> action) throws E {
        currentPhase = phase;
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            phaseDurations.merge(phase, Duration.ofNanos(System.nanoTime() - start).toMillis(), Long::sum);
        }
    }

    /**
     * Time a phase and return the result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(Phase phase, ThrowingSupplier<T, E> action) throws E {
        currentPhase = phase;
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            phaseDurations.merge(phase, Duration.ofNanos(System.nanoTime() - start).toMillis(), Long::sum);
        }
    }

    /**
     * Returns the phase most recently entered through {@code timed}, or null before the first.
     */
    public Phase currentPhase() {
        return currentPhase;
    }

    public MigrationMetricsCollector transferMethod(String method) {
        builder.transferMethod(method);
        return this;
    }

    /**
     * Records the {@code du -s} block counts of both sides; -1 means unmeasured.
     */
    public MigrationMetricsCollector blocks(long source, long destination) {
        builder.sourceBlocks(source).destinationBlocks(destination);
        return this;
    }

    public MigrationMetricsCollector sizeCheck(String outcome) {
        builder.sizeCheck(outcome);
        return this;
    }

    /**
     * Finishes metrics collection and returns the final metrics.
     */
    public MigrationMetrics finish() {
        Instant endTime = clock.instant();
        return builder
                .endTime(endTime)
                .phaseDurations(phaseDurations)
                .totalDurationMs(Duration.between(startTime, endTime).toMillis())
                .build();
    }
}
