package pvcmigrator.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.config.AlertLevel;
import pvcmigrator.metrics.MigrationMetrics;
import pvcmigrator.metrics.MigrationMetrics.Phase;

/**
 * Structured logging for migration events.
 *
 * <p>Log entries use markers like MIGRATION_STARTED, PHASE_COMPLETED,
 * MIGRATION_FAILED with key=value pairs so a run log can be grepped or
 * shipped to a log aggregator.
 *
 * <h2>Log Levels:</h2>
 * <ul>
 *   <li>INFO: migration started, phase transitions, successful completion</li>
 *   <li>WARN: size check warning, teardown step failed</li>
 *   <li>ERROR: migration failed</li>
 * </ul>
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events</li>
 *   <li>WARNING: logs warnings and errors only</li>
 *   <li>ERROR: logs errors only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - MIGRATION_STARTED id=20240101-120000 source=ns-a destination=ns-b method=STREAM_ARCHIVE
 * 12:00:00.100 INFO  migration - PHASE_STARTED id=20240101-120000 phase=BACKUP
 * 12:03:10.500 INFO  migration - PHASE_COMPLETED id=20240101-120000 phase=BACKUP duration_ms=190400
 * 12:09:00.000 INFO  migration - MIGRATION_COMPLETED id=20240101-120000 duration_ms=540000 method=STREAM_ARCHIVE size_check=PASSED
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level (DEBUG, WARNING, or ERROR)
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    /**
     * Log when a migration starts.
     *
     * @param runId the run identifier
     * @param sourceNamespace namespace on the source cluster
     * @param destinationNamespace namespace on the destination cluster
     * @param method the requested transfer method
     */
    public static void migrationStarted(String runId, String sourceNamespace, String destinationNamespace, String method) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_STARTED id={} source={} destination={} method={}",
                    runId, sourceNamespace, destinationNamespace, method);
        }
    }

    public static void phaseStarted(String runId, Phase phase) {
        if (shouldLogInfo()) {
            log.info("PHASE_STARTED id={} phase={}", runId, phase.name());
        }
    }

    public static void phaseCompleted(String runId, Phase phase, long durationMs) {
        if (shouldLogInfo()) {
            log.info("PHASE_COMPLETED id={} phase={} duration_ms={}", runId, phase.name(), durationMs);
        }
    }

    /**
     * Log when a migration completes successfully.
     *
     * @param runId the run identifier
     * @param metrics the final metrics
     */
    public static void migrationCompleted(String runId, MigrationMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_COMPLETED id={} duration_ms={} method={} source_blocks={} destination_blocks={} size_check={}",
                    runId,
                    metrics.totalDurationMs(),
                    metrics.transferMethod(),
                    metrics.sourceBlocks(),
                    metrics.destinationBlocks(),
                    metrics.sizeCheck());
        }
    }

    /**
     * Log when a migration fails.
     *
     * @param runId the run identifier
     * @param error the error that caused the failure
     * @param currentPhase the phase during which failure occurred (may be null)
     * @param partialMetrics partial metrics if available (may be null)
     */
    public static void migrationFailed(String runId, Throwable error, Phase currentPhase, MigrationMetrics partialMetrics) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        String phaseName = currentPhase != null ? currentPhase.name() : "UNKNOWN";

        if (partialMetrics != null) {
            log.error("MIGRATION_FAILED id={} phase={} error=\"{}\" duration_ms={}",
                    runId, phaseName, errorMsg, partialMetrics.totalDurationMs());
        } else {
            log.error("MIGRATION_FAILED id={} phase={} error=\"{}\"", runId, phaseName, errorMsg);
        }
    }

    /**
     * Log when the copied data differs in size beyond tolerance.
     */
    public static void sizeMismatch(String runId, long sourceBlocks, long destinationBlocks, long tolerance) {
        if (shouldLogWarn()) {
            log.warn("SIZE_MISMATCH id={} source_blocks={} destination_blocks={} tolerance={}",
                    runId, sourceBlocks, destinationBlocks, tolerance);
        }
    }

    /**
     * Log when a teardown step could not delete its target.
     *
     * @param target a description such as {@code pod ns-a/pvc-src-20240101-120000}
     * @param error the failure
     */
    public static void teardownStepFailed(String target, Throwable error) {
        if (shouldLogWarn()) {
            log.warn("TEARDOWN_STEP_FAILED target={} error=\"{}\"", target, error != null ? error.getMessage() : "unknown");
        }
    }

    /**
     * Log when teardown finishes.
     *
     * @param clean whether every step succeeded
     * @param summary the teardown report summary
     */
    public static void teardownCompleted(boolean clean, String summary) {
        if (clean) {
            if (shouldLogInfo()) {
                log.info("TEARDOWN_COMPLETED status=CLEAN {}", summary);
            }
        } else if (shouldLogWarn()) {
            log.warn("TEARDOWN_COMPLETED status=PARTIAL {}", summary);
        }
    }

    /**
     * Log when a wait exceeds its deadline.
     *
     * @param runId the run identifier
     * @param timeoutMs the configured timeout in milliseconds
     * @param currentPhase the phase during which timeout occurred
     */
    public static void migrationTimeout(String runId, long timeoutMs, Phase currentPhase) {
        // Always log errors
        String phaseName = currentPhase != null ? currentPhase.name() : "UNKNOWN";
        log.error("MIGRATION_TIMEOUT id={} timeout_ms={} phase={}", runId, timeoutMs, phaseName);
    }
}
