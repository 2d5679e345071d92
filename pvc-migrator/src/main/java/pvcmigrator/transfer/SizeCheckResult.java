package pvcmigrator.transfer;

/**
 * Outcome of comparing source and destination block counts.
 *
 * @param status PASSED, WARNING or SKIPPED
 * @param sourceBlocks source count, -1 if unmeasured
 * @param destinationBlocks destination count, -1 if unmeasured
 * @param delta absolute difference, 0 when skipped
 * @param tolerance allowed difference, 0 when skipped
 */
public record SizeCheckResult(Status status, long sourceBlocks, long destinationBlocks, long delta, long tolerance) {

    public enum Status {
        PASSED,
        /** Advisory only; the run continues. */
        WARNING,
        /** Source empty or a side could not be measured. */
        SKIPPED
    }
}
