package pvcmigrator.phase;

/**
 * Lifecycle of one phase controller run.
 */
public enum PhaseState {
    /** Nothing submitted yet. */
    NEW,
    /** Record created on the cluster. */
    SUBMITTED,
    /** Waiting for the success condition. */
    POLLING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }
}
