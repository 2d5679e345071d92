package pvcmigrator.workload;

/**
 * Lifecycle of a transfer pod as tracked by this process.
 */
public enum WorkloadState {
    PENDING,
    READY,
    DELETED
}
