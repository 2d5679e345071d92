package pvcmigrator.volume;

/**
 * Result of ensuring the destination claim.
 */
public enum ProvisioningOutcome {
    /** A new claim was created. */
    CREATED,
    /** A compatible claim already existed and is used as is. */
    REUSED
}
