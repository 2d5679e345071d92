package pvcmigrator.volume;

/**
 * Where the destination storage class came from.
 */
public enum StorageClassSource {
    /** The source claim's class also exists on the destination. */
    SOURCE_MATCH,
    /** The destination's annotated default class. */
    DESTINATION_DEFAULT,
    /** No class set; the cluster's admission defaulting applies. */
    CLUSTER_DEFAULT
}
