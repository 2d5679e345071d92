package pvcmigrator.volume;

import pvcmigrator.exceptions.MigrateException;

import java.util.Optional;

/**
 * Claim and storage class operations on one cluster.
 */
public interface VolumeGateway {

    /** Reads a claim, or empty if it does not exist. */
    Optional<ClaimSnapshot> read(String namespace, String name) throws MigrateException;

    default boolean exists(String namespace, String name) throws MigrateException {
        return read(namespace, name).isPresent();
    }

    void create(String namespace, String name, VolumeSpec spec) throws MigrateException;

    /** Deletes a claim; absent claims are not an error. */
    void delete(String namespace, String name) throws MigrateException;

    boolean storageClassExists(String name) throws MigrateException;

    /**
     * The class annotated {@code storageclass.kubernetes.io/is-default-class=true}
     * (or the beta annotation), if any.
     */
    Optional<String> defaultStorageClass() throws MigrateException;
}
