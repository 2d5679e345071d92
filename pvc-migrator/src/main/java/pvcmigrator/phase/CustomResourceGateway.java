package pvcmigrator.phase;

import pvcmigrator.exceptions.MigrateException;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Access to untyped custom resources on one cluster.
 *
 * <p>Implementations talk to the API server; tests use an in-memory fake.
 */
public interface CustomResourceGateway {

    /**
     * Reads the {@code status} block.
     *
     * @return empty if the resource does not exist; an empty map if it exists without status
     */
    Optional<Map<String, Object>> status(ResourceRef ref) throws MigrateException;

    boolean exists(ResourceRef ref) throws MigrateException;

    /**
     * Deletes the resource if present and blocks until the API server no longer returns it.
     *
     * @throws pvcmigrator.exceptions.ResourceTimeoutException if it is still present after {@code timeout}
     */
    void delete(ResourceRef ref, Duration timeout) throws MigrateException;

    /**
     * Creates the resource with the given {@code spec}.
     */
    void create(ResourceRef ref, Map<String, Object> spec) throws MigrateException;
}
