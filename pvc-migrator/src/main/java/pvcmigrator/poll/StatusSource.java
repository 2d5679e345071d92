package pvcmigrator.poll;

import pvcmigrator.exceptions.MigrateException;

import java.util.Optional;

/**
 * Reads the current status of one remote resource.
 */
@FunctionalInterface
public interface StatusSource {

    /**
     * @return the decoded status, or empty if the resource does not exist (yet)
     * @throws MigrateException if the status cannot be read
     */
    Optional<ResourceStatus> fetch() throws MigrateException;
}
