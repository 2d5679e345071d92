package pvcmigrator.session;

import pvcmigrator.exceptions.AuthException;

/**
 * Opens verified sessions.
 */
@FunctionalInterface
public interface ClusterSessionFactory {

    /**
     * @throws AuthException if credentials are incomplete or the cluster rejects them
     */
    ClusterSession open(ClusterRole role, ClusterEndpoint endpoint) throws AuthException;
}
