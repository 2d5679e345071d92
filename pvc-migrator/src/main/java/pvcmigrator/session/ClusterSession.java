package pvcmigrator.session;

import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.phase.CustomResourceGateway;
import pvcmigrator.volume.VolumeGateway;
import pvcmigrator.workload.WorkloadGateway;

/**
 * An authenticated connection to one cluster.
 *
 * <p>Each session owns its own client and is passed explicitly to every
 * operation that touches its cluster. Sessions are never shared between
 * roles.
 */
public interface ClusterSession extends AutoCloseable {

    ClusterRole role();

    String apiUrl();

    CustomResourceGateway customResources();

    VolumeGateway volumes();

    WorkloadGateway workloads();

    boolean namespaceExists(String namespace) throws MigrateException;

    /** Releases the client. Never throws. */
    @Override
    void close();
}
