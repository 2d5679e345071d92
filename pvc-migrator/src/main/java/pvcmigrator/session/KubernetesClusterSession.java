package pvcmigrator.session;

import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.phase.CustomResourceGateway;
import pvcmigrator.volume.VolumeGateway;
import pvcmigrator.workload.WorkloadGateway;

import java.net.HttpURLConnection;

/**
 * {@link ClusterSession} backed by a fabric8 {@link KubernetesClient}.
 */
public class KubernetesClusterSession implements ClusterSession {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClusterSession.class);

    private final ClusterRole role;
    private final String apiUrl;
    private final KubernetesClient client;
    private final CustomResourceGateway customResources;
    private final VolumeGateway volumes;
    private final WorkloadGateway workloads;

    KubernetesClusterSession(ClusterRole role, String apiUrl, KubernetesClient client) {
        this.role = role;
        this.apiUrl = apiUrl;
        this.client = client;
        this.customResources = new KubernetesCustomResources(client);
        this.volumes = new KubernetesVolumes(client);
        this.workloads = new KubernetesWorkloads(client);
    }

    @Override
    public ClusterRole role() {
        return role;
    }

    @Override
    public String apiUrl() {
        return apiUrl;
    }

    @Override
    public CustomResourceGateway customResources() {
        return customResources;
    }

    @Override
    public VolumeGateway volumes() {
        return volumes;
    }

    @Override
    public WorkloadGateway workloads() {
        return workloads;
    }

    /**
     * Checks the namespace object; users without cluster-scope read fall back
     * to listing pods in it.
     */
    @Override
    public boolean namespaceExists(String namespace) throws MigrateException {
        try {
            return client.namespaces().withName(namespace).get() != null;
        } catch (KubernetesClientException e) {
            if (e.getCode() != HttpURLConnection.HTTP_FORBIDDEN) {
                throw new MigrateException("Cannot read namespace: " + e.getMessage(), "PREFLIGHT",
                        role + " namespace " + namespace, e);
            }
        }
        try {
            client.pods().inNamespace(namespace).list(new ListOptionsBuilder().withLimit(1L).build());
            return true;
        } catch (KubernetesClientException e) {
            log.debug("Pod list in {} on {} failed: {}", namespace, role, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        try {
            client.close();
        } catch (RuntimeException e) {
            log.warn("Closing {} client failed: {}", role, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return role + " session (" + apiUrl + ")";
    }
}
