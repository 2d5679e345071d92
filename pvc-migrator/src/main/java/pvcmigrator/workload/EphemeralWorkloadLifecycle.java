package pvcmigrator.workload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.exceptions.LaunchException;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.ReadinessTimeoutException;
import pvcmigrator.session.ClusterRole;

import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Creates, waits for and removes transfer pods.
 *
 * <p>{@link #launch} hands the workload to its {@code registrar} before the
 * pod is created, so a teardown guard knows about it even if creation fails
 * half way. {@link #terminate} never throws.
 */
public class EphemeralWorkloadLifecycle {

    private static final Logger log = LoggerFactory.getLogger(EphemeralWorkloadLifecycle.class);

    private final Duration readinessTimeout;
    private final Duration execTimeout;

    public EphemeralWorkloadLifecycle(Duration readinessTimeout, Duration execTimeout) {
        this.readinessTimeout = readinessTimeout;
        this.execTimeout = execTimeout;
    }

    /**
     * Creates the pod and returns it in state {@link WorkloadState#PENDING}.
     *
     * @param registrar called with the workload before the create call
     * @throws LaunchException if the API server rejects the pod
     */
    public EphemeralWorkload launch(WorkloadGateway gateway, ClusterRole role, String namespace, String name,
                                    String claim, String image, Consumer<EphemeralWorkload> registrar)
            throws MigrateException {
        EphemeralWorkload workload = new EphemeralWorkload(gateway, role, namespace, name, claim, image, execTimeout);
        registrar.accept(workload);
        log.info("Creating {} pod {}/{} on claim '{}' ({})", role, namespace, name, claim, image);
        try {
            gateway.createPod(new PodRequest(namespace, name, claim, image, EphemeralWorkload.MOUNT_PATH,
                    Map.of("app", EphemeralWorkload.APP_LABEL)));
        } catch (LaunchException e) {
            throw e;
        } catch (MigrateException | RuntimeException e) {
            throw new LaunchException("Failed to create pod: " + e.getMessage(), "pod " + namespace + "/" + name, e);
        }
        return workload;
    }

    /**
     * Blocks until the pod is Ready.
     *
     * @throws ReadinessTimeoutException if it is not Ready within the readiness timeout
     */
    public void awaitReady(EphemeralWorkload workload) throws MigrateException {
        String resource = "pod " + workload.namespace() + "/" + workload.name();
        boolean ready;
        try {
            ready = workload.gateway().waitReady(workload.namespace(), workload.name(), readinessTimeout);
        } catch (RuntimeException e) {
            throw new LaunchException("Readiness check failed: " + e.getMessage(), resource, e);
        }
        if (!ready) {
            throw new ReadinessTimeoutException(resource, readinessTimeout);
        }
        workload.state(WorkloadState.READY);
        log.info("{} is Ready", resource);
    }

    /**
     * Deletes the pod. Failures are logged and reported as {@code false}.
     */
    public boolean terminate(EphemeralWorkload workload) {
        if (workload.state() == WorkloadState.DELETED) {
            return true;
        }
        try {
            workload.gateway().deletePod(workload.namespace(), workload.name());
            workload.state(WorkloadState.DELETED);
            log.info("Deleted pod {}/{}", workload.namespace(), workload.name());
            return true;
        } catch (MigrateException | RuntimeException e) {
            log.warn("Failed to delete pod {}/{}: {}", workload.namespace(), workload.name(), e.getMessage());
            return false;
        }
    }
}
