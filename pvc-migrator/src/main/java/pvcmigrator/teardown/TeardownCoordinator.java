package pvcmigrator.teardown;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.alert.MigrationAlertLogger;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.volume.VolumeGateway;
import pvcmigrator.workload.EphemeralWorkload;
import pvcmigrator.workload.EphemeralWorkloadLifecycle;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Guarantees cleanup of transfer pods on every exit path.
 *
 * <p>Used as a try-with-resources guard around a run and, optionally, as a JVM
 * shutdown hook for interrupts. Every registered pod is deleted once. Claims
 * registered with {@link #registerVolume} are deleted only after
 * {@link #markSucceeded()}; a failed run keeps them for inspection or retry.
 *
 * <p>{@link #close()} is idempotent and never throws. Deletion failures are
 * logged and recorded in the {@link TeardownReport}.
 */
public class TeardownCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TeardownCoordinator.class);

    private final EphemeralWorkloadLifecycle lifecycle;
    private final Set<EphemeralWorkload> workloads = new LinkedHashSet<>();
    private final List<VolumeTarget> volumes = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean succeeded = new AtomicBoolean();

    private volatile TeardownReport report = TeardownReport.NOT_RUN;
    private Thread shutdownHook;

    public TeardownCoordinator(EphemeralWorkloadLifecycle lifecycle) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
    }

    public synchronized void registerWorkload(EphemeralWorkload workload) {
        workloads.add(workload);
    }

    /**
     * Registers a claim for deletion after a successful run.
     */
    public synchronized void registerVolume(VolumeGateway gateway, String namespace, String name) {
        volumes.add(new VolumeTarget(gateway, namespace, name));
    }

    public void markSucceeded() {
        succeeded.set(true);
    }

    public boolean isSucceeded() {
        return succeeded.get();
    }

    /**
     * Installs a JVM shutdown hook that runs {@link #close()}.
     */
    public synchronized void installShutdownHook() {
        if (shutdownHook != null) {
            return;
        }
        shutdownHook = new Thread(this::close, "pvc-migrator-teardown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        removeShutdownHook();

        List<EphemeralWorkload> pods;
        List<VolumeTarget> claims;
        synchronized (this) {
            pods = new ArrayList<>(workloads);
            claims = new ArrayList<>(volumes);
        }

        List<String> deleted = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        log.info("Cleaning up {} transfer pod(s)", pods.size());
        for (EphemeralWorkload pod : pods) {
            String target = "pod " + pod.namespace() + "/" + pod.name();
            if (lifecycle.terminate(pod)) {
                deleted.add(target);
            } else {
                failed.add(target);
                MigrationAlertLogger.teardownStepFailed(target, null);
            }
        }

        boolean releaseVolumes = succeeded.get();
        if (releaseVolumes) {
            for (VolumeTarget claim : claims) {
                String target = "pvc " + claim.namespace + "/" + claim.name;
                try {
                    log.info("Deleting {}", target);
                    claim.gateway.delete(claim.namespace, claim.name);
                    deleted.add(target);
                } catch (MigrateException | RuntimeException e) {
                    log.warn("Failed to delete {}: {}", target, e.getMessage());
                    failed.add(target);
                    MigrationAlertLogger.teardownStepFailed(target, e);
                }
            }
        } else if (!claims.isEmpty()) {
            log.info("Run did not succeed; keeping {} claim(s)", claims.size());
        }

        report = new TeardownReport(deleted, failed, releaseVolumes);
        MigrationAlertLogger.teardownCompleted(report.isClean(), report.summary());
    }

    public TeardownReport report() {
        return report;
    }

    public boolean isClosed() {
        return closed.get();
    }

    private synchronized void removeShutdownHook() {
        if (shutdownHook == null || Thread.currentThread() == shutdownHook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down; hook stays registered");
        }
        shutdownHook = null;
    }

    private static final class VolumeTarget {
        private final VolumeGateway gateway;
        private final String namespace;
        private final String name;

        private VolumeTarget(VolumeGateway gateway, String namespace, String name) {
            this.gateway = gateway;
            this.namespace = namespace;
            this.name = name;
        }
    }
}
