package pvcmigrator.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.alert.MigrationAlertLogger;
import pvcmigrator.config.MigrationRequest;
import pvcmigrator.config.MigratorConfig;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.ResourceTimeoutException;
import pvcmigrator.exceptions.TransferException;
import pvcmigrator.metrics.MigrationMetrics;
import pvcmigrator.metrics.MigrationMetrics.Phase;
import pvcmigrator.metrics.MigrationMetricsCollector;
import pvcmigrator.metrics.MigrationMetricsCollector.ThrowingRunnable;
import pvcmigrator.metrics.MigrationMetricsCollector.ThrowingSupplier;
import pvcmigrator.phase.BackupPhase;
import pvcmigrator.phase.BackupResult;
import pvcmigrator.phase.PhaseController;
import pvcmigrator.phase.PhaseDefinition;
import pvcmigrator.phase.RestorePhase;
import pvcmigrator.phase.RestoreResult;
import pvcmigrator.poll.ConditionPoller;
import pvcmigrator.session.ClusterRole;
import pvcmigrator.session.ClusterSession;
import pvcmigrator.teardown.TeardownCoordinator;
import pvcmigrator.transfer.SelinuxRelabel;
import pvcmigrator.transfer.SizeCheckResult;
import pvcmigrator.transfer.SizeMeasurement;
import pvcmigrator.transfer.SizeVerifier;
import pvcmigrator.transfer.TransferPlan;
import pvcmigrator.transfer.TransferStrategies;
import pvcmigrator.transfer.TransferStrategy;
import pvcmigrator.volume.ProvisioningOutcome;
import pvcmigrator.volume.VolumeProvisioningResolver;
import pvcmigrator.volume.VolumeResolution;
import pvcmigrator.workload.EphemeralWorkload;
import pvcmigrator.workload.EphemeralWorkloadLifecycle;
import pvcmigrator.workload.ExecResult;
import pvcmigrator.workload.Shell;
import pvcmigrator.workload.WorkloadNames;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Orchestrates one migration between two clusters.
 *
 * Phases (strictly sequential, each depends on the previous one):
 *  - preflight: both namespaces exist
 *  - backup: backup record on the source reaches Successful
 *  - provision: destination claim resolved and ensured
 *  - launch: source and destination transfer pods Ready
 *  - transfer: backup folder copied, folder name preserved
 *  - verify: relabel, size comparison (advisory)
 *  - restore: destination pod released, restore record reaches Successful + restoreComplete
 *  - teardown: pods always; claims only after success
 *
 * Any failure before teardown aborts the run; teardown still executes.
 */
public final class MigrationEngine {

    private static final Logger log = LoggerFactory.getLogger(MigrationEngine.class);

    private final MigrationTimeouts timeouts;
    private final ConditionPoller poller;
    private final VolumeProvisioningResolver resolver;
    private final EphemeralWorkloadLifecycle lifecycle;
    private final TransferStrategies strategies;
    private final SizeVerifier verifier;
    private final Clock clock;

    private boolean installShutdownHook = true;

    public MigrationEngine(MigratorConfig config) {
        this(MigrationTimeouts.from(config), new ConditionPoller(),
                new VolumeProvisioningResolver(config.fallbackCapacity()), new TransferStrategies(),
                new SizeVerifier(), Clock.systemUTC());
    }

    public MigrationEngine(MigrationTimeouts timeouts, ConditionPoller poller, VolumeProvisioningResolver resolver,
                           TransferStrategies strategies, SizeVerifier verifier, Clock clock) {
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.poller = Objects.requireNonNull(poller, "poller");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.strategies = Objects.requireNonNull(strategies, "strategies");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lifecycle = new EphemeralWorkloadLifecycle(timeouts.readinessTimeout(), timeouts.execTimeout());
    }

    /**
     * Whether teardown is also registered as a JVM shutdown hook during a run (default true).
     */
    public MigrationEngine setInstallShutdownHook(boolean install) {
        this.installShutdownHook = install;
        return this;
    }

    public MigrationTimeouts getTimeouts() {
        return timeouts;
    }

    /**
     * Runs the full migration.
     *
     * @param runId identifier used in logs and pod names, e.g. {@code 20240101-120000}
     * @param request what to migrate
     * @param source session on the source cluster
     * @param destination session on the destination cluster
     * @param stagingDirectory local scratch directory for this run
     * @return the report of a successful run
     * @throws MigrateException on the first fatal failure, with its stage set
     */
    public MigrationReport run(String runId, MigrationRequest request, ClusterSession source,
                               ClusterSession destination, Path stagingDirectory) throws MigrateException {
        if (source.role() != ClusterRole.SOURCE || destination.role() != ClusterRole.DESTINATION) {
            throw new IllegalArgumentException("Sessions passed in the wrong roles: " + source + ", " + destination);
        }
        log.info("Starting migration {}: {}", runId, request);
        MigrationAlertLogger.migrationStarted(runId, request.sourceNamespace(), request.destinationNamespace(),
                request.transferMethod().name());

        MigrationMetricsCollector metrics = new MigrationMetricsCollector(clock).start(runId);
        TeardownCoordinator teardown = new TeardownCoordinator(lifecycle);
        if (installShutdownHook) {
            teardown.installShutdownHook();
        }

        RunState state = new RunState();
        MigrateException failure = null;
        Phase failedPhase = null;
        try {
            step(runId, metrics, Phase.PREFLIGHT, () -> preflight(request, source, destination));
            state.backup = phase(runId, metrics, Phase.BACKUP, () -> backup(request, source));
            phase(runId, metrics, Phase.PROVISION, () -> provision(request, source, destination, state, teardown));
            phase(runId, metrics, Phase.LAUNCH, () -> launch(runId, request, source, destination, state, teardown));
            phase(runId, metrics, Phase.TRANSFER, () -> transfer(request, stagingDirectory, state, metrics));
            phase(runId, metrics, Phase.VERIFY, () -> verify(runId, state, metrics));
            state.restore = phase(runId, metrics, Phase.RESTORE, () -> restore(request, destination, state));
            teardown.markSucceeded();
        } catch (MigrateException e) {
            failedPhase = metrics.currentPhase();
            failure = e.atStage(failedPhase != null ? failedPhase.name() : "UNKNOWN");
        } catch (RuntimeException e) {
            failedPhase = metrics.currentPhase();
            failure = new MigrateException(String.valueOf(e.getMessage()),
                    failedPhase != null ? failedPhase.name() : "UNKNOWN", null, e);
        } finally {
            metrics.timed(Phase.TEARDOWN, (ThrowingRunnable<RuntimeException>) teardown::close);
        }

        MigrationMetrics finished = metrics.finish();
        if (failure != null) {
            if (failure instanceof ResourceTimeoutException) {
                MigrationAlertLogger.migrationTimeout(runId,
                        ((ResourceTimeoutException) failure).getTimeout().toMillis(), failedPhase);
            }
            MigrationAlertLogger.migrationFailed(runId, failure, failedPhase, finished);
            log.warn("Migration failed - metrics: {}", finished.summary());
            throw failure;
        }

        MigrationAlertLogger.migrationCompleted(runId, finished);
        log.info("Migration metrics: {}", finished.summary());
        log.info("All done.");
        return new MigrationReport(runId, request, state.backup, state.destinationClaim, state.volume,
                state.provisioning, state.strategy.method(), state.sourceSize, state.destinationSize,
                state.sizeCheck, state.restore, teardown.report(), finished);
    }

    /* ---------------- phases ---------------- */

    private void preflight(MigrationRequest request, ClusterSession source, ClusterSession destination)
            throws MigrateException {
        if (!source.namespaceExists(request.sourceNamespace())) {
            throw new MigrateException("Source namespace '" + request.sourceNamespace() + "' not found",
                    Phase.PREFLIGHT.name(), "namespace " + request.sourceNamespace(), null);
        }
        if (!destination.namespaceExists(request.destinationNamespace())) {
            throw new MigrateException("Destination namespace '" + request.destinationNamespace() + "' not found",
                    Phase.PREFLIGHT.name(), "namespace " + request.destinationNamespace(), null);
        }
    }

    private BackupResult backup(MigrationRequest request, ClusterSession source) throws MigrateException {
        String defaultClaim = request.sourceVolumeName().orElse(request.workloadIdentity() + "-backup-claim");
        BackupPhase definition = new BackupPhase(request.sourceNamespace(), request.workloadIdentity(),
                request.sourcePath(), defaultClaim);
        BackupResult backup = controller(definition, source).run();
        log.info("Using source PVC='{}', backup dir='{}', dir name='{}'.",
                backup.backupClaim(), backup.backupDirectory(), backup.directoryName());
        return backup;
    }

    private Void provision(MigrationRequest request, ClusterSession source, ClusterSession destination,
                           RunState state, TeardownCoordinator teardown) throws MigrateException {
        state.destinationClaim = request.effectiveDestinationVolumeName();
        state.volume = resolver.resolve(source.volumes(), request.sourceNamespace(), state.backup.backupClaim(),
                destination.volumes());
        state.provisioning = resolver.ensure(destination.volumes(), request.destinationNamespace(),
                state.destinationClaim, state.volume.spec());
        teardown.registerVolume(source.volumes(), request.sourceNamespace(), state.backup.backupClaim());
        teardown.registerVolume(destination.volumes(), request.destinationNamespace(), state.destinationClaim);
        return null;
    }

    private Void launch(String runId, MigrationRequest request, ClusterSession source, ClusterSession destination,
                        RunState state, TeardownCoordinator teardown) throws MigrateException {
        state.sourcePod = lifecycle.launch(source.workloads(), ClusterRole.SOURCE, request.sourceNamespace(),
                WorkloadNames.sourcePod(runId), state.backup.backupClaim(), request.image(), teardown::registerWorkload);
        lifecycle.awaitReady(state.sourcePod);

        state.destinationPod = lifecycle.launch(destination.workloads(), ClusterRole.DESTINATION,
                request.destinationNamespace(), WorkloadNames.destinationPod(runId), state.destinationClaim,
                request.image(), teardown::registerWorkload);
        lifecycle.awaitReady(state.destinationPod);

        ExecResult mkdir = state.destinationPod.exec("mkdir -p " + Shell.quote(request.destinationPath()));
        if (!mkdir.succeeded()) {
            throw new TransferException("mkdir " + request.destinationPath() + " failed: " + mkdir.stderr().trim(),
                    "pod " + state.destinationPod.namespace() + "/" + state.destinationPod.name());
        }
        return null;
    }

    private Void transfer(MigrationRequest request, Path stagingDirectory, RunState state,
                          MigrationMetricsCollector metrics) throws MigrateException {
        TransferPlan plan = new TransferPlan(state.sourcePod, state.backup.parentPath(), state.backup.directoryName(),
                state.destinationPod, request.destinationPath(), stagingDirectory);
        state.plan = plan;
        state.strategy = strategies.select(request.transferMethod(), plan);
        metrics.transferMethod(state.strategy.method().name());

        state.sourceSize = verifier.measure(state.sourcePod, plan.sourceDirectory());
        log.info("Source backup dir size: {} ({} blocks)", state.sourceSize.human(), state.sourceSize.blocks());

        state.strategy.transfer(plan);
        return null;
    }

    private Void verify(String runId, RunState state, MigrationMetricsCollector metrics) {
        String copied = state.plan.destinationDirectory();
        SelinuxRelabel.apply(state.destinationPod, copied);
        state.destinationSize = verifier.measure(state.destinationPod, copied);
        log.info("Destination backup dir size: {} ({} blocks)", state.destinationSize.human(),
                state.destinationSize.blocks());
        state.sizeCheck = verifier.verify(state.sourceSize.blocks(), state.destinationSize.blocks());
        metrics.blocks(state.sourceSize.blocks(), state.destinationSize.blocks())
                .sizeCheck(state.sizeCheck.status().name());
        if (state.sizeCheck.status() == SizeCheckResult.Status.WARNING) {
            MigrationAlertLogger.sizeMismatch(runId, state.sizeCheck.sourceBlocks(),
                    state.sizeCheck.destinationBlocks(), state.sizeCheck.tolerance());
        }
        return null;
    }

    private RestoreResult restore(MigrationRequest request, ClusterSession destination, RunState state)
            throws MigrateException {
        log.info("Deleting destination transfer pod '{}' before restore...", state.destinationPod.name());
        if (!lifecycle.terminate(state.destinationPod)) {
            log.warn("Destination transfer pod '{}' could not be deleted; restore may not mount the claim",
                    state.destinationPod.name());
        }
        String backupDir = Shell.join(request.destinationPath(), state.backup.directoryName());
        RestorePhase definition = new RestorePhase(request.destinationNamespace(), request.workloadIdentity(),
                backupDir, state.destinationClaim);
        RestoreResult result = controller(definition, destination).run();
        log.info("Restore completed successfully.");
        return result;
    }

    /* ---------------- helpers ---------------- */

    private <R> PhaseController<R> controller(PhaseDefinition<R> definition, ClusterSession session) {
        return new PhaseController<>(definition, session.customResources(), poller,
                timeouts.deletionTimeout(), timeouts.phaseTimeout(), timeouts.pollInterval());
    }

    private static <T> T phase(String runId, MigrationMetricsCollector metrics, Phase phase,
                               ThrowingSupplier<T, MigrateException> action) throws MigrateException {
        MigrationAlertLogger.phaseStarted(runId, phase);
        long start = System.nanoTime();
        T result = metrics.timed(phase, action);
        MigrationAlertLogger.phaseCompleted(runId, phase, (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    private static void step(String runId, MigrationMetricsCollector metrics, Phase phase,
                             ThrowingRunnable<MigrateException> action) throws MigrateException {
        MigrationAlertLogger.phaseStarted(runId, phase);
        long start = System.nanoTime();
        metrics.timed(phase, action);
        MigrationAlertLogger.phaseCompleted(runId, phase, (System.nanoTime() - start) / 1_000_000);
    }

    /** Intermediate results of a run. */
    private static final class RunState {
        BackupResult backup;
        String destinationClaim;
        VolumeResolution volume;
        ProvisioningOutcome provisioning;
        EphemeralWorkload sourcePod;
        EphemeralWorkload destinationPod;
        TransferPlan plan;
        TransferStrategy strategy;
        SizeMeasurement sourceSize;
        SizeMeasurement destinationSize;
        SizeCheckResult sizeCheck;
        RestoreResult restore;
    }
}
