package pvcmigrator.teardown;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.session.ClusterRole;
import pvcmigrator.testing.FakeVolumes;
import pvcmigrator.testing.FakeWorkloads;
import pvcmigrator.volume.ClaimSnapshot;
import pvcmigrator.workload.EphemeralWorkload;
import pvcmigrator.workload.EphemeralWorkloadLifecycle;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TeardownCoordinator")
class TeardownCoordinatorTest {

    private EphemeralWorkloadLifecycle lifecycle;
    private FakeWorkloads pods;
    private FakeVolumes volumes;
    private TeardownCoordinator teardown;

    @BeforeEach
    void setUp() throws MigrateException {
        lifecycle = new EphemeralWorkloadLifecycle(Duration.ofSeconds(5), Duration.ofSeconds(5));
        pods = new FakeWorkloads();
        volumes = new FakeVolumes()
                .claim(new ClaimSnapshot("src", "backup-claim", "1Gi", List.of(), null, null, "Bound"))
                .claim(new ClaimSnapshot("dst", "recovery-claim", "1Gi", List.of(), null, null, "Bound"));
        teardown = new TeardownCoordinator(lifecycle);
        lifecycle.launch(pods, ClusterRole.SOURCE, "src", "pvc-src-1", "backup-claim", "ubi9", teardown::registerWorkload);
        lifecycle.launch(pods, ClusterRole.DESTINATION, "dst", "pvc-dst-1", "recovery-claim", "ubi9",
                teardown::registerWorkload);
        teardown.registerVolume(volumes, "src", "backup-claim");
        teardown.registerVolume(volumes, "dst", "recovery-claim");
    }

    @Test
    void failedRunDeletesPodsButKeepsClaims() {
        teardown.close();

        assertThat(pods.deleted()).containsExactly("src/pvc-src-1", "dst/pvc-dst-1");
        assertThat(volumes.deleted()).isEmpty();
        assertThat(teardown.report().volumesReleased()).isFalse();
        assertThat(teardown.report().isClean()).isTrue();
    }

    @Test
    void successfulRunAlsoReleasesClaims() {
        teardown.markSucceeded();
        teardown.close();

        assertThat(volumes.deleted()).containsExactly("src/backup-claim", "dst/recovery-claim");
        assertThat(teardown.report().deleted()).contains("pvc dst/recovery-claim", "pod src/pvc-src-1");
    }

    @Test
    void alreadyTerminatedPodIsNotDeletedTwice() throws MigrateException {
        EphemeralWorkload extra = lifecycle.launch(pods, ClusterRole.DESTINATION, "dst", "pvc-dst-2", "c", "ubi9",
                teardown::registerWorkload);
        lifecycle.terminate(extra);

        teardown.close();

        assertThat(pods.deleted()).containsOnlyOnce("dst/pvc-dst-2");
    }

    @Test
    void closeIsIdempotent() {
        teardown.close();
        teardown.close();

        assertThat(teardown.isClosed()).isTrue();
        assertThat(pods.deleted()).hasSize(2);
    }

    @Test
    void deletionFailuresAreRecordedNotThrown() {
        pods.failDelete();
        volumes.undeletable("dst", "recovery-claim");
        teardown.markSucceeded();

        teardown.close();

        TeardownReport report = teardown.report();
        assertThat(report.isClean()).isFalse();
        assertThat(report.failed()).containsExactly("pod src/pvc-src-1", "pod dst/pvc-dst-1", "pvc dst/recovery-claim");
        assertThat(report.deleted()).containsExactly("pvc src/backup-claim");
    }

    @Test
    void reportBeforeCloseIsNotRun() {
        assertThat(teardown.report()).isSameAs(TeardownReport.NOT_RUN);
    }

    @Test
    void shutdownHookIsRemovedOnClose() {
        teardown.installShutdownHook();
        teardown.close();

        assertThat(teardown.isClosed()).isTrue();
    }
}
