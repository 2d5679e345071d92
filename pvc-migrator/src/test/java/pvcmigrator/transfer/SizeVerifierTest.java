package pvcmigrator.transfer;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.TransferException;
import pvcmigrator.testing.FakeWorkloads;
import pvcmigrator.workload.ExecResult;
import pvcmigrator.workload.WorkloadGateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SizeVerifierTest {

    private final SizeVerifier verifier = new SizeVerifier();

    @Nested
    class Verify {

        @Test
        void withinTolerancePasses() {
            SizeCheckResult r = verifier.verify(1000, 1026);

            assertThat(r.status()).isEqualTo(SizeCheckResult.Status.PASSED);
            assertThat(r.tolerance()).isEqualTo(26);
            assertThat(r.delta()).isEqualTo(26);
        }

        @Test
        void smallerDestinationBeyondToleranceWarns() {
            SizeCheckResult r = verifier.verify(1000, 973);

            assertThat(r.status()).isEqualTo(SizeCheckResult.Status.WARNING);
            assertThat(r.delta()).isEqualTo(27);
        }

        @Test
        void largerDirectoryScalesTolerance() {
            SizeCheckResult within = verifier.verify(10000, 10080);
            SizeCheckResult beyond = verifier.verify(10000, 10200);

            assertThat(within.status()).isEqualTo(SizeCheckResult.Status.PASSED);
            assertThat(within.tolerance()).isEqualTo(116);
            assertThat(beyond.status()).isEqualTo(SizeCheckResult.Status.WARNING);
            assertThat(beyond.tolerance()).isEqualTo(116);
            assertThat(beyond.delta()).isEqualTo(200);
        }

        @Test
        void emptyOrUnmeasuredSourceSkips() {
            assertThat(verifier.verify(0, 10).status()).isEqualTo(SizeCheckResult.Status.SKIPPED);
            assertThat(verifier.verify(-1, 10).status()).isEqualTo(SizeCheckResult.Status.SKIPPED);
            assertThat(verifier.verify(10, -1).status()).isEqualTo(SizeCheckResult.Status.SKIPPED);
        }
    }

    @Nested
    class Measure {

        @Test
        void readsHumanAndBlockCounts() throws MigrateException {
            FakeWorkloads gateway = new FakeWorkloads()
                    .on("du -sh", "1.2G\n")
                    .on("du -s ", "1234\n");

            SizeMeasurement m = verifier.measure(Pods.source(gateway), "/backups/dir");

            assertThat(m).isEqualTo(new SizeMeasurement(1234, "1.2G"));
            assertThat(m.isMeasured()).isTrue();
        }

        @Test
        void failedCommandIsUnknown() throws MigrateException {
            FakeWorkloads gateway = new FakeWorkloads().on("du ", new ExecResult(1, "", "denied"));

            assertThat(verifier.measure(Pods.source(gateway), "/x")).isEqualTo(SizeMeasurement.UNKNOWN);
        }

        @Test
        void execErrorIsUnknown() throws MigrateException {
            WorkloadGateway gateway = mock(WorkloadGateway.class);
            when(gateway.exec(anyString(), anyString(), anyString(), any()))
                    .thenThrow(new TransferException("connection reset", "pod src/pvc-src-1"));

            assertThat(verifier.measure(Pods.source(gateway), "/x")).isEqualTo(SizeMeasurement.UNKNOWN);
        }
    }

    @Test
    void relabelIsBestEffort() throws MigrateException {
        FakeWorkloads gateway = new FakeWorkloads();
        SelinuxRelabel.apply(Pods.destination(gateway), "/backups/dir");
        assertThat(gateway.scripts()).singleElement().asString().contains("restorecon -R '/backups/dir'");

        WorkloadGateway failing = mock(WorkloadGateway.class);
        when(failing.exec(anyString(), anyString(), anyString(), any())).thenThrow(new IllegalStateException("gone"));
        SelinuxRelabel.apply(Pods.destination(failing), "/backups/dir");
    }
}
