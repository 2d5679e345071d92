package pvcmigrator.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;
import pvcmigrator.engine.MigrationEngine;
import pvcmigrator.engine.MigrationTimeouts;
import pvcmigrator.exceptions.AuthException;
import pvcmigrator.phase.BackupPhase;
import pvcmigrator.phase.RestorePhase;
import pvcmigrator.poll.ConditionPoller;
import pvcmigrator.session.ClusterEndpoint;
import pvcmigrator.session.ClusterRole;
import pvcmigrator.session.ClusterSessionFactory;
import pvcmigrator.testing.FakeClusterSession;
import pvcmigrator.testing.ManualClock;
import pvcmigrator.transfer.SizeVerifier;
import pvcmigrator.transfer.TransferStrategies;
import pvcmigrator.volume.ClaimSnapshot;
import pvcmigrator.volume.VolumeProvisioningResolver;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static pvcmigrator.testing.FakeCustomResources.condition;

@DisplayName("pvc-migrator command")
class PvcMigratorCommandTest {

    private static final String RUN_ID = "20240101-120000";

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private final StringWriter promptOut = new StringWriter();

    private ManualClock clock;
    private FakeClusterSession source;
    private FakeClusterSession destination;
    private ClusterSessionFactory sessions;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        source = new FakeClusterSession(ClusterRole.SOURCE, "aap-src");
        destination = new FakeClusterSession(ClusterRole.DESTINATION, "aap-dst");

        source.customResources().script(BackupPhase.KIND, List.of(
                condition("True", "Successful", Map.of(
                        "backupDirectory", "/backups/tower-openshift-backup-1",
                        "backupClaim", "controller-backup-claim"))));
        source.volumes().claim(new ClaimSnapshot("aap-src", "controller-backup-claim", "10Gi",
                List.of("ReadWriteOnce"), "Filesystem", "gp3", "Bound"));
        source.workloads().on("du -sh", "1.0G").on("du -s ", "1000");
        destination.volumes().storageClass("gp3");
        destination.workloads().on("du -sh", "1.0G").on("du -s ", "1000");
        destination.customResources().script(RestorePhase.KIND, List.of(
                condition("True", "Successful", Map.of("restoreComplete", true))));

        sessions = mock(ClusterSessionFactory.class);
    }

    private MigrationEngine engine() {
        return new MigrationEngine(
                MigrationTimeouts.builder().pollInterval(Duration.ofSeconds(5)).build(),
                new ConditionPoller(clock, clock.sleeper()),
                new VolumeProvisioningResolver("20Gi"),
                new TransferStrategies(),
                new SizeVerifier(),
                clock).setInstallShutdownHook(false);
    }

    private int execute(String input, String... args) {
        InteractivePrompter prompter = new InteractivePrompter(
                new BufferedReader(new StringReader(input)), new PrintWriter(promptOut, true), null);
        CommandLine cmd = new CommandLine(new PvcMigratorCommand(sessions, config -> engine(), clock, prompter));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path mapping(String sourceNamespace) throws IOException {
        Path f = tempDir.resolve("pvc-map.csv");
        Files.writeString(f, "source_namespace,dest_namespace\n" + sourceNamespace + ",aap-dst\n");
        return f;
    }

    private Path credentials(String name) throws IOException {
        Path f = tempDir.resolve(name);
        Files.writeString(f, """
                label,api_url,token,user,pass,insecure
                source,https://api.src:6443,sha256~src,,,no
                dest,https://api.dst:6443,sha256~dst,,,no
                """);
        return f;
    }

    private void bothClustersAccept() throws AuthException {
        when(sessions.open(eq(ClusterRole.SOURCE), any())).thenReturn(source);
        when(sessions.open(eq(ClusterRole.DESTINATION), any())).thenReturn(destination);
    }

    @Nested
    @DisplayName("argument checks")
    class Arguments {

        @Test
        void mappingFileIsRequired() {
            int code = execute("");

            assertThat(code).isEqualTo(1);
            assertThat(err.toString()).contains("ERROR: pvc-map CSV is required.").contains("Usage:");
        }

        @Test
        void missingMappingFile() {
            int code = execute("", "--pvc", tempDir.resolve("nope.csv").toString());

            assertThat(code).isEqualTo(1);
            assertThat(err.toString()).contains("ERROR: PVC CSV not found:");
        }

        @Test
        void mappingWithoutNamespacesIsAConfigError() throws IOException {
            Path f = tempDir.resolve("pvc-map.csv");
            Files.writeString(f, "source_namespace,dest_namespace\n");

            int code = execute("", "--non-interactive", "--workdir", tempDir.toString(), f.toString());

            assertThat(code).isEqualTo(1);
            assertThat(err.toString()).startsWith("ERROR: ");
        }
    }

    @Nested
    @DisplayName("non-interactive run")
    class NonInteractive {

        @Test
        void migratesAndPrintsSummary() throws Exception {
            bothClustersAccept();
            Path cred = credentials("creds.csv");

            int code = execute("", "--non-interactive", "--workdir", tempDir.toString(),
                    "--cred", cred.toString(), "--pvc", mapping("aap-src").toString());

            assertThat(code).as(err.toString()).isEqualTo(0);
            assertThat(out.toString())
                    .contains("Migration " + RUN_ID + " completed.")
                    .contains("Method:   tar")
                    .contains("[PASSED]");
            assertThat(source.isClosed()).isTrue();
            assertThat(destination.isClosed()).isTrue();
            assertThat(tempDir.resolve(RunDirectory.PREFIX + RUN_ID)).isDirectory();
            assertThat(promptOut.toString()).isEmpty();
        }

        @Test
        void usesImageOption() throws Exception {
            bothClustersAccept();

            execute("", "--non-interactive", "--workdir", tempDir.toString(), "--image", "registry.local/ubi9:9.4",
                    "--cred", credentials("creds.csv").toString(), mapping("aap-src").toString());

            assertThat(source.workloads().created()).singleElement()
                    .satisfies(p -> assertThat(p.image()).isEqualTo("registry.local/ubi9:9.4"));
        }

        @Test
        void picksUpCredentialsNextToMapping() throws Exception {
            bothClustersAccept();
            credentials(PvcMigratorCommand.DEFAULT_CREDENTIALS_FILE);

            execute("", "--non-interactive", "--workdir", tempDir.toString(), mapping("aap-src").toString());

            ArgumentCaptor<ClusterEndpoint> endpoint = ArgumentCaptor.forClass(ClusterEndpoint.class);
            verify(sessions).open(eq(ClusterRole.SOURCE), endpoint.capture());
            assertThat(endpoint.getValue().apiUrl()).isEqualTo("https://api.src:6443");
        }

        @Test
        void reportsFailedPhase() throws Exception {
            bothClustersAccept();

            int code = execute("", "--non-interactive", "--workdir", tempDir.toString(),
                    "--cred", credentials("creds.csv").toString(), mapping("missing-ns").toString());

            assertThat(code).isEqualTo(1);
            assertThat(err.toString()).startsWith("ERROR [phase=PREFLIGHT] ").contains("missing-ns");
            assertThat(source.isClosed()).isTrue();
        }

        @Test
        void rejectedLoginFailsWithoutPrompting() throws Exception {
            when(sessions.open(eq(ClusterRole.SOURCE), any()))
                    .thenThrow(new AuthException("source credentials rejected (HTTP 401)", AuthException.Reason.REJECTED));

            int code = execute("1\n", "--non-interactive", "--workdir", tempDir.toString(),
                    "--cred", credentials("creds.csv").toString(), mapping("aap-src").toString());

            assertThat(code).isEqualTo(1);
            assertThat(err.toString()).contains("ERROR [phase=LOGIN] source credentials rejected (HTTP 401)");
            assertThat(promptOut.toString()).isEmpty();
        }
    }

    @Nested
    @DisplayName("interactive run")
    class Interactive {

        @Test
        void promptsAfterRejectedFileLogin() throws Exception {
            when(sessions.open(eq(ClusterRole.SOURCE), argThat(e -> e != null && "sha256~src".equals(e.token()))))
                    .thenThrow(new AuthException("source credentials rejected (HTTP 401)", AuthException.Reason.REJECTED));
            when(sessions.open(eq(ClusterRole.SOURCE), argThat(e -> e != null && "sha256~typed".equals(e.token()))))
                    .thenReturn(source);
            when(sessions.open(eq(ClusterRole.DESTINATION), any())).thenReturn(destination);

            String input = String.join("\n",
                    "1", "https://api.src:6443", "sha256~typed", "n",
                    "",
                    "") + "\n";
            int code = execute(input, "--workdir", tempDir.toString(), "--image", "ubi9",
                    "--cred", credentials("creds.csv").toString(), mapping("aap-src").toString());

            assertThat(code).as(err.toString()).isEqualTo(0);
            assertThat(promptOut.toString())
                    .contains("CSV login for source failed or incomplete.")
                    .contains("=== source login ===")
                    .contains("Controller (deployment) name [controller]");
            verify(sessions, times(2)).open(eq(ClusterRole.SOURCE), any());
        }

        @Test
        void abortAtLoginMenu() throws Exception {
            when(sessions.open(eq(ClusterRole.SOURCE), any()))
                    .thenThrow(new AuthException("source API URL is missing", AuthException.Reason.INCOMPLETE));

            int code = execute("3\n", "--workdir", tempDir.toString(), mapping("aap-src").toString());

            assertThat(code).isEqualTo(1);
            assertThat(err.toString()).contains("ERROR [phase=LOGIN] Aborted by user at source login");
        }

        @Test
        void failedPromptedLoginAsksAgain() throws Exception {
            when(sessions.open(eq(ClusterRole.SOURCE), any()))
                    .thenThrow(new AuthException("no", AuthException.Reason.REJECTED));

            int code = execute("2\nhttps://api.src:6443\nadmin\npw\nn\n3\n",
                    "--workdir", tempDir.toString(), mapping("aap-src").toString());

            assertThat(code).isEqualTo(1);
            assertThat(promptOut.toString()).contains("Login failed.");
            verify(sessions, times(2)).open(eq(ClusterRole.SOURCE), any());
        }
    }
}
