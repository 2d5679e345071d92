package pvcmigrator.exceptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MigrateException")
class MigrateExceptionTest {

    @Nested
    @DisplayName("message")
    class Message {

        @Test
        @DisplayName("should carry no diagnostics when created with a message only")
        void plainMessage() {
            MigrateException ex = new MigrateException("Migration failed");

            assertThat(ex.getMessage()).isEqualTo("Migration failed");
            assertThat(ex.getStage()).isNull();
            assertThat(ex.getResource()).isNull();
            assertThat(ex.getCause()).isNull();
        }

        @Test
        @DisplayName("should append stage and resource")
        void appendsDiagnostics() {
            MigrateException ex = new MigrateException("Copy failed", "TRANSFER", "pod ns/pvc-src-1", null);

            assertThat(ex.getMessage()).isEqualTo("Copy failed [stage=TRANSFER] [resource=pod ns/pvc-src-1]");
            assertThat(ex.getRawMessage()).isEqualTo("Copy failed");
        }

        @Test
        @DisplayName("should keep the cause")
        void keepsCause() {
            RuntimeException cause = new RuntimeException("Root cause");

            assertThat(new MigrateException("failed", cause).getCause()).isSameAs(cause);
        }
    }

    @Nested
    @DisplayName("atStage")
    class AtStage {

        @Test
        @DisplayName("should fill in a missing stage")
        void fillsMissingStage() {
            MigrateException ex = new TransferException("tar exited 2", "pod ns/p");

            assertThat(ex.atStage("TRANSFER")).isSameAs(ex);
            assertThat(ex.getStage()).isEqualTo("TRANSFER");
            assertThat(ex).isInstanceOf(TransferException.class);
        }

        @Test
        @DisplayName("should not overwrite an existing stage")
        void keepsExistingStage() {
            MigrateException ex = new MigrateException("x", "BACKUP", null, null).atStage("RESTORE");

            assertThat(ex.getStage()).isEqualTo("BACKUP");
        }

        @Test
        @DisplayName("login failures are staged at LOGIN")
        void authIsLoginStage() {
            AuthException ex = new AuthException("rejected", AuthException.Reason.REJECTED);

            assertThat(ex.atStage("PREFLIGHT").getStage()).isEqualTo("LOGIN");
        }
    }

    @Test
    @DisplayName("timeout carries budget and last observation")
    void timeoutDetails() {
        ResourceTimeoutException ex = new ResourceTimeoutException(
                "AutomationControllerBackup ns/b", Duration.ofMinutes(30), "Unknown/Running");

        assertThat(ex.getTimeout()).isEqualTo(Duration.ofMinutes(30));
        assertThat(ex.getLastObserved()).isEqualTo("Unknown/Running");
        assertThat(ex.getRawMessage()).contains("1800 s").contains("Unknown/Running");
        assertThat(ex.getResource()).isEqualTo("AutomationControllerBackup ns/b");
    }

    @Test
    @DisplayName("should be a checked exception")
    void checked() {
        assertThat(MigrateException.class).hasSuperclass(Exception.class);
        assertThat(RuntimeException.class.isAssignableFrom(MigrateException.class)).isFalse();
    }
}
