package pvcmigrator.cli;

import org.junit.jupiter.api.Test;
import pvcmigrator.session.ClusterEndpoint;
import pvcmigrator.session.ClusterRole;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class InteractivePrompterTest {

    private final StringWriter out = new StringWriter();

    private InteractivePrompter prompter(String input) {
        return new InteractivePrompter(new BufferedReader(new StringReader(input)), new PrintWriter(out, true), null);
    }

    @Test
    void emptyAnswerTakesDefault() {
        assertThat(prompter("\n").ask("Ephemeral pod image", "ubi9")).isEqualTo("ubi9");
        assertThat(out.toString()).contains("Ephemeral pod image [ubi9]: ");
    }

    @Test
    void endOfInputTakesDefault() {
        assertThat(prompter("").ask("Controller (deployment) name", "controller")).isEqualTo("controller");
    }

    @Test
    void answerIsTrimmed() {
        assertThat(prompter("  tower \n").ask("Controller (deployment) name", "controller")).isEqualTo("tower");
    }

    @Test
    void tokenLogin() {
        Optional<ClusterEndpoint> endpoint = prompter("1\nhttps://api.src:6443\nsha256~t\ny\n").login(ClusterRole.SOURCE);

        assertThat(endpoint).hasValueSatisfying(e -> {
            assertThat(e.apiUrl()).isEqualTo("https://api.src:6443");
            assertThat(e.token()).isEqualTo("sha256~t");
            assertThat(e.insecure()).isTrue();
        });
        assertThat(out.toString()).contains("=== source login ===");
    }

    @Test
    void passwordLoginAfterInvalidChoice() {
        Optional<ClusterEndpoint> endpoint = prompter("9\n2\nhttps://api.dst:6443\nadmin\npw\n\n")
                .login(ClusterRole.DESTINATION);

        assertThat(out.toString()).contains("Invalid choice.");
        assertThat(endpoint).hasValueSatisfying(e -> {
            assertThat(e.hasBasicAuth()).isTrue();
            assertThat(e.username()).isEqualTo("admin");
            assertThat(e.insecure()).isFalse();
        });
    }

    @Test
    void abortAndEndOfInputGiveEmpty() {
        assertThat(prompter("3\n").login(ClusterRole.SOURCE)).isEmpty();
        assertThat(prompter("").login(ClusterRole.SOURCE)).isEmpty();
    }
}
