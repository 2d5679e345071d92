package pvcmigrator.cli;

import pvcmigrator.session.ClusterEndpoint;
import pvcmigrator.session.ClusterRole;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Terminal prompts for values the input files leave out.
 *
 * <p>End of input counts as abort for the login menu and as "use the default"
 * for plain prompts.
 */
public class InteractivePrompter {

    private final BufferedReader in;
    private final PrintWriter out;
    private final Console console;

    public InteractivePrompter(BufferedReader in, PrintWriter out, Console console) {
        this.in = in;
        this.out = out;
        this.console = console;
    }

    public static InteractivePrompter fromSystem(PrintWriter out) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return new InteractivePrompter(in, out, System.console());
    }

    /**
     * Asks for a value.
     *
     * @param defaultValue shown in brackets and returned on empty input; may be null
     * @return the answer, trimmed; null only when there is neither answer nor default
     */
    public String ask(String message, String defaultValue) {
        if (defaultValue != null && !defaultValue.isEmpty()) {
            out.print(message + " [" + defaultValue + "]: ");
        } else {
            out.print(message + ": ");
        }
        out.flush();
        String answer = readLine();
        if (answer == null || answer.isBlank()) {
            return defaultValue;
        }
        return answer.trim();
    }

    /**
     * Login menu for one cluster: token, username/password, or abort.
     *
     * @return the entered endpoint, or empty if the user aborted
     */
    public Optional<ClusterEndpoint> login(ClusterRole role) {
        while (true) {
            out.println("=== " + role + " login ===");
            out.println("  1) Token");
            out.println("  2) Username/Password");
            out.println("  3) Abort");
            out.print("Choose [1-3]: ");
            out.flush();
            String choice = readLine();
            if (choice == null) {
                return Optional.empty();
            }
            switch (choice.trim()) {
                case "1": {
                    String api = ask("API URL (e.g., https://api.cluster:6443)", null);
                    String token = askSecret("Bearer token");
                    return Optional.of(ClusterEndpoint.withToken(api, token, askInsecure()));
                }
                case "2": {
                    String api = ask("API URL (e.g., https://api.cluster:6443)", null);
                    String user = ask("Username", null);
                    String pass = askSecret("Password");
                    return Optional.of(ClusterEndpoint.withBasicAuth(api, user, pass, askInsecure()));
                }
                case "3":
                    return Optional.empty();
                default:
                    out.println("Invalid choice.");
            }
        }
    }

    public void say(String message) {
        out.println(message);
        out.flush();
    }

    private boolean askInsecure() {
        String answer = ask("Skip TLS verify? [y/N]", null);
        return answer != null && answer.toLowerCase(Locale.ROOT).startsWith("y");
    }

    private String askSecret(String message) {
        if (console != null) {
            char[] secret = console.readPassword("%s (hidden): ", message);
            return secret == null ? null : new String(secret);
        }
        out.print(message + " (hidden): ");
        out.flush();
        return readLine();
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from terminal", e);
        }
    }
}
