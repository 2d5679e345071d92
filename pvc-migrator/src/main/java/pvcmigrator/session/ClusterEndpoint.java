package pvcmigrator.session;

/**
 * Connection details for one cluster.
 *
 * <p>A bearer token takes precedence over username/password. Secrets are
 * masked in {@link #toString()}.
 *
 * @param apiUrl   API server URL
 * @param token    bearer token, may be null
 * @param username basic-auth user, may be null
 * @param password basic-auth password, may be null
 * @param insecure skip TLS certificate and hostname verification
 */
public record ClusterEndpoint(String apiUrl, String token, String username, String password, boolean insecure) {

    public ClusterEndpoint {
        apiUrl = blankToNull(apiUrl);
        token = blankToNull(token);
        username = blankToNull(username);
        password = blankToNull(password);
    }

    public static ClusterEndpoint withToken(String apiUrl, String token, boolean insecure) {
        return new ClusterEndpoint(apiUrl, token, null, null, insecure);
    }

    public static ClusterEndpoint withBasicAuth(String apiUrl, String username, String password, boolean insecure) {
        return new ClusterEndpoint(apiUrl, null, username, password, insecure);
    }

    public boolean hasToken() {
        return token != null;
    }

    public boolean hasBasicAuth() {
        return username != null && password != null;
    }

    /** True when an API URL and at least one credential form are present. */
    public boolean isComplete() {
        return apiUrl != null && (hasToken() || hasBasicAuth());
    }

    @Override
    public String toString() {
        return "ClusterEndpoint{" +
                "apiUrl=" + apiUrl +
                ", auth=" + (hasToken() ? "token" : hasBasicAuth() ? "basic(" + username + ")" : "none") +
                ", insecure=" + insecure +
                '}';
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
