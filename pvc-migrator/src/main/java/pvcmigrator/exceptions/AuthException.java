package pvcmigrator.exceptions;

/**
 * Thrown when a cluster session cannot be established.
 *
 * <p>Either the credentials were rejected, the credentials were incomplete
 * (no token and no username/password), or the liveness check after login
 * (identity lookup plus API discovery) did not pass.
 */
public class AuthException extends MigrateException {

    /** Why the session was rejected. */
    public enum Reason {
        /** No endpoint, or neither a token nor a username/password pair. */
        INCOMPLETE,
        /** The API server rejected the credentials or could not be reached. */
        REJECTED,
        /** The server certificate could not be verified. */
        UNTRUSTED
    }

    private final Reason reason;

    public AuthException(String message, Reason reason) {
        super(message, "LOGIN", null, null);
        this.reason = reason;
    }

    public AuthException(String message, Reason reason, Throwable cause) {
        super(message, "LOGIN", null, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
