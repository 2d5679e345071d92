package pvcmigrator.exceptions;

import java.time.Duration;

/**
 * Thrown when an ephemeral transfer pod does not become Ready in time.
 */
public class ReadinessTimeoutException extends MigrateException {

    private final Duration timeout;

    public ReadinessTimeoutException(String resource, Duration timeout) {
        super("Pod did not become Ready within " + timeout.toSeconds() + " s", "LAUNCH", resource, null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
