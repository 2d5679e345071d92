package pvcmigrator.exceptions;

import java.time.Duration;

/**
 * Thrown when a status condition is not satisfied within its time budget.
 *
 * <p>The resource is left in place so it can be inspected; nothing is
 * deleted or re-created on timeout.
 */
public class ResourceTimeoutException extends MigrateException {

    private final Duration timeout;
    private final String lastObserved;

    /**
     * @param resource the resource that was being watched
     * @param timeout the budget that was exceeded
     * @param lastObserved the last status/reason pair seen, for diagnostics
     */
    public ResourceTimeoutException(String resource, Duration timeout, String lastObserved) {
        super(String.format("Timed out after %d s waiting for %s (last observed: %s)",
                timeout.toSeconds(), resource, lastObserved), null, resource, null);
        this.timeout = timeout;
        this.lastObserved = lastObserved;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getLastObserved() {
        return lastObserved;
    }
}
