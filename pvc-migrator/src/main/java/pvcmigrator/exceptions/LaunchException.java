package pvcmigrator.exceptions;

/**
 * Thrown when an ephemeral transfer pod cannot be created.
 */
public class LaunchException extends MigrateException {

    public LaunchException(String message, String resource, Throwable cause) {
        super(message, "LAUNCH", resource, cause);
    }
}
