package pvcmigrator.exceptions;

/**
 * Thrown when a copy step (exec, download or upload) fails.
 */
public class TransferException extends MigrateException {

    public TransferException(String message, String resource) {
        super(message, "TRANSFER", resource, null);
    }

    public TransferException(String message, String resource, Throwable cause) {
        super(message, "TRANSFER", resource, cause);
    }
}
