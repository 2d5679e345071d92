package pvcmigrator.exceptions;

/**
 * Thrown when the destination volume cannot be created, or when an existing
 * destination volume does not match the source volume.
 */
public class ProvisioningException extends MigrateException {

    public ProvisioningException(String message, String resource) {
        super(message, "PROVISION", resource, null);
    }

    public ProvisioningException(String message, String resource, Throwable cause) {
        super(message, "PROVISION", resource, cause);
    }
}
