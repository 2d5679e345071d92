package pvcmigrator.exceptions;

/**
 * Exception thrown when a migration step fails.
 *
 * <p>Carries the migration stage in which the failure happened (for example
 * {@code BACKUP}, {@code TRANSFER}) and, where one is involved, the remote
 * resource that was being worked on. Both are appended to {@link #getMessage()}
 * so the CLI can print a single diagnostic line.
 *
 * <p>Every fatal failure category of a run is a subclass of this type:
 * <ul>
 *   <li>{@link AuthException} - a cluster session could not be established</li>
 *   <li>{@link ResourceTimeoutException} - a condition was not met in time</li>
 *   <li>{@link ResourceFailedException} - a condition reported failure</li>
 *   <li>{@link ProvisioningException} - the destination volume could not be provided</li>
 *   <li>{@link LaunchException} / {@link ReadinessTimeoutException} - ephemeral pod problems</li>
 *   <li>{@link TransferException} - the copy step failed</li>
 * </ul>
 *
 * @see pvcmigrator.engine.MigrationEngine
 */
public class MigrateException extends Exception {

    private String stage;
    private final String resource;

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        this(message, null, null, null);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    /**
     * Creates a new migration exception with stage and resource context.
     *
     * @param message the error message
     * @param stage the migration stage where failure occurred (may be null)
     * @param resource description of the remote resource involved (may be null)
     * @param cause the underlying cause (may be null)
     */
    public MigrateException(String message, String stage, String resource, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.resource = resource;
    }

    /**
     * Returns the migration stage where the failure occurred.
     *
     * @return the stage name, or null if not set
     */
    public String getStage() {
        return stage;
    }

    /**
     * Records the stage if none was set when the exception was created.
     * Low-level helpers throw without a stage; the phase that called them fills it in.
     *
     * @param stage the stage name
     * @return this exception
     */
    public MigrateException atStage(String stage) {
        if (this.stage == null) {
            this.stage = stage;
        }
        return this;
    }

    /**
     * Returns the remote resource involved in the failure.
     *
     * @return a {@code kind/namespace/name} description, or null if not set
     */
    public String getResource() {
        return resource;
    }

    /**
     * Returns the bare message without the stage/resource suffix.
     *
     * @return the message passed to the constructor
     */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));
        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (resource != null) sb.append(" [resource=").append(resource).append("]");
        return sb.toString();
    }
}
