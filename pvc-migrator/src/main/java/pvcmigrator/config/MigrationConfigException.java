package pvcmigrator.config;

/**
 * Exception thrown when configuration or an input file cannot be loaded or is invalid.
 *
 * <p>This exception is thrown when:
 * <ul>
 *   <li>The PVC mapping file is missing, unreadable, or has no data row</li>
 *   <li>Required mapping columns (source/destination namespace) are absent or empty</li>
 *   <li>The credentials file cannot be read</li>
 *   <li>An explicitly named configuration file cannot be parsed</li>
 * </ul>
 *
 * <p>Configuration errors are fatal and never retried.
 *
 * @see MigratorConfigLoader
 * @see MappingFileLoader
 * @see CredentialsFileLoader
 */
public class MigrationConfigException extends RuntimeException {

    /**
     * Creates a new configuration exception with the specified message.
     *
     * @param message a description of the configuration problem
     */
    public MigrationConfigException(String message) {
        super(message);
    }

    /**
     * Creates a new configuration exception with the specified message and cause.
     *
     * @param message a description of the configuration problem
     * @param cause the underlying cause (e.g., IOException, YAML parse error)
     */
    public MigrationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
