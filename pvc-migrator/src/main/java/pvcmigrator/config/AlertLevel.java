package pvcmigrator.config;

/**
 * Alert level for migration event logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link pvcmigrator.alert.MigrationAlertLogger}. Configured via the
 * {@code pvcmigrator.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - all events: started, phase transitions, completed, warnings, errors</li>
 *   <li>{@link #WARNING} - warnings (size mismatch, teardown failures) and errors only</li>
 *   <li>{@link #ERROR} - errors only</li>
 * </ul>
 */
public enum AlertLevel {
    DEBUG,
    WARNING,
    ERROR
}
