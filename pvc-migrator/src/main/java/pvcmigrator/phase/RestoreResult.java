package pvcmigrator.phase;

/**
 * Final state reported by the restore.
 *
 * @param restoreComplete the operator's {@code restoreComplete} flag
 */
public record RestoreResult(boolean restoreComplete) {
}
