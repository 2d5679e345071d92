package pvcmigrator.phase;

import java.util.Objects;

/**
 * Where the operator wrote the backup on the source cluster.
 *
 * @param backupDirectory absolute directory inside the backup claim, e.g. {@code /backups/tower-openshift-backup-2024-01-01}
 * @param backupClaim name of the claim holding the backup
 */
public record BackupResult(String backupDirectory, String backupClaim) {

    public BackupResult {
        Objects.requireNonNull(backupDirectory, "backupDirectory");
        Objects.requireNonNull(backupClaim, "backupClaim");
        backupDirectory = stripTrailingSlashes(backupDirectory);
    }

    /** Directory containing the backup ({@code dirname}). */
    public String parentPath() {
        int idx = backupDirectory.lastIndexOf('/');
        if (idx < 0) {
            return ".";
        }
        return idx == 0 ? "/" : backupDirectory.substring(0, idx);
    }

    /** Last path element ({@code basename}); the folder name kept on the destination. */
    public String directoryName() {
        int idx = backupDirectory.lastIndexOf('/');
        return idx < 0 ? backupDirectory : backupDirectory.substring(idx + 1);
    }

    private static String stripTrailingSlashes(String path) {
        String p = path.trim();
        while (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }
}
