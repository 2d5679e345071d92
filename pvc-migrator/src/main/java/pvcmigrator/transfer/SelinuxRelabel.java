package pvcmigrator.transfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.workload.EphemeralWorkload;

import static pvcmigrator.workload.Shell.quote;

/**
 * Runs {@code restorecon -R} on the copied directory when the tool exists in the pod.
 * Best effort: failures are logged.
 */
public final class SelinuxRelabel {

    private static final Logger log = LoggerFactory.getLogger(SelinuxRelabel.class);

    private SelinuxRelabel() {}

    public static void apply(EphemeralWorkload pod, String path) {
        try {
            pod.exec("command -v restorecon >/dev/null 2>&1 && restorecon -R " + quote(path) + " || true");
        } catch (MigrateException | RuntimeException e) {
            log.warn("restorecon on {} skipped: {}", path, e.getMessage());
        }
    }
}
