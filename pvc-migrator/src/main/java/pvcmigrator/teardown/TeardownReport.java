package pvcmigrator.teardown;

import java.util.List;

/**
 * What teardown removed and what it could not.
 *
 * @param deleted descriptions of removed pods and claims
 * @param failed descriptions of targets whose deletion failed
 * @param volumesReleased whether claims were in scope (run succeeded)
 */
public record TeardownReport(List<String> deleted, List<String> failed, boolean volumesReleased) {

    public static final TeardownReport NOT_RUN = new TeardownReport(List.of(), List.of(), false);

    public TeardownReport {
        deleted = List.copyOf(deleted);
        failed = List.copyOf(failed);
    }

    public boolean isClean() {
        return failed.isEmpty();
    }

    public String summary() {
        return "deleted=" + deleted + " failed=" + failed + " volumes_released=" + volumesReleased;
    }
}
