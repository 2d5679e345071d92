package pvcmigrator.phase;

import pvcmigrator.poll.ConditionExpectation;
import pvcmigrator.poll.ResourceStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Restore of the controller deployment on the destination cluster from the copied directory.
 *
 * <p>Success additionally requires {@code status.restoreComplete == true}.
 */
public final class RestorePhase implements PhaseDefinition<RestoreResult> {

    public static final String KIND = "AutomationControllerRestore";
    public static final String NAME = "aap-controller-restore";

    private final ResourceRef resource;
    private final String deploymentName;
    private final String backupDir;
    private final String backupClaim;

    /**
     * @param namespace destination namespace
     * @param deploymentName controller deployment to restore into
     * @param backupDir absolute path of the copied directory inside the claim
     * @param backupClaim destination claim holding the copy
     */
    public RestorePhase(String namespace, String deploymentName, String backupDir, String backupClaim) {
        this.resource = ResourceRef.automationController(KIND, namespace, NAME);
        this.deploymentName = deploymentName;
        this.backupDir = backupDir;
        this.backupClaim = backupClaim;
    }

    @Override
    public String phaseName() {
        return "RESTORE";
    }

    @Override
    public ResourceRef resource() {
        return resource;
    }

    @Override
    public Map<String, Object> spec() {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("backup_dir", backupDir);
        spec.put("backup_pvc", backupClaim);
        spec.put("backup_source", "PVC");
        spec.put("deployment_name", deploymentName);
        spec.put("force_drop_db", false);
        spec.put("image_pull_policy", "IfNotPresent");
        spec.put("no_log", true);
        spec.put("set_self_labels", true);
        return spec;
    }

    @Override
    public ConditionExpectation expectation() {
        return ConditionExpectation.successful().and(s -> s.isTrue("restoreComplete"));
    }

    @Override
    public RestoreResult decode(ResourceStatus status) {
        return new RestoreResult(status.isTrue("restoreComplete"));
    }
}
