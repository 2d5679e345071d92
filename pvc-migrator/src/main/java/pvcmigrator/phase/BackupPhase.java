package pvcmigrator.phase;

import pvcmigrator.poll.ConditionExpectation;
import pvcmigrator.poll.ResourceStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Backup of the controller deployment on the source cluster.
 *
 * <p>When the operator omits {@code backupDirectory} or {@code backupClaim}
 * from its status, the supplied defaults are used.
 */
public final class BackupPhase implements PhaseDefinition<BackupResult> {

    public static final String KIND = "AutomationControllerBackup";
    public static final String NAME = "controller-backup";

    private final ResourceRef resource;
    private final String deploymentName;
    private final String defaultDirectory;
    private final String defaultClaim;

    /**
     * @param namespace source namespace
     * @param deploymentName controller deployment to back up
     * @param defaultDirectory used when status has no {@code backupDirectory}
     * @param defaultClaim used when status has no {@code backupClaim}
     */
    public BackupPhase(String namespace, String deploymentName, String defaultDirectory, String defaultClaim) {
        this.resource = ResourceRef.automationController(KIND, namespace, NAME);
        this.deploymentName = deploymentName;
        this.defaultDirectory = defaultDirectory;
        this.defaultClaim = defaultClaim;
    }

    @Override
    public String phaseName() {
        return "BACKUP";
    }

    @Override
    public ResourceRef resource() {
        return resource;
    }

    @Override
    public Map<String, Object> spec() {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("no_log", true);
        spec.put("image_pull_policy", "IfNotPresent");
        spec.put("set_self_labels", true);
        spec.put("deployment_name", deploymentName);
        return spec;
    }

    @Override
    public ConditionExpectation expectation() {
        return ConditionExpectation.successful();
    }

    @Override
    public BackupResult decode(ResourceStatus status) {
        return new BackupResult(
                status.field("backupDirectory").orElse(defaultDirectory),
                status.field("backupClaim").orElse(defaultClaim));
    }
}
