package pvcmigrator.workload;

import pvcmigrator.config.MigrationRequest;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.session.ClusterRole;

import java.nio.file.Path;
import java.time.Duration;

/**
 * A short-lived pod mounting one claim, used as a data endpoint for the copy.
 *
 * <p>Commands are routed through the gateway of the cluster the pod lives on.
 */
public final class EphemeralWorkload {

    public static final String MOUNT_PATH = MigrationRequest.DEFAULT_PATH;
    public static final String CONTAINER = "migrator";
    public static final String APP_LABEL = "pvc-migrator";

    private final WorkloadGateway gateway;
    private final ClusterRole role;
    private final String namespace;
    private final String name;
    private final String claim;
    private final String image;
    private final Duration execTimeout;

    private volatile WorkloadState state = WorkloadState.PENDING;

    EphemeralWorkload(WorkloadGateway gateway, ClusterRole role, String namespace, String name, String claim,
                      String image, Duration execTimeout) {
        this.gateway = gateway;
        this.role = role;
        this.namespace = namespace;
        this.name = name;
        this.claim = claim;
        this.image = image;
        this.execTimeout = execTimeout;
    }

    public ClusterRole role() { return role; }

    public String namespace() { return namespace; }

    public String name() { return name; }

    public String claim() { return claim; }

    public String image() { return image; }

    public WorkloadState state() { return state; }

    void state(WorkloadState state) {
        this.state = state;
    }

    WorkloadGateway gateway() {
        return gateway;
    }

    public ExecResult exec(String script) throws MigrateException {
        return gateway.exec(namespace, name, script, execTimeout);
    }

    public ExecResult execToFile(String script, Path target) throws MigrateException {
        return gateway.execToFile(namespace, name, script, target, execTimeout);
    }

    public void upload(Path local, String remotePath) throws MigrateException {
        gateway.upload(namespace, name, local, remotePath);
    }

    public void download(String remotePath, Path local) throws MigrateException {
        gateway.download(namespace, name, remotePath, local);
    }

    /** True if {@code command} resolves on the pod's PATH. */
    public boolean hasCommand(String command) throws MigrateException {
        return exec("command -v " + command + " >/dev/null 2>&1").succeeded();
    }

    @Override
    public String toString() {
        return "pod " + namespace + "/" + name + " (" + role + ", claim=" + claim + ", " + state + ")";
    }
}
