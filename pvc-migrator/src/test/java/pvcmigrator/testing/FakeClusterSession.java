package pvcmigrator.testing;

import pvcmigrator.session.ClusterRole;
import pvcmigrator.session.ClusterSession;

import java.util.HashSet;
import java.util.Set;

public class FakeClusterSession implements ClusterSession {

    private final ClusterRole role;
    private final Set<String> namespaces = new HashSet<>();
    private final FakeCustomResources customResources = new FakeCustomResources();
    private final FakeVolumes volumes = new FakeVolumes();
    private final FakeWorkloads workloads = new FakeWorkloads();
    private boolean closed;

    public FakeClusterSession(ClusterRole role, String... namespaces) {
        this.role = role;
        this.namespaces.addAll(Set.of(namespaces));
    }

    @Override
    public ClusterRole role() {
        return role;
    }

    @Override
    public String apiUrl() {
        return "https://api." + role.label() + ".example:6443";
    }

    @Override
    public FakeCustomResources customResources() {
        return customResources;
    }

    @Override
    public FakeVolumes volumes() {
        return volumes;
    }

    @Override
    public FakeWorkloads workloads() {
        return workloads;
    }

    @Override
    public boolean namespaceExists(String namespace) {
        return namespaces.contains(namespace);
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
