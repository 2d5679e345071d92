package pvcmigrator.session;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.storage.StorageClass;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.ProvisioningException;
import pvcmigrator.volume.ClaimSnapshot;
import pvcmigrator.volume.VolumeGateway;
import pvcmigrator.volume.VolumeSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Claims and storage classes through the typed fabric8 model.
 */
class KubernetesVolumes implements VolumeGateway {

    static final String DEFAULT_CLASS_ANNOTATION = "storageclass.kubernetes.io/is-default-class";
    static final String BETA_DEFAULT_CLASS_ANNOTATION = "storageclass.beta.kubernetes.io/is-default-class";

    private final KubernetesClient client;

    KubernetesVolumes(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Optional<ClaimSnapshot> read(String namespace, String name) throws MigrateException {
        PersistentVolumeClaim pvc;
        try {
            pvc = client.persistentVolumeClaims().inNamespace(namespace).withName(name).get();
        } catch (KubernetesClientException e) {
            throw new MigrateException("Read failed: " + e.getMessage(), null, resource(namespace, name), e);
        }
        if (pvc == null) {
            return Optional.empty();
        }
        String capacity = null;
        List<String> modes = List.of();
        String volumeMode = null;
        String storageClass = null;
        if (pvc.getSpec() != null) {
            if (pvc.getSpec().getResources() != null && pvc.getSpec().getResources().getRequests() != null) {
                Quantity q = pvc.getSpec().getResources().getRequests().get("storage");
                capacity = q != null ? q.toString() : null;
            }
            modes = pvc.getSpec().getAccessModes() != null ? new ArrayList<>(pvc.getSpec().getAccessModes()) : List.of();
            volumeMode = pvc.getSpec().getVolumeMode();
            storageClass = pvc.getSpec().getStorageClassName();
        }
        String phase = pvc.getStatus() != null ? pvc.getStatus().getPhase() : null;
        return Optional.of(new ClaimSnapshot(namespace, name, capacity, modes, volumeMode, storageClass, phase));
    }

    @Override
    public void create(String namespace, String name, VolumeSpec spec) throws MigrateException {
        PersistentVolumeClaim pvc = new PersistentVolumeClaimBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                .endMetadata()
                .withNewSpec()
                    .withAccessModes(new ArrayList<>(spec.accessModes()))
                    .withVolumeMode(spec.volumeMode())
                    .withStorageClassName(spec.storageClass())
                    .withNewResources()
                        .addToRequests("storage", new Quantity(spec.capacity()))
                    .endResources()
                .endSpec()
                .build();
        try {
            client.persistentVolumeClaims().inNamespace(namespace).resource(pvc).create();
        } catch (KubernetesClientException e) {
            throw new ProvisioningException("Create failed: " + e.getMessage(), resource(namespace, name), e);
        }
    }

    @Override
    public void delete(String namespace, String name) throws MigrateException {
        try {
            client.persistentVolumeClaims().inNamespace(namespace).withName(name).delete();
        } catch (KubernetesClientException e) {
            throw new MigrateException("Delete failed: " + e.getMessage(), null, resource(namespace, name), e);
        }
    }

    @Override
    public boolean storageClassExists(String name) throws MigrateException {
        try {
            return client.storage().v1().storageClasses().withName(name).get() != null;
        } catch (KubernetesClientException e) {
            throw new MigrateException("StorageClass lookup failed: " + e.getMessage(), null, "storageclass " + name, e);
        }
    }

    @Override
    public Optional<String> defaultStorageClass() throws MigrateException {
        List<StorageClass> classes;
        try {
            classes = client.storage().v1().storageClasses().list().getItems();
        } catch (KubernetesClientException e) {
            throw new MigrateException("StorageClass list failed: " + e.getMessage(), null, "storageclasses", e);
        }
        for (StorageClass sc : classes) {
            if (isDefault(sc.getMetadata())) {
                return Optional.of(sc.getMetadata().getName());
            }
        }
        return Optional.empty();
    }

    static boolean isDefault(ObjectMeta meta) {
        if (meta == null || meta.getAnnotations() == null) {
            return false;
        }
        Map<String, String> annotations = meta.getAnnotations();
        return "true".equalsIgnoreCase(annotations.get(DEFAULT_CLASS_ANNOTATION))
                || "true".equalsIgnoreCase(annotations.get(BETA_DEFAULT_CLASS_ANNOTATION));
    }

    private static String resource(String namespace, String name) {
        return "PersistentVolumeClaim " + namespace + "/" + name;
    }
}
