package pvcmigrator.session;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.storage.StorageClass;
import io.fabric8.kubernetes.api.model.storage.StorageClassBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.junit.jupiter.api.Test;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.volume.ClaimSnapshot;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class KubernetesVolumesTest {

    private final KubernetesClient client = mock(KubernetesClient.class, RETURNS_DEEP_STUBS);
    private final KubernetesVolumes volumes = new KubernetesVolumes(client);

    @Test
    void readMapsClaimFields() throws MigrateException {
        PersistentVolumeClaim pvc = new PersistentVolumeClaimBuilder()
                .withNewMetadata().withName("backup-claim").withNamespace("src").endMetadata()
                .withNewSpec()
                    .withAccessModes("ReadWriteOnce")
                    .withVolumeMode("Filesystem")
                    .withStorageClassName("gp3")
                    .withNewResources().addToRequests("storage", new Quantity("10Gi")).endResources()
                .endSpec()
                .withNewStatus().withPhase("Bound").endStatus()
                .build();
        when(client.persistentVolumeClaims().inNamespace("src").withName("backup-claim").get()).thenReturn(pvc);

        ClaimSnapshot snapshot = volumes.read("src", "backup-claim").orElseThrow();

        assertThat(snapshot.requestedCapacity()).isEqualTo("10Gi");
        assertThat(snapshot.accessModes()).containsExactly("ReadWriteOnce");
        assertThat(snapshot.storageClass()).isEqualTo("gp3");
        assertThat(snapshot.phase()).isEqualTo("Bound");
    }

    @Test
    void absentClaimIsEmpty() throws MigrateException {
        when(client.persistentVolumeClaims().inNamespace("src").withName("nope").get()).thenReturn(null);

        assertThat(volumes.read("src", "nope")).isEmpty();
    }

    @Test
    void findsAnnotatedDefaultClass() throws MigrateException {
        StorageClass plain = new StorageClassBuilder().withNewMetadata().withName("slow").endMetadata().build();
        StorageClass beta = new StorageClassBuilder().withNewMetadata().withName("fast")
                .addToAnnotations(KubernetesVolumes.BETA_DEFAULT_CLASS_ANNOTATION, "true").endMetadata().build();
        when(client.storage().v1().storageClasses().list().getItems()).thenReturn(List.of(plain, beta));

        assertThat(volumes.defaultStorageClass()).contains("fast");
    }

    @Test
    void defaultAnnotationMustBeTrue() {
        ObjectMeta no = new ObjectMetaBuilder().addToAnnotations(KubernetesVolumes.DEFAULT_CLASS_ANNOTATION, "false").build();
        ObjectMeta yes = new ObjectMetaBuilder().addToAnnotations(KubernetesVolumes.DEFAULT_CLASS_ANNOTATION, "TRUE").build();

        assertThat(KubernetesVolumes.isDefault(no)).isFalse();
        assertThat(KubernetesVolumes.isDefault(yes)).isTrue();
        assertThat(KubernetesVolumes.isDefault(null)).isFalse();
    }
}
