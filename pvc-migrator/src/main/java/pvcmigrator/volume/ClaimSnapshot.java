package pvcmigrator.volume;

import java.util.List;

/**
 * Fields of an existing PersistentVolumeClaim as observed on a cluster.
 * Any field may be null when the API server does not report it.
 *
 * @param namespace claim namespace
 * @param name claim name
 * @param requestedCapacity {@code spec.resources.requests.storage}
 * @param accessModes {@code spec.accessModes}, never null
 * @param volumeMode {@code spec.volumeMode}
 * @param storageClass {@code spec.storageClassName}
 * @param phase {@code status.phase}
 */
public record ClaimSnapshot(String namespace, String name, String requestedCapacity, List<String> accessModes,
                            String volumeMode, String storageClass, String phase) {

    public ClaimSnapshot {
        accessModes = accessModes == null ? List.of() : List.copyOf(accessModes);
    }
}
