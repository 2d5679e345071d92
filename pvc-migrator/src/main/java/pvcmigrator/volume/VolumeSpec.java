package pvcmigrator.volume;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Storage characteristics requested for the destination claim.
 *
 * @param capacity storage request, e.g. {@code 20Gi}
 * @param accessModes unordered set of access modes, never empty
 * @param volumeMode {@code Filesystem} or {@code Block}
 * @param storageClass class name, or null to leave it to the cluster
 * @param storageClassSource how {@code storageClass} was chosen
 */
public record VolumeSpec(String capacity, Set<String> accessModes, String volumeMode, String storageClass,
                         StorageClassSource storageClassSource) {

    public VolumeSpec {
        Objects.requireNonNull(capacity, "capacity");
        Objects.requireNonNull(volumeMode, "volumeMode");
        Objects.requireNonNull(storageClassSource, "storageClassSource");
        if (accessModes == null || accessModes.isEmpty()) {
            throw new IllegalArgumentException("accessModes must not be empty");
        }
        accessModes = Collections.unmodifiableSet(new LinkedHashSet<>(accessModes));
    }

    @Override
    public String toString() {
        return "size=" + capacity + ", modes=" + accessModes + ", volumeMode=" + volumeMode
                + ", sc=" + (storageClass != null ? storageClass : "<cluster-default>")
                + " (" + storageClassSource + ")";
    }
}
