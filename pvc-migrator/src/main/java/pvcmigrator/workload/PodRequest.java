package pvcmigrator.workload;

import java.util.Map;

/**
 * Everything needed to create one transfer pod.
 *
 * @param namespace target namespace
 * @param name pod name
 * @param claim claim mounted at {@link #mountPath()}
 * @param image container image
 * @param mountPath mount point of the claim inside the container
 * @param labels pod labels
 */
public record PodRequest(String namespace, String name, String claim, String image, String mountPath,
                         Map<String, String> labels) {

    public PodRequest {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
