package pvcmigrator.transfer;

import pvcmigrator.workload.EphemeralWorkload;
import pvcmigrator.workload.Shell;

import java.nio.file.Path;
import java.util.Objects;

/**
 * What to copy and where.
 *
 * <p>The directory {@code sourceParent/directoryName} on the source pod ends up
 * as {@code destinationRoot/directoryName} on the destination pod. The folder
 * name is preserved.
 *
 * @param source source transfer pod
 * @param sourceParent parent directory of the backup on the source
 * @param directoryName backup folder name
 * @param destination destination transfer pod
 * @param destinationRoot directory on the destination that receives the folder
 * @param stagingDirectory local scratch directory for this run
 */
public record TransferPlan(EphemeralWorkload source, String sourceParent, String directoryName,
                           EphemeralWorkload destination, String destinationRoot, Path stagingDirectory) {

    public TransferPlan {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(stagingDirectory, "stagingDirectory");
        if (directoryName == null || directoryName.isBlank() || directoryName.contains("/")) {
            throw new IllegalArgumentException("directoryName must be a single path element: " + directoryName);
        }
    }

    public String sourceDirectory() {
        return Shell.join(sourceParent, directoryName);
    }

    public String destinationDirectory() {
        return Shell.join(destinationRoot, directoryName);
    }
}
