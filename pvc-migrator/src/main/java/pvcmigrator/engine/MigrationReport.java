package pvcmigrator.engine;

import pvcmigrator.config.MigrationRequest;
import pvcmigrator.config.TransferMethod;
import pvcmigrator.metrics.MigrationMetrics;
import pvcmigrator.phase.BackupResult;
import pvcmigrator.phase.RestoreResult;
import pvcmigrator.teardown.TeardownReport;
import pvcmigrator.transfer.SizeCheckResult;
import pvcmigrator.transfer.SizeMeasurement;
import pvcmigrator.volume.ProvisioningOutcome;
import pvcmigrator.volume.VolumeResolution;

/**
 * Everything a successful run produced.
 */
public record MigrationReport(
        String runId,
        MigrationRequest request,
        BackupResult backup,
        String destinationClaim,
        VolumeResolution volume,
        ProvisioningOutcome provisioning,
        TransferMethod transferMethod,
        SizeMeasurement sourceSize,
        SizeMeasurement destinationSize,
        SizeCheckResult sizeCheck,
        RestoreResult restore,
        TeardownReport teardown,
        MigrationMetrics metrics
) {
}
