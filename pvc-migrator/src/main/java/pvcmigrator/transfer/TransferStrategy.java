package pvcmigrator.transfer;

import pvcmigrator.config.TransferMethod;
import pvcmigrator.exceptions.MigrateException;

/**
 * A way of moving the backup directory between the two transfer pods.
 */
public interface TransferStrategy {

    TransferMethod method();

    /**
     * Whether the tools this strategy needs exist in both pods.
     */
    default boolean isAvailable(TransferPlan plan) throws MigrateException {
        return true;
    }

    /**
     * Copies the directory.
     *
     * @throws pvcmigrator.exceptions.TransferException if any remote command or copy fails
     */
    void transfer(TransferPlan plan) throws MigrateException;
}
