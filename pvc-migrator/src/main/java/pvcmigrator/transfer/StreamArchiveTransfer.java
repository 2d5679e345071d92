package pvcmigrator.transfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.config.TransferMethod;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.TransferException;
import pvcmigrator.workload.ExecResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static pvcmigrator.workload.Shell.quote;

/**
 * Copies the directory as a single tar stream.
 *
 * <ol>
 *   <li>{@code tar cf - <dir>} on the source, stdout written to {@code payload.tar} in staging</li>
 *   <li>upload to {@value #REMOTE_ARCHIVE} on the destination; the local file is deleted right after</li>
 *   <li>{@code mkdir -p <root> && tar xf ... -C <root> && rm -f ...} on the destination</li>
 * </ol>
 */
public class StreamArchiveTransfer implements TransferStrategy {

    private static final Logger log = LoggerFactory.getLogger(StreamArchiveTransfer.class);

    static final String LOCAL_ARCHIVE = "payload.tar";
    static final String REMOTE_ARCHIVE = "/tmp/payload.tar";

    @Override
    public TransferMethod method() {
        return TransferMethod.STREAM_ARCHIVE;
    }

    @Override
    public void transfer(TransferPlan plan) throws MigrateException {
        Path archive = plan.stagingDirectory().resolve(LOCAL_ARCHIVE);
        try {
            Files.createDirectories(plan.stagingDirectory());
        } catch (IOException e) {
            throw new TransferException("Cannot create staging directory " + plan.stagingDirectory(), null, e);
        }

        log.info("Archiving {} on {}", plan.sourceDirectory(), plan.source());
        ExecResult pack = plan.source().execToFile(
                "cd " + quote(plan.sourceParent()) + " && tar cf - " + quote(plan.directoryName()), archive);
        if (!pack.succeeded()) {
            deleteQuietly(archive);
            throw new TransferException("tar on source exited with " + pack.exitCode() + ": " + pack.stderr().trim(),
                    resource(plan.source().namespace(), plan.source().name()));
        }

        try {
            log.info("Uploading {} ({} bytes) to {}", archive, sizeOf(archive), plan.destination());
            plan.destination().upload(archive, REMOTE_ARCHIVE);
        } finally {
            deleteQuietly(archive);
        }

        String unpack = "mkdir -p " + quote(plan.destinationRoot())
                + " && tar xf " + REMOTE_ARCHIVE + " -C " + quote(plan.destinationRoot())
                + " && rm -f " + REMOTE_ARCHIVE;
        ExecResult extract = plan.destination().exec(unpack);
        if (!extract.succeeded()) {
            throw new TransferException("tar on destination exited with " + extract.exitCode() + ": "
                    + extract.stderr().trim(), resource(plan.destination().namespace(), plan.destination().name()));
        }
        log.info("Extracted {} into {}", plan.directoryName(), plan.destinationRoot());
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return -1;
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", file, e.getMessage());
        }
    }

    static String resource(String namespace, String pod) {
        return "pod " + namespace + "/" + pod;
    }
}
