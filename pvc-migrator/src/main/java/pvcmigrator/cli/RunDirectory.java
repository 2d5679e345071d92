package pvcmigrator.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Per-run working directory {@code pvc-migrate-logs-<ts>} holding the master
 * log {@code run-<ts>.log} and local transfer staging.
 */
public record RunDirectory(Path directory, Path logFile) {

    public static final String PREFIX = "pvc-migrate-logs-";

    public static RunDirectory create(Path workDir, String timestamp) throws IOException {
        Path dir = workDir.resolve(PREFIX + timestamp);
        Files.createDirectories(dir);
        return new RunDirectory(dir, dir.resolve("run-" + timestamp + ".log"));
    }
}
