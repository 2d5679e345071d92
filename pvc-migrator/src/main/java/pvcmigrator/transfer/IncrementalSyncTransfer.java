package pvcmigrator.transfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.config.TransferMethod;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.TransferException;
import pvcmigrator.workload.EphemeralWorkload;
import pvcmigrator.workload.ExecResult;
import pvcmigrator.workload.Shell;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

import static pvcmigrator.workload.Shell.quote;

/**
 * Copies only the files whose content differs on the destination.
 *
 * <p>Both sides are listed with {@code sha256sum}. Files missing on the
 * destination or with a different digest are pulled into local staging and
 * pushed to the destination one by one; matching files are skipped. Files
 * that exist only on the destination are left alone. The staging copy is
 * removed afterwards.
 */
public class IncrementalSyncTransfer implements TransferStrategy {

    private static final Logger log = LoggerFactory.getLogger(IncrementalSyncTransfer.class);

    static final String STAGING = "tmp_copy";

    @Override
    public TransferMethod method() {
        return TransferMethod.INCREMENTAL_SYNC;
    }

    @Override
    public boolean isAvailable(TransferPlan plan) throws MigrateException {
        return plan.source().hasCommand("sha256sum") && plan.destination().hasCommand("sha256sum");
    }

    @Override
    public void transfer(TransferPlan plan) throws MigrateException {
        Path staging = plan.stagingDirectory().resolve(STAGING);
        try {
            Map<String, String> sourceFiles = manifest(plan.source(), plan.sourceParent(), plan.directoryName(), true);
            Map<String, String> destinationFiles = manifest(plan.destination(), plan.destinationRoot(), plan.directoryName(), false);
            List<String> directories = directories(plan.source(), plan.sourceParent(), plan.directoryName());

            List<String> changed = new ArrayList<>();
            sourceFiles.forEach((path, digest) -> {
                if (!Objects.equals(digest, destinationFiles.get(path))) {
                    changed.add(path);
                }
            });
            log.info("{} of {} file(s) differ on {}", changed.size(), sourceFiles.size(), plan.destination());

            StringBuilder mkdirs = new StringBuilder("mkdir -p ").append(quote(plan.destinationDirectory()));
            for (String dir : directories) {
                mkdirs.append(' ').append(quote(Shell.join(plan.destinationRoot(), dir)));
            }
            check(plan.destination(), plan.destination().exec(mkdirs.toString()), "mkdir");

            for (String relative : changed) {
                Path local = staging.resolve(relative);
                Files.createDirectories(local.getParent());
                plan.source().download(Shell.join(plan.sourceParent(), relative), local);
                plan.destination().upload(local, Shell.join(plan.destinationRoot(), relative));
            }
        } catch (IOException e) {
            throw new TransferException("Local staging failed: " + e.getMessage(), staging.toString(), e);
        } finally {
            deleteRecursively(staging);
        }
    }

    /**
     * Relative path (starting with the directory name) to hex digest.
     */
    Map<String, String> manifest(EphemeralWorkload pod, String parent, String directoryName, boolean required)
            throws MigrateException {
        String script = "cd " + quote(parent) + " && find " + quote(directoryName) + " -type f -exec sha256sum {} +";
        if (!required) {
            script = "if [ -d " + quote(Shell.join(parent, directoryName)) + " ]; then " + script + "; fi";
        }
        ExecResult result = pod.exec(script);
        check(pod, result, "sha256sum");
        return parseManifest(result.stdout());
    }

    List<String> directories(EphemeralWorkload pod, String parent, String directoryName) throws MigrateException {
        ExecResult result = pod.exec("cd " + quote(parent) + " && find " + quote(directoryName) + " -type d");
        check(pod, result, "find");
        List<String> dirs = new ArrayList<>();
        for (String line : result.stdout().split("\n")) {
            String d = line.trim();
            if (!d.isEmpty()) {
                dirs.add(d);
            }
        }
        return dirs;
    }

    static Map<String, String> parseManifest(String output) {
        Map<String, String> files = new LinkedHashMap<>();
        for (String line : output.split("\n")) {
            String l = line.replace("\r", "");
            int sep = l.indexOf(' ');
            if (sep <= 0 || l.length() < sep + 2) {
                continue;
            }
            String digest = l.substring(0, sep);
            String path = l.substring(sep + 1);
            if (path.startsWith(" ") || path.startsWith("*")) {
                path = path.substring(1);
            }
            if (path.startsWith("./")) {
                path = path.substring(2);
            }
            if (!path.isEmpty()) {
                files.put(path, digest);
            }
        }
        return files;
    }

    private static void check(EphemeralWorkload pod, ExecResult result, String step) throws TransferException {
        if (!result.succeeded()) {
            throw new TransferException(step + " exited with " + result.exitCode() + ": " + result.stderr().trim(),
                    "pod " + pod.namespace() + "/" + pod.name());
        }
    }

    private static void deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean staging {}: {}", root, e.getMessage());
        }
    }
}
