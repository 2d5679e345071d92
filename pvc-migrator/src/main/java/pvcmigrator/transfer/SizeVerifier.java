package pvcmigrator.transfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.workload.EphemeralWorkload;
import pvcmigrator.workload.ExecResult;

import static pvcmigrator.workload.Shell.quote;

/**
 * Compares directory sizes before and after the copy.
 *
 * <p>Tolerance is {@code source/100 + 16} blocks. A check never fails the run.
 */
public class SizeVerifier {

    private static final Logger log = LoggerFactory.getLogger(SizeVerifier.class);

    /**
     * Measures {@code path} inside the pod. Measurement errors yield {@link SizeMeasurement#UNKNOWN}.
     */
    public SizeMeasurement measure(EphemeralWorkload pod, String path) {
        try {
            String human = firstField(pod.exec("du -sh " + quote(path) + " 2>/dev/null | awk '{print $1}'"));
            String blocks = firstField(pod.exec("du -s " + quote(path) + " 2>/dev/null | awk '{print $1}'"));
            long count = blocks.matches("\\d+") ? Long.parseLong(blocks) : -1;
            return new SizeMeasurement(count, human.isEmpty() ? "?" : human);
        } catch (MigrateException | RuntimeException e) {
            log.warn("Could not measure {} in {}: {}", path, pod, e.getMessage());
            return SizeMeasurement.UNKNOWN;
        }
    }

    public SizeCheckResult verify(long sourceBlocks, long destinationBlocks) {
        if (sourceBlocks <= 0 || destinationBlocks < 0) {
            log.info("Skipping size delta check; empty/unmeasurable.");
            return new SizeCheckResult(SizeCheckResult.Status.SKIPPED, sourceBlocks, destinationBlocks, 0, 0);
        }
        long tolerance = sourceBlocks / 100 + 16;
        long delta = Math.abs(destinationBlocks - sourceBlocks);
        if (delta <= tolerance) {
            log.info("Size check PASSED (delta={} <= {}).", delta, tolerance);
            return new SizeCheckResult(SizeCheckResult.Status.PASSED, sourceBlocks, destinationBlocks, delta, tolerance);
        }
        log.warn("Size delta={} (> {}).", delta, tolerance);
        return new SizeCheckResult(SizeCheckResult.Status.WARNING, sourceBlocks, destinationBlocks, delta, tolerance);
    }

    private static String firstField(ExecResult result) {
        if (!result.succeeded()) {
            return "";
        }
        String out = result.stdout().trim();
        int nl = out.indexOf('\n');
        return (nl >= 0 ? out.substring(0, nl) : out).trim();
    }
}
