package pvcmigrator.workload;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Naming of transfer pods and run artifacts.
 */
public final class WorkloadNames {

    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss", Locale.ROOT);

    private static final int MAX_LENGTH = 63;

    private WorkloadNames() {}

    public static String timestamp(LocalDateTime time) {
        return TIMESTAMP.format(time);
    }

    /**
     * Lower-cases and replaces every character outside {@code [a-z0-9-]} with
     * {@code -}, trims leading/trailing dashes and caps the length at 63.
     */
    public static String safeName(String raw) {
        String s = raw.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
        if (s.length() > MAX_LENGTH) {
            s = s.substring(0, MAX_LENGTH);
        }
        s = s.replaceAll("^-+", "").replaceAll("-+$", "");
        if (s.isEmpty()) {
            throw new IllegalArgumentException("No DNS-safe characters in name: " + raw);
        }
        return s;
    }

    public static String sourcePod(String timestamp) {
        return safeName("pvc-src-" + timestamp);
    }

    public static String destinationPod(String timestamp) {
        return safeName("pvc-dst-" + timestamp);
    }
}
