package pvcmigrator.config;

import java.util.Locale;
import java.util.Optional;

/**
 * How the backup directory is moved between the two transfer pods.
 */
public enum TransferMethod {

    /** Pack into a single tar stream, stage locally, unpack on the destination. */
    STREAM_ARCHIVE("tar", "stream-archive"),

    /** Pull to local staging and push only files that differ on the destination. */
    INCREMENTAL_SYNC("rsync", "incremental-sync");

    private final String shortName;
    private final String longName;

    TransferMethod(String shortName, String longName) {
        this.shortName = shortName;
        this.longName = longName;
    }

    /** The name used in the mapping file ({@code tar} or {@code rsync}). */
    public String shortName() {
        return shortName;
    }

    /**
     * Parses a method name from the mapping file. Accepts the short names
     * {@code tar}/{@code rsync}, the long names, and the enum constant names,
     * case-insensitively.
     *
     * @param value the raw value, may be null or blank
     * @return the method, or empty if the value is blank or unknown
     */
    public static Optional<TransferMethod> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (TransferMethod m : values()) {
            if (m.shortName.equals(v) || m.longName.equals(v) || m.name().toLowerCase(Locale.ROOT).equals(v)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
