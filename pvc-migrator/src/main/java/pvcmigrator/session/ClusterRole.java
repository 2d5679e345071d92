package pvcmigrator.session;

import java.util.Locale;
import java.util.Optional;

/**
 * Which side of a migration a cluster plays.
 */
public enum ClusterRole {
    SOURCE("source"),
    DESTINATION("destination");

    private final String label;

    ClusterRole(String label) {
        this.label = label;
    }

    /** Lower-case label used in logs and in the credentials file. */
    public String label() {
        return label;
    }

    /**
     * Maps a credentials-file label to a role. {@code dest} is accepted for the destination.
     */
    public static Optional<ClusterRole> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "source":
                return Optional.of(SOURCE);
            case "destination":
            case "dest":
                return Optional.of(DESTINATION);
            default:
                return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return label;
    }
}
