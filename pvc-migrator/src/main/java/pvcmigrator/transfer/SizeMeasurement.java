package pvcmigrator.transfer;

/**
 * Disk usage of a directory inside a pod.
 *
 * @param blocks {@code du -s} block count, -1 if it could not be measured
 * @param human {@code du -sh} figure, e.g. {@code 1.2G}, or {@code ?}
 */
public record SizeMeasurement(long blocks, String human) {

    public static final SizeMeasurement UNKNOWN = new SizeMeasurement(-1, "?");

    public boolean isMeasured() {
        return blocks >= 0;
    }
}
