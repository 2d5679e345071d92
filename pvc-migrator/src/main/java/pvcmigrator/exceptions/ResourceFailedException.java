package pvcmigrator.exceptions;

/**
 * Thrown when a watched resource reports a terminal failure condition.
 */
public class ResourceFailedException extends MigrateException {

    private final String observed;

    public ResourceFailedException(String resource, String observed) {
        super("Resource reported failure: " + observed, null, resource, null);
        this.observed = observed;
    }

    /** Returns the status/reason pair that was classified as a failure. */
    public String getObserved() {
        return observed;
    }
}
