package pvcmigrator.workload;

/**
 * Quoting for scripts passed to {@code sh -lc}.
 */
public final class Shell {

    private Shell() {}

    /** Wraps {@code value} in single quotes, escaping embedded single quotes. */
    public static String quote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }

    /** Joins two path segments with exactly one slash. */
    public static String join(String parent, String child) {
        if (parent.endsWith("/")) {
            return parent + child;
        }
        return parent + "/" + child;
    }
}
