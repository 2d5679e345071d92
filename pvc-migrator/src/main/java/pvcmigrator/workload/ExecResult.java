package pvcmigrator.workload;

/**
 * Outcome of a command run inside a pod.
 *
 * @param exitCode process exit code, -1 if unknown
 * @param stdout captured standard output (empty when streamed elsewhere)
 * @param stderr captured standard error
 */
public record ExecResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
