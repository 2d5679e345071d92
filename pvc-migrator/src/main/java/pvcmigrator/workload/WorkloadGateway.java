package pvcmigrator.workload;

import pvcmigrator.exceptions.MigrateException;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Pod operations on one cluster.
 */
public interface WorkloadGateway {

    void createPod(PodRequest request) throws MigrateException;

    /**
     * Blocks until the pod reports Ready.
     *
     * @return false if {@code timeout} passed first
     */
    boolean waitReady(String namespace, String name, Duration timeout) throws MigrateException;

    /** Deletes a pod; an absent pod is not an error. */
    void deletePod(String namespace, String name) throws MigrateException;

    /**
     * Runs {@code sh -lc script} in the pod and captures both streams.
     */
    ExecResult exec(String namespace, String pod, String script, Duration timeout) throws MigrateException;

    /**
     * Runs {@code sh -lc script} in the pod, writing standard output to {@code target}.
     * The returned result has an empty stdout.
     */
    ExecResult execToFile(String namespace, String pod, String script, Path target, Duration timeout)
            throws MigrateException;

    /** Copies a local file into the pod. */
    void upload(String namespace, String pod, Path local, String remotePath) throws MigrateException;

    /** Copies a single file out of the pod. */
    void download(String namespace, String pod, String remotePath, Path local) throws MigrateException;
}
