package pvcmigrator.session;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.KubernetesClientTimeoutException;
import io.fabric8.kubernetes.client.dsl.ContainerResource;
import io.fabric8.kubernetes.client.dsl.ExecWatch;
import io.fabric8.kubernetes.client.dsl.PodResource;
import pvcmigrator.exceptions.LaunchException;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.TransferException;
import pvcmigrator.workload.EphemeralWorkload;
import pvcmigrator.workload.ExecResult;
import pvcmigrator.workload.PodRequest;
import pvcmigrator.workload.WorkloadGateway;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Transfer pods, remote commands and file copies through the fabric8 pod API.
 */
class KubernetesWorkloads implements WorkloadGateway {

    static final String VOLUME_NAME = "vol";

    private final KubernetesClient client;

    KubernetesWorkloads(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public void createPod(PodRequest request) throws MigrateException {
        Pod pod = new PodBuilder()
                .withNewMetadata()
                    .withName(request.name())
                    .withNamespace(request.namespace())
                    .withLabels(request.labels())
                .endMetadata()
                .withNewSpec()
                    .withRestartPolicy("Never")
                    .addNewContainer()
                        .withName(EphemeralWorkload.CONTAINER)
                        .withImage(request.image())
                        .withCommand("bash", "-lc", "sleep infinity")
                        .addNewVolumeMount()
                            .withName(VOLUME_NAME)
                            .withMountPath(request.mountPath())
                        .endVolumeMount()
                    .endContainer()
                    .addNewVolume()
                        .withName(VOLUME_NAME)
                        .withNewPersistentVolumeClaim()
                            .withClaimName(request.claim())
                        .endPersistentVolumeClaim()
                    .endVolume()
                .endSpec()
                .build();
        try {
            client.pods().inNamespace(request.namespace()).resource(pod).create();
        } catch (KubernetesClientException e) {
            throw new LaunchException("Create failed: " + e.getMessage(), resource(request.namespace(), request.name()), e);
        }
    }

    @Override
    public boolean waitReady(String namespace, String name, Duration timeout) throws MigrateException {
        try {
            pod(namespace, name).waitUntilReady(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (KubernetesClientTimeoutException e) {
            return false;
        } catch (KubernetesClientException e) {
            throw new LaunchException("Readiness wait failed: " + e.getMessage(), resource(namespace, name), e);
        }
    }

    @Override
    public void deletePod(String namespace, String name) throws MigrateException {
        try {
            pod(namespace, name).delete();
        } catch (KubernetesClientException e) {
            throw new MigrateException("Delete failed: " + e.getMessage(), null, resource(namespace, name), e);
        }
    }

    @Override
    public ExecResult exec(String namespace, String pod, String script, Duration timeout) throws MigrateException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code = run(namespace, pod, script, out, err, timeout);
        return new ExecResult(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    @Override
    public ExecResult execToFile(String namespace, String pod, String script, Path target, Duration timeout)
            throws MigrateException {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try (OutputStream out = Files.newOutputStream(target)) {
            code = run(namespace, pod, script, out, err, timeout);
        } catch (IOException e) {
            throw new TransferException("Cannot write " + target + ": " + e.getMessage(), resource(namespace, pod), e);
        }
        return new ExecResult(code, "", err.toString(StandardCharsets.UTF_8));
    }

    @Override
    public void upload(String namespace, String pod, Path local, String remotePath) throws MigrateException {
        boolean ok;
        try {
            ok = container(namespace, pod).file(remotePath).upload(local);
        } catch (KubernetesClientException e) {
            throw new TransferException("Upload of " + local + " failed: " + e.getMessage(), resource(namespace, pod), e);
        }
        if (!ok) {
            throw new TransferException("Upload of " + local + " to " + remotePath + " failed", resource(namespace, pod));
        }
    }

    @Override
    public void download(String namespace, String pod, String remotePath, Path local) throws MigrateException {
        boolean ok;
        try {
            ok = container(namespace, pod).file(remotePath).copy(local);
        } catch (KubernetesClientException e) {
            throw new TransferException("Download of " + remotePath + " failed: " + e.getMessage(), resource(namespace, pod), e);
        }
        if (!ok) {
            throw new TransferException("Download of " + remotePath + " failed", resource(namespace, pod));
        }
    }

    private int run(String namespace, String pod, String script, OutputStream out, OutputStream err, Duration timeout)
            throws MigrateException {
        String resource = resource(namespace, pod);
        try (ExecWatch watch = container(namespace, pod)
                .writingOutput(out)
                .writingError(err)
                .exec("sh", "-lc", script)) {
            Integer code = watch.exitCode().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return code != null ? code : -1;
        } catch (KubernetesClientException e) {
            throw new TransferException("exec failed: " + e.getMessage(), resource, e);
        } catch (ExecutionException e) {
            throw new TransferException("exec failed: " + e.getCause(), resource, e.getCause());
        } catch (TimeoutException e) {
            throw new TransferException("exec did not finish within " + timeout.toSeconds() + " s", resource, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MigrateException("Interrupted during exec", null, resource, e);
        }
    }

    private PodResource pod(String namespace, String name) {
        return client.pods().inNamespace(namespace).withName(name);
    }

    private ContainerResource container(String namespace, String name) {
        return pod(namespace, name).inContainer(EphemeralWorkload.CONTAINER);
    }

    private static String resource(String namespace, String name) {
        return "pod " + namespace + "/" + name;
    }
}
