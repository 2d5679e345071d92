package pvcmigrator.testing;

import pvcmigrator.exceptions.LaunchException;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.TransferException;
import pvcmigrator.workload.ExecResult;
import pvcmigrator.workload.PodRequest;
import pvcmigrator.workload.WorkloadGateway;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory pods. Commands are answered by the first registered rule whose
 * fragment occurs in the script; unmatched scripts succeed with empty output.
 */
public class FakeWorkloads implements WorkloadGateway {

    private final Map<String, PodRequest> pods = new LinkedHashMap<>();
    private final List<PodRequest> created = new ArrayList<>();
    private final List<String> deleted = new ArrayList<>();
    private final List<String> scripts = new ArrayList<>();
    private final Map<String, ExecResult> rules = new LinkedHashMap<>();
    private final Map<String, byte[]> remoteFiles = new HashMap<>();
    private final Map<String, byte[]> uploads = new LinkedHashMap<>();
    private final List<String> downloads = new ArrayList<>();
    private boolean ready = true;
    private boolean failCreate;
    private boolean failDelete;
    private byte[] archive = "archive".getBytes(StandardCharsets.UTF_8);

    public FakeWorkloads on(String fragment, ExecResult result) {
        rules.put(fragment, result);
        return this;
    }

    public FakeWorkloads on(String fragment, String stdout) {
        return on(fragment, new ExecResult(0, stdout, ""));
    }

    public FakeWorkloads remoteFile(String path, String content) {
        remoteFiles.put(path, content.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public FakeWorkloads archive(String content) {
        archive = content.getBytes(StandardCharsets.UTF_8);
        return this;
    }

    public FakeWorkloads neverReady() {
        ready = false;
        return this;
    }

    public FakeWorkloads failCreate() {
        failCreate = true;
        return this;
    }

    public FakeWorkloads failDelete() {
        failDelete = true;
        return this;
    }

    public List<PodRequest> created() { return created; }

    public List<String> deleted() { return deleted; }

    public List<String> scripts() { return scripts; }

    public Map<String, byte[]> uploads() { return uploads; }

    public List<String> downloads() { return downloads; }

    public boolean isRunning(String namespace, String name) {
        return pods.containsKey(namespace + "/" + name);
    }

    @Override
    public void createPod(PodRequest request) throws MigrateException {
        if (failCreate) {
            throw new LaunchException("quota exceeded", "pod " + request.namespace() + "/" + request.name(), null);
        }
        pods.put(request.namespace() + "/" + request.name(), request);
        created.add(request);
    }

    @Override
    public boolean waitReady(String namespace, String name, Duration timeout) {
        return ready && pods.containsKey(namespace + "/" + name);
    }

    @Override
    public void deletePod(String namespace, String name) throws MigrateException {
        if (failDelete) {
            throw new MigrateException("forbidden");
        }
        pods.remove(namespace + "/" + name);
        deleted.add(namespace + "/" + name);
    }

    @Override
    public ExecResult exec(String namespace, String pod, String script, Duration timeout) {
        scripts.add(script);
        for (Map.Entry<String, ExecResult> rule : rules.entrySet()) {
            if (script.contains(rule.getKey())) {
                return rule.getValue();
            }
        }
        return new ExecResult(0, "", "");
    }

    @Override
    public ExecResult execToFile(String namespace, String pod, String script, Path target, Duration timeout) {
        ExecResult result = exec(namespace, pod, script, timeout);
        try {
            Files.write(target, archive);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new ExecResult(result.exitCode(), "", result.stderr());
    }

    @Override
    public void upload(String namespace, String pod, Path local, String remotePath) throws MigrateException {
        try {
            uploads.put(remotePath, Files.readAllBytes(local));
        } catch (IOException e) {
            throw new TransferException("upload failed", remotePath, e);
        }
    }

    @Override
    public void download(String namespace, String pod, String remotePath, Path local) throws MigrateException {
        byte[] content = remoteFiles.get(remotePath);
        if (content == null) {
            throw new TransferException("no such file " + remotePath, "pod " + namespace + "/" + pod);
        }
        try {
            Files.write(local, content);
        } catch (IOException e) {
            throw new TransferException("download failed", remotePath, e);
        }
        downloads.add(remotePath);
    }
}
