package pvcmigrator.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one migration: which namespaces, which volumes,
 * which paths and which transfer method.
 *
 * <p>Defaults are applied by the {@link Builder} for omitted optional fields:
 * both paths default to {@value #DEFAULT_PATH}, the method to
 * {@link TransferMethod#STREAM_ARCHIVE}, the workload identity to
 * {@value #DEFAULT_WORKLOAD_IDENTITY} and the transfer pod image to {@value #DEFAULT_IMAGE}.
 *
 * <p>The transfer pods and the restore mount each claim at {@value #DEFAULT_PATH},
 * so both paths must be that directory or lie beneath it.
 */
public final class MigrationRequest {

    public static final String DEFAULT_PATH = "/backups";
    public static final String DEFAULT_WORKLOAD_IDENTITY = "controller";
    public static final String DEFAULT_IMAGE = "registry.redhat.io/ubi9:9.5";

    private final String sourceNamespace;
    private final String destinationNamespace;
    private final String sourceVolumeName;
    private final String destinationVolumeName;
    private final String sourcePath;
    private final String destinationPath;
    private final TransferMethod transferMethod;
    private final String workloadIdentity;
    private final String image;

    private MigrationRequest(Builder b) {
        this.sourceNamespace = requireText(b.sourceNamespace, "sourceNamespace");
        this.destinationNamespace = requireText(b.destinationNamespace, "destinationNamespace");
        this.sourceVolumeName = blankToNull(b.sourceVolumeName);
        this.destinationVolumeName = blankToNull(b.destinationVolumeName);
        this.sourcePath = underMount(orDefault(b.sourcePath, DEFAULT_PATH), "sourcePath");
        this.destinationPath = underMount(orDefault(b.destinationPath, DEFAULT_PATH), "destinationPath");
        this.transferMethod = b.transferMethod != null ? b.transferMethod : TransferMethod.STREAM_ARCHIVE;
        this.workloadIdentity = orDefault(b.workloadIdentity, DEFAULT_WORKLOAD_IDENTITY);
        this.image = orDefault(b.image, DEFAULT_IMAGE);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this request's values. */
    public Builder toBuilder() {
        return new Builder()
                .sourceNamespace(sourceNamespace)
                .destinationNamespace(destinationNamespace)
                .sourceVolumeName(sourceVolumeName)
                .destinationVolumeName(destinationVolumeName)
                .sourcePath(sourcePath)
                .destinationPath(destinationPath)
                .transferMethod(transferMethod)
                .workloadIdentity(workloadIdentity)
                .image(image);
    }

    public String sourceNamespace() { return sourceNamespace; }

    public String destinationNamespace() { return destinationNamespace; }

    /** Source volume name from the mapping file; the backup's own claim wins when reported. */
    public Optional<String> sourceVolumeName() { return Optional.ofNullable(sourceVolumeName); }

    public Optional<String> destinationVolumeName() { return Optional.ofNullable(destinationVolumeName); }

    public String sourcePath() { return sourcePath; }

    public String destinationPath() { return destinationPath; }

    public TransferMethod transferMethod() { return transferMethod; }

    /** Name of the controller deployment the backup and restore refer to. */
    public String workloadIdentity() { return workloadIdentity; }

    /** Container image for both transfer pods. */
    public String image() { return image; }

    /** Destination claim name: the mapped one, or {@code <identity>-recovery-claim}. */
    public String effectiveDestinationVolumeName() {
        return destinationVolumeName != null ? destinationVolumeName : workloadIdentity + "-recovery-claim";
    }

    @Override
    public String toString() {
        return "MigrationRequest{" +
                "source=" + sourceNamespace + (sourceVolumeName != null ? "/" + sourceVolumeName : "") +
                ", destination=" + destinationNamespace + "/" + effectiveDestinationVolumeName() +
                ", sourcePath=" + sourcePath +
                ", destinationPath=" + destinationPath +
                ", method=" + transferMethod +
                ", workloadIdentity=" + workloadIdentity +
                ", image=" + image +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MigrationRequest)) return false;
        MigrationRequest that = (MigrationRequest) o;
        return sourceNamespace.equals(that.sourceNamespace)
                && destinationNamespace.equals(that.destinationNamespace)
                && Objects.equals(sourceVolumeName, that.sourceVolumeName)
                && Objects.equals(destinationVolumeName, that.destinationVolumeName)
                && sourcePath.equals(that.sourcePath)
                && destinationPath.equals(that.destinationPath)
                && transferMethod == that.transferMethod
                && workloadIdentity.equals(that.workloadIdentity)
                && image.equals(that.image);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceNamespace, destinationNamespace, sourceVolumeName, destinationVolumeName,
                sourcePath, destinationPath, transferMethod, workloadIdentity, image);
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MigrationConfigException(field + " is required");
        }
        return value.trim();
    }

    private static String underMount(String path, String field) {
        String p = path;
        while (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        boolean inside = p.equals(DEFAULT_PATH) || p.startsWith(DEFAULT_PATH + "/");
        if (!inside || p.contains("/../") || p.endsWith("/..")) {
            throw new MigrationConfigException(field + " must be " + DEFAULT_PATH
                    + " or a directory under it, where the claim is mounted: " + path);
        }
        return p;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String orDefault(String value, String def) {
        String v = blankToNull(value);
        return v != null ? v : def;
    }

    /**
     * Builder for {@link MigrationRequest}. Blank strings count as omitted.
     */
    public static final class Builder {
        private String sourceNamespace;
        private String destinationNamespace;
        private String sourceVolumeName;
        private String destinationVolumeName;
        private String sourcePath;
        private String destinationPath;
        private TransferMethod transferMethod;
        private String workloadIdentity;
        private String image;

        private Builder() {}

        public Builder sourceNamespace(String v) { this.sourceNamespace = v; return this; }
        public Builder destinationNamespace(String v) { this.destinationNamespace = v; return this; }
        public Builder sourceVolumeName(String v) { this.sourceVolumeName = v; return this; }
        public Builder destinationVolumeName(String v) { this.destinationVolumeName = v; return this; }
        public Builder sourcePath(String v) { this.sourcePath = v; return this; }
        public Builder destinationPath(String v) { this.destinationPath = v; return this; }
        public Builder transferMethod(TransferMethod v) { this.transferMethod = v; return this; }
        public Builder workloadIdentity(String v) { this.workloadIdentity = v; return this; }
        public Builder image(String v) { this.image = v; return this; }

        /** Returns the namespace set so far, or null. Used by prompting before build. */
        public String sourceNamespace() { return sourceNamespace; }
        public String destinationNamespace() { return destinationNamespace; }
        public String workloadIdentity() { return workloadIdentity; }
        public String image() { return image; }

        /**
         * @throws MigrationConfigException if a namespace is missing or a path lies outside the claim mount
         */
        public MigrationRequest build() {
            return new MigrationRequest(this);
        }
    }
}
