package pvcmigrator.config;

import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the PVC mapping CSV into a {@link MigrationRequest.Builder}.
 *
 * <p>Recognised columns (header is case- and space-insensitive):
 * <ul>
 *   <li>{@code source_namespace} / {@code sourcenamespace} (required)</li>
 *   <li>{@code dest_namespace} / {@code destnamespace} (required)</li>
 *   <li>{@code source_pvc}, {@code dest_pvc}, {@code source_path}, {@code dest_path}</li>
 *   <li>{@code method} ({@code tar} or {@code rsync})</li>
 *   <li>{@code controller_name} / {@code controllername}</li>
 * </ul>
 * Only the first data row is used. The builder is returned unbuilt so that
 * the caller can fill remaining gaps (controller name, image) before building.
 */
public final class MappingFileLoader {

    private static final Logger log = LoggerFactory.getLogger(MappingFileLoader.class);

    private MappingFileLoader() {}

    /**
     * @throws MigrationConfigException if the file is missing, lacks a required
     *         column, has no data row, or the row has an empty namespace
     */
    public static MigrationRequest.Builder load(Path file) {
        CsvHeaders csv = CsvHeaders.read(file, "PVC mapping file");

        int srcNs = csv.indexOf("source_namespace", "sourcenamespace");
        int dstNs = csv.indexOf("dest_namespace", "destnamespace");
        List<String> missing = new ArrayList<>();
        if (srcNs < 0) missing.add("source_namespace");
        if (dstNs < 0) missing.add("dest_namespace");
        if (!missing.isEmpty()) {
            throw new MigrationConfigException("Missing required column(s) in header: " + String.join(", ", missing)
                    + " (header seen: '" + csv.rawHeader() + "')");
        }

        CSVRecord row = csv.rows().stream()
                .filter(r -> !CsvHeaders.isBlank(r))
                .findFirst()
                .orElseThrow(() -> new MigrationConfigException("PVC mapping file has no data row: " + file));

        String sourceNamespace = CsvHeaders.field(row, srcNs);
        String destinationNamespace = CsvHeaders.field(row, dstNs);
        if (sourceNamespace.isEmpty() || destinationNamespace.isEmpty()) {
            throw new MigrationConfigException(
                    "source_namespace or dest_namespace is empty in the first data row (line " + row.getRecordNumber() + ")");
        }

        String rawMethod = CsvHeaders.field(row, csv.indexOf("method"));
        TransferMethod method = TransferMethod.parse(rawMethod).orElse(null);
        if (method == null && !rawMethod.isEmpty()) {
            log.warn("Unknown transfer method '{}', using {}", rawMethod, TransferMethod.STREAM_ARCHIVE);
        }

        return MigrationRequest.builder()
                .sourceNamespace(sourceNamespace)
                .destinationNamespace(destinationNamespace)
                .sourceVolumeName(CsvHeaders.field(row, csv.indexOf("source_pvc", "sourcepvc")))
                .destinationVolumeName(CsvHeaders.field(row, csv.indexOf("dest_pvc", "destpvc")))
                .sourcePath(CsvHeaders.field(row, csv.indexOf("source_path", "sourcepath")))
                .destinationPath(CsvHeaders.field(row, csv.indexOf("dest_path", "destpath")))
                .transferMethod(method)
                .workloadIdentity(CsvHeaders.field(row, csv.indexOf("controller_name", "controllername")));
    }
}
