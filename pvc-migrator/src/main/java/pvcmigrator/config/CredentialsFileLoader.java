package pvcmigrator.config;

import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.session.ClusterEndpoint;
import pvcmigrator.session.ClusterRole;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the cluster credentials CSV.
 *
 * <p>Columns: {@code label}, {@code api_url} (or {@code apiurl}), {@code token},
 * {@code user}, {@code pass}, {@code insecure}. Rows labelled {@code source}
 * and {@code destination} (or {@code dest}) are used, later rows win; other
 * labels are ignored. Entries may be incomplete, the caller prompts for the rest.
 */
public final class CredentialsFileLoader {

    private static final Logger log = LoggerFactory.getLogger(CredentialsFileLoader.class);

    private CredentialsFileLoader() {}

    public static Map<ClusterRole, ClusterEndpoint> load(Path file) {
        CsvHeaders csv = CsvHeaders.read(file, "Credentials file");
        int label = csv.indexOf("label");
        int api = csv.indexOf("api_url", "apiurl");
        int token = csv.indexOf("token");
        int user = csv.indexOf("user");
        int pass = csv.indexOf("pass");
        int insecure = csv.indexOf("insecure");
        if (label < 0) {
            throw new MigrationConfigException("Credentials file has no 'label' column: " + file);
        }

        Map<ClusterRole, ClusterEndpoint> endpoints = new EnumMap<>(ClusterRole.class);
        for (CSVRecord row : csv.rows()) {
            String rawLabel = CsvHeaders.field(row, label);
            if (rawLabel.isEmpty()) {
                continue;
            }
            Optional<ClusterRole> role = ClusterRole.fromLabel(rawLabel);
            if (role.isEmpty()) {
                log.debug("Ignoring credentials row with label '{}'", rawLabel);
                continue;
            }
            endpoints.put(role.get(), new ClusterEndpoint(
                    CsvHeaders.field(row, api),
                    CsvHeaders.field(row, token),
                    CsvHeaders.field(row, user),
                    CsvHeaders.field(row, pass),
                    parseInsecure(CsvHeaders.field(row, insecure))));
        }
        log.info("Loaded credentials for {} from {}", endpoints.keySet(), file);
        return endpoints;
    }

    /**
     * Parses the {@code insecure} flag. Unknown values count as {@code false}.
     */
    static boolean parseInsecure(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "y":
            case "1":
            case "on":
                return true;
            case "false":
            case "no":
            case "n":
            case "0":
            case "off":
                return false;
            default:
                log.warn("Unrecognised insecure flag '{}', TLS verification stays on", value);
                return false;
        }
    }
}
