package pvcmigrator.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import pvcmigrator.alert.MigrationAlertLogger;
import pvcmigrator.config.CredentialsFileLoader;
import pvcmigrator.config.MappingFileLoader;
import pvcmigrator.config.MigrationConfigException;
import pvcmigrator.config.MigrationRequest;
import pvcmigrator.config.MigratorConfig;
import pvcmigrator.config.MigratorConfigLoader;
import pvcmigrator.engine.MigrationEngine;
import pvcmigrator.engine.MigrationReport;
import pvcmigrator.exceptions.AuthException;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.session.ClusterEndpoint;
import pvcmigrator.session.ClusterRole;
import pvcmigrator.session.ClusterSession;
import pvcmigrator.session.ClusterSessionFactory;
import pvcmigrator.session.ClusterSessions;
import pvcmigrator.workload.WorkloadNames;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command-line entry point.
 *
 * <pre>
 *   pvc-migrator --pvc pvc-map.csv [--cred cluster-creds.csv] [--config pvc-migrator.yml]
 *   pvc-migrator pvc-map.csv
 * </pre>
 *
 * Exit code 0 on success, 1 on any fatal error.
 */
@Command(
        name = "pvc-migrator",
        version = "1.0.0",
        mixinStandardHelpOptions = true,
        description = "Migrate an automation controller's backup volume between two clusters and restore it.",
        footerHeading = "%nExamples:%n",
        footer = {
                "  pvc-migrator --pvc pvc-map.csv --cred cluster-creds.csv",
                "  pvc-migrator pvc-map.csv"
        }
)
public class PvcMigratorCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PvcMigratorCommand.class);

    static final String DEFAULT_CREDENTIALS_FILE = "cluster-creds.csv";
    static final String LOGIN_STAGE = "LOGIN";

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "PVC_MAP", description = "Mapping CSV (same as --pvc)")
    Path positionalMapping;

    @Option(names = "--pvc", paramLabel = "FILE", description = "Mapping CSV with namespaces, claims, paths and method")
    Path mappingFile;

    @Option(names = "--cred", paramLabel = "FILE",
            description = "Credentials CSV (default: cluster-creds.csv next to the mapping file, if present)")
    Path credentialsFile;

    @Option(names = "--config", paramLabel = "FILE", description = "Configuration file (.properties or .yml)")
    Path configFile;

    @Option(names = "--image", description = "Transfer pod image (skips the image prompt)")
    String image;

    @Option(names = "--workdir", paramLabel = "DIR", defaultValue = ".",
            description = "Where the run directory is created (default: ${DEFAULT-VALUE})")
    Path workDir;

    @Option(names = "--non-interactive", description = "Never prompt; fail on missing or rejected input")
    boolean nonInteractive;

    private final ClusterSessionFactory sessions;
    private final Function<MigratorConfig, MigrationEngine> engineFactory;
    private final Clock clock;
    private InteractivePrompter prompter;

    public PvcMigratorCommand() {
        this(new ClusterSessions(), MigrationEngine::new, Clock.systemDefaultZone(), null);
    }

    PvcMigratorCommand(ClusterSessionFactory sessions, Function<MigratorConfig, MigrationEngine> engineFactory,
                       Clock clock, InteractivePrompter prompter) {
        this.sessions = sessions;
        this.engineFactory = engineFactory;
        this.clock = clock;
        this.prompter = prompter;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new PvcMigratorCommand()).execute(args));
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path mapping = mappingFile != null ? mappingFile : positionalMapping;
        if (mapping == null) {
            err.println("ERROR: pvc-map CSV is required.");
            spec.commandLine().usage(err);
            return 1;
        }
        if (!Files.isRegularFile(mapping)) {
            err.println("ERROR: PVC CSV not found: " + mapping);
            spec.commandLine().usage(err);
            return 1;
        }

        RunLogAppender runLog = null;
        try {
            MigratorConfig config = configFile != null
                    ? MigratorConfigLoader.loadFromFile(configFile)
                    : MigratorConfigLoader.load();
            MigrationAlertLogger.setAlertLevel(config.alertLevel());

            String timestamp = WorkloadNames.timestamp(LocalDateTime.now(clock));
            RunDirectory runDirectory = RunDirectory.create(workDir, timestamp);
            runLog = RunLogAppender.attach(runDirectory.logFile());
            log.info("Logs at: {}", runDirectory.directory());

            MigrationRequest.Builder request = MappingFileLoader.load(mapping);
            Map<ClusterRole, ClusterEndpoint> endpoints = loadCredentials(mapping);

            try (ClusterSession source = connect(ClusterRole.SOURCE, endpoints.get(ClusterRole.SOURCE));
                 ClusterSession destination = connect(ClusterRole.DESTINATION,
                         endpoints.get(ClusterRole.DESTINATION))) {
                completeRequest(request, config);
                MigrationReport report = engineFactory.apply(config)
                        .run(timestamp, request.build(), source, destination, runDirectory.directory());
                printSummary(out, report);
            }
            return 0;
        } catch (MigrateException e) {
            String stage = e.getStage() != null ? e.getStage() : "UNKNOWN";
            err.println("ERROR [phase=" + stage + "] " + e.getRawMessage());
            return 1;
        } catch (MigrationConfigException e) {
            err.println("ERROR: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("ERROR: " + e.getMessage());
            log.debug("I/O failure", e);
            return 1;
        } finally {
            err.flush();
            out.flush();
            if (runLog != null) {
                runLog.close();
            }
        }
    }

    private Map<ClusterRole, ClusterEndpoint> loadCredentials(Path mapping) {
        Path file = credentialsFile;
        if (file == null) {
            Path parent = mapping.toAbsolutePath().getParent();
            Path sibling = (parent != null ? parent : Paths.get(".")).resolve(DEFAULT_CREDENTIALS_FILE);
            if (Files.isRegularFile(sibling)) {
                file = sibling;
            }
        }
        if (file == null) {
            log.info("No credentials file; logins will be prompted");
            return new EnumMap<>(ClusterRole.class);
        }
        log.info("Using credentials from {}", file);
        return CredentialsFileLoader.load(file);
    }

    /**
     * Opens a session from the file's endpoint, falling back to the login menu
     * until a login succeeds or the user aborts.
     */
    ClusterSession connect(ClusterRole role, ClusterEndpoint endpoint) throws MigrateException {
        log.info("Validating {} cluster login...", role);
        try {
            return sessions.open(role, endpoint);
        } catch (AuthException e) {
            if (nonInteractive) {
                throw e.atStage(LOGIN_STAGE);
            }
            log.warn("CSV login for {} failed or incomplete: {}", role, e.getRawMessage());
            prompter().say("CSV login for " + role + " failed or incomplete.");
        }
        while (true) {
            ClusterEndpoint entered = prompter().login(role).orElse(null);
            if (entered == null) {
                throw new AuthException("Aborted by user at " + role + " login", AuthException.Reason.INCOMPLETE)
                        .atStage(LOGIN_STAGE);
            }
            try {
                return sessions.open(role, entered);
            } catch (AuthException e) {
                log.warn("{} login failed: {}", role, e.getRawMessage());
                prompter().say("Login failed.");
            }
        }
    }

    private void completeRequest(MigrationRequest.Builder request, MigratorConfig config) {
        String identity = request.workloadIdentity();
        if ((identity == null || identity.isBlank()) && !nonInteractive) {
            request.workloadIdentity(prompter().ask("Controller (deployment) name",
                    MigrationRequest.DEFAULT_WORKLOAD_IDENTITY));
        }
        if (image != null) {
            request.image(image);
        } else if (nonInteractive) {
            request.image(config.image());
        } else {
            request.image(prompter().ask("Ephemeral pod image", config.image()));
        }
    }

    private static void printSummary(PrintWriter out, MigrationReport report) {
        out.println("Migration " + report.runId() + " completed.");
        out.println("  Backup:   " + report.backup().backupDirectory() + " (claim " + report.backup().backupClaim() + ")");
        out.println("  Claim:    " + report.request().destinationNamespace() + "/" + report.destinationClaim()
                + " " + report.provisioning());
        out.println("  Method:   " + report.transferMethod().shortName());
        out.println("  Size:     " + report.sourceSize().human() + " -> " + report.destinationSize().human()
                + " [" + report.sizeCheck().status() + "]");
        out.println("  Teardown: " + report.teardown().summary());
        out.println("  Metrics:  " + report.metrics().summary());
    }

    private InteractivePrompter prompter() {
        if (prompter == null) {
            prompter = InteractivePrompter.fromSystem(spec.commandLine().getOut());
        }
        return prompter;
    }
}
