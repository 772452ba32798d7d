package com.modelkeeper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.modelkeeper.gate.GateCursorStore;
import com.modelkeeper.gate.SqliteTrainingDataGate;
import com.modelkeeper.gate.TrainingDataGate;
import com.modelkeeper.gate.TrainingStatistics;
import com.modelkeeper.monitor.DaemonController;
import com.modelkeeper.monitor.DaemonLauncher;
import com.modelkeeper.monitor.DaemonizationException;
import com.modelkeeper.monitor.FatalAlertNotifier;
import com.modelkeeper.monitor.MonitorStatus;
import com.modelkeeper.monitor.MonitorSummary;
import com.modelkeeper.monitor.PidFile;
import com.modelkeeper.monitor.RetrainMonitor;
import com.modelkeeper.monitor.SingleInstanceViolationException;
import com.modelkeeper.monitor.WebhookAlertNotifier;
import com.modelkeeper.pipeline.ArtifactValidator;
import com.modelkeeper.pipeline.MetricExtractor;
import com.modelkeeper.pipeline.PipelineDefinition;
import com.modelkeeper.pipeline.RollbackException;
import com.modelkeeper.pipeline.StageRunner;
import com.modelkeeper.pipeline.TrainingOrchestrator;
import com.modelkeeper.pipeline.TrainingRun;
import com.modelkeeper.pipeline.TrainingRunLog;
import com.modelkeeper.runtime.AppConfig;
import com.modelkeeper.runtime.AuditTrail;
import com.modelkeeper.runtime.FileAuditTrail;
import com.modelkeeper.versioning.ArtifactStore;
import com.modelkeeper.versioning.BackupSnapshot;
import com.modelkeeper.versioning.RetentionPolicy;
import com.modelkeeper.versioning.StorageException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "model-keeper",
        mixinStandardHelpOptions = true,
        version = "model-keeper 0.1.0",
        description = "Versioned model artifacts, guarded retraining and the retrain monitor daemon.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FATAL_ROLLBACK = 3;
    static final int EXIT_START_REFUSED = 4;

    static final String RUN_LOG_FILE = "training-runs.jsonl";
    private static final Duration DAEMON_CONFIRM_WINDOW = Duration.ofSeconds(2);

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "status")
    Mode mode;

    @Option(names = "--daemon", description = "Run the monitor detached from the terminal", defaultValue = "false")
    boolean daemon;

    @Option(names = "--interval", description = "Seconds between gate checks (overrides monitor.intervalSeconds)")
    Long intervalSeconds;

    @Option(names = "--min-quality", description = "Minimum training quality score (overrides monitor.minQualityScore)")
    Double minQualityScore;

    @Option(names = "--min-records", description = "New records needed to retrain (overrides monitor.minNewRecords)")
    Integer minNewRecords;

    @Option(names = "--max-cycles", description = "Stop the monitor after this many cycles (0 = run until stopped)")
    Integer maxCycles;

    @Option(names = "--reason", description = "Reason recorded with a manual backup", defaultValue = "manual")
    String reason;

    @Option(names = "--if-changed", description = "Back up only when production changed within this many hours")
    Integer ifChangedHours;

    @Option(names = "--version-id", description = "Backup version to restore, e.g. 20240101_120000")
    String versionId;

    enum Mode {
        monitor,
        status,
        stop,
        train,
        backup,
        restore,
        backups,
        stats
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        applyOverrides(config);
        log.debug("Using config file: {} mode={}", configPath, mode);

        switch (mode) {
            case monitor:
                return daemon ? launchDaemon(config) : runMonitor(config);
            case status:
                return printStatus(config);
            case stop:
                return stopMonitor(config);
            case train:
                return train(config);
            case backup:
                return backup(config);
            case restore:
                return restore(config);
            case backups:
                return listBackups(config);
            case stats:
                return printStatistics(config);
            default:
                log.error("Unsupported mode {}", mode);
                return EXIT_USAGE;
        }
    }

    private int runMonitor(AppConfig config) throws IOException {
        AppConfig.MonitorConfig monitorConfig = config.getMonitor();
        AuditTrail audit = createAudit(config);
        TrainingDataGate gate = createGate(config);
        TrainingOrchestrator orchestrator = createOrchestrator(config, createStore(config, audit), audit);
        RetrainMonitor monitor = new RetrainMonitor(
                gate,
                orchestrator,
                new RetrainMonitor.Settings(
                        Duration.ofSeconds(monitorConfig.getIntervalSeconds()),
                        monitorConfig.getMinQualityScore(),
                        monitorConfig.getMinNewRecords(),
                        monitorConfig.getMaxCycles()),
                new PidFile(Path.of(monitorConfig.getPidFile())),
                audit,
                createAlertNotifier(config));
        // A stop must be able to wait out a full run: every stage may use its whole timeout.
        Duration maxRunDuration = Duration.ofMillis(config.getPipeline().getStageTimeoutMs())
                .multipliedBy(orchestrator.pipeline().ordered().size() + 1L);
        Thread hook = monitor.installShutdownHook(maxRunDuration);

        try {
            MonitorSummary summary = monitor.run();
            log.info("monitor.finished cycles={} runs={} committed={} failedCycles={}",
                    summary.cycles(), summary.runsTriggered(), summary.runsCommitted(), summary.failedCycles());
            return EXIT_OK;
        } catch (SingleInstanceViolationException e) {
            log.error("{}", e.getMessage());
            return EXIT_START_REFUSED;
        } catch (RollbackException e) {
            log.error("monitor.fatal backup={} reason={}", e.backupVersion(), e.getMessage(), e);
            return EXIT_FATAL_ROLLBACK;
        } finally {
            removeShutdownHook(hook);
        }
    }

    private int launchDaemon(AppConfig config) {
        PidFile pidFile = new PidFile(Path.of(config.getMonitor().getPidFile()));
        try {
            if (pidFile.isOwnerAlive()) {
                log.error("Monitor already running with pid {}", pidFile.read().orElse(-1));
                return EXIT_START_REFUSED;
            }
            DaemonLauncher launcher = createLauncher(config);
            long pid = launcher.launch(childArguments());
            System.out.printf("Retrain monitor started in background (pid %d)%n", pid);
            System.out.printf("Log file: %s%n", config.getMonitor().getLogFile());
            System.out.printf("Error log: %s%n", launcher.errorLogFile());
            return EXIT_OK;
        } catch (DaemonizationException | IOException e) {
            log.error("Could not start monitor daemon: {}", e.getMessage());
            return EXIT_START_REFUSED;
        }
    }

    private int printStatus(AppConfig config) throws IOException {
        MonitorStatus status = createController(config, createAudit(config)).status();
        switch (status.state()) {
            case RUNNING:
                System.out.printf("Retrain monitor is running (pid %d)%n", status.pid().getAsLong());
                break;
            case STALE:
                System.out.printf("Retrain monitor is not running (stale pid file for pid %d)%n", status.pid().getAsLong());
                break;
            default:
                System.out.println("Retrain monitor is not running");
                break;
        }
        if (!status.logTail().isEmpty()) {
            System.out.println();
            System.out.printf("Last %d log lines:%n", status.logTail().size());
            status.logTail().forEach(System.out::println);
        }
        return EXIT_OK;
    }

    private int stopMonitor(AppConfig config) throws IOException {
        DaemonController.StopOutcome outcome = createController(config, createAudit(config)).stop();
        switch (outcome) {
            case NOT_RUNNING:
                System.out.println("Retrain monitor is not running");
                return EXIT_OK;
            case STALE_PID_FILE_REMOVED:
                System.out.println("Retrain monitor was not running; removed stale pid file");
                return EXIT_OK;
            case STOPPED:
                System.out.println("Retrain monitor stopped");
                return EXIT_OK;
            case KILLED:
                System.out.println("Retrain monitor did not stop in time and was killed");
                return EXIT_OK;
            default:
                System.out.println("Retrain monitor is still running");
                return EXIT_FAILURE;
        }
    }

    private int train(AppConfig config) throws IOException {
        AuditTrail audit = createAudit(config);
        TrainingDataGate gate = createGate(config);
        TrainingOrchestrator orchestrator = createOrchestrator(config, createStore(config, audit), audit);
        try {
            TrainingRun run = orchestrator.run(gate::markConsumed);
            System.out.printf("Training run %s (backup %s, %.1fs)%n",
                    run.disposition(), run.backupVersion(), run.elapsed().toMillis() / 1000.0);
            if (run.validation() != null) {
                run.validation().violations().forEach(violation -> System.out.println("  " + violation));
            }
            return run.committed() ? EXIT_OK : EXIT_FAILURE;
        } catch (RollbackException e) {
            log.error("train.fatal backup={} reason={}", e.backupVersion(), e.getMessage(), e);
            createAlertNotifier(config).rollbackFailed(e);
            return EXIT_FATAL_ROLLBACK;
        }
    }

    private int backup(AppConfig config) throws IOException {
        ArtifactStore store = createStore(config, createAudit(config));
        if (ifChangedHours != null) {
            if (ifChangedHours < 0) {
                log.error("--if-changed must be >= 0");
                return EXIT_USAGE;
            }
            Instant since = Instant.now().minus(Duration.ofHours(ifChangedHours));
            if (!store.changedSince(since)) {
                System.out.printf("No production changes in the last %d hours; backup skipped%n", ifChangedHours);
                return EXIT_OK;
            }
        }
        try {
            String created = store.snapshot(reason);
            System.out.printf("Created backup %s%s%n", ArtifactStore.VERSION_PREFIX, created);
            return EXIT_OK;
        } catch (StorageException e) {
            log.error("Backup failed: {}", e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int restore(AppConfig config) {
        if (versionId == null || versionId.isBlank()) {
            log.error("--version-id is required in restore mode");
            return EXIT_USAGE;
        }
        String id = versionId.startsWith(ArtifactStore.VERSION_PREFIX)
                ? versionId.substring(ArtifactStore.VERSION_PREFIX.length())
                : versionId;
        try {
            createStore(config, createAudit(config)).restore(id);
            System.out.printf("Restored production artifacts from %s%s%n", ArtifactStore.VERSION_PREFIX, id);
            return EXIT_OK;
        } catch (StorageException e) {
            log.error("Restore failed: {}", e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int listBackups(AppConfig config) throws IOException {
        List<BackupSnapshot> snapshots = createStore(config, createAudit(config)).list();
        if (snapshots.isEmpty()) {
            System.out.println("No backups found");
            return EXIT_OK;
        }
        LocalDateTime now = LocalDateTime.now();
        System.out.printf("%-24s %10s %8s %-16s %10s %s%n", "VERSION", "SIZE(KB)", "AGE(D)", "REASON", "TEST_MAE", "TRAIN_DATE");
        for (BackupSnapshot snapshot : snapshots) {
            System.out.printf(Locale.ROOT, "%-24s %10.1f %8d %-16s %10s %s%n",
                    ArtifactStore.VERSION_PREFIX + snapshot.versionId(),
                    snapshot.sizeBytes() / 1024.0,
                    Duration.between(snapshot.createdAt(), now).toDays(),
                    snapshot.reason() == null ? "-" : snapshot.reason(),
                    String.valueOf(snapshot.metrics().getOrDefault("test_mae", "N/A")),
                    String.valueOf(snapshot.metrics().getOrDefault("train_date", "N/A")));
        }
        return EXIT_OK;
    }

    private int printStatistics(AppConfig config) throws IOException {
        TrainingStatistics statistics = createGate(config).statistics();
        System.out.printf("Training records: %d%n", statistics.totalTrainingRecords());
        for (Map.Entry<String, Integer> bucket : statistics.byQuality().entrySet()) {
            System.out.printf("  %-10s %d%n", bucket.getKey(), bucket.getValue());
        }
        System.out.printf("New since %s: %d%n", statistics.cursor(), statistics.newSinceCursor());
        return EXIT_OK;
    }

    private void applyOverrides(AppConfig config) {
        AppConfig.MonitorConfig monitorConfig = config.getMonitor();
        if (intervalSeconds != null) {
            monitorConfig.setIntervalSeconds(intervalSeconds);
        }
        if (minQualityScore != null) {
            monitorConfig.setMinQualityScore(minQualityScore);
        }
        if (minNewRecords != null) {
            monitorConfig.setMinNewRecords(minNewRecords);
        }
        if (maxCycles != null) {
            monitorConfig.setMaxCycles(maxCycles);
        }
    }

    List<String> childArguments() {
        List<String> arguments = new ArrayList<>();
        if (spec != null) {
            arguments.addAll(spec.commandLine().getParseResult().originalArgs());
        }
        arguments.removeIf(argument -> argument.equals("--daemon") || argument.startsWith("--daemon="));
        return arguments;
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("shutdown.hook.in-progress");
        }
    }

    AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    AuditTrail createAudit(AppConfig config) {
        return new FileAuditTrail(Path.of(config.getMonitor().getLogFile()));
    }

    ArtifactStore createStore(AppConfig config, AuditTrail audit) {
        AppConfig.ArtifactsConfig artifacts = config.getArtifacts();
        AppConfig.RetentionConfig retention = config.getRetention();
        return new ArtifactStore(
                artifacts.resolveProductionDir(),
                artifacts.resolveBackupDir(),
                artifacts.getMetadataFile(),
                new RetentionPolicy(retention.getKeepAllDays(), retention.getWeeklyUntilDays(), retention.getMonthlyUntilDays()),
                audit);
    }

    TrainingOrchestrator createOrchestrator(AppConfig config, ArtifactStore store, AuditTrail audit) {
        AppConfig.PipelineConfig pipelineConfig = config.getPipeline();
        PipelineDefinition pipeline = PipelineDefinition.fromConfig(pipelineConfig.getStages());
        StageRunner stageRunner = new StageRunner(
                Duration.ofMillis(pipelineConfig.getStageTimeoutMs()),
                Path.of(pipelineConfig.getWorkingDirectory()),
                new MetricExtractor(pipelineConfig.getMetricPatterns()),
                pipelineConfig.getMaxCapturedOutputChars());
        ArtifactValidator validator = new ArtifactValidator(
                store.productionDir(),
                pipeline.requiredArtifacts(config.getArtifacts().getRequiredFiles()),
                pipelineConfig.getMainMetricCeiling());
        return new TrainingOrchestrator(
                store,
                stageRunner,
                pipeline,
                validator,
                pipelineConfig.getSpecialistParallelism(),
                new TrainingRunLog(store.backupDir().resolve(RUN_LOG_FILE)),
                audit,
                Clock.systemDefaultZone());
    }

    TrainingDataGate createGate(AppConfig config) {
        AppConfig.GateConfig gateConfig = config.getGate();
        return new SqliteTrainingDataGate(
                Path.of(gateConfig.getDatabasePath()),
                new GateCursorStore(Path.of(gateConfig.getCursorPath())));
    }

    FatalAlertNotifier createAlertNotifier(AppConfig config) {
        AppConfig.AlertsConfig alerts = config.getAlerts();
        if (!alerts.isEnabled()) {
            return FatalAlertNotifier.NONE;
        }
        return new WebhookAlertNotifier(alerts.getWebhookUrl(), Duration.ofMillis(alerts.getTimeoutMs()));
    }

    DaemonController createController(AppConfig config, AuditTrail audit) {
        AppConfig.MonitorConfig monitorConfig = config.getMonitor();
        return new DaemonController(
                new PidFile(Path.of(monitorConfig.getPidFile())),
                Path.of(monitorConfig.getLogFile()),
                monitorConfig.getStatusTailLines(),
                Duration.ofMillis(monitorConfig.getStopGracePeriodMs()),
                audit);
    }

    DaemonLauncher createLauncher(AppConfig config) {
        return new DaemonLauncher(Main.class.getName(), Path.of(config.getMonitor().getLogFile()), DAEMON_CONFIRM_WINDOW);
    }
}
