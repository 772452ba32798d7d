package com.modelkeeper.runtime;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    static final String DEFAULT_HOME = Path.of(System.getProperty("user.home"), ".model-keeper").toString();

    private ArtifactsConfig artifacts = new ArtifactsConfig();
    private RetentionConfig retention = new RetentionConfig();
    private PipelineConfig pipeline = new PipelineConfig();
    private MonitorConfig monitor = new MonitorConfig();
    private GateConfig gate = new GateConfig();
    private AlertsConfig alerts = new AlertsConfig();

    public ArtifactsConfig getArtifacts() {
        return artifacts;
    }

    public void setArtifacts(ArtifactsConfig artifacts) {
        this.artifacts = artifacts == null ? new ArtifactsConfig() : artifacts;
    }

    public RetentionConfig getRetention() {
        return retention;
    }

    public void setRetention(RetentionConfig retention) {
        this.retention = retention == null ? new RetentionConfig() : retention;
    }

    public PipelineConfig getPipeline() {
        return pipeline;
    }

    public void setPipeline(PipelineConfig pipeline) {
        this.pipeline = pipeline == null ? new PipelineConfig() : pipeline;
    }

    public MonitorConfig getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorConfig monitor) {
        this.monitor = monitor == null ? new MonitorConfig() : monitor;
    }

    public GateConfig getGate() {
        return gate;
    }

    public void setGate(GateConfig gate) {
        this.gate = gate == null ? new GateConfig() : gate;
    }

    public AlertsConfig getAlerts() {
        return alerts;
    }

    public void setAlerts(AlertsConfig alerts) {
        this.alerts = alerts == null ? new AlertsConfig() : alerts;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ArtifactsConfig {
        private String productionDir = Path.of(DEFAULT_HOME, "models").toString();
        private String backupDir = "";
        private String metadataFile = "metadata.json";
        private List<String> requiredFiles = new ArrayList<>(List.of("price_v1.pkl", "scaler_v1.pkl", "metadata.json"));

        public String getProductionDir() {
            return productionDir;
        }

        public void setProductionDir(String productionDir) {
            this.productionDir = productionDir;
        }

        public String getBackupDir() {
            return backupDir;
        }

        public void setBackupDir(String backupDir) {
            this.backupDir = backupDir;
        }

        public String getMetadataFile() {
            return metadataFile;
        }

        public void setMetadataFile(String metadataFile) {
            this.metadataFile = metadataFile;
        }

        public List<String> getRequiredFiles() {
            return requiredFiles;
        }

        public void setRequiredFiles(List<String> requiredFiles) {
            this.requiredFiles = requiredFiles == null ? new ArrayList<>() : requiredFiles;
        }

        public Path resolveProductionDir() {
            return Path.of(productionDir);
        }

        public Path resolveBackupDir() {
            if (backupDir == null || backupDir.isBlank()) {
                return resolveProductionDir().resolve("backups");
            }
            return Path.of(backupDir);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetentionConfig {
        private int keepAllDays = 30;
        private int weeklyUntilDays = 180;
        private int monthlyUntilDays = 365;

        public int getKeepAllDays() {
            return keepAllDays;
        }

        public void setKeepAllDays(int keepAllDays) {
            this.keepAllDays = keepAllDays;
        }

        public int getWeeklyUntilDays() {
            return weeklyUntilDays;
        }

        public void setWeeklyUntilDays(int weeklyUntilDays) {
            this.weeklyUntilDays = weeklyUntilDays;
        }

        public int getMonthlyUntilDays() {
            return monthlyUntilDays;
        }

        public void setMonthlyUntilDays(int monthlyUntilDays) {
            this.monthlyUntilDays = monthlyUntilDays;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PipelineConfig {
        private String workingDirectory = ".";
        private long stageTimeoutMs = 600_000L;
        private int maxCapturedOutputChars = 8192;
        private int specialistParallelism = 1;
        private double mainMetricCeiling = 10.0;
        private List<String> metricPatterns = new ArrayList<>(List.of(
                "Test MAE:\\s*\\$?(\\d+\\.?\\d*)",
                "MAE:\\s*\\$?(\\d+\\.?\\d*)",
                "Mean Absolute Error:\\s*\\$?(\\d+\\.?\\d*)"));
        private StagesConfig stages = StagesConfig.defaults();

        public String getWorkingDirectory() {
            return workingDirectory;
        }

        public void setWorkingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
        }

        public long getStageTimeoutMs() {
            return stageTimeoutMs;
        }

        public void setStageTimeoutMs(long stageTimeoutMs) {
            this.stageTimeoutMs = stageTimeoutMs;
        }

        public int getMaxCapturedOutputChars() {
            return maxCapturedOutputChars;
        }

        public void setMaxCapturedOutputChars(int maxCapturedOutputChars) {
            this.maxCapturedOutputChars = maxCapturedOutputChars;
        }

        public int getSpecialistParallelism() {
            return specialistParallelism;
        }

        public void setSpecialistParallelism(int specialistParallelism) {
            this.specialistParallelism = specialistParallelism;
        }

        public double getMainMetricCeiling() {
            return mainMetricCeiling;
        }

        public void setMainMetricCeiling(double mainMetricCeiling) {
            this.mainMetricCeiling = mainMetricCeiling;
        }

        public List<String> getMetricPatterns() {
            return metricPatterns;
        }

        public void setMetricPatterns(List<String> metricPatterns) {
            this.metricPatterns = metricPatterns == null ? new ArrayList<>() : metricPatterns;
        }

        public StagesConfig getStages() {
            return stages;
        }

        public void setStages(StagesConfig stages) {
            this.stages = stages == null ? StagesConfig.defaults() : stages;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StagesConfig {
        private StageConfig main;
        private List<StageConfig> specialists = new ArrayList<>();
        private StageConfig aggregate;
        private StageConfig ensemble;

        static StagesConfig defaults() {
            StagesConfig stages = new StagesConfig();
            stages.setMain(StageConfig.of("main_model",
                    List.of("python3", "scripts/train_price_model.py"),
                    List.of("price_v1.pkl", "scaler_v1.pkl", "metadata.json")));
            List<StageConfig> specialists = new ArrayList<>();
            for (String platform : List.of("abebooks", "alibris", "amazon", "biblio", "ebay", "zvab")) {
                specialists.add(platformStage("specialist_" + platform, "train_" + platform + "_model.py", platform, true));
            }
            stages.setSpecialists(specialists);
            stages.setAggregate(platformStage("lot_model", "train_lot_model.py", "lot", true));
            stages.setEnsemble(platformStage("meta_model", "train_meta_model.py", "meta", false));
            return stages;
        }

        private static StageConfig platformStage(String name, String script, String prefix, boolean withScaler) {
            List<String> artifacts = new ArrayList<>();
            artifacts.add("stacking/" + prefix + "_model.pkl");
            if (withScaler) {
                artifacts.add("stacking/" + prefix + "_scaler.pkl");
            }
            artifacts.add("stacking/" + prefix + "_metadata.json");
            return StageConfig.of(name, List.of("python3", "scripts/stacking/" + script), artifacts);
        }

        public StageConfig getMain() {
            return main;
        }

        public void setMain(StageConfig main) {
            this.main = main;
        }

        public List<StageConfig> getSpecialists() {
            return specialists;
        }

        public void setSpecialists(List<StageConfig> specialists) {
            this.specialists = specialists == null ? new ArrayList<>() : specialists;
        }

        public StageConfig getAggregate() {
            return aggregate;
        }

        public void setAggregate(StageConfig aggregate) {
            this.aggregate = aggregate;
        }

        public StageConfig getEnsemble() {
            return ensemble;
        }

        public void setEnsemble(StageConfig ensemble) {
            this.ensemble = ensemble;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StageConfig {
        private String name;
        private List<String> command = new ArrayList<>();
        private List<String> artifacts = new ArrayList<>();

        public static StageConfig of(String name, List<String> command, List<String> artifacts) {
            StageConfig stage = new StageConfig();
            stage.setName(name);
            stage.setCommand(new ArrayList<>(command));
            stage.setArtifacts(new ArrayList<>(artifacts));
            return stage;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command == null ? new ArrayList<>() : command;
        }

        public List<String> getArtifacts() {
            return artifacts;
        }

        public void setArtifacts(List<String> artifacts) {
            this.artifacts = artifacts == null ? new ArrayList<>() : artifacts;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MonitorConfig {
        private long intervalSeconds = 600;
        private double minQualityScore = 0.6;
        private int minNewRecords = 1;
        private String pidFile = Path.of(DEFAULT_HOME, "retrain-monitor.pid").toString();
        private String logFile = Path.of(DEFAULT_HOME, "retrain-monitor.log").toString();
        private long stopGracePeriodMs = 30_000L;
        private int statusTailLines = 20;
        private int maxCycles;

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public double getMinQualityScore() {
            return minQualityScore;
        }

        public void setMinQualityScore(double minQualityScore) {
            this.minQualityScore = minQualityScore;
        }

        public int getMinNewRecords() {
            return minNewRecords;
        }

        public void setMinNewRecords(int minNewRecords) {
            this.minNewRecords = minNewRecords;
        }

        public String getPidFile() {
            return pidFile;
        }

        public void setPidFile(String pidFile) {
            this.pidFile = pidFile;
        }

        public String getLogFile() {
            return logFile;
        }

        public void setLogFile(String logFile) {
            this.logFile = logFile;
        }

        public long getStopGracePeriodMs() {
            return stopGracePeriodMs;
        }

        public void setStopGracePeriodMs(long stopGracePeriodMs) {
            this.stopGracePeriodMs = stopGracePeriodMs;
        }

        public int getStatusTailLines() {
            return statusTailLines;
        }

        public void setStatusTailLines(int statusTailLines) {
            this.statusTailLines = statusTailLines;
        }

        public int getMaxCycles() {
            return maxCycles;
        }

        public void setMaxCycles(int maxCycles) {
            this.maxCycles = maxCycles;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GateConfig {
        private String databasePath = Path.of(DEFAULT_HOME, "metadata_cache.db").toString();
        private String cursorPath = Path.of(DEFAULT_HOME, "last_training_state.txt").toString();

        public String getDatabasePath() {
            return databasePath;
        }

        public void setDatabasePath(String databasePath) {
            this.databasePath = databasePath;
        }

        public String getCursorPath() {
            return cursorPath;
        }

        public void setCursorPath(String cursorPath) {
            this.cursorPath = cursorPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AlertsConfig {
        private String webhookUrl = "";
        private long timeoutMs = 10_000L;

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public boolean isEnabled() {
            return webhookUrl != null && !webhookUrl.isBlank();
        }
    }
}
