package com.modelkeeper.pipeline;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelkeeper.runtime.AuditTrail;
import com.modelkeeper.versioning.ArtifactStore;
import com.modelkeeper.versioning.StorageException;

/**
 * Backs up production, runs every stage, validates the result and then either keeps the new
 * generation or restores the backup. When {@link #run(CommitHook)} returns, production holds either
 * the validated new generation or exactly the files of the pre-run backup.
 */
public class TrainingOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(TrainingOrchestrator.class);
    static final String BACKUP_REASON = "pre-training";

    private final ArtifactStore artifactStore;
    private final StageRunner stageRunner;
    private final PipelineDefinition pipeline;
    private final ArtifactValidator validator;
    private final int specialistParallelism;
    private final TrainingRunLog runLog;
    private final AuditTrail audit;
    private final Clock clock;

    public TrainingOrchestrator(
            ArtifactStore artifactStore,
            StageRunner stageRunner,
            PipelineDefinition pipeline,
            ArtifactValidator validator,
            int specialistParallelism,
            TrainingRunLog runLog,
            AuditTrail audit,
            Clock clock) {
        this.artifactStore = artifactStore;
        this.stageRunner = stageRunner;
        this.pipeline = pipeline;
        this.validator = validator;
        this.specialistParallelism = Math.max(1, specialistParallelism);
        this.runLog = runLog;
        this.audit = audit;
        this.clock = clock;
    }

    public TrainingRun run() {
        return run(CommitHook.NONE);
    }

    /**
     * @throws RollbackException when validation failed and the backup could not be restored
     */
    public TrainingRun run(CommitHook commitHook) {
        Instant startedAt = clock.instant();
        audit.record("Training run started (" + pipeline.ordered().size() + " stages)");

        String backupVersion;
        try {
            backupVersion = artifactStore.snapshot(BACKUP_REASON);
        } catch (StorageException e) {
            log.error("orchestrator.backup.failed reason={}", e.getMessage(), e);
            audit.record("Backup failed, training not attempted: " + e.getMessage());
            return finish(new TrainingRun(startedAt, clock.instant(), null, List.of(), null,
                    Disposition.FAILED_NO_BACKUP, e.getMessage()));
        }

        List<StageResult> results = new ArrayList<>();
        ValidationResult validation;
        try {
            results.addAll(runStages());
            validation = validator.validate(results);
        } catch (RuntimeException e) {
            log.error("orchestrator.stages.unexpected-failure backup={}", backupVersion, e);
            validation = ValidationResult.failed("Unexpected error while running stages: " + e.getMessage());
        }

        TrainingRun run;
        if (validation.passed()) {
            String notes = null;
            try {
                commitHook.onCommit(clock.instant());
            } catch (IOException e) {
                log.warn("orchestrator.commit-hook.failed backup={} reason={}", backupVersion, e.getMessage());
                notes = "Commit hook failed: " + e.getMessage();
            }
            run = new TrainingRun(startedAt, clock.instant(), backupVersion, results, validation, Disposition.COMMITTED, notes);
            audit.record("All models validated; new generation committed (backup " + backupVersion + ")");
        } else {
            validation.violations().forEach(violation -> audit.record("  Validation: " + violation));
            audit.record("Validation failed; rolling back to backup " + backupVersion);
            try {
                artifactStore.restore(backupVersion);
            } catch (StorageException e) {
                audit.record("FATAL: rollback to backup " + backupVersion + " failed: " + e.getMessage()
                        + " - production artifacts are in an unknown state");
                throw new RollbackException(backupVersion, results, validation, e);
            }
            run = new TrainingRun(startedAt, clock.instant(), backupVersion, results, validation, Disposition.ROLLED_BACK, null);
        }

        summarize(run);
        return finish(run);
    }

    List<StageResult> runStages() {
        List<StageResult> results = new ArrayList<>();
        results.add(runStage(pipeline.main()));
        results.addAll(runSpecialists(pipeline.specialists()));
        results.add(runStage(pipeline.aggregate()));
        results.add(runStage(pipeline.ensemble()));
        return results;
    }

    private List<StageResult> runSpecialists(List<StageDefinition> specialists) {
        if (specialistParallelism <= 1 || specialists.size() <= 1) {
            List<StageResult> results = new ArrayList<>();
            for (StageDefinition specialist : specialists) {
                results.add(runStage(specialist));
            }
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(specialistParallelism, specialists.size()));
        try {
            List<Future<StageResult>> futures = new ArrayList<>();
            for (StageDefinition specialist : specialists) {
                futures.add(executor.submit(() -> runStage(specialist)));
            }
            List<StageResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), specialists.get(i)));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private StageResult await(Future<StageResult> future, StageDefinition stage) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("stage.unexpected-failure name={}", stage.name(), e.getCause());
            return new StageResult(stage.name(), stage.kind(), StageStatus.FAILED, -1, null,
                    Duration.ZERO, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new StageResult(stage.name(), stage.kind(), StageStatus.INTERRUPTED, StageRunner.INTERRUPTED_EXIT_CODE,
                    null, Duration.ZERO, "");
        }
    }

    private StageResult runStage(StageDefinition stage) {
        StageResult result = stageRunner.run(stage);
        if (result.success()) {
            audit.record(String.format(Locale.ROOT, "  Stage %s succeeded (metric %s, %.1fs)",
                    stage.name(), formatMetric(result), seconds(result)));
        } else {
            audit.record(String.format(Locale.ROOT, "  Stage %s %s (exit %d, %.1fs)",
                    stage.name(), result.status(), result.exitCode(), seconds(result)));
        }
        return result;
    }

    private void summarize(TrainingRun run) {
        audit.record(String.format(Locale.ROOT, "Training run %s in %.1fs (backup %s)",
                run.disposition(), run.elapsed().toMillis() / 1000.0, run.backupVersion()));
        for (StageResult result : run.stages()) {
            if (result.success()) {
                audit.record(String.format(Locale.ROOT, "  %-25s metric=%-8s (%.1fs)",
                        result.stageName(), formatMetric(result), seconds(result)));
            } else {
                audit.record(String.format(Locale.ROOT, "  %-25s FAILED (%s)", result.stageName(), result.status()));
            }
        }
    }

    private TrainingRun finish(TrainingRun run) {
        try {
            runLog.append(run);
        } catch (IOException e) {
            log.warn("orchestrator.run-log.failed path={} reason={}", runLog.path(), e.getMessage());
        }
        log.info("orchestrator.run.finished disposition={} backup={} elapsedMs={}",
                run.disposition(), run.backupVersion(), run.elapsed().toMillis());
        return run;
    }

    private static String formatMetric(StageResult result) {
        return result.metric() == null ? "N/A" : String.format(Locale.ROOT, "%.2f", result.metric());
    }

    private static double seconds(StageResult result) {
        return result.elapsed() == null ? 0.0 : result.elapsed().toMillis() / 1000.0;
    }

    public PipelineDefinition pipeline() {
        return pipeline;
    }
}
