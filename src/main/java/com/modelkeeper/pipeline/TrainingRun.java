package com.modelkeeper.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One orchestration attempt, immutable once its disposition is known.
 *
 * @param backupVersion the snapshot taken before any stage ran, {@code null} when that snapshot failed
 * @param validation    {@code null} when the run never reached validation
 * @param notes         free-form detail such as the backup error or a gate cursor warning
 */
public record TrainingRun(
        Instant startedAt,
        Instant finishedAt,
        String backupVersion,
        List<StageResult> stages,
        ValidationResult validation,
        Disposition disposition,
        String notes) {

    public TrainingRun {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public boolean committed() {
        return disposition == Disposition.COMMITTED;
    }
}
