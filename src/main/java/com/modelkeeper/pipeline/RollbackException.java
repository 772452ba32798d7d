package com.modelkeeper.pipeline;

import java.util.List;

/**
 * Validation failed and restoring the pre-run backup failed too. Production is in an unknown
 * state and needs a human.
 */
public class RollbackException extends RuntimeException {
    private final String backupVersion;
    private final List<StageResult> stages;
    private final ValidationResult validation;

    public RollbackException(String backupVersion, List<StageResult> stages, ValidationResult validation, Throwable cause) {
        super("Rollback to backup " + backupVersion + " failed: " + (cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.backupVersion = backupVersion;
        this.stages = stages == null ? List.of() : List.copyOf(stages);
        this.validation = validation;
    }

    public String backupVersion() {
        return backupVersion;
    }

    public List<StageResult> stages() {
        return stages;
    }

    public ValidationResult validation() {
        return validation;
    }
}
