package com.modelkeeper.runtime;

/**
 * Human-readable, append-only record of everything the lifecycle manager decided: snapshots,
 * restores, retention sweeps, stage outcomes, run dispositions and monitor cycles.
 */
@FunctionalInterface
public interface AuditTrail {

    void record(String message);

    default void blankLine() {
        record("");
    }
}
