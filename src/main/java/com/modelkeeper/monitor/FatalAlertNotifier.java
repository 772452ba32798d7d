package com.modelkeeper.monitor;

import com.modelkeeper.pipeline.RollbackException;

/**
 * Tells an operator that production artifacts are in an unknown state.
 */
@FunctionalInterface
public interface FatalAlertNotifier {
    FatalAlertNotifier NONE = failure -> {
    };

    void rollbackFailed(RollbackException failure);
}
