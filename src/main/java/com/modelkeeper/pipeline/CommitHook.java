package com.modelkeeper.pipeline;

import java.io.IOException;
import java.time.Instant;

/**
 * Called once a run has been validated, before the run is reported as committed.
 */
@FunctionalInterface
public interface CommitHook {
    CommitHook NONE = committedAt -> {
    };

    void onCommit(Instant committedAt) throws IOException;
}
