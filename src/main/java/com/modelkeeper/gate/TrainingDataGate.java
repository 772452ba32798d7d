package com.modelkeeper.gate;

import java.io.IOException;
import java.time.Instant;

/**
 * Decides whether enough new training data has arrived to justify a retraining run. The gate owns
 * its cursor; callers only ask for counts and advance it after a committed run.
 */
public interface TrainingDataGate {

    /**
     * Counts qualifying records added since the cursor.
     */
    int countNew(double minQualityScore) throws IOException;

    void markConsumed(Instant now) throws IOException;

    TrainingStatistics statistics() throws IOException;
}
