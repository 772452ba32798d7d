package com.modelkeeper.pipeline;

import java.time.Duration;
import java.util.OptionalDouble;

/**
 * Outcome of one stage. {@code metric} is {@code null} when no accepted pattern matched the
 * output, which is not the same as a metric of zero.
 */
public record StageResult(
        String stageName,
        StageKind kind,
        StageStatus status,
        int exitCode,
        Double metric,
        Duration elapsed,
        String output) {

    public boolean success() {
        return status == StageStatus.SUCCEEDED;
    }

    public OptionalDouble metricValue() {
        return metric == null ? OptionalDouble.empty() : OptionalDouble.of(metric);
    }
}
