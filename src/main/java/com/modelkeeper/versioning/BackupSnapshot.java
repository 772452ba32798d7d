package com.modelkeeper.versioning;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * One immutable backup of the production artifact set, as reported by {@link ArtifactStore#list()}.
 *
 * @param metrics the snapshot's metadata record ({@code test_mae}, {@code train_date}, ...), empty when absent
 */
public record BackupSnapshot(
        String versionId,
        LocalDateTime createdAt,
        long sizeBytes,
        String reason,
        Path path,
        Map<String, Object> metrics) {

    public BackupSnapshot {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public Object metric(String key) {
        return metrics.get(key);
    }
}
