package com.modelkeeper.versioning;

import java.time.LocalDateTime;
import java.util.List;

public record SnapshotManifest(
        String versionId,
        String reason,
        LocalDateTime createdAt,
        List<String> files,
        long totalBytes) {

    public SnapshotManifest {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
