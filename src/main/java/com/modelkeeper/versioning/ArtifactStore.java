package com.modelkeeper.versioning;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.modelkeeper.runtime.AuditTrail;

/**
 * Production model directory plus timestamped backup snapshots of it.
 *
 * <p>Snapshots are staged under a hidden directory and moved into place only once every file has
 * been copied, so a failed snapshot never leaves a partial {@code v_<id>} directory behind. The
 * backup directory may live inside the production directory; that subtree is never treated as part
 * of the artifact set.
 */
public class ArtifactStore {
    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    public static final String VERSION_PREFIX = "v_";
    public static final String MANIFEST_FILE = ".snapshot.json";
    static final DateTimeFormatter VERSION_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String STAGING_PREFIX = ".staging-";

    /**
     * Oldest first: by the timestamp part of the id, then by the numeric same-second suffix
     * ({@code _2}, {@code _3}, ... {@code _10}).
     */
    public static final Comparator<String> VERSION_ORDER = Comparator.<String, String>comparing(ArtifactStore::timestampPart)
            .thenComparingInt(ArtifactStore::suffixPart)
            .thenComparing(Comparator.naturalOrder());

    private final Path productionDir;
    private final Path backupDir;
    private final String metadataFile;
    private final RetentionPolicy retentionPolicy;
    private final Clock clock;
    private final AuditTrail audit;
    private final FileCopier copier;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public ArtifactStore(Path productionDir, Path backupDir, String metadataFile, RetentionPolicy retentionPolicy, AuditTrail audit) {
        this(productionDir, backupDir, metadataFile, retentionPolicy, audit, Clock.systemDefaultZone());
    }

    public ArtifactStore(
            Path productionDir,
            Path backupDir,
            String metadataFile,
            RetentionPolicy retentionPolicy,
            AuditTrail audit,
            Clock clock) {
        this(productionDir, backupDir, metadataFile, retentionPolicy, audit, clock,
                (source, target) -> Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES));
    }

    ArtifactStore(
            Path productionDir,
            Path backupDir,
            String metadataFile,
            RetentionPolicy retentionPolicy,
            AuditTrail audit,
            Clock clock,
            FileCopier copier) {
        this.productionDir = productionDir.toAbsolutePath().normalize();
        this.backupDir = backupDir.toAbsolutePath().normalize();
        this.metadataFile = metadataFile;
        this.retentionPolicy = retentionPolicy;
        this.audit = audit;
        this.clock = clock;
        this.copier = copier;
    }

    public Path productionDir() {
        return productionDir;
    }

    public Path backupDir() {
        return backupDir;
    }

    public String snapshot(String reason) throws StorageException {
        if (!Files.isDirectory(productionDir) || !Files.isReadable(productionDir)) {
            throw new StorageException("Production artifact directory missing or unreadable: " + productionDir);
        }

        LocalDateTime createdAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        String versionId;
        Path staging;
        List<Path> files;
        try {
            Files.createDirectories(backupDir);
            versionId = nextVersionId(createdAt);
            staging = backupDir.resolve(STAGING_PREFIX + VERSION_PREFIX + versionId);
            files = productionFiles();
        } catch (IOException e) {
            throw new StorageException("Unable to prepare snapshot of " + productionDir, e);
        }

        long totalBytes = 0;
        try {
            Files.createDirectories(staging);
            for (Path relative : files) {
                Path target = staging.resolve(relative);
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                copier.copy(productionDir.resolve(relative), target);
                totalBytes += Files.size(target);
            }
            SnapshotManifest manifest = new SnapshotManifest(
                    versionId,
                    reason,
                    createdAt,
                    files.stream().map(ArtifactStore::portable).toList(),
                    totalBytes);
            mapper.writerWithDefaultPrettyPrinter().writeValue(staging.resolve(MANIFEST_FILE).toFile(), manifest);
            moveIntoPlace(staging, snapshotDirectory(versionId));
        } catch (IOException e) {
            discard(staging);
            throw new StorageException("Snapshot of " + productionDir + " failed; partial backup discarded", e);
        }

        audit.record(String.format("Backed up %d files (%d bytes) to %s%s (reason: %s)",
                files.size(), totalBytes, VERSION_PREFIX, versionId, reason));
        collectGarbage();
        return versionId;
    }

    public void restore(String versionId) throws StorageException {
        Path snapshotDir = snapshotDirectory(versionId);
        if (versionId == null || versionId.isBlank() || !Files.isDirectory(snapshotDir)) {
            throw new VersionNotFoundException(versionId);
        }

        int restored = 0;
        int removed = 0;
        try {
            List<Path> snapshotFiles = snapshotFiles(snapshotDir);
            Files.createDirectories(productionDir);
            for (Path relative : snapshotFiles) {
                Path target = productionDir.resolve(relative);
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                Files.copy(snapshotDir.resolve(relative), target,
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                restored++;
            }
            Set<Path> wanted = new HashSet<>(snapshotFiles);
            for (Path relative : productionFiles()) {
                if (!wanted.contains(relative)) {
                    Files.deleteIfExists(productionDir.resolve(relative));
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new StorageException("Restore of " + VERSION_PREFIX + versionId + " failed after " + restored + " files", e);
        }
        audit.record("Restored " + restored + " files from backup " + VERSION_PREFIX + versionId
                + (removed > 0 ? " (removed " + removed + " files not in the backup)" : ""));
    }

    public List<BackupSnapshot> list() throws StorageException {
        List<BackupSnapshot> snapshots = new ArrayList<>();
        for (Path dir : versionDirectories()) {
            String versionId = dir.getFileName().toString().substring(VERSION_PREFIX.length());
            SnapshotManifest manifest = readManifest(dir);
            long size;
            try {
                size = sizeOf(dir);
            } catch (IOException e) {
                throw new StorageException("Unable to size backup " + dir, e);
            }
            snapshots.add(new BackupSnapshot(
                    versionId,
                    manifest != null && manifest.createdAt() != null ? manifest.createdAt() : createdAt(dir),
                    size,
                    manifest == null ? null : manifest.reason(),
                    dir,
                    readMetrics(dir.resolve(metadataFile))));
        }
        snapshots.sort(Comparator.comparing(BackupSnapshot::createdAt)
                .thenComparing(BackupSnapshot::versionId, VERSION_ORDER)
                .reversed());
        return snapshots;
    }

    /**
     * Applies the retention policy to every existing backup and returns the deleted version ids.
     */
    public List<String> collectGarbage() {
        List<Path> dirs;
        try {
            dirs = versionDirectories();
        } catch (StorageException e) {
            log.warn("retention.sweep.skipped reason={}", e.getMessage());
            return List.of();
        }

        Map<String, LocalDateTime> backups = new LinkedHashMap<>();
        for (Path dir : dirs) {
            backups.put(dir.getFileName().toString().substring(VERSION_PREFIX.length()), createdAt(dir));
        }
        LocalDateTime now = LocalDateTime.now(clock);
        List<String> deleted = new ArrayList<>();
        for (String versionId : retentionPolicy.expired(backups, now)) {
            try {
                deleteRecursively(snapshotDirectory(versionId));
                deleted.add(versionId);
            } catch (IOException e) {
                log.warn("retention.delete.failed version={} reason={}", versionId, e.getMessage());
            }
        }
        if (!deleted.isEmpty()) {
            deleted.sort(Comparator.naturalOrder());
            audit.record("Retention sweep removed " + deleted.size() + " old backups (keeping "
                    + (backups.size() - deleted.size()) + "): " + String.join(", ", deleted));
        }
        return deleted;
    }

    public Path snapshotDirectory(String versionId) {
        return backupDir.resolve(VERSION_PREFIX + versionId);
    }

    /**
     * Files of the production artifact set, relative to the production directory, in stable order.
     */
    public List<Path> productionFiles() throws IOException {
        if (!Files.isDirectory(productionDir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.walk(productionDir)) {
            return stream
                    .filter(path -> !path.startsWith(backupDir))
                    .filter(Files::isRegularFile)
                    .map(productionDir::relativize)
                    .sorted()
                    .toList();
        }
    }

    /**
     * True when any production file was modified after {@code since}.
     */
    public boolean changedSince(Instant since) throws IOException {
        for (Path relative : productionFiles()) {
            if (Files.getLastModifiedTime(productionDir.resolve(relative)).toInstant().isAfter(since)) {
                return true;
            }
        }
        return false;
    }

    private List<Path> snapshotFiles(Path snapshotDir) throws IOException {
        try (Stream<Path> stream = Files.walk(snapshotDir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .map(snapshotDir::relativize)
                    .filter(relative -> !relative.toString().equals(MANIFEST_FILE))
                    .sorted()
                    .toList();
        }
    }

    private List<Path> versionDirectories() throws StorageException {
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(backupDir)) {
            return stream
                    .filter(Files::isDirectory)
                    .filter(dir -> dir.getFileName().toString().startsWith(VERSION_PREFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Unable to list backups in " + backupDir, e);
        }
    }

    private String nextVersionId(LocalDateTime createdAt) {
        String base = VERSION_FORMAT.format(createdAt);
        String candidate = base;
        int suffix = 2;
        while (Files.exists(snapshotDirectory(candidate))) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    LocalDateTime createdAt(Path versionDir) {
        String versionId = versionDir.getFileName().toString().substring(VERSION_PREFIX.length());
        String stamp = versionId.length() >= 15 ? versionId.substring(0, 15) : versionId;
        try {
            return LocalDateTime.parse(stamp, VERSION_FORMAT);
        } catch (DateTimeParseException e) {
            log.debug("version.timestamp.unparseable version={} falling back to mtime", versionId);
            try {
                return LocalDateTime.ofInstant(Files.getLastModifiedTime(versionDir).toInstant(), clock.getZone());
            } catch (IOException io) {
                return LocalDateTime.now(clock);
            }
        }
    }

    private SnapshotManifest readManifest(Path dir) {
        Path manifest = dir.resolve(MANIFEST_FILE);
        if (!Files.exists(manifest)) {
            return null;
        }
        try {
            return mapper.readValue(manifest.toFile(), SnapshotManifest.class);
        } catch (IOException e) {
            log.warn("snapshot.manifest.unreadable path={} reason={}", manifest, e.getMessage());
            return null;
        }
    }

    private Map<String, Object> readMetrics(Path metadataPath) {
        if (!Files.exists(metadataPath)) {
            return Map.of();
        }
        try {
            Map<String, Object> metadata = mapper.readValue(metadataPath.toFile(), new TypeReference<Map<String, Object>>() {
            });
            Map<String, Object> metrics = new LinkedHashMap<>();
            metadata.forEach((key, value) -> {
                if (value != null) {
                    metrics.put(key, value);
                }
            });
            return metrics;
        } catch (IOException e) {
            log.warn("snapshot.metadata.unreadable path={} reason={}", metadataPath, e.getMessage());
            return Map.of();
        }
    }

    private void moveIntoPlace(Path staging, Path target) throws IOException {
        try {
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(staging, target);
        }
    }

    private void discard(Path staging) {
        try {
            deleteRecursively(staging);
        } catch (IOException e) {
            log.error("snapshot.staging.cleanup.failed path={} reason={}", staging, e.getMessage());
        }
    }

    private static long sizeOf(Path dir) throws IOException {
        try (Stream<Path> stream = Files.walk(dir)) {
            long total = 0;
            for (Path path : stream.filter(Files::isRegularFile).toList()) {
                if (!path.getFileName().toString().equals(MANIFEST_FILE)) {
                    total += Files.size(path);
                }
            }
            return total;
        }
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(root)) {
            for (Path path : stream.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static String timestampPart(String versionId) {
        return versionId.length() > 15 ? versionId.substring(0, 15) : versionId;
    }

    private static int suffixPart(String versionId) {
        if (versionId.length() <= 16 || versionId.charAt(15) != '_') {
            return 1;
        }
        try {
            return Integer.parseInt(versionId.substring(16));
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private static String portable(Path relative) {
        return relative.toString().replace('\\', '/');
    }

    @FunctionalInterface
    interface FileCopier {
        void copy(Path source, Path target) throws IOException;
    }
}
