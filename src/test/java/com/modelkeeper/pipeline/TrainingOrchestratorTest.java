package com.modelkeeper.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.modelkeeper.versioning.ArtifactStore;
import com.modelkeeper.versioning.RetentionPolicy;
import com.modelkeeper.versioning.StorageException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrainingOrchestratorTest {
    private static final List<String> BASE_LAYOUT = List.of("price_v1.pkl", "scaler_v1.pkl", "metadata.json");

    @TempDir
    Path tempDir;

    private Path production;
    private Path backups;
    private final List<String> audit = new ArrayList<>();
    private final PipelineDefinition pipeline = new PipelineDefinition(
            stage("main_model", StageKind.MAIN, "price_v1.pkl", "scaler_v1.pkl", "metadata.json"),
            List.of(
                    stage("specialist_ebay", StageKind.SPECIALIST, "stacking/ebay_model.pkl"),
                    stage("specialist_amazon", StageKind.SPECIALIST, "stacking/amazon_model.pkl"),
                    stage("specialist_biblio", StageKind.SPECIALIST, "stacking/biblio_model.pkl")),
            stage("lot_model", StageKind.AGGREGATE, "stacking/lot_model.pkl"),
            stage("meta_model", StageKind.ENSEMBLE, "stacking/meta_model.pkl"));

    @BeforeEach
    void setUp() throws IOException {
        production = tempDir.resolve("models");
        backups = tempDir.resolve("backups");
        for (String file : pipeline.requiredArtifacts(BASE_LAYOUT)) {
            Path target = production.resolve(file);
            Files.createDirectories(target.getParent());
            Files.writeString(target, "generation-1 " + file);
        }
    }

    @Test
    void shouldCommitWhenEveryStageSucceedsUnderCeiling() throws IOException {
        List<Instant> commits = new ArrayList<>();
        TrainingOrchestrator orchestrator = orchestrator(store(), new ScriptedRunner(Map.of("main_model", 3.1)), 1);

        TrainingRun run = orchestrator.run(commits::add);

        assertEquals(Disposition.COMMITTED, run.disposition());
        assertNotNull(run.backupVersion());
        assertEquals(1, commits.size());
        assertEquals(6, run.stages().size());
        assertEquals("generation-2 price_v1.pkl", Files.readString(production.resolve("price_v1.pkl")));
        assertEquals(1, new TrainingRunLog(backups.resolve("training-runs.jsonl")).readAll().size());
        assertTrue(audit.stream().anyMatch(line -> line.contains("committed")));
    }

    @Test
    void shouldRollBackToByteIdenticalBackupWhenSpecialistFails() throws IOException {
        List<Instant> commits = new ArrayList<>();
        ScriptedRunner runner = new ScriptedRunner(Map.of("main_model", 2.0));
        runner.failing.add("specialist_amazon");
        ArtifactStore store = store();
        TrainingOrchestrator orchestrator = orchestrator(store, runner, 1);

        TrainingRun run = orchestrator.run(commits::add);

        assertEquals(Disposition.ROLLED_BACK, run.disposition());
        assertTrue(commits.isEmpty());
        assertTrue(run.stages().stream().anyMatch(result -> !result.success()));
        assertTrue(run.validation().violations().stream().anyMatch(v -> v.contains("specialist_amazon")));
        assertSameContents(store.snapshotDirectory(run.backupVersion()), production);
    }

    @Test
    void shouldNeverCommitWhenAnyStageFails() {
        for (String failing : List.of("main_model", "specialist_ebay", "lot_model", "meta_model")) {
            ScriptedRunner runner = new ScriptedRunner(Map.of("main_model", 1.0));
            runner.failing.add(failing);

            TrainingRun run = orchestrator(store(), runner, 1).run();

            assertEquals(Disposition.ROLLED_BACK, run.disposition(), failing);
        }
    }

    @Test
    void shouldRollBackWhenMainMetricExceedsCeiling() throws IOException {
        ArtifactStore store = store();
        TrainingOrchestrator orchestrator = orchestrator(store, new ScriptedRunner(Map.of("main_model", 12.0)), 1);

        TrainingRun run = orchestrator.run();

        assertEquals(Disposition.ROLLED_BACK, run.disposition());
        assertTrue(run.stages().stream().allMatch(StageResult::success));
        assertTrue(run.validation().violations().stream().anyMatch(v -> v.contains("too high")));
        assertSameContents(store.snapshotDirectory(run.backupVersion()), production);
    }

    @Test
    void shouldRollBackWhenRequiredArtifactMissing() throws IOException {
        ScriptedRunner runner = new ScriptedRunner(Map.of("main_model", 2.0));
        runner.deleting.add("stacking/lot_model.pkl");

        TrainingRun run = orchestrator(store(), runner, 1).run();

        assertEquals(Disposition.ROLLED_BACK, run.disposition());
        assertTrue(run.validation().violations().contains("Missing required file: stacking/lot_model.pkl"));
        assertTrue(Files.exists(production.resolve("stacking/lot_model.pkl")));
    }

    @Test
    void shouldNotRunStagesWhenBackupFails() throws IOException {
        ScriptedRunner runner = new ScriptedRunner(Map.of("main_model", 2.0));
        ArtifactStore missing = new ArtifactStore(tempDir.resolve("nowhere"), backups, "metadata.json",
                RetentionPolicy.defaults(), audit::add);

        TrainingRun run = orchestrator(missing, runner, 1).run();

        assertEquals(Disposition.FAILED_NO_BACKUP, run.disposition());
        assertNull(run.backupVersion());
        assertEquals(0, runner.invocations.get());
        assertTrue(run.stages().isEmpty());
    }

    @Test
    void shouldEscalateWhenRestoreFails() {
        ArtifactStore brokenRestore = new ArtifactStore(production, backups, "metadata.json",
                RetentionPolicy.defaults(), audit::add) {
            @Override
            public void restore(String versionId) throws StorageException {
                throw new StorageException("disk full");
            }
        };
        ScriptedRunner runner = new ScriptedRunner(Map.of("main_model", 2.0));
        runner.failing.add("meta_model");

        RollbackException error = assertThrows(RollbackException.class,
                () -> orchestrator(brokenRestore, runner, 1).run());

        assertNotNull(error.backupVersion());
        assertTrue(error.getMessage().contains("disk full"));
        assertTrue(audit.stream().anyMatch(line -> line.startsWith("FATAL")));
    }

    @Test
    void shouldKeepCommitWhenCommitHookFails() {
        TrainingRun run = orchestrator(store(), new ScriptedRunner(Map.of("main_model", 2.0)), 1).run(committedAt -> {
            throw new IOException("cursor file read-only");
        });

        assertEquals(Disposition.COMMITTED, run.disposition());
        assertTrue(run.notes().contains("cursor file read-only"));
    }

    @Test
    void shouldRunSpecialistsInParallelPreservingOrder() {
        ScriptedRunner runner = new ScriptedRunner(Map.of("main_model", 2.0));
        runner.delay = Duration.ofMillis(50);
        TrainingOrchestrator orchestrator = orchestrator(store(), runner, 3);

        List<StageResult> results = orchestrator.runStages();

        assertEquals(List.of("main_model", "specialist_ebay", "specialist_amazon", "specialist_biblio", "lot_model", "meta_model"),
                results.stream().map(StageResult::stageName).toList());
        assertTrue(runner.maxConcurrent.get() > 1, "specialists should overlap");
    }

    private TrainingOrchestrator orchestrator(ArtifactStore store, StageRunner runner, int parallelism) {
        return new TrainingOrchestrator(
                store,
                runner,
                pipeline,
                new ArtifactValidator(production, pipeline.requiredArtifacts(BASE_LAYOUT), 10.0),
                parallelism,
                new TrainingRunLog(backups.resolve("training-runs.jsonl")),
                audit::add,
                Clock.systemUTC());
    }

    private ArtifactStore store() {
        return new ArtifactStore(production, backups, "metadata.json", RetentionPolicy.defaults(), audit::add);
    }

    private static StageDefinition stage(String name, StageKind kind, String... artifacts) {
        return new StageDefinition(name, kind, List.of("train", name), List.of(artifacts));
    }

    private static void assertSameContents(Path expectedDir, Path actualDir) throws IOException {
        Map<String, byte[]> expected = contents(expectedDir);
        Map<String, byte[]> actual = contents(actualDir);
        assertEquals(expected.keySet(), actual.keySet());
        for (String file : expected.keySet()) {
            assertArrayEquals(expected.get(file), actual.get(file), file);
        }
    }

    private static Map<String, byte[]> contents(Path dir) throws IOException {
        Map<String, byte[]> contents = new HashMap<>();
        try (Stream<Path> stream = Files.walk(dir)) {
            for (Path path : stream.filter(Files::isRegularFile).toList()) {
                String relative = dir.relativize(path).toString().replace('\\', '/');
                if (!relative.equals(ArtifactStore.MANIFEST_FILE)) {
                    contents.put(relative, Files.readAllBytes(path));
                }
            }
        }
        return contents;
    }

    /**
     * Writes each stage's artifacts as generation 2 and reports a scripted metric.
     */
    private class ScriptedRunner extends StageRunner {
        private final Map<String, Double> metrics;
        private final Set<String> failing = ConcurrentHashMap.newKeySet();
        private final Set<String> deleting = ConcurrentHashMap.newKeySet();
        private final AtomicInteger invocations = new AtomicInteger();
        private final AtomicInteger running = new AtomicInteger();
        private final AtomicInteger maxConcurrent = new AtomicInteger();
        private Duration delay = Duration.ZERO;

        private ScriptedRunner(Map<String, Double> metrics) {
            super(Duration.ofSeconds(1), Path.of("."), new MetricExtractor(), 8192);
            this.metrics = metrics;
        }

        @Override
        public StageResult run(StageDefinition stage) {
            invocations.incrementAndGet();
            maxConcurrent.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                if (!delay.isZero()) {
                    Thread.sleep(delay.toMillis());
                }
                for (String artifact : stage.artifacts()) {
                    Files.writeString(production.resolve(artifact), "generation-2 " + artifact);
                }
                for (String artifact : deleting) {
                    Files.deleteIfExists(production.resolve(artifact));
                }
            } catch (IOException e) {
                throw new IllegalStateException(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                running.decrementAndGet();
            }
            if (failing.contains(stage.name())) {
                return new StageResult(stage.name(), stage.kind(), StageStatus.FAILED, 1, null, Duration.ofMillis(5), "boom");
            }
            Double metric = metrics.get(stage.name());
            return new StageResult(stage.name(), stage.kind(), StageStatus.SUCCEEDED, 0, metric, Duration.ofMillis(5), "ok");
        }
    }
}
