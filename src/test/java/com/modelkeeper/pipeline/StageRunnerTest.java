package com.modelkeeper.pipeline;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageRunnerTest {
    private static final StageDefinition STAGE = new StageDefinition(
            "main_model", StageKind.MAIN, List.of("python3", "train.py"), List.of("price_v1.pkl"));

    @Test
    void shouldExtractMetricFromSuccessfulStage() {
        StageRunner runner = runner(Duration.ofSeconds(1), 8192,
                (workingDirectory, command) -> new FakeProcess(0, true, "Loading 812 books\nTest MAE: $2.45\nSaved model\n"));

        StageResult result = runner.run(STAGE);

        assertTrue(result.success());
        assertEquals(StageStatus.SUCCEEDED, result.status());
        assertEquals(2.45, result.metric(), 1e-9);
        assertTrue(result.output().contains("Saved model"));
    }

    @Test
    void shouldReportFailureForNonZeroExitWithoutMetric() {
        StageRunner runner = runner(Duration.ofSeconds(1), 8192,
                (workingDirectory, command) -> new FakeProcess(3, true, "Traceback: no training data"));

        StageResult result = runner.run(STAGE);

        assertFalse(result.success());
        assertEquals(StageStatus.FAILED, result.status());
        assertEquals(3, result.exitCode());
        assertNull(result.metric());
    }

    @Test
    void shouldMarkTimedOutAndDestroyProcess() {
        FakeProcess process = new FakeProcess(0, false, "still training");
        StageRunner runner = runner(Duration.ofMillis(5), 8192, (workingDirectory, command) -> process);

        StageResult result = runner.run(STAGE);

        assertEquals(StageStatus.TIMED_OUT, result.status());
        assertEquals(StageRunner.TIMEOUT_EXIT_CODE, result.exitCode());
        assertFalse(result.success());
        assertTrue(process.destroyForciblyCalled);
    }

    @Test
    void shouldReportLaunchFailureAsResult() {
        StageRunner runner = runner(Duration.ofSeconds(1), 8192, (workingDirectory, command) -> {
            throw new IOException("python3: not found");
        });

        StageResult result = runner.run(STAGE);

        assertEquals(StageStatus.LAUNCH_FAILED, result.status());
        assertEquals(StageRunner.LAUNCH_FAILURE_EXIT_CODE, result.exitCode());
        assertTrue(result.output().contains("not found"));
    }

    @Test
    void shouldTruncateStoredOutputButExtractMetricFromAll() {
        String output = "MAE: 4.5\n" + "x".repeat(500);
        StageRunner runner = runner(Duration.ofSeconds(1), 50, (workingDirectory, command) -> new FakeProcess(0, true, output));

        StageResult result = runner.run(STAGE);

        assertEquals(4.5, result.metric(), 1e-9);
        assertTrue(result.output().startsWith("[... "));
        assertTrue(result.output().endsWith("x".repeat(50)));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void shouldRunRealChildProcess() {
        StageRunner runner = new StageRunner(Duration.ofSeconds(10), Path.of("."), new MetricExtractor(), 8192);
        StageDefinition stage = new StageDefinition("shell", StageKind.SPECIALIST,
                List.of("sh", "-c", "echo 'Mean Absolute Error: 7.25' 1>&2; exit 0"), List.of());

        StageResult result = runner.run(stage);

        assertTrue(result.success());
        assertEquals(7.25, result.metric(), 1e-9);
    }

    private static StageRunner runner(Duration timeout, int maxChars, StageRunner.ProcessStarter starter) {
        return new StageRunner(timeout, Path.of("."), new MetricExtractor(), maxChars, starter);
    }

    private static class FakeProcess extends Process {
        private final int exitCode;
        private final boolean waitFinished;
        private final InputStream stdout;

        private boolean destroyForciblyCalled;

        private FakeProcess(int exitCode, boolean waitFinished, String stdout) {
            this.exitCode = exitCode;
            this.waitFinished = waitFinished;
            this.stdout = new ByteArrayInputStream(stdout.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public OutputStream getOutputStream() {
            return OutputStream.nullOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return stdout;
        }

        @Override
        public InputStream getErrorStream() {
            return InputStream.nullInputStream();
        }

        @Override
        public int waitFor() {
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) {
            return waitFinished;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            // no-op
        }

        @Override
        public Process destroyForcibly() {
            destroyForciblyCalled = true;
            return this;
        }

        @Override
        public boolean isAlive() {
            return !waitFinished;
        }
    }
}
