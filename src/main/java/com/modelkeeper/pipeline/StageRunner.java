package com.modelkeeper.pipeline;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a single stage as a child process with a timeout. Every outcome, including a timeout or a
 * launch failure, comes back as a {@link StageResult}; nothing here throws.
 */
public class StageRunner {
    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    static final int TIMEOUT_EXIT_CODE = 124;
    static final int INTERRUPTED_EXIT_CODE = 130;
    static final int LAUNCH_FAILURE_EXIT_CODE = 127;
    private static final long OUTPUT_DRAIN_SECONDS = 5;

    private final Duration timeout;
    private final Path workingDirectory;
    private final MetricExtractor metricExtractor;
    private final int maxCapturedOutputChars;
    private final ProcessStarter processStarter;

    public StageRunner(Duration timeout, Path workingDirectory, MetricExtractor metricExtractor, int maxCapturedOutputChars) {
        this(timeout, workingDirectory, metricExtractor, maxCapturedOutputChars, new DefaultProcessStarter());
    }

    StageRunner(
            Duration timeout,
            Path workingDirectory,
            MetricExtractor metricExtractor,
            int maxCapturedOutputChars,
            ProcessStarter processStarter) {
        this.timeout = timeout;
        this.workingDirectory = workingDirectory;
        this.metricExtractor = metricExtractor;
        this.maxCapturedOutputChars = maxCapturedOutputChars;
        this.processStarter = processStarter;
    }

    public StageResult run(StageDefinition stage) {
        long startedAt = System.nanoTime();
        log.debug("stage.start name={} command={}", stage.name(), stage.command());

        Process process;
        try {
            process = processStarter.start(workingDirectory, stage.command());
        } catch (IOException e) {
            log.warn("stage.launch.failed name={} reason={}", stage.name(), e.getMessage());
            return result(stage, StageStatus.LAUNCH_FAILED, LAUNCH_FAILURE_EXIT_CODE, String.valueOf(e.getMessage()), startedAt);
        }

        CompletableFuture<String> output = readStream(process.getInputStream());

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("stage.timeout name={} timeoutMs={}", stage.name(), timeout.toMillis());
                terminate(process);
                return result(stage, StageStatus.TIMED_OUT, TIMEOUT_EXIT_CODE, drain(output), startedAt);
            }

            int exitCode = process.exitValue();
            StageStatus status = exitCode == 0 ? StageStatus.SUCCEEDED : StageStatus.FAILED;
            return result(stage, status, exitCode, drain(output), startedAt);
        } catch (InterruptedException e) {
            terminate(process);
            Thread.currentThread().interrupt();
            return result(stage, StageStatus.INTERRUPTED, INTERRUPTED_EXIT_CODE, "", startedAt);
        }
    }

    private StageResult result(StageDefinition stage, StageStatus status, int exitCode, String output, long startedAt) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        Double metric = null;
        var extracted = metricExtractor.extract(output);
        if (extracted.isPresent()) {
            metric = extracted.getAsDouble();
        }
        return new StageResult(stage.name(), stage.kind(), status, exitCode, metric, elapsed, truncate(output));
    }

    String truncate(String output) {
        if (output == null) {
            return "";
        }
        if (maxCapturedOutputChars <= 0 || output.length() <= maxCapturedOutputChars) {
            return output;
        }
        int dropped = output.length() - maxCapturedOutputChars;
        return "[... " + dropped + " chars truncated ...]\n" + output.substring(dropped);
    }

    private void terminate(Process process) {
        try {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
        } catch (UnsupportedOperationException e) {
            log.debug("stage.descendants.unsupported process={}", process.getClass().getSimpleName());
        }
        process.destroyForcibly();
    }

    private String drain(CompletableFuture<String> output) {
        try {
            return output.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException | ExecutionException e) {
            log.debug("stage.output.unavailable reason={}", e.toString());
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        }
    }

    private CompletableFuture<String> readStream(InputStream inputStream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = inputStream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                return "";
            }
        });
    }

    interface ProcessStarter {
        Process start(Path workingDirectory, List<String> command) throws IOException;
    }

    private static final class DefaultProcessStarter implements ProcessStarter {
        @Override
        public Process start(Path workingDirectory, List<String> command) throws IOException {
            return new ProcessBuilder(command)
                    .directory(workingDirectory == null ? null : workingDirectory.toFile())
                    .redirectErrorStream(true)
                    .start();
        }
    }

    @Override
    public String toString() {
        return "StageRunner{" +
                "timeout=" + timeout +
                ", workingDirectory=" + workingDirectory +
                ", processStarter=" + processStarter.getClass().getSimpleName() +
                '}';
    }
}
