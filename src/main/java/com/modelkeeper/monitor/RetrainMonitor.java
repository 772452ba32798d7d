package com.modelkeeper.monitor;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelkeeper.gate.TrainingDataGate;
import com.modelkeeper.pipeline.RollbackException;
import com.modelkeeper.pipeline.TrainingOrchestrator;
import com.modelkeeper.pipeline.TrainingRun;
import com.modelkeeper.runtime.AuditTrail;

/**
 * Poll loop: check the gate, train when enough new data arrived, sleep, repeat. One run at a time.
 * A stop request lets the current cycle finish; the pid file is removed on the way out.
 */
public class RetrainMonitor {
    private static final Logger log = LoggerFactory.getLogger(RetrainMonitor.class);

    private final TrainingDataGate gate;
    private final TrainingOrchestrator orchestrator;
    private final Settings settings;
    private final PidFile pidFile;
    private final AuditTrail audit;
    private final FatalAlertNotifier alertNotifier;
    private final long pid;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch wakeUp = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);

    public record Settings(Duration interval, double minQualityScore, int minNewRecords, int maxCycles) {
        public Settings {
            if (interval == null || interval.isNegative()) {
                throw new IllegalArgumentException("interval must be >= 0");
            }
            if (minNewRecords < 1) {
                throw new IllegalArgumentException("minNewRecords must be >= 1");
            }
            if (maxCycles < 0) {
                throw new IllegalArgumentException("maxCycles must be >= 0");
            }
        }
    }

    public RetrainMonitor(
            TrainingDataGate gate,
            TrainingOrchestrator orchestrator,
            Settings settings,
            PidFile pidFile,
            AuditTrail audit,
            FatalAlertNotifier alertNotifier) {
        this(gate, orchestrator, settings, pidFile, audit, alertNotifier, ProcessHandle.current().pid());
    }

    RetrainMonitor(
            TrainingDataGate gate,
            TrainingOrchestrator orchestrator,
            Settings settings,
            PidFile pidFile,
            AuditTrail audit,
            FatalAlertNotifier alertNotifier,
            long pid) {
        this.gate = gate;
        this.orchestrator = orchestrator;
        this.settings = settings;
        this.pidFile = pidFile;
        this.audit = audit;
        this.alertNotifier = alertNotifier;
        this.pid = pid;
    }

    /**
     * Runs until stopped or until {@code maxCycles} cycles completed.
     *
     * @throws SingleInstanceViolationException when another live monitor owns the pid file
     * @throws RollbackException when a failed run could not be rolled back; the loop halts
     */
    public MonitorSummary run() throws SingleInstanceViolationException, IOException {
        pidFile.acquire(pid);
        audit.blankLine();
        audit.record(String.format(Locale.ROOT,
                "Retrain monitor started (pid %d, interval %ds, min quality %.2f, min new records %d)",
                pid, settings.interval().toSeconds(), settings.minQualityScore(), settings.minNewRecords()));

        int cycles = 0;
        int triggered = 0;
        int committed = 0;
        int failed = 0;
        try {
            while (!stopRequested.get()) {
                if (settings.maxCycles() > 0 && cycles >= settings.maxCycles()) {
                    log.info("monitor.stop reason=max-cycles cycles={}", cycles);
                    break;
                }
                cycles++;
                try {
                    TrainingRun run = runCycle(cycles);
                    if (run != null) {
                        triggered++;
                        if (run.committed()) {
                            committed++;
                        }
                    }
                } catch (RollbackException e) {
                    audit.record("FATAL: monitor halted after failed rollback: " + e.getMessage());
                    alertNotifier.rollbackFailed(e);
                    throw e;
                } catch (Exception e) {
                    failed++;
                    log.error("monitor.cycle.failed cycle={} reason={}", cycles, e.getMessage(), e);
                    audit.record("Cycle " + cycles + " failed: " + e.getMessage());
                }

                if (stopRequested.get() || (settings.maxCycles() > 0 && cycles >= settings.maxCycles())) {
                    continue;
                }
                sleep();
            }
        } finally {
            pidFile.release(pid);
            audit.record(String.format(Locale.ROOT,
                    "Retrain monitor stopped after %d cycles (%d runs, %d committed)", cycles, triggered, committed));
            finished.countDown();
        }
        return new MonitorSummary(cycles, triggered, committed, failed, stopRequested.get());
    }

    /**
     * Returns the run this cycle triggered, or null when the gate kept it idle.
     */
    TrainingRun runCycle(int cycle) throws IOException {
        int newRecords = gate.countNew(settings.minQualityScore());
        if (newRecords < settings.minNewRecords()) {
            log.info("monitor.cycle.idle cycle={} newRecords={} required={}", cycle, newRecords, settings.minNewRecords());
            audit.record("Found " + newRecords + " new training records (need " + settings.minNewRecords() + "); waiting");
            return null;
        }

        audit.record("Found " + newRecords + " new training records; starting retraining");
        TrainingRun run = orchestrator.run(gate::markConsumed);
        audit.record(String.format(Locale.ROOT, "Retraining %s (backup %s, %.1fs)%s",
                run.disposition(), run.backupVersion(), run.elapsed().toMillis() / 1000.0,
                run.notes() == null ? "" : " - " + run.notes()));
        log.info("monitor.cycle.trained cycle={} disposition={} backup={} elapsedMs={}",
                cycle, run.disposition(), run.backupVersion(), run.elapsed().toMillis());
        return run;
    }

    private void sleep() {
        try {
            if (wakeUp.await(settings.interval().toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("monitor.sleep.interrupted-by-stop");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested.set(true);
        }
    }

    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.info("monitor.stop.requested pid={}", pid);
            audit.record("Received shutdown signal; finishing current cycle");
        }
        wakeUp.countDown();
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Blocks until {@link #run()} has returned and cleaned up.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Turns SIGTERM and SIGINT into a graceful stop. The hook waits for the in-flight cycle,
     * bounded by {@code maxWait}.
     */
    public Thread installShutdownHook(Duration maxWait) {
        Thread hook = new Thread(() -> {
            requestStop();
            try {
                if (!awaitTermination(maxWait)) {
                    log.warn("monitor.shutdown.timeout waitedMs={}", maxWait.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "retrain-monitor-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }
}
