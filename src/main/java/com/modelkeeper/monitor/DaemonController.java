package com.modelkeeper.monitor;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelkeeper.runtime.AuditTrail;
import com.modelkeeper.runtime.FileAuditTrail;

/**
 * Status and stop for a monitor running in another process. Everything goes through the pid
 * file and the log file.
 */
public class DaemonController {
    private static final Logger log = LoggerFactory.getLogger(DaemonController.class);
    private static final Duration KILL_WAIT = Duration.ofSeconds(5);

    private final PidFile pidFile;
    private final Path logFile;
    private final int tailLines;
    private final Duration gracePeriod;
    private final AuditTrail audit;

    public enum StopOutcome {
        NOT_RUNNING,
        STALE_PID_FILE_REMOVED,
        STOPPED,
        KILLED,
        STILL_RUNNING
    }

    public DaemonController(PidFile pidFile, Path logFile, int tailLines, Duration gracePeriod, AuditTrail audit) {
        this.pidFile = pidFile;
        this.logFile = logFile;
        this.tailLines = tailLines;
        this.gracePeriod = gracePeriod;
        this.audit = audit;
    }

    public MonitorStatus status() throws IOException {
        OptionalLong pid = pidFile.read();
        List<String> tail = FileAuditTrail.tail(logFile, tailLines);
        if (pid.isEmpty()) {
            return new MonitorStatus(MonitorStatus.State.NOT_RUNNING, OptionalLong.empty(), tail);
        }
        MonitorStatus.State state = PidFile.isAlive(pid.getAsLong())
                ? MonitorStatus.State.RUNNING
                : MonitorStatus.State.STALE;
        return new MonitorStatus(state, pid, tail);
    }

    /**
     * Sends SIGTERM, waits for the grace period, then SIGKILL.
     */
    public StopOutcome stop() throws IOException {
        OptionalLong pid = pidFile.read();
        if (pid.isEmpty()) {
            return StopOutcome.NOT_RUNNING;
        }

        Optional<ProcessHandle> handle = ProcessHandle.of(pid.getAsLong()).filter(ProcessHandle::isAlive);
        if (handle.isEmpty()) {
            pidFile.delete();
            log.info("daemon.stop.stale pid={}", pid.getAsLong());
            return StopOutcome.STALE_PID_FILE_REMOVED;
        }

        ProcessHandle process = handle.get();
        log.info("daemon.stop.terminate pid={} graceMs={}", process.pid(), gracePeriod.toMillis());
        process.destroy();
        StopOutcome outcome;
        if (awaitExit(process, gracePeriod)) {
            outcome = StopOutcome.STOPPED;
        } else {
            log.warn("daemon.stop.kill pid={}", process.pid());
            process.destroyForcibly();
            outcome = awaitExit(process, KILL_WAIT) ? StopOutcome.KILLED : StopOutcome.STILL_RUNNING;
        }

        if (outcome != StopOutcome.STILL_RUNNING) {
            pidFile.delete();
            audit.record("Monitor (pid " + process.pid() + ") " + (outcome == StopOutcome.KILLED ? "killed" : "stopped"));
        }
        return outcome;
    }

    private boolean awaitExit(ProcessHandle process, Duration wait) {
        try {
            process.onExit().get(wait.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return !process.isAlive();
        } catch (ExecutionException e) {
            log.debug("daemon.stop.wait.failed pid={} reason={}", process.pid(), e.getMessage());
            return !process.isAlive();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }
}
