package com.modelkeeper.monitor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonControllerTest {

    @TempDir
    Path tempDir;

    private final List<String> audit = new ArrayList<>();

    @Test
    void shouldReportNotRunningWithoutPidFile() throws IOException {
        DaemonController controller = controller(new PidFile(tempDir.resolve("monitor.pid")), Duration.ofSeconds(1));

        assertEquals(MonitorStatus.State.NOT_RUNNING, controller.status().state());
        assertEquals(DaemonController.StopOutcome.NOT_RUNNING, controller.stop());
    }

    @Test
    void shouldReportLogTail() throws IOException {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            lines.add("line " + i);
        }
        Files.write(tempDir.resolve("monitor.log"), lines);
        DaemonController controller = controller(new PidFile(tempDir.resolve("monitor.pid")), Duration.ofSeconds(1));

        List<String> tail = controller.status().logTail();

        assertEquals(20, tail.size());
        assertEquals("line 10", tail.get(0));
        assertEquals("line 29", tail.get(19));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void shouldDetectAndRemoveStalePidFile() throws Exception {
        Process finished = new ProcessBuilder("true").start();
        assertTrue(finished.waitFor(10, TimeUnit.SECONDS));
        PidFile pidFile = new PidFile(tempDir.resolve("monitor.pid"));
        Files.writeString(pidFile.path(), Long.toString(finished.pid()));
        DaemonController controller = controller(pidFile, Duration.ofSeconds(1));

        assertEquals(MonitorStatus.State.STALE, controller.status().state());
        assertEquals(DaemonController.StopOutcome.STALE_PID_FILE_REMOVED, controller.stop());
        assertFalse(Files.exists(pidFile.path()));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void shouldStopRunningProcessGracefully() throws Exception {
        Process sleeper = new ProcessBuilder("sleep", "60").start();
        try {
            PidFile pidFile = new PidFile(tempDir.resolve("monitor.pid"));
            Files.writeString(pidFile.path(), Long.toString(sleeper.pid()));
            DaemonController controller = controller(pidFile, Duration.ofSeconds(10));
            assertTrue(controller.status().running());

            assertEquals(DaemonController.StopOutcome.STOPPED, controller.stop());

            assertTrue(sleeper.waitFor(5, TimeUnit.SECONDS));
            assertFalse(Files.exists(pidFile.path()));
            assertEquals(MonitorStatus.State.NOT_RUNNING, controller.status().state());
            assertTrue(audit.stream().anyMatch(line -> line.contains("stopped")));
        } finally {
            sleeper.destroyForcibly();
        }
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void shouldKillProcessIgnoringTermination() throws Exception {
        Process stubborn = new ProcessBuilder("sh", "-c", "trap '' TERM; exec sleep 60").start();
        try {
            Thread.sleep(300);
            PidFile pidFile = new PidFile(tempDir.resolve("monitor.pid"));
            Files.writeString(pidFile.path(), Long.toString(stubborn.pid()));

            assertEquals(DaemonController.StopOutcome.KILLED, controller(pidFile, Duration.ofMillis(300)).stop());

            assertTrue(stubborn.waitFor(5, TimeUnit.SECONDS));
            assertFalse(Files.exists(pidFile.path()));
        } finally {
            stubborn.destroyForcibly();
        }
    }

    private DaemonController controller(PidFile pidFile, Duration grace) {
        return new DaemonController(pidFile, tempDir.resolve("monitor.log"), 20, grace, audit::add);
    }
}
