package com.modelkeeper.monitor;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PidFileTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteAndReleaseOwnPid() throws Exception {
        PidFile pidFile = new PidFile(tempDir.resolve("run/monitor.pid"));

        pidFile.acquire(1234);

        assertEquals(1234, pidFile.read().getAsLong());
        pidFile.release(1234);
        assertFalse(Files.exists(pidFile.path()));
    }

    @Test
    void shouldReplaceStalePidFile() throws Exception {
        PidFile pidFile = new PidFile(tempDir.resolve("monitor.pid"), pid -> false);
        Files.writeString(pidFile.path(), "999");

        pidFile.acquire(1234);

        assertEquals(1234, pidFile.read().getAsLong());
    }

    @Test
    void shouldRefuseLiveOwner() throws Exception {
        PidFile pidFile = new PidFile(tempDir.resolve("monitor.pid"), pid -> pid == 999);
        Files.writeString(pidFile.path(), "999\n");

        assertThrows(SingleInstanceViolationException.class, () -> pidFile.acquire(1234));
        assertTrue(pidFile.isOwnerAlive());
    }

    @Test
    void shouldNotReleaseAnotherOwnersFile() throws Exception {
        PidFile pidFile = new PidFile(tempDir.resolve("monitor.pid"));
        Files.writeString(pidFile.path(), "999");

        pidFile.release(1234);

        assertTrue(Files.exists(pidFile.path()));
    }

    @Test
    void shouldTreatGarbageAsAbsent() throws Exception {
        PidFile pidFile = new PidFile(tempDir.resolve("monitor.pid"));
        Files.writeString(pidFile.path(), "not-a-pid");

        assertTrue(pidFile.read().isEmpty());
        assertFalse(pidFile.isOwnerAlive());
    }

    @Test
    void shouldSeeCurrentProcessAsAlive() {
        assertTrue(PidFile.isAlive(ProcessHandle.current().pid()));
    }
}
