package com.modelkeeper.monitor;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.OptionalLong;
import java.util.function.LongPredicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-instance guard backed by a file holding the owner's process id.
 */
public class PidFile {
    private static final Logger log = LoggerFactory.getLogger(PidFile.class);

    private final Path path;
    private final LongPredicate liveness;

    public PidFile(Path path) {
        this(path, PidFile::isAlive);
    }

    PidFile(Path path, LongPredicate liveness) {
        this.path = path;
        this.liveness = liveness;
    }

    public static boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    public Path path() {
        return path;
    }

    /**
     * Returns the recorded pid, or empty when the file is absent or does not hold a number.
     */
    public OptionalLong read() throws IOException {
        if (!Files.exists(path)) {
            return OptionalLong.empty();
        }
        String raw = Files.readString(path).strip();
        try {
            return OptionalLong.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            log.warn("pidfile.unreadable path={} content={}", path, raw);
            return OptionalLong.empty();
        }
    }

    public boolean isOwnerAlive() throws IOException {
        OptionalLong pid = read();
        return pid.isPresent() && liveness.test(pid.getAsLong());
    }

    /**
     * Records {@code pid} as the owner. A file left behind by a dead process is replaced.
     *
     * @throws SingleInstanceViolationException when another live process owns the file
     */
    public void acquire(long pid) throws SingleInstanceViolationException, IOException {
        OptionalLong existing = read();
        if (existing.isPresent() && existing.getAsLong() != pid && liveness.test(existing.getAsLong())) {
            throw new SingleInstanceViolationException(existing.getAsLong(),
                    "Monitor already running with pid " + existing.getAsLong() + " (" + path + ")");
        }
        if (existing.isPresent() && existing.getAsLong() != pid) {
            log.info("pidfile.stale.replaced path={} stalePid={}", path, existing.getAsLong());
        }

        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(temp, Long.toString(pid));
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("pidfile.acquired path={} pid={}", path, pid);
    }

    /**
     * Deletes the file if it still names {@code pid}.
     */
    public void release(long pid) {
        try {
            OptionalLong existing = read();
            if (existing.isPresent() && existing.getAsLong() != pid) {
                log.warn("pidfile.release.skipped path={} owner={} pid={}", path, existing.getAsLong(), pid);
                return;
            }
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("pidfile.release.failed path={} reason={}", path, e.getMessage());
        }
    }

    public void delete() throws IOException {
        Files.deleteIfExists(path);
    }
}
