package com.modelkeeper.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FileAuditTrail implements AuditTrail {
    private static final Logger log = LoggerFactory.getLogger(FileAuditTrail.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path logFile;
    private final Clock clock;

    public FileAuditTrail(Path logFile) {
        this(logFile, Clock.systemDefaultZone());
    }

    public FileAuditTrail(Path logFile, Clock clock) {
        this.logFile = logFile;
        this.clock = clock;
    }

    @Override
    public synchronized void record(String message) {
        String line = message == null || message.isEmpty()
                ? ""
                : "[" + TIMESTAMP.format(LocalDateTime.now(clock)) + "] " + message;
        if (!line.isEmpty()) {
            log.info(message);
        }
        try {
            if (logFile.getParent() != null) {
                Files.createDirectories(logFile.getParent());
            }
            Files.writeString(logFile, line + System.lineSeparator(),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("audit.write.failed path={} reason={}", logFile, e.getMessage());
        }
    }

    public Path logFile() {
        return logFile;
    }

    public static List<String> tail(Path logFile, int lines) throws IOException {
        if (!Files.exists(logFile)) {
            return List.of();
        }
        List<String> all = Files.readAllLines(logFile);
        int from = Math.max(0, all.size() - Math.max(0, lines));
        return List.copyOf(all.subList(from, all.size()));
    }
}
