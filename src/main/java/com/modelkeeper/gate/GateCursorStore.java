package com.modelkeeper.gate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-line text file holding the last consumed point in time as an ISO local date-time.
 */
public class GateCursorStore {
    private static final Logger log = LoggerFactory.getLogger(GateCursorStore.class);
    static final LocalDateTime NEVER_TRAINED = LocalDateTime.of(2000, 1, 1, 0, 0);

    private final Path path;

    public GateCursorStore(Path path) {
        this.path = path;
    }

    public LocalDateTime read() throws IOException {
        if (!Files.exists(path)) {
            return NEVER_TRAINED;
        }
        String raw = Files.readString(path).strip();
        if (raw.isEmpty()) {
            return NEVER_TRAINED;
        }
        try {
            return LocalDateTime.parse(raw, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        } catch (DateTimeParseException e) {
            throw new IOException("Unreadable gate cursor in " + path + ": " + raw, e);
        }
    }

    public void write(LocalDateTime cursor) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, format(cursor));
        log.info("gate.cursor.advanced cursor={} path={}", format(cursor), path);
    }

    public static String format(LocalDateTime cursor) {
        return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(cursor);
    }

    public Path path() {
        return path;
    }
}
