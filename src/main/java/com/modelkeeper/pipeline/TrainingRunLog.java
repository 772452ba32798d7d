package com.modelkeeper.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * One JSON line per finished run.
 */
public class TrainingRunLog {
    private final Path path;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public TrainingRunLog(Path path) {
        this.path = path;
    }

    public void append(TrainingRun run) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        String line = mapper.writeValueAsString(run) + System.lineSeparator();
        Files.writeString(path, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    public List<TrainingRun> readAll() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<TrainingRun> runs = new ArrayList<>();
        for (String line : Files.readAllLines(path)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            runs.add(mapper.readValue(line, TrainingRun.class));
        }
        return runs;
    }

    public Path path() {
        return path;
    }
}
