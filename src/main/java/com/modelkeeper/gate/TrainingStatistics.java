package com.modelkeeper.gate;

import java.util.Map;

public record TrainingStatistics(
        int totalTrainingRecords,
        Map<String, Integer> byQuality,
        int newSinceCursor,
        String cursor) {

    public TrainingStatistics {
        byQuality = byQuality == null ? Map.of() : Map.copyOf(byQuality);
    }
}
