package com.modelkeeper.pipeline;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MetricExtractorTest {
    private final MetricExtractor extractor = new MetricExtractor();

    @Test
    void shouldPreferFirstPatternInOrder() {
        String output = "Train MAE: 1.10\nTest MAE: $2.45\n";

        assertEquals(2.45, extractor.extract(output).getAsDouble(), 1e-9);
    }

    @Test
    void shouldFallBackToLaterPatterns() {
        assertEquals(3.0, extractor.extract("mae: 3").getAsDouble(), 1e-9);
        assertEquals(5.75, extractor.extract("Mean Absolute Error: $5.75").getAsDouble(), 1e-9);
    }

    @Test
    void shouldTreatNoMatchAsAbsentNotZero() {
        assertFalse(extractor.extract("R2 score: 0.81").isPresent());
        assertFalse(extractor.extract("").isPresent());
        assertFalse(extractor.extract(null).isPresent());
        assertEquals(0.0, extractor.extract("MAE: 0.0").getAsDouble(), 1e-9);
    }

    @Test
    void shouldUseConfiguredPatterns() {
        MetricExtractor custom = new MetricExtractor(List.of("RMSE=(\\d+\\.\\d+)"));

        assertEquals(1.25, custom.extract("epoch 3 RMSE=1.25").getAsDouble(), 1e-9);
        assertFalse(custom.extract("MAE: 2.0").isPresent());
        assertThrows(IllegalArgumentException.class, () -> new MetricExtractor(List.of()));
    }
}
