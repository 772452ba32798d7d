package com.modelkeeper.pipeline;

import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls the quality metric out of a stage's free-text output. Patterns are tried in order against
 * the whole output; the first one that matches wins and its first group is parsed as a decimal.
 */
public class MetricExtractor {
    private static final Logger log = LoggerFactory.getLogger(MetricExtractor.class);

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "Test MAE:\\s*\\$?(\\d+\\.?\\d*)",
            "MAE:\\s*\\$?(\\d+\\.?\\d*)",
            "Mean Absolute Error:\\s*\\$?(\\d+\\.?\\d*)");

    private final List<Pattern> patterns;

    public MetricExtractor() {
        this(DEFAULT_PATTERNS);
    }

    public MetricExtractor(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("at least one metric pattern is required");
        }
        this.patterns = patterns.stream()
                .map(pattern -> Pattern.compile(pattern, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public OptionalDouble extract(String output) {
        if (output == null || output.isBlank()) {
            return OptionalDouble.empty();
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(output);
            if (matcher.find()) {
                String value = matcher.groupCount() >= 1 ? matcher.group(1) : matcher.group();
                try {
                    return OptionalDouble.of(Double.parseDouble(value));
                } catch (NumberFormatException e) {
                    log.debug("metric.unparseable pattern={} value={}", pattern.pattern(), value);
                }
            }
        }
        return OptionalDouble.empty();
    }
}
