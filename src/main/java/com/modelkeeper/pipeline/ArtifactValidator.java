package com.modelkeeper.pipeline;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a finished run may replace production. All checks run in one pass so the
 * report lists every violation, not just the first.
 */
public class ArtifactValidator {
    private final Path productionDir;
    private final List<String> requiredFiles;
    private final double mainMetricCeiling;

    public ArtifactValidator(Path productionDir, List<String> requiredFiles, double mainMetricCeiling) {
        this.productionDir = productionDir;
        this.requiredFiles = List.copyOf(requiredFiles);
        this.mainMetricCeiling = mainMetricCeiling;
    }

    public ValidationResult validate(List<StageResult> results) {
        List<String> violations = new ArrayList<>();

        for (StageResult result : results) {
            if (!result.success()) {
                violations.add("Stage failed: " + result.stageName() + " (" + result.status() + ", exit " + result.exitCode() + ")");
            }
        }

        for (String required : requiredFiles) {
            if (!Files.isRegularFile(productionDir.resolve(required))) {
                violations.add("Missing required file: " + required);
            }
        }

        StageResult main = results.stream()
                .filter(result -> result.kind() == StageKind.MAIN)
                .findFirst()
                .orElse(null);
        if (main == null) {
            violations.add("Main estimator stage did not run");
        } else if (main.metric() == null) {
            violations.add("Main estimator reported no metric");
        } else if (!(main.metric() < mainMetricCeiling)) {
            violations.add(String.format(Locale.ROOT, "Main estimator metric too high: %.2f (ceiling %.2f)",
                    main.metric(), mainMetricCeiling));
        }

        return new ValidationResult(violations);
    }

    public List<String> requiredFiles() {
        return requiredFiles;
    }
}
