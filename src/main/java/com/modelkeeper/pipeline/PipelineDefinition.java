package com.modelkeeper.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.modelkeeper.runtime.AppConfig;

/**
 * The fixed stage order of a retraining run: main estimator, independent specialists, aggregate,
 * ensemble.
 */
public record PipelineDefinition(
        StageDefinition main,
        List<StageDefinition> specialists,
        StageDefinition aggregate,
        StageDefinition ensemble) {

    public PipelineDefinition {
        if (main == null || aggregate == null || ensemble == null) {
            throw new IllegalArgumentException("pipeline needs a main, an aggregate and an ensemble stage");
        }
        specialists = specialists == null ? List.of() : List.copyOf(specialists);
    }

    public static PipelineDefinition fromConfig(AppConfig.StagesConfig stages) {
        List<StageDefinition> specialists = new ArrayList<>();
        for (AppConfig.StageConfig specialist : stages.getSpecialists()) {
            specialists.add(toStage(specialist, StageKind.SPECIALIST));
        }
        return new PipelineDefinition(
                toStage(stages.getMain(), StageKind.MAIN),
                specialists,
                toStage(stages.getAggregate(), StageKind.AGGREGATE),
                toStage(stages.getEnsemble(), StageKind.ENSEMBLE));
    }

    private static StageDefinition toStage(AppConfig.StageConfig config, StageKind kind) {
        if (config == null) {
            throw new IllegalArgumentException("missing " + kind.name().toLowerCase() + " stage configuration");
        }
        return new StageDefinition(config.getName(), kind, config.getCommand(), config.getArtifacts());
    }

    public List<StageDefinition> ordered() {
        List<StageDefinition> ordered = new ArrayList<>();
        ordered.add(main);
        ordered.addAll(specialists);
        ordered.add(aggregate);
        ordered.add(ensemble);
        return ordered;
    }

    /**
     * The complete artifact set: the base layout plus every file a stage declares.
     */
    public List<String> requiredArtifacts(List<String> baseLayout) {
        Set<String> required = new LinkedHashSet<>(baseLayout);
        for (StageDefinition stage : ordered()) {
            required.addAll(stage.artifacts());
        }
        return List.copyOf(required);
    }
}
