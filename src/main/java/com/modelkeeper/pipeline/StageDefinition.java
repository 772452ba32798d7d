package com.modelkeeper.pipeline;

import java.util.List;

/**
 * One independently runnable training stage.
 *
 * @param command   argv of the child process
 * @param artifacts files, relative to the production directory, that a successful run leaves behind
 */
public record StageDefinition(String name, StageKind kind, List<String> command, List<String> artifacts) {

    public StageDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stage name must not be blank");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("stage " + name + " has no command");
        }
        command = List.copyOf(command);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }
}
