package com.modelkeeper.pipeline;

public enum StageKind {
    MAIN,
    SPECIALIST,
    AGGREGATE,
    ENSEMBLE
}
