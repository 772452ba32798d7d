package com.modelkeeper.pipeline;

public enum StageStatus {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    LAUNCH_FAILED,
    INTERRUPTED
}
