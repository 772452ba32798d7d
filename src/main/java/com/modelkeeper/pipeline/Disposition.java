package com.modelkeeper.pipeline;

public enum Disposition {
    COMMITTED,
    ROLLED_BACK,
    FAILED_NO_BACKUP
}
