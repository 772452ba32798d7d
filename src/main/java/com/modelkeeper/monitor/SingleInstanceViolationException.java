package com.modelkeeper.monitor;

public class SingleInstanceViolationException extends Exception {
    private final long ownerPid;

    public SingleInstanceViolationException(long ownerPid, String message) {
        super(message);
        this.ownerPid = ownerPid;
    }

    public long ownerPid() {
        return ownerPid;
    }
}
