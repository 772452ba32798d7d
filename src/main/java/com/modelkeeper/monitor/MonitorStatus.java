package com.modelkeeper.monitor;

import java.util.List;
import java.util.OptionalLong;

public record MonitorStatus(State state, OptionalLong pid, List<String> logTail) {

    public enum State {
        RUNNING,
        /** A pid file exists but its process is gone. */
        STALE,
        NOT_RUNNING
    }

    public MonitorStatus {
        pid = pid == null ? OptionalLong.empty() : pid;
        logTail = logTail == null ? List.of() : List.copyOf(logTail);
    }

    public boolean running() {
        return state == State.RUNNING;
    }
}
