package com.modelkeeper.monitor;

public class DaemonizationException extends Exception {

    public DaemonizationException(String message) {
        super(message);
    }

    public DaemonizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
