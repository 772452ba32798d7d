package com.modelkeeper.monitor;

public record MonitorSummary(int cycles, int runsTriggered, int runsCommitted, int failedCycles, boolean stopRequested) {
}
