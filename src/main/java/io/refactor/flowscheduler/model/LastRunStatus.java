package io.refactor.flowscheduler.model;

/** Outcome of the most recent firing. ERROR means the flow was never started (missing or unreachable). */
public enum LastRunStatus {
    RUNNING,
    SUCCESS,
    FAILED,
    ERROR;

    public boolean flowStarted() {
        return this != ERROR;
    }
}
