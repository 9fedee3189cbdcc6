package io.refactor.flowscheduler.registry;

public enum RemovalResult {
    REMOVED,
    NOT_PRESENT
}
