package io.refactor.flowscheduler.model;

/**
 * Lifecycle of a schedule. Only {@link #ACTIVE} schedules hold a registry entry;
 * {@link #COMPLETED} and {@link #FAILED} are terminal until resumed through the API.
 */
public enum ScheduleStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    FAILED
}
