package io.refactor.flowscheduler.model;

public enum ScheduleFrequency {
    ONCE,
    DAILY,
    WEEKLY,
    MONTHLY,
    CUSTOM
}
