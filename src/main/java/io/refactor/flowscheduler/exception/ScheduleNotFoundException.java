package io.refactor.flowscheduler.exception;

import java.util.UUID;

public class ScheduleNotFoundException extends RuntimeException {

    public ScheduleNotFoundException(String message) {
        super(message);
    }

    public static ScheduleNotFoundException schedule(UUID scheduleId) {
        return new ScheduleNotFoundException("Schedule not found: " + scheduleId);
    }

    public static ScheduleNotFoundException flow(UUID flowId) {
        return new ScheduleNotFoundException("Flow not found or access denied: " + flowId);
    }
}
