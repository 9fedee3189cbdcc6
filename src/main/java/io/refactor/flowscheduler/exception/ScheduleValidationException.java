package io.refactor.flowscheduler.exception;

/**
 * A schedule's recurrence fields cannot produce a trigger: malformed time of day,
 * a missing or out-of-range recurrence parameter, or an invalid cron expression.
 * Raised at create/update time; such a schedule is never registered.
 */
public class ScheduleValidationException extends RuntimeException {

    public ScheduleValidationException(String message) {
        super(message);
    }

    public ScheduleValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
