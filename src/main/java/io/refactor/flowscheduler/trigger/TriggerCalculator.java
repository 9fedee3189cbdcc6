package io.refactor.flowscheduler.trigger;

import io.refactor.flowscheduler.exception.ScheduleValidationException;
import io.refactor.flowscheduler.model.Schedule;
import io.refactor.flowscheduler.model.ScheduleFrequency;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class TriggerCalculator {

    private static final Pattern TIME_OF_DAY = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    public Instant computeNextRun(Schedule schedule, Instant now) {
        return recurrenceOf(schedule).nextAfter(now);
    }

    public Recurrence recurrenceOf(Schedule schedule) {
        ScheduleFrequency frequency = schedule.getFrequency();
        if (frequency == null) {
            throw new ScheduleValidationException("frequency is required");
        }
        return switch (frequency) {
            case ONCE -> new Recurrence.Once(parseTime(schedule.getScheduleTime()));
            case DAILY -> new Recurrence.Daily(parseTime(schedule.getScheduleTime()));
            case WEEKLY -> new Recurrence.Weekly(dayOfWeek(schedule.getDayOfWeek()), parseTime(schedule.getScheduleTime()));
            case MONTHLY -> new Recurrence.Monthly(dayOfMonth(schedule.getDayOfMonth()), parseTime(schedule.getScheduleTime()));
            case CUSTOM -> new Recurrence.Custom(schedule.getCronExpression(), parseCron(schedule.getCronExpression()));
        };
    }

    public static LocalTime parseTime(String value) {
        if (value == null) {
            throw new ScheduleValidationException("scheduleTime is required");
        }
        Matcher m = TIME_OF_DAY.matcher(value.trim());
        if (!m.matches()) {
            throw new ScheduleValidationException("Time must be in HH:MM format (24-hour): " + value);
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        if (hour > 23 || minute > 59) {
            throw new ScheduleValidationException("Time must be in HH:MM format (24-hour): " + value);
        }
        return LocalTime.of(hour, minute);
    }

    // 5-field crontab; the seconds field Spring expects is pinned to 0
    public static CronExpression parseCron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleValidationException("cronExpression is required for CUSTOM schedules");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new ScheduleValidationException("cronExpression must have 5 fields: " + expression);
        }
        try {
            return CronExpression.parse("0 " + String.join(" ", fields));
        } catch (IllegalArgumentException e) {
            throw new ScheduleValidationException("Invalid cron expression: " + e.getMessage(), e);
        }
    }

    private static DayOfWeek dayOfWeek(Integer value) {
        if (value == null) {
            throw new ScheduleValidationException("dayOfWeek is required for WEEKLY schedules");
        }
        if (value < 0 || value > 6) {
            throw new ScheduleValidationException("dayOfWeek must be between 0 (Monday) and 6 (Sunday): " + value);
        }
        return DayOfWeek.of(value + 1);
    }

    private static int dayOfMonth(Integer value) {
        if (value == null) {
            throw new ScheduleValidationException("dayOfMonth is required for MONTHLY schedules");
        }
        if (value < 1 || value > 31) {
            throw new ScheduleValidationException("dayOfMonth must be between 1 and 31: " + value);
        }
        return value;
    }
}
