package io.refactor.flowscheduler.support;

import io.refactor.flowscheduler.model.Schedule;
import io.refactor.flowscheduler.model.ScheduleFrequency;
import io.refactor.flowscheduler.model.ScheduleStatus;

import java.time.Instant;
import java.util.UUID;

/** Builders for schedule records used across tests. */
public final class Schedules {

    private Schedules() {}

    public static Schedule once(String time) {
        return base(ScheduleFrequency.ONCE, time);
    }

    public static Schedule daily(String time) {
        return base(ScheduleFrequency.DAILY, time);
    }

    public static Schedule weekly(int dayOfWeek, String time) {
        Schedule s = base(ScheduleFrequency.WEEKLY, time);
        s.setDayOfWeek(dayOfWeek);
        return s;
    }

    public static Schedule monthly(int dayOfMonth, String time) {
        Schedule s = base(ScheduleFrequency.MONTHLY, time);
        s.setDayOfMonth(dayOfMonth);
        return s;
    }

    public static Schedule custom(String cron) {
        Schedule s = base(ScheduleFrequency.CUSTOM, "00:00");
        s.setCronExpression(cron);
        return s;
    }

    private static Schedule base(ScheduleFrequency frequency, String time) {
        Schedule s = new Schedule();
        s.setId(UUID.randomUUID());
        s.setUserId(UUID.randomUUID());
        s.setFlowId(UUID.randomUUID());
        s.setFrequency(frequency);
        s.setScheduleTime(time);
        s.setStatus(ScheduleStatus.ACTIVE);
        s.setCreatedAt(Instant.parse("2026-01-01T00:00:00Z"));
        s.setUpdatedAt(Instant.parse("2026-01-01T00:00:00Z"));
        return s;
    }
}
