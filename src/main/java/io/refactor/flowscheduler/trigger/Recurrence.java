package io.refactor.flowscheduler.trigger;

import io.refactor.flowscheduler.model.ScheduleFrequency;
import org.springframework.scheduling.support.CronExpression;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

// Next fire times are UTC and always strictly after the reference instant.
public sealed interface Recurrence
        permits Recurrence.Once, Recurrence.Daily, Recurrence.Weekly, Recurrence.Monthly, Recurrence.Custom {

    Instant nextAfter(Instant now);

    ScheduleFrequency frequency();

    default boolean isOneShot() {
        return false;
    }

    record Once(LocalTime time) implements Recurrence {
        @Override
        public Instant nextAfter(Instant now) {
            return nextTimeOfDay(now, time);
        }

        @Override
        public ScheduleFrequency frequency() {
            return ScheduleFrequency.ONCE;
        }

        @Override
        public boolean isOneShot() {
            return true;
        }
    }

    record Daily(LocalTime time) implements Recurrence {
        @Override
        public Instant nextAfter(Instant now) {
            return nextTimeOfDay(now, time);
        }

        @Override
        public ScheduleFrequency frequency() {
            return ScheduleFrequency.DAILY;
        }
    }

    record Weekly(DayOfWeek dayOfWeek, LocalTime time) implements Recurrence {
        @Override
        public Instant nextAfter(Instant now) {
            LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
            // offset from the weekday alone: the same weekday always means next week
            int offset = dayOfWeek.getValue() - today.getDayOfWeek().getValue();
            if (offset <= 0) {
                offset += 7;
            }
            return today.plusDays(offset).atTime(time).atZone(ZoneOffset.UTC).toInstant();
        }

        @Override
        public ScheduleFrequency frequency() {
            return ScheduleFrequency.WEEKLY;
        }
    }

    // day of month is clamped to the last day of shorter months
    record Monthly(int dayOfMonth, LocalTime time) implements Recurrence {
        @Override
        public Instant nextAfter(Instant now) {
            ZonedDateTime reference = now.atZone(ZoneOffset.UTC);
            YearMonth month = YearMonth.from(reference);
            ZonedDateTime candidate = occurrenceIn(month);
            if (!candidate.isAfter(reference)) {
                candidate = occurrenceIn(month.plusMonths(1));
            }
            return candidate.toInstant();
        }

        private ZonedDateTime occurrenceIn(YearMonth month) {
            int day = Math.min(dayOfMonth, month.lengthOfMonth());
            return month.atDay(day).atTime(time).atZone(ZoneOffset.UTC);
        }

        @Override
        public ScheduleFrequency frequency() {
            return ScheduleFrequency.MONTHLY;
        }
    }

    record Custom(String expression, CronExpression cron) implements Recurrence {
        @Override
        public Instant nextAfter(Instant now) {
            ZonedDateTime next = cron.next(now.atZone(ZoneOffset.UTC));
            if (next == null) {
                throw new IllegalStateException("Cron expression has no future occurrence: " + expression);
            }
            return next.toInstant();
        }

        @Override
        public ScheduleFrequency frequency() {
            return ScheduleFrequency.CUSTOM;
        }
    }

    private static Instant nextTimeOfDay(Instant now, LocalTime time) {
        ZonedDateTime reference = now.atZone(ZoneOffset.UTC);
        ZonedDateTime candidate = reference.toLocalDate().atTime(time).atZone(ZoneOffset.UTC);
        if (!candidate.isAfter(reference)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant();
    }
}
