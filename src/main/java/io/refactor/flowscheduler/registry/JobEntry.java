package io.refactor.flowscheduler.registry;

import io.refactor.flowscheduler.trigger.Recurrence;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record JobEntry(UUID scheduleId, Recurrence trigger, Instant fireAt) {

    public JobEntry {
        Objects.requireNonNull(scheduleId, "scheduleId");
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(fireAt, "fireAt");
    }

    public JobEntry next(Instant now) {
        return new JobEntry(scheduleId, trigger, trigger.nextAfter(now));
    }
}
