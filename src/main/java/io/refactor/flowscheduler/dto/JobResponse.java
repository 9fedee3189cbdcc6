package io.refactor.flowscheduler.dto;

import io.refactor.flowscheduler.model.ScheduleFrequency;
import io.refactor.flowscheduler.registry.JobEntry;

import java.time.Instant;
import java.util.UUID;

public record JobResponse(UUID scheduleId, ScheduleFrequency frequency, Instant fireAt) {
    public static JobResponse from(JobEntry entry) {
        return new JobResponse(entry.scheduleId(), entry.trigger().frequency(), entry.fireAt());
    }
}
