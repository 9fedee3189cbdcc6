package io.refactor.flowscheduler.dto;

import io.refactor.flowscheduler.model.LastRunStatus;
import io.refactor.flowscheduler.model.Schedule;
import io.refactor.flowscheduler.model.ScheduleFrequency;
import io.refactor.flowscheduler.model.ScheduleStatus;

import java.time.Instant;
import java.util.UUID;

public record ScheduleResponse(
        UUID id,
        UUID userId,
        UUID flowId,
        ScheduleFrequency frequency,
        String scheduleTime,
        Integer dayOfWeek,
        Integer dayOfMonth,
        String cronExpression,
        ScheduleStatus status,
        Instant lastRunAt,
        Instant nextRunAt,
        LastRunStatus lastRunStatus,
        String lastRunError,
        Instant createdAt,
        Instant updatedAt
) {
    public static ScheduleResponse from(Schedule s) {
        return new ScheduleResponse(s.getId(), s.getUserId(), s.getFlowId(), s.getFrequency(), s.getScheduleTime(),
                s.getDayOfWeek(), s.getDayOfMonth(), s.getCronExpression(), s.getStatus(), s.getLastRunAt(),
                s.getNextRunAt(), s.getLastRunStatus(), s.getLastRunError(), s.getCreatedAt(), s.getUpdatedAt());
    }
}
