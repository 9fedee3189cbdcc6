package io.refactor.flowscheduler.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "flow_schedule")
public class Schedule {
    @Id
    private UUID id;
    @Column(name = "user_id", nullable = false)
    private UUID userId;
    @Column(name = "flow_id", nullable = false)
    private UUID flowId;
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ScheduleFrequency frequency;
    // HH:MM, UTC
    @Column(name = "schedule_time", nullable = false)
    private String scheduleTime;
    // 0 = Monday .. 6 = Sunday
    @Column(name = "day_of_week")
    private Integer dayOfWeek;
    @Column(name = "day_of_month")
    private Integer dayOfMonth;
    @Column(name = "cron_expression")
    private String cronExpression;
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ScheduleStatus status;
    @Column(name = "last_run_at")
    private Instant lastRunAt;
    @Column(name = "next_run_at")
    private Instant nextRunAt;
    @Enumerated(EnumType.STRING)
    @Column(name = "last_run_status")
    private LastRunStatus lastRunStatus;
    @Column(name = "last_run_error")
    private String lastRunError;
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Schedule() {}

    public boolean isActive() {
        return status == ScheduleStatus.ACTIVE;
    }

    // getters and setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public UUID getUserId() { return userId; }
    public void setUserId(UUID userId) { this.userId = userId; }
    public UUID getFlowId() { return flowId; }
    public void setFlowId(UUID flowId) { this.flowId = flowId; }
    public ScheduleFrequency getFrequency() { return frequency; }
    public void setFrequency(ScheduleFrequency frequency) { this.frequency = frequency; }
    public String getScheduleTime() { return scheduleTime; }
    public void setScheduleTime(String scheduleTime) { this.scheduleTime = scheduleTime; }
    public Integer getDayOfWeek() { return dayOfWeek; }
    public void setDayOfWeek(Integer dayOfWeek) { this.dayOfWeek = dayOfWeek; }
    public Integer getDayOfMonth() { return dayOfMonth; }
    public void setDayOfMonth(Integer dayOfMonth) { this.dayOfMonth = dayOfMonth; }
    public String getCronExpression() { return cronExpression; }
    public void setCronExpression(String cronExpression) { this.cronExpression = cronExpression; }
    public ScheduleStatus getStatus() { return status; }
    public void setStatus(ScheduleStatus status) { this.status = status; }
    public Instant getLastRunAt() { return lastRunAt; }
    public void setLastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; }
    public Instant getNextRunAt() { return nextRunAt; }
    public void setNextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; }
    public LastRunStatus getLastRunStatus() { return lastRunStatus; }
    public void setLastRunStatus(LastRunStatus lastRunStatus) { this.lastRunStatus = lastRunStatus; }
    public String getLastRunError() { return lastRunError; }
    public void setLastRunError(String lastRunError) { this.lastRunError = lastRunError; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
