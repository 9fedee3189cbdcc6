package io.refactor.flowscheduler.dto;

import io.refactor.flowscheduler.model.ScheduleFrequency;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.UUID;

public class CreateScheduleRequest {
    @NotNull
    private UUID flowId;
    @NotNull
    private ScheduleFrequency frequency = ScheduleFrequency.ONCE;
    @NotBlank
    @Pattern(regexp = "^\\d{1,2}:\\d{2}$", message = "must be in HH:MM format (24-hour)")
    private String scheduleTime;
    @Min(0)
    @Max(6)
    private Integer dayOfWeek; // WEEKLY, 0 = Monday
    @Min(1)
    @Max(31)
    private Integer dayOfMonth; // MONTHLY
    private String cronExpression; // CUSTOM, 5 fields
    private boolean paused;

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
    public boolean isPaused() { return paused; }
    public void setPaused(boolean paused) { this.paused = paused; }
}
