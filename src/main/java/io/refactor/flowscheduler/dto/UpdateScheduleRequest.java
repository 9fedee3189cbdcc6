package io.refactor.flowscheduler.dto;

import io.refactor.flowscheduler.model.ScheduleFrequency;
import io.refactor.flowscheduler.model.ScheduleStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

/** Partial update; null fields are left unchanged. */
public class UpdateScheduleRequest {
    private ScheduleFrequency frequency;
    @Pattern(regexp = "^\\d{1,2}:\\d{2}$", message = "must be in HH:MM format (24-hour)")
    private String scheduleTime;
    private ScheduleStatus status;
    @Min(0)
    @Max(6)
    private Integer dayOfWeek;
    @Min(1)
    @Max(31)
    private Integer dayOfMonth;
    private String cronExpression;

    public ScheduleFrequency getFrequency() { return frequency; }
    public void setFrequency(ScheduleFrequency frequency) { this.frequency = frequency; }
    public String getScheduleTime() { return scheduleTime; }
    public void setScheduleTime(String scheduleTime) { this.scheduleTime = scheduleTime; }
    public ScheduleStatus getStatus() { return status; }
    public void setStatus(ScheduleStatus status) { this.status = status; }
    public Integer getDayOfWeek() { return dayOfWeek; }
    public void setDayOfWeek(Integer dayOfWeek) { this.dayOfWeek = dayOfWeek; }
    public Integer getDayOfMonth() { return dayOfMonth; }
    public void setDayOfMonth(Integer dayOfMonth) { this.dayOfMonth = dayOfMonth; }
    public String getCronExpression() { return cronExpression; }
    public void setCronExpression(String cronExpression) { this.cronExpression = cronExpression; }
}
