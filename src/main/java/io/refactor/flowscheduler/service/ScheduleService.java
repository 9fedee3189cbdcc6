package io.refactor.flowscheduler.service;

import io.refactor.flowscheduler.client.FlowRunnerClient;
import io.refactor.flowscheduler.client.FlowSummary;
import io.refactor.flowscheduler.dto.CreateScheduleRequest;
import io.refactor.flowscheduler.dto.UpdateScheduleRequest;
import io.refactor.flowscheduler.exception.ScheduleNotFoundException;
import io.refactor.flowscheduler.exception.ScheduleValidationException;
import io.refactor.flowscheduler.model.Schedule;
import io.refactor.flowscheduler.model.ScheduleStatus;
import io.refactor.flowscheduler.registry.JobEntry;
import io.refactor.flowscheduler.repository.ScheduleRepository;
import io.refactor.flowscheduler.trigger.Recurrence;
import io.refactor.flowscheduler.trigger.TriggerCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Schedule management on behalf of a user. Each mutating call commits the record
 * and then brings the job registry in line before returning.
 */
@Service
public class ScheduleService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository repo;
    private final SchedulerService scheduler;
    private final TriggerCalculator calculator;
    private final FlowRunnerClient flowRunner;
    private final Clock clock;

    public ScheduleService(ScheduleRepository repo, SchedulerService scheduler, TriggerCalculator calculator,
                           FlowRunnerClient flowRunner, Clock clock) {
        this.repo = repo;
        this.scheduler = scheduler;
        this.calculator = calculator;
        this.flowRunner = flowRunner;
        this.clock = clock;
    }

    public Schedule create(UUID userId, CreateScheduleRequest req) {
        FlowSummary flow = flowRunner.findFlow(req.getFlowId())
                .filter(f -> userId.equals(f.userId()))
                .orElseThrow(() -> ScheduleNotFoundException.flow(req.getFlowId()));

        Instant now = clock.instant();
        Schedule s = new Schedule();
        s.setId(UUID.randomUUID());
        s.setUserId(userId);
        s.setFlowId(flow.id() == null ? req.getFlowId() : flow.id());
        s.setFrequency(req.getFrequency());
        s.setScheduleTime(req.getScheduleTime());
        s.setDayOfWeek(req.getDayOfWeek());
        s.setDayOfMonth(req.getDayOfMonth());
        s.setCronExpression(req.getCronExpression());
        s.setStatus(req.isPaused() ? ScheduleStatus.PAUSED : ScheduleStatus.ACTIVE);
        s.setCreatedAt(now);
        s.setUpdatedAt(now);

        // validated even when paused, before anything is stored or registered
        Recurrence recurrence = calculator.recurrenceOf(s);
        s.setNextRunAt(s.isActive() ? recurrence.nextAfter(now) : null);
        Schedule saved = repo.save(s);
        syncRegistry(saved);
        log.info("Created schedule {} for flow {} ({})", saved.getId(), saved.getFlowId(), saved.getFrequency());
        return saved;
    }

    public Schedule get(UUID userId, UUID scheduleId) {
        return repo.findByIdAndUserId(scheduleId, userId)
                .orElseThrow(() -> ScheduleNotFoundException.schedule(scheduleId));
    }

    public List<Schedule> list(UUID userId, UUID flowId) {
        return flowId == null ? repo.findByUserId(userId) : repo.findByUserIdAndFlowId(userId, flowId);
    }

    public Schedule update(UUID userId, UUID scheduleId, UpdateScheduleRequest req) {
        Schedule s = get(userId, scheduleId);
        if (req.getFrequency() != null) s.setFrequency(req.getFrequency());
        if (req.getScheduleTime() != null) s.setScheduleTime(req.getScheduleTime());
        if (req.getDayOfWeek() != null) s.setDayOfWeek(req.getDayOfWeek());
        if (req.getDayOfMonth() != null) s.setDayOfMonth(req.getDayOfMonth());
        if (req.getCronExpression() != null) s.setCronExpression(req.getCronExpression());
        if (req.getStatus() != null) {
            if (req.getStatus() != ScheduleStatus.ACTIVE && req.getStatus() != ScheduleStatus.PAUSED) {
                throw new ScheduleValidationException("status can only be set to ACTIVE or PAUSED");
            }
            s.setStatus(req.getStatus());
        }
        // always validated, so a paused schedule cannot hold a rule that would fail on resume
        calculator.recurrenceOf(s);

        Instant now = clock.instant();
        s.setNextRunAt(s.isActive() ? calculator.computeNextRun(s, now) : null);
        s.setUpdatedAt(now);
        Schedule saved = repo.save(s);
        syncRegistry(saved);
        return saved;
    }

    public Schedule pause(UUID userId, UUID scheduleId) {
        Schedule s = get(userId, scheduleId);
        s.setStatus(ScheduleStatus.PAUSED);
        s.setNextRunAt(null);
        s.setUpdatedAt(clock.instant());
        Schedule saved = repo.save(s);
        scheduler.removeJob(scheduleId);
        log.info("Paused schedule {}", scheduleId);
        return saved;
    }

    public Schedule resume(UUID userId, UUID scheduleId) {
        Schedule s = get(userId, scheduleId);
        Instant now = clock.instant();
        s.setStatus(ScheduleStatus.ACTIVE);
        s.setNextRunAt(calculator.computeNextRun(s, now));
        s.setUpdatedAt(now);
        Schedule saved = repo.save(s);
        syncRegistry(saved);
        log.info("Resumed schedule {}", scheduleId);
        return saved;
    }

    public void delete(UUID userId, UUID scheduleId) {
        Schedule s = get(userId, scheduleId);
        scheduler.removeJob(scheduleId);
        repo.delete(s);
        log.info("Deleted schedule {}", scheduleId);
    }

    /** Live registry entries belonging to the user's schedules. */
    public List<JobEntry> jobs(UUID userId) {
        Set<UUID> owned = repo.findByUserId(userId).stream().map(Schedule::getId).collect(Collectors.toSet());
        return scheduler.jobs().stream().filter(j -> owned.contains(j.scheduleId())).collect(Collectors.toList());
    }

    private void syncRegistry(Schedule saved) {
        scheduler.upsertJob(saved).ifPresent(next -> {
            // the registry computed against a slightly later clock reading
            if (!next.equals(saved.getNextRunAt())) {
                repo.updateNextRun(saved.getId(), next, clock.instant());
                saved.setNextRunAt(next);
            }
        });
    }
}
