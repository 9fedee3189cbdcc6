package io.refactor.flowscheduler.service;

import io.refactor.flowscheduler.exception.ScheduleValidationException;
import io.refactor.flowscheduler.model.Schedule;
import io.refactor.flowscheduler.model.ScheduleFrequency;
import io.refactor.flowscheduler.model.ScheduleStatus;
import io.refactor.flowscheduler.registry.JobEntry;
import io.refactor.flowscheduler.registry.JobRegistry;
import io.refactor.flowscheduler.registry.RemovalResult;
import io.refactor.flowscheduler.repository.ScheduleRepository;
import io.refactor.flowscheduler.trigger.Recurrence;
import io.refactor.flowscheduler.trigger.TriggerCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class SchedulerService {

    private static final Logger log = LoggerFactory.getLogger(SchedulerService.class);

    private final JobRegistry registry;
    private final TriggerCalculator calculator;
    private final ScheduleRepository repo;
    private final Clock clock;

    public SchedulerService(JobRegistry registry, TriggerCalculator calculator, ScheduleRepository repo, Clock clock) {
        this.registry = registry;
        this.calculator = calculator;
        this.repo = repo;
        this.clock = clock;
    }

    /**
     * @return the next fire time, or empty when the schedule is not ACTIVE (any entry is removed)
     * @throws ScheduleValidationException when the recurrence fields are invalid; nothing is registered
     */
    public Optional<Instant> upsertJob(Schedule schedule) {
        if (!schedule.isActive()) {
            log.debug("Skipping inactive schedule: {}", schedule.getId());
            removeJob(schedule.getId());
            return Optional.empty();
        }
        Recurrence recurrence = calculator.recurrenceOf(schedule);
        Instant next = recurrence.nextAfter(clock.instant());
        Optional<JobEntry> replaced = registry.upsert(new JobEntry(schedule.getId(), recurrence, next));
        log.info("{} schedule job: {} ({}) next run at {}",
                replaced.isPresent() ? "Replaced" : "Added", schedule.getId(), schedule.getFrequency(), next);
        return Optional.of(next);
    }

    public RemovalResult removeJob(UUID scheduleId) {
        RemovalResult result = registry.remove(scheduleId);
        if (result == RemovalResult.REMOVED) {
            log.info("Removed schedule job: {}", scheduleId);
        }
        return result;
    }

    // a stored record that can no longer produce a trigger is moved to FAILED
    public int reconcileOnStartup() {
        List<Schedule> active = repo.findByStatus(ScheduleStatus.ACTIVE);
        int restored = 0;
        for (Schedule schedule : active) {
            if (restore(schedule)) {
                restored++;
            }
        }
        log.info("Loaded {} active schedules ({} found)", restored, active.size());
        return restored;
    }

    // schedules with a run in flight re-arm themselves and are left alone
    public AuditResult audit() {
        Map<UUID, Schedule> active = new HashMap<>();
        for (Schedule schedule : repo.findByStatus(ScheduleStatus.ACTIVE)) {
            active.put(schedule.getId(), schedule);
        }
        int stale = 0;
        for (JobEntry entry : registry.snapshot()) {
            if (!active.containsKey(entry.scheduleId()) && removeJob(entry.scheduleId()) == RemovalResult.REMOVED) {
                log.warn("Dropped stale registry entry for schedule {}", entry.scheduleId());
                stale++;
            }
        }
        int restored = 0;
        for (Schedule schedule : active.values()) {
            if (!registry.contains(schedule.getId()) && !registry.isInFlight(schedule.getId()) && restore(schedule)) {
                log.warn("Restored missing registry entry for schedule {}", schedule.getId());
                restored++;
            }
        }
        return new AuditResult(stale, restored);
    }

    public List<JobEntry> jobs() {
        return registry.snapshot();
    }

    private boolean restore(Schedule schedule) {
        if (hasAlreadyRun(schedule)) {
            log.warn("One-shot schedule {} already ran but is still ACTIVE; marking COMPLETED", schedule.getId());
            repo.markCompleted(schedule.getId(), clock.instant());
            return false;
        }
        try {
            Optional<Instant> next = upsertJob(schedule);
            next.ifPresent(at -> repo.updateNextRun(schedule.getId(), at, clock.instant()));
            return next.isPresent();
        } catch (ScheduleValidationException e) {
            log.error("Schedule {} cannot be scheduled ({}); marking FAILED", schedule.getId(), e.getMessage());
            repo.updateStatus(schedule.getId(), ScheduleStatus.FAILED, clock.instant());
            return false;
        }
    }

    // A ONCE row left ACTIVE because its completion could not be stored. Resuming or
    // editing moves nextRunAt past lastRunAt, which re-arms the schedule.
    private static boolean hasAlreadyRun(Schedule schedule) {
        return schedule.getFrequency() == ScheduleFrequency.ONCE
                && schedule.getLastRunStatus() != null
                && schedule.getLastRunStatus().flowStarted()
                && schedule.getLastRunAt() != null
                && (schedule.getNextRunAt() == null || !schedule.getNextRunAt().isAfter(schedule.getLastRunAt()));
    }

    public record AuditResult(int stale, int restored) {
    }
}
