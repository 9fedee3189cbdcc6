package io.refactor.flowscheduler.service;

import io.refactor.flowscheduler.client.FlowRunnerClient;
import io.refactor.flowscheduler.client.FlowSummary;
import io.refactor.flowscheduler.model.LastRunStatus;
import io.refactor.flowscheduler.model.Schedule;
import io.refactor.flowscheduler.registry.JobEntry;
import io.refactor.flowscheduler.registry.JobRegistry;
import io.refactor.flowscheduler.repository.ScheduleRepository;
import io.refactor.flowscheduler.trigger.Recurrence;
import io.refactor.flowscheduler.trigger.TriggerCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one firing of a schedule. The stored record is authoritative: a firing whose
 * record is gone or no longer ACTIVE is dropped without side effects.
 */
@Service
public class ScheduleRunHandler {

    private static final Logger log = LoggerFactory.getLogger(ScheduleRunHandler.class);

    static final String FLOW_NOT_FOUND = "Flow not found";
    private static final int MAX_ERROR_LENGTH = 4000;

    private final ScheduleRepository repo;
    private final FlowRunnerClient flowRunner;
    private final TriggerCalculator calculator;
    private final JobRegistry registry;
    private final Clock clock;

    public ScheduleRunHandler(ScheduleRepository repo, FlowRunnerClient flowRunner, TriggerCalculator calculator,
                              JobRegistry registry, Clock clock) {
        this.repo = repo;
        this.flowRunner = flowRunner;
        this.calculator = calculator;
        this.registry = registry;
        this.clock = clock;
    }

    public void fire(JobEntry entry) {
        UUID id = entry.scheduleId();
        boolean executed = false;
        try {
            Schedule schedule = repo.findById(id).orElse(null);
            if (schedule == null || !schedule.isActive()) {
                log.warn("Schedule {} not found or not active, dropping firing", id);
                return;
            }

            Optional<FlowSummary> flow;
            try {
                flow = flowRunner.findFlow(schedule.getFlowId());
            } catch (RestClientException e) {
                log.error("Flow lookup failed for schedule {}: {}", id, e.getMessage());
                repo.recordRun(id, LastRunStatus.ERROR, truncate(e.getMessage()), clock.instant());
                rearm(id, clock.instant());
                return;
            }
            if (flow.isEmpty()) {
                log.error("Flow {} not found for schedule {}", schedule.getFlowId(), id);
                repo.recordRun(id, LastRunStatus.ERROR, FLOW_NOT_FOUND, clock.instant());
                rearm(id, clock.instant());
                return;
            }

            log.info("Executing scheduled flow: {} (Schedule: {})", flow.get().name(), id);
            repo.markRunning(id, clock.instant());

            executed = true;
            LastRunStatus outcome;
            String error = null;
            try {
                flowRunner.runFlow(schedule.getFlowId(), id);
                outcome = LastRunStatus.SUCCESS;
                log.info("Successfully executed flow: {}", flow.get().name());
            } catch (RuntimeException e) {
                outcome = LastRunStatus.FAILED;
                error = truncate(String.valueOf(e.getMessage()));
                log.error("Failed to execute flow {}: {}", flow.get().name(), e.getMessage(), e);
            }

            Instant finishedAt = clock.instant();
            repo.recordOutcome(id, outcome, error, finishedAt);
            if (entry.trigger().isOneShot()) {
                repo.markCompleted(id, finishedAt);
                registry.remove(id);
                log.info("One-shot schedule {} completed", id);
                return;
            }
            rearm(id, finishedAt);
        } catch (DataAccessException e) {
            log.error("Store failure while firing schedule {}; run treated as failed", id, e);
            rearmAfterStoreFailure(entry, executed);
        }
    }

    public void recordMisfire(JobEntry next) {
        try {
            repo.updateNextRun(next.scheduleId(), next.fireAt(), clock.instant());
        } catch (DataAccessException e) {
            log.warn("Could not persist next run {} of schedule {}", next.fireAt(), next.scheduleId(), e);
        }
    }

    // The fired entry was drained at dispatch, so an entry present now was installed
    // by the API during the run and is newer than anything derived here.
    private void rearm(UUID id, Instant now) {
        Schedule fresh = repo.findById(id).orElse(null);
        if (fresh == null || !fresh.isActive()) {
            log.debug("Schedule {} left ACTIVE during its run, not re-armed", id);
            return;
        }
        Recurrence recurrence = calculator.recurrenceOf(fresh);
        Instant next = recurrence.nextAfter(now);
        if (!registry.addIfAbsent(new JobEntry(id, recurrence, next))) {
            log.debug("Schedule {} was re-registered during its run, keeping that entry", id);
            return;
        }
        repo.updateNextRun(id, next, now);
        log.debug("Schedule {} next run at {}", id, next);
    }

    private void rearmAfterStoreFailure(JobEntry entry, boolean executed) {
        if (executed && entry.trigger().isOneShot()) {
            try {
                repo.markCompleted(entry.scheduleId(), clock.instant());
            } catch (DataAccessException e) {
                log.error("One-shot schedule {} ran but could not be marked COMPLETED; the registry audit will retry",
                        entry.scheduleId(), e);
            }
            return;
        }
        try {
            registry.addIfAbsent(entry.next(clock.instant()));
        } catch (RuntimeException e) {
            log.error("Could not re-arm schedule {}", entry.scheduleId(), e);
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
