package io.refactor.flowscheduler.repository;

import io.refactor.flowscheduler.model.LastRunStatus;
import io.refactor.flowscheduler.model.Schedule;
import io.refactor.flowscheduler.model.ScheduleStatus;
import io.refactor.flowscheduler.support.Schedules;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class ScheduleRepositoryTest {

    private static final Instant AT = Instant.parse("2026-10-19T10:00:00Z");

    @Autowired
    private ScheduleRepository repo;

    @Test
    void findersScopeByOwnerFlowAndStatus() {
        Schedule a = Schedules.daily("09:00");
        Schedule b = Schedules.daily("10:00");
        b.setUserId(a.getUserId());
        Schedule paused = Schedules.daily("11:00");
        paused.setUserId(a.getUserId());
        paused.setFlowId(a.getFlowId());
        paused.setStatus(ScheduleStatus.PAUSED);
        repo.saveAll(List.of(a, b, paused));

        assertEquals(3, repo.findByUserId(a.getUserId()).size());
        assertEquals(2, repo.findByUserIdAndFlowId(a.getUserId(), a.getFlowId()).size());
        assertTrue(repo.findByIdAndUserId(a.getId(), a.getUserId()).isPresent());
        assertTrue(repo.findByIdAndUserId(a.getId(), UUID.randomUUID()).isEmpty());
        assertTrue(repo.findByStatus(ScheduleStatus.PAUSED).stream().anyMatch(s -> s.getId().equals(paused.getId())));
        assertTrue(repo.findByStatus(ScheduleStatus.ACTIVE).stream().noneMatch(s -> s.getId().equals(paused.getId())));
    }

    @Test
    void markRunningRecordsTheStartOfARun() {
        Schedule s = repo.save(Schedules.daily("09:00"));

        assertEquals(1, repo.markRunning(s.getId(), AT));

        Schedule stored = repo.findById(s.getId()).orElseThrow();
        assertEquals(LastRunStatus.RUNNING, stored.getLastRunStatus());
        assertEquals(AT, stored.getLastRunAt());
        assertNull(stored.getLastRunError());
    }

    @Test
    void recordOutcomeDoesNotClobberAConcurrentEdit() {
        Schedule s = repo.save(Schedules.daily("09:00"));
        repo.markRunning(s.getId(), AT);

        // edited through the API while the run was in flight
        Schedule edited = repo.findById(s.getId()).orElseThrow();
        edited.setScheduleTime("18:00");
        edited.setStatus(ScheduleStatus.PAUSED);
        repo.save(edited);

        repo.recordOutcome(s.getId(), LastRunStatus.FAILED, "boom", AT.plusSeconds(30));

        Schedule stored = repo.findById(s.getId()).orElseThrow();
        assertEquals("18:00", stored.getScheduleTime());
        assertEquals(ScheduleStatus.PAUSED, stored.getStatus());
        assertEquals(LastRunStatus.FAILED, stored.getLastRunStatus());
        assertEquals("boom", stored.getLastRunError());
        assertEquals(AT, stored.getLastRunAt());
        assertEquals(AT.plusSeconds(30), stored.getUpdatedAt());
    }

    @Test
    void markCompletedClearsTheNextRun() {
        Schedule s = Schedules.once("09:00");
        s.setNextRunAt(AT);
        repo.save(s);

        repo.markCompleted(s.getId(), AT);

        Schedule stored = repo.findById(s.getId()).orElseThrow();
        assertEquals(ScheduleStatus.COMPLETED, stored.getStatus());
        assertNull(stored.getNextRunAt());
    }

    @Test
    void updateNextRunTouchesOnlyTheNextRun() {
        Schedule s = repo.save(Schedules.weekly(3, "07:15"));
        Instant next = Instant.parse("2026-10-22T07:15:00Z");

        assertEquals(1, repo.updateNextRun(s.getId(), next, AT));
        assertEquals(0, repo.updateNextRun(UUID.randomUUID(), next, AT));

        Schedule stored = repo.findById(s.getId()).orElseThrow();
        assertEquals(next, stored.getNextRunAt());
        assertEquals(ScheduleStatus.ACTIVE, stored.getStatus());
        assertEquals(3, stored.getDayOfWeek());
    }

    @Test
    void updateNextRunLeavesPausedRowsAlone() {
        Schedule s = Schedules.daily("09:00");
        s.setStatus(ScheduleStatus.PAUSED);
        s.setNextRunAt(null);
        repo.save(s);

        assertEquals(0, repo.updateNextRun(s.getId(), Instant.parse("2026-10-20T09:00:00Z"), AT));

        Schedule stored = repo.findById(s.getId()).orElseThrow();
        assertNull(stored.getNextRunAt());
        assertEquals(ScheduleStatus.PAUSED, stored.getStatus());
    }
}
