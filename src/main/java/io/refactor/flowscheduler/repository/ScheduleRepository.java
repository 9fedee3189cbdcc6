package io.refactor.flowscheduler.repository;

import io.refactor.flowscheduler.model.LastRunStatus;
import io.refactor.flowscheduler.model.Schedule;
import io.refactor.flowscheduler.model.ScheduleStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

// Bookkeeping updates touch only run-related columns so they never clobber an API edit.
public interface ScheduleRepository extends JpaRepository<Schedule, UUID> {

    List<Schedule> findByStatus(ScheduleStatus status);

    List<Schedule> findByUserId(UUID userId);

    List<Schedule> findByUserIdAndFlowId(UUID userId, UUID flowId);

    Optional<Schedule> findByIdAndUserId(UUID id, UUID userId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Schedule s SET s.lastRunAt = :at, s.lastRunStatus = :status, s.lastRunError = :error, s.updatedAt = :at WHERE s.id = :id")
    int recordRun(@Param("id") UUID id, @Param("status") LastRunStatus status, @Param("error") String error, @Param("at") Instant at);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Schedule s SET s.lastRunStatus = :status, s.lastRunError = :error, s.updatedAt = :at WHERE s.id = :id")
    int recordOutcome(@Param("id") UUID id, @Param("status") LastRunStatus status, @Param("error") String error, @Param("at") Instant at);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Schedule s SET s.nextRunAt = :next, s.updatedAt = :at WHERE s.id = :id AND s.status = :status")
    int updateNextRunIfStatus(@Param("id") UUID id, @Param("next") Instant next, @Param("status") ScheduleStatus status,
                              @Param("at") Instant at);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Schedule s SET s.status = :status, s.nextRunAt = null, s.updatedAt = :at WHERE s.id = :id")
    int updateStatus(@Param("id") UUID id, @Param("status") ScheduleStatus status, @Param("at") Instant at);

    default int markRunning(UUID id, Instant at) {
        return recordRun(id, LastRunStatus.RUNNING, null, at);
    }

    // a paused or completed row keeps nextRunAt null
    default int updateNextRun(UUID id, Instant next, Instant at) {
        return updateNextRunIfStatus(id, next, ScheduleStatus.ACTIVE, at);
    }

    default int markCompleted(UUID id, Instant at) {
        return updateStatus(id, ScheduleStatus.COMPLETED, at);
    }
}
