package io.refactor.flowscheduler.service;

import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RegistryAuditJob {
    private static final Logger log = LoggerFactory.getLogger(RegistryAuditJob.class);

    private final SchedulerService scheduler;

    public RegistryAuditJob(SchedulerService scheduler) {
        this.scheduler = scheduler;
    }

    @Scheduled(fixedDelayString = "${flow-scheduler.audit-interval-ms:60000}",
            initialDelayString = "${flow-scheduler.audit-initial-delay-ms:60000}")
    @SchedulerLock(name = "schedule-registry-audit", lockAtMostFor = "PT2M", lockAtLeastFor = "PT1S")
    public void audit() {
        try {
            SchedulerService.AuditResult result = scheduler.audit();
            if (result.stale() > 0 || result.restored() > 0) {
                log.info("Registry audit: dropped {} stale entries, restored {}", result.stale(), result.restored());
            }
        } catch (DataAccessException e) {
            log.warn("Registry audit skipped, store unavailable: {}", e.getMessage());
        }
    }
}
