package io.refactor.flowscheduler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Repopulates the job registry from the store once the application is up. If the
 * store is unreachable at that point, {@link RegistryAuditJob} restores the entries
 * on a later pass.
 */
@Component
public class SchedulerBootstrap implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SchedulerBootstrap.class);

    private final SchedulerService scheduler;

    public SchedulerBootstrap(SchedulerService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            scheduler.reconcileOnStartup();
        } catch (DataAccessException e) {
            log.warn("Startup reconcile skipped, store unavailable; the registry audit will restore schedules", e);
        }
    }
}
