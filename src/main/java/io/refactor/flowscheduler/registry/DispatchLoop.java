package io.refactor.flowscheduler.registry;

import io.refactor.flowscheduler.service.ScheduleRunHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Single timer authority of the process. An entry observed later than the misfire
 * grace window, or whose schedule still has a run in flight, is skipped and re-armed
 * to its next regular occurrence.
 */
public class DispatchLoop {

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private final JobRegistry registry;
    private final ScheduleRunHandler handler;
    private final ExecutorService workers;
    private final Clock clock;
    private final Duration misfireGrace;

    private volatile boolean running;
    private Thread thread;

    public DispatchLoop(JobRegistry registry, ScheduleRunHandler handler, ExecutorService workers,
                        Clock clock, Duration misfireGrace) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.misfireGrace = Objects.requireNonNull(misfireGrace, "misfireGrace");
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this::run, "schedule-dispatch");
        thread.setDaemon(true);
        thread.start();
        log.info("Schedule dispatch loop started (misfire grace {})", misfireGrace);
    }

    public synchronized void shutdown() {
        running = false;
        registry.wakeUp();
        if (thread != null) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            thread = null;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Schedule workers still busy after 30s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Schedule dispatch loop stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void run() {
        while (running) {
            try {
                dispatch(registry.awaitDue(clock));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Dispatch cycle failed, continuing", e);
            }
        }
    }

    public void dispatchDue() {
        dispatch(registry.pollDue(clock.instant()));
    }

    void dispatch(List<JobEntry> due) {
        if (due.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        for (JobEntry entry : due) {
            Duration lateness = Duration.between(entry.fireAt(), now);
            if (lateness.compareTo(misfireGrace) > 0) {
                log.warn("Schedule {} misfired: due at {}, observed {} late; skipping occurrence",
                        entry.scheduleId(), entry.fireAt(), lateness);
                rearm(entry, now);
                continue;
            }
            if (!registry.markInFlight(entry.scheduleId())) {
                log.warn("Schedule {} is still running; skipping occurrence due at {}",
                        entry.scheduleId(), entry.fireAt());
                rearm(entry, now);
                continue;
            }
            try {
                workers.execute(() -> fire(entry));
            } catch (RejectedExecutionException e) {
                registry.clearInFlight(entry.scheduleId());
                log.warn("Worker pool rejected schedule {}; skipping occurrence", entry.scheduleId(), e);
                rearm(entry, now);
            }
        }
    }

    private void fire(JobEntry entry) {
        try {
            handler.fire(entry);
        } catch (RuntimeException e) {
            log.error("Unhandled error firing schedule {}", entry.scheduleId(), e);
        } finally {
            registry.clearInFlight(entry.scheduleId());
        }
    }

    private void rearm(JobEntry entry, Instant now) {
        JobEntry next;
        try {
            next = entry.next(now);
        } catch (RuntimeException e) {
            log.error("Cannot compute next occurrence of schedule {}; entry retired", entry.scheduleId(), e);
            return;
        }
        // an API upsert that raced with this dispatch has already installed a fresher entry
        if (registry.addIfAbsent(next)) {
            try {
                workers.execute(() -> handler.recordMisfire(next));
            } catch (RejectedExecutionException e) {
                log.debug("Could not persist next run of schedule {}", entry.scheduleId(), e);
            }
        }
    }
}
