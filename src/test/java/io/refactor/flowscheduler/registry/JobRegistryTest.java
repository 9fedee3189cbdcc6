package io.refactor.flowscheduler.registry;

import io.refactor.flowscheduler.support.MutableClock;
import io.refactor.flowscheduler.trigger.Recurrence;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobRegistryTest {

    private static final Recurrence DAILY = new Recurrence.Daily(LocalTime.of(9, 0));

    private final JobRegistry registry = new JobRegistry();

    private static JobEntry entry(UUID id, String fireAt) {
        return new JobEntry(id, DAILY, Instant.parse(fireAt));
    }

    @Test
    void upsertReplacesInsteadOfDuplicating() {
        UUID id = UUID.randomUUID();
        assertTrue(registry.upsert(entry(id, "2026-10-20T09:00:00Z")).isEmpty());
        assertTrue(registry.upsert(entry(id, "2026-10-21T09:00:00Z")).isPresent());

        assertEquals(1, registry.size());
        assertEquals(Instant.parse("2026-10-21T09:00:00Z"), registry.get(id).orElseThrow().fireAt());
        // the replaced fire time must not linger in the queue
        assertTrue(registry.pollDue(Instant.parse("2026-10-20T12:00:00Z")).isEmpty());
    }

    @Test
    void removeDistinguishesMissingEntries() {
        UUID id = UUID.randomUUID();
        registry.upsert(entry(id, "2026-10-20T09:00:00Z"));

        assertEquals(RemovalResult.REMOVED, registry.remove(id));
        assertEquals(RemovalResult.NOT_PRESENT, registry.remove(id));
        assertEquals(0, registry.size());
        assertTrue(registry.nextFireTime().isEmpty());
    }

    @Test
    void addIfAbsentKeepsExistingEntry() {
        UUID id = UUID.randomUUID();
        registry.upsert(entry(id, "2026-10-20T09:00:00Z"));

        assertFalse(registry.addIfAbsent(entry(id, "2026-10-25T09:00:00Z")));
        assertEquals(Instant.parse("2026-10-20T09:00:00Z"), registry.get(id).orElseThrow().fireAt());
    }

    @Test
    void pollDueReturnsDueEntriesEarliestFirstAndRemovesThem() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        UUID c = UUID.randomUUID();
        registry.upsert(entry(a, "2026-10-20T09:05:00Z"));
        registry.upsert(entry(b, "2026-10-20T09:00:00Z"));
        registry.upsert(entry(c, "2026-10-20T10:00:00Z"));

        List<JobEntry> due = registry.pollDue(Instant.parse("2026-10-20T09:05:00Z"));

        assertEquals(List.of(b, a), due.stream().map(JobEntry::scheduleId).toList());
        assertEquals(1, registry.size());
        assertTrue(registry.contains(c));
        assertEquals(Instant.parse("2026-10-20T10:00:00Z"), registry.nextFireTime().orElseThrow());
    }

    @Test
    void snapshotIsOrderedByFireTime() {
        UUID late = UUID.randomUUID();
        UUID early = UUID.randomUUID();
        registry.upsert(entry(late, "2026-11-01T00:00:00Z"));
        registry.upsert(entry(early, "2026-10-01T00:00:00Z"));

        assertEquals(List.of(early, late), registry.snapshot().stream().map(JobEntry::scheduleId).toList());
    }

    @Test
    void inFlightMarksAreExclusive() {
        UUID id = UUID.randomUUID();
        assertTrue(registry.markInFlight(id));
        assertFalse(registry.markInFlight(id));
        assertTrue(registry.isInFlight(id));
        registry.clearInFlight(id);
        assertFalse(registry.isInFlight(id));
        assertTrue(registry.markInFlight(id));
    }

    @Test
    void awaitDueReturnsImmediatelyWhenSomethingIsDue() throws Exception {
        MutableClock clock = MutableClock.at("2026-10-20T09:00:00Z");
        UUID id = UUID.randomUUID();
        registry.upsert(entry(id, "2026-10-20T08:59:00Z"));

        List<JobEntry> due = registry.awaitDue(clock);

        assertEquals(1, due.size());
        assertEquals(id, due.get(0).scheduleId());
    }

    @Test
    void awaitDueWakesUpWhenAnEarlierEntryIsAdded() throws Exception {
        MutableClock clock = MutableClock.at("2026-10-20T09:00:00Z");
        registry.upsert(entry(UUID.randomUUID(), "2026-10-21T09:00:00Z"));

        CompletableFuture<List<JobEntry>> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return registry.awaitDue(clock);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        assertFalse(waiter.isDone());

        UUID urgent = UUID.randomUUID();
        registry.upsert(entry(urgent, "2026-10-20T09:00:00Z"));

        List<JobEntry> due = waiter.get(2, TimeUnit.SECONDS);
        assertEquals(List.of(urgent), due.stream().map(JobEntry::scheduleId).toList());
    }

    @Test
    void wakeUpReleasesAWaitingThread() throws Exception {
        MutableClock clock = MutableClock.at("2026-10-20T09:00:00Z");

        CompletableFuture<List<JobEntry>> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return registry.awaitDue(clock);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        registry.wakeUp();

        assertTrue(waiter.get(2, TimeUnit.SECONDS).isEmpty());
    }
}
