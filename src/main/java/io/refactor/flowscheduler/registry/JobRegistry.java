package io.refactor.flowscheduler.registry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory index of schedules awaiting their next fire time, at most one entry per
 * schedule. Every mutation signals the dispatch thread blocked in {@link #awaitDue}.
 */
public class JobRegistry {

    // upper bound on a single wait so wall-clock adjustments are noticed
    private static final Duration MAX_WAIT = Duration.ofSeconds(30);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<UUID, JobEntry> entries = new HashMap<>();
    private final PriorityQueue<JobEntry> queue = new PriorityQueue<>(
            Comparator.comparing(JobEntry::fireAt).thenComparing(JobEntry::scheduleId));
    private final Set<UUID> inFlight = new HashSet<>();
    private boolean wakeRequested;

    public Optional<JobEntry> upsert(JobEntry entry) {
        lock.lock();
        try {
            JobEntry previous = entries.put(entry.scheduleId(), entry);
            if (previous != null) {
                queue.remove(previous);
            }
            queue.add(entry);
            changed.signalAll();
            return Optional.ofNullable(previous);
        } finally {
            lock.unlock();
        }
    }

    public boolean addIfAbsent(JobEntry entry) {
        lock.lock();
        try {
            if (entries.containsKey(entry.scheduleId())) {
                return false;
            }
            entries.put(entry.scheduleId(), entry);
            queue.add(entry);
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public RemovalResult remove(UUID scheduleId) {
        lock.lock();
        try {
            JobEntry previous = entries.remove(scheduleId);
            if (previous == null) {
                return RemovalResult.NOT_PRESENT;
            }
            queue.remove(previous);
            changed.signalAll();
            return RemovalResult.REMOVED;
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobEntry> get(UUID scheduleId) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(scheduleId));
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(UUID scheduleId) {
        return get(scheduleId).isPresent();
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public List<JobEntry> snapshot() {
        lock.lock();
        try {
            List<JobEntry> copy = new ArrayList<>(queue);
            copy.sort(queue.comparator());
            return copy;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> nextFireTime() {
        lock.lock();
        try {
            JobEntry head = queue.peek();
            return head == null ? Optional.empty() : Optional.of(head.fireAt());
        } finally {
            lock.unlock();
        }
    }

    public List<JobEntry> pollDue(Instant now) {
        lock.lock();
        try {
            return drainDue(now);
        } finally {
            lock.unlock();
        }
    }

    // empty when released by wakeUp()
    public List<JobEntry> awaitDue(Clock clock) throws InterruptedException {
        lock.lock();
        try {
            while (true) {
                if (wakeRequested) {
                    wakeRequested = false;
                    return List.of();
                }
                Instant now = clock.instant();
                JobEntry head = queue.peek();
                if (head == null) {
                    changed.await(MAX_WAIT.toMillis(), TimeUnit.MILLISECONDS);
                } else if (!head.fireAt().isAfter(now)) {
                    return drainDue(now);
                } else {
                    Duration wait = Duration.between(now, head.fireAt());
                    if (wait.compareTo(MAX_WAIT) > 0) {
                        wait = MAX_WAIT;
                    }
                    changed.awaitNanos(wait.toNanos());
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public void wakeUp() {
        lock.lock();
        try {
            wakeRequested = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean markInFlight(UUID scheduleId) {
        lock.lock();
        try {
            return inFlight.add(scheduleId);
        } finally {
            lock.unlock();
        }
    }

    public void clearInFlight(UUID scheduleId) {
        lock.lock();
        try {
            inFlight.remove(scheduleId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isInFlight(UUID scheduleId) {
        lock.lock();
        try {
            return inFlight.contains(scheduleId);
        } finally {
            lock.unlock();
        }
    }

    private List<JobEntry> drainDue(Instant now) {
        List<JobEntry> due = new ArrayList<>();
        while (!queue.isEmpty() && !queue.peek().fireAt().isAfter(now)) {
            JobEntry entry = queue.poll();
            entries.remove(entry.scheduleId());
            due.add(entry);
        }
        return due;
    }
}
