package dev.rocksscheduler.core;

import dev.rocksscheduler.api.Horizon;
import dev.rocksscheduler.api.ScheduledJob;
import dev.rocksscheduler.api.TimestampStore;
import dev.rocksscheduler.ser.JsonSerializer;
import dev.rocksscheduler.ser.Serializer;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Simple in-memory timestamp store backed by a sorted map of per-second deques.
 * Nothing survives the process; intended for tests and embedded use.
 *
 * <p>Removal matches jobs on their JSON form, the same way the RocksDB store compares stored
 * bytes, so {@code 42} and {@code 42L} name the same job.
 */
public final class InMemoryTimestampStore implements TimestampStore {
    private final TreeMap<Long, Deque<ScheduledJob>> bySecond = new TreeMap<>();
    private final Clock clock;
    private final Serializer<ScheduledJob> serializer = new JsonSerializer<>(ScheduledJob.class);
    private boolean closed;

    public InMemoryTimestampStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTimestampStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public synchronized void schedule(Instant at, ScheduledJob job) {
        Objects.requireNonNull(at, "at cannot be null");
        Objects.requireNonNull(job, "job cannot be null");
        ensureOpen();
        if (at.getEpochSecond() < 0) {
            throw new IllegalArgumentException("at must not be before the epoch");
        }
        bySecond.computeIfAbsent(at.getEpochSecond(), s -> new ArrayDeque<>()).addLast(job);
    }

    @Override
    public synchronized Optional<Instant> nextDueTimestamp(Horizon horizon) {
        Objects.requireNonNull(horizon, "horizon cannot be null");
        ensureOpen();
        Long first = firstSecond();
        if (first == null || first > horizon.resolve(clock).getEpochSecond()) {
            return Optional.empty();
        }
        return Optional.of(Instant.ofEpochSecond(first));
    }

    @Override
    public synchronized Optional<ScheduledJob> popJob(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        ensureOpen();
        Deque<ScheduledJob> jobs = bySecond.get(timestamp.getEpochSecond());
        if (jobs == null) {
            return Optional.empty();
        }
        ScheduledJob job = jobs.pollFirst();
        if (jobs.isEmpty()) {
            bySecond.remove(timestamp.getEpochSecond());
        }
        return Optional.ofNullable(job);
    }

    @Override
    public synchronized long scheduleSize() {
        ensureOpen();
        return bySecond.size();
    }

    @Override
    public synchronized long timestampSize(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        ensureOpen();
        Deque<ScheduledJob> jobs = bySecond.get(timestamp.getEpochSecond());
        return jobs == null ? 0 : jobs.size();
    }

    @Override
    public synchronized int remove(ScheduledJob job) {
        Objects.requireNonNull(job, "job cannot be null");
        ensureOpen();
        int removed = 0;
        Iterator<Map.Entry<Long, Deque<ScheduledJob>>> it = bySecond.entrySet().iterator();
        while (it.hasNext()) {
            Deque<ScheduledJob> jobs = it.next().getValue();
            removed += removeAll(jobs, job);
            if (jobs.isEmpty()) {
                it.remove();
            }
        }
        return removed;
    }

    @Override
    public synchronized int removeFromTimestamp(Instant timestamp, ScheduledJob job) {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(job, "job cannot be null");
        ensureOpen();
        Deque<ScheduledJob> jobs = bySecond.get(timestamp.getEpochSecond());
        if (jobs == null) {
            return 0;
        }
        int removed = removeAll(jobs, job);
        if (jobs.isEmpty()) {
            bySecond.remove(timestamp.getEpochSecond());
        }
        return removed;
    }

    @Override
    public synchronized void close() {
        closed = true;
        bySecond.clear();
    }

    private Long firstSecond() {
        return bySecond.isEmpty() ? null : bySecond.firstKey();
    }

    private int removeAll(Deque<ScheduledJob> jobs, ScheduledJob job) {
        byte[] target = serializer.serialize(job);
        int before = jobs.size();
        jobs.removeIf(candidate -> Arrays.equals(target, serializer.serialize(candidate)));
        return before - jobs.size();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Store is closed");
        }
    }
}
