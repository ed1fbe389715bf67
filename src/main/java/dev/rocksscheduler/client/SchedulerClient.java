package dev.rocksscheduler.client;

import dev.rocksscheduler.api.Horizon;
import dev.rocksscheduler.api.ScheduledJob;
import dev.rocksscheduler.api.TimestampStore;
import dev.rocksscheduler.config.SchedulerConfig;
import dev.rocksscheduler.core.RocksReadyQueue;
import dev.rocksscheduler.core.RocksTimestampStore;
import dev.rocksscheduler.event.SchedulerEventListener;
import dev.rocksscheduler.event.SchedulerEvents;
import dev.rocksscheduler.worker.DelayedDispatchWorker;
import dev.rocksscheduler.worker.ShutdownCoordinator;
import dev.rocksscheduler.worker.SignalRegistrar;
import dev.rocksscheduler.worker.WorkerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * SchedulerClient owns the delayed store and the ready queues under one base path and is the
 * entry point for producers scheduling work and for wiring workers.
 *
 * <p><strong>Usage Pattern:</strong>
 * <pre>{@code
 * try (SchedulerClient client = new SchedulerClient(new SchedulerConfig().setBasePath("/var/lib/scheduler"))) {
 *     // 1. Producers schedule jobs
 *     client.enqueueIn(Duration.ofMinutes(10), "emails", "SendReminder", 42);
 *
 *     // 2. A worker process drains due jobs into the ready queues
 *     client.newWorker().run(client.config().getPollInterval());
 * }
 *
 * // 3. Consumers take jobs from the ready queues
 * Optional<ScheduledJob> job = client.readyQueue().pop("emails");
 * }</pre>
 */
public class SchedulerClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SchedulerClient.class);

    private final SchedulerConfig config;
    private final TimestampStore store;
    private final RocksReadyQueue readyQueue;
    private final SchedulerEvents events;
    private final Clock clock;

    public SchedulerClient(SchedulerConfig config) {
        this(config, Clock.systemUTC());
    }

    public SchedulerClient(SchedulerConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.events = new SchedulerEvents();
        this.store = new RocksTimestampStore(config, clock);
        try {
            this.readyQueue = new RocksReadyQueue(config);
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
    }

    /**
     * Schedules a job to be moved to {@code queue} once {@code at} has passed.
     *
     * @param at     due time; sub-second parts are dropped
     * @param queue  destination queue name
     * @param taskId task identifier
     * @param args   task arguments, passed through unmodified
     * @throws IllegalArgumentException if queue or task identifier is empty, or {@code at} is before the epoch
     */
    public void enqueueAt(Instant at, String queue, String taskId, Object... args) {
        Objects.requireNonNull(at, "at cannot be null");
        ScheduledJob job = ScheduledJob.of(queue, taskId, args);
        store.schedule(at, job);
        events.fireAfterSchedule(at, job);
    }

    /**
     * Schedules a job to be moved to {@code queue} after {@code delay}.
     */
    public void enqueueIn(Duration delay, String queue, String taskId, Object... args) {
        Objects.requireNonNull(delay, "delay cannot be null");
        enqueueAt(clock.instant().plus(delay), queue, taskId, args);
    }

    /**
     * @return the number of distinct due timestamps still holding jobs
     */
    public long delayedQueueScheduleSize() {
        return store.scheduleSize();
    }

    /**
     * @return the number of jobs pending at exactly {@code at}
     */
    public long delayedTimestampSize(Instant at) {
        return store.timestampSize(at);
    }

    /**
     * Removes every pending copy of a job, whatever its due time.
     *
     * @return the number of jobs removed
     */
    public int removeDelayed(String queue, String taskId, Object... args) {
        return store.remove(ScheduledJob.of(queue, taskId, args));
    }

    /**
     * Removes pending copies of a job due at exactly {@code at}.
     *
     * @return the number of jobs removed
     */
    public int removeDelayedJobFromTimestamp(Instant at, String queue, String taskId, Object... args) {
        return store.removeFromTimestamp(at, ScheduledJob.of(queue, taskId, args));
    }

    public Optional<Instant> nextDelayedTimestamp(Horizon horizon) {
        return store.nextDueTimestamp(horizon);
    }

    public Optional<ScheduledJob> nextItemForTimestamp(Instant at) {
        return store.popJob(at);
    }

    public SchedulerClient listen(SchedulerEventListener listener) {
        events.listen(listener);
        return this;
    }

    /**
     * Creates a worker draining this client's store into its ready queues. Signal handlers are
     * installed when the worker runs unless {@link SchedulerConfig#isHandleSignals()} is off.
     */
    public DelayedDispatchWorker newWorker() {
        ShutdownCoordinator shutdown = config.isHandleSignals()
                ? new ShutdownCoordinator()
                : new ShutdownCoordinator(SignalRegistrar.NONE);
        return new DelayedDispatchWorker(store, readyQueue, events, shutdown,
                WorkerIdentity.current(), config.getZoneId());
    }

    public RocksReadyQueue readyQueue() {
        return readyQueue;
    }

    public TimestampStore store() {
        return store;
    }

    public SchedulerEvents events() {
        return events;
    }

    public SchedulerConfig config() {
        return config;
    }

    @Override
    public void close() {
        try {
            readyQueue.close();
        } finally {
            store.close();
        }
        logger.debug("SchedulerClient closed for base path {}", config.getBasePath());
    }
}
