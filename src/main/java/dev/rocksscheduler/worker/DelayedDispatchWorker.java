package dev.rocksscheduler.worker;

import dev.rocksscheduler.api.DispatchSink;
import dev.rocksscheduler.api.Horizon;
import dev.rocksscheduler.api.ScheduledJob;
import dev.rocksscheduler.api.TimestampStore;
import dev.rocksscheduler.event.SchedulerEvents;
import dev.rocksscheduler.ser.JsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Moves delayed jobs into their ready queues once they are due.
 *
 * <p>{@link #run(Duration)} repeats a drain cycle followed by a fixed sleep until shutdown is
 * requested. A drain cycle ({@link #drainDue(Horizon)}) empties every due timestamp, earliest
 * first, and each timestamp ({@link #drainTimestamp(Instant)}) is emptied completely before the
 * store is asked for the next one. For every popped job the worker logs it, fires
 * {@code beforeDelayedEnqueue} and hands it to the {@link DispatchSink}.
 *
 * <p>Failures from the store, a listener or the sink are not caught here. A job that was popped
 * but not accepted by the sink is lost unless the sink is durable; callers are expected to let
 * the process die and be restarted.
 *
 * <p>A worker is driven by a single thread. Several workers may share one store: each popped
 * job goes to exactly one of them.
 */
public class DelayedDispatchWorker {
    private static final Logger logger = LoggerFactory.getLogger(DelayedDispatchWorker.class);
    private static final Marker NOTICE = MarkerFactory.getMarker("NOTICE");

    public static final String VERSION = "1.0.0";
    public static final String STATUS_STARTING = "Starting";
    public static final String STATUS_PROCESSING = "Processing Delayed Items";

    private static final DateTimeFormatter DUE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final TimestampStore store;
    private final DispatchSink sink;
    private final SchedulerEvents events;
    private final ShutdownCoordinator shutdown;
    private final WorkerIdentity identity;
    private final DateTimeFormatter dueFormat;

    private volatile String status = "Idle";
    private volatile Thread runner;

    public DelayedDispatchWorker(TimestampStore store, DispatchSink sink, SchedulerEvents events) {
        this(store, sink, events, new ShutdownCoordinator(), WorkerIdentity.current(), ZoneId.systemDefault());
    }

    /**
     * @param store    source of delayed jobs
     * @param sink     destination for due jobs
     * @param events   listeners notified before each dispatch
     * @param shutdown coordinator owning the shutdown flag and signal handlers
     * @param identity identity shown in logs and status
     * @param zone     zone used to render due times in log lines
     */
    public DelayedDispatchWorker(TimestampStore store,
                                 DispatchSink sink,
                                 SchedulerEvents events,
                                 ShutdownCoordinator shutdown,
                                 WorkerIdentity identity,
                                 ZoneId zone) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.sink = Objects.requireNonNull(sink, "sink cannot be null");
        this.events = Objects.requireNonNull(events, "events cannot be null");
        this.shutdown = Objects.requireNonNull(shutdown, "shutdown cannot be null");
        this.identity = Objects.requireNonNull(identity, "identity cannot be null");
        this.dueFormat = DUE_FORMAT.withZone(Objects.requireNonNull(zone, "zone cannot be null"));
    }

    /**
     * The primary loop. Every {@code interval} the store is checked for due jobs, which are
     * pushed to their ready queues. Blocks until shutdown is requested; a cycle in progress
     * always completes first.
     *
     * @param interval idle time between drain cycles, sub-second precision honoured
     * @throws IllegalArgumentException if the interval is negative
     */
    public void run(Duration interval) {
        Objects.requireNonNull(interval, "interval cannot be null");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be >= 0");
        }

        Thread thread = Thread.currentThread();
        String originalName = thread.getName();
        runner = thread;
        MDC.put("worker", identity.toString());
        try {
            updateStatus(STATUS_STARTING);
            shutdown.install();
            logger.info(NOTICE, "Starting delayed dispatch worker {} (interval {} ms)", identity, interval.toMillis());

            while (!shutdown.isShutdownRequested()) {
                drainDue(Horizon.now());
                if (shutdown.isShutdownRequested()) {
                    break;
                }
                sleep(interval);
            }

            logger.info(NOTICE, "Worker {} stopped", identity);
        } finally {
            shutdown.close();
            runner = null;
            thread.setName(originalName);
            MDC.remove("worker");
        }
    }

    /**
     * Dispatches every job due at or before {@code horizon}, timestamp by timestamp. With an
     * unset horizon the store re-reads the clock on every query, so timestamps that become due
     * while draining are included in the same call.
     *
     * @return the number of jobs dispatched
     */
    public int drainDue(Horizon horizon) {
        Objects.requireNonNull(horizon, "horizon cannot be null");
        int dispatched = 0;
        Optional<Instant> next;
        while ((next = store.nextDueTimestamp(horizon)).isPresent()) {
            updateStatus(STATUS_PROCESSING);
            dispatched += drainTimestamp(next.get());
        }
        return dispatched;
    }

    /**
     * Pops every job stored at exactly {@code timestamp} and pushes it to its ready queue.
     *
     * @return the number of jobs dispatched
     */
    public int drainTimestamp(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        int dispatched = 0;
        Optional<ScheduledJob> popped;
        while ((popped = store.popJob(timestamp)).isPresent()) {
            ScheduledJob job = popped.get();

            logger.info(NOTICE, "Queueing {} scheduled to {} in {} queue with args {}",
                    job.taskId(), dueFormat.format(timestamp), job.queue(), JsonSerializer.toJson(job.args()));

            events.fireBeforeDelayedEnqueue(job);
            sink.dispatch(job.queue(), job.taskId(), job.args().toArray());
            dispatched++;
        }
        return dispatched;
    }

    /**
     * Asks the loop to stop after the current cycle. Same effect as a termination signal.
     */
    public void shutdown() {
        shutdown.requestShutdown();
    }

    public boolean isShutdownRequested() {
        return shutdown.isShutdownRequested();
    }

    /**
     * @return the last recorded phase, for monitoring
     */
    public String status() {
        return status;
    }

    public WorkerIdentity identity() {
        return identity;
    }

    /**
     * Sleeps for the interval. An interrupt is treated as a shutdown request.
     */
    protected void sleep(Duration interval) {
        try {
            TimeUnit.NANOSECONDS.sleep(interval.toNanos());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info(NOTICE, "Interrupted while idle");
            shutdown.requestShutdown();
        }
    }

    /**
     * Records the phase. Inside {@link #run(Duration)} it is mirrored in the loop thread's name,
     * where thread dumps and JVM monitoring tools show it.
     */
    private void updateStatus(String newStatus) {
        status = newStatus;
        Thread current = Thread.currentThread();
        if (current == runner) {
            current.setName("rocks-scheduler-" + VERSION + ": " + newStatus);
        }
    }

    @Override
    public String toString() {
        return identity.toString();
    }
}
