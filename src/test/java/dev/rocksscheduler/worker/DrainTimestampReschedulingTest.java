package dev.rocksscheduler.worker;

import dev.rocksscheduler.api.Horizon;
import dev.rocksscheduler.api.ScheduledJob;
import dev.rocksscheduler.api.TimestampStore;
import dev.rocksscheduler.config.SchedulerConfig;
import dev.rocksscheduler.core.InMemoryTimestampStore;
import dev.rocksscheduler.core.RocksTimestampStore;
import dev.rocksscheduler.event.SchedulerEventListener;
import dev.rocksscheduler.event.SchedulerEvents;
import dev.rocksscheduler.testing.MutableClock;
import dev.rocksscheduler.testing.RecordingSink;
import dev.rocksscheduler.testing.TempDirs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Jobs added to a timestamp while that timestamp is being drained are dispatched by the same
 * drain, exactly once.
 */
class DrainTimestampReschedulingTest {

    private static final long NOW = 1_700_000_000L;

    private final MutableClock clock = MutableClock.startingAtSecond(NOW);
    private TimestampStore store;
    private Path tmp;

    @AfterEach
    void tearDown() {
        if (store != null) store.close();
        TempDirs.deleteQuietly(tmp);
    }

    @Test
    void inMemoryStore() {
        store = new InMemoryTimestampStore(clock);
        assertFollowUpDispatchedOnce(store);
    }

    @Test
    void rocksStore() throws Exception {
        tmp = Files.createTempDirectory("rocksscheduler-resched-");
        store = new RocksTimestampStore(new SchedulerConfig().setBasePath(tmp.toString()), clock);
        assertFollowUpDispatchedOnce(store);
    }

    private void assertFollowUpDispatchedOnce(TimestampStore store) {
        Instant ts = Instant.ofEpochSecond(NOW - 30);
        store.schedule(ts, ScheduledJob.of("q", "Original", 1));

        RecordingSink sink = new RecordingSink();
        AtomicBoolean added = new AtomicBoolean(false);
        SchedulerEvents events = new SchedulerEvents().listen(SchedulerEventListener.onBeforeDelayedEnqueue(
                (queue, taskId, args) -> {
                    if (added.compareAndSet(false, true)) {
                        store.schedule(ts, ScheduledJob.of("q", "FollowUp", 2));
                    }
                }));
        DelayedDispatchWorker worker = new DelayedDispatchWorker(store, sink, events,
                new ShutdownCoordinator(SignalRegistrar.NONE), new WorkerIdentity("test-host", 1L), ZoneId.of("UTC"));

        assertEquals(2, worker.drainTimestamp(ts));

        assertEquals(List.of(ScheduledJob.of("q", "Original", 1), ScheduledJob.of("q", "FollowUp", 2)),
                sink.dispatched());
        assertEquals(0, store.timestampSize(ts));
        assertEquals(0, store.scheduleSize());
        assertEquals(Optional.empty(), store.nextDueTimestamp(Horizon.now()));
        assertEquals(0, worker.drainDue(Horizon.now()));
    }
}
