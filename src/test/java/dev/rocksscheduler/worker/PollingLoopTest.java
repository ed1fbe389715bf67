package dev.rocksscheduler.worker;

import dev.rocksscheduler.api.DispatchSink;
import dev.rocksscheduler.api.ScheduledJob;
import dev.rocksscheduler.core.InMemoryTimestampStore;
import dev.rocksscheduler.event.SchedulerEvents;
import dev.rocksscheduler.testing.RecordingSink;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PollingLoopTest {

    private final InMemoryTimestampStore store = new InMemoryTimestampStore();

    /**
     * Worker that counts its idle periods.
     */
    static class CountingWorker extends DelayedDispatchWorker {
        final AtomicInteger sleeps = new AtomicInteger();

        CountingWorker(InMemoryTimestampStore store, DispatchSink sink, ShutdownCoordinator shutdown) {
            super(store, sink, new SchedulerEvents(), shutdown, new WorkerIdentity("loop-host", 7L), ZoneId.of("UTC"));
        }

        @Override
        protected void sleep(Duration interval) {
            sleeps.incrementAndGet();
            super.sleep(interval);
        }
    }

    private Thread start(DelayedDispatchWorker worker, Duration interval, AtomicReference<Throwable> failure) {
        Thread thread = new Thread(() -> {
            try {
                worker.run(interval);
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "polling-loop-test");
        thread.start();
        return thread;
    }

    @Test
    void shutdownDuringFirstDrain_completesDrainAndExitsWithoutSleeping() throws Exception {
        Instant past = Instant.now().minusSeconds(60);
        store.schedule(past, ScheduledJob.of("q", "First"));
        store.schedule(past, ScheduledJob.of("q", "Second"));

        CountDownLatch inDrain = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RecordingSink recorder = new RecordingSink();
        DispatchSink blocking = (queue, taskId, args) -> {
            inDrain.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            recorder.dispatch(queue, taskId, args);
        };
        CountingWorker worker = new CountingWorker(store, blocking, new ShutdownCoordinator(SignalRegistrar.NONE));
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread thread = start(worker, Duration.ofMillis(100), failure);
        assertTrue(inDrain.await(5, TimeUnit.SECONDS));
        worker.shutdown();
        worker.shutdown();
        release.countDown();
        thread.join(5000);

        assertFalse(thread.isAlive());
        assertNull(failure.get());
        assertEquals(List.of("First", "Second"), List.of(recorder.dispatched().get(0).taskId(), recorder.dispatched().get(1).taskId()));
        assertEquals(0, worker.sleeps.get());
        assertEquals(0, store.scheduleSize());
    }

    @Test
    void loopKeepsPollingUntilShutdown_andPicksUpNewWork() throws Exception {
        RecordingSink sink = new RecordingSink();
        CountingWorker worker = new CountingWorker(store, sink, new ShutdownCoordinator(SignalRegistrar.NONE));
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread thread = start(worker, Duration.ofMillis(20), failure);
        // let it idle through a few cycles, then hand it work
        long deadline = System.currentTimeMillis() + 5000;
        while (worker.sleeps.get() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        store.schedule(Instant.now().minusSeconds(1), ScheduledJob.of("q", "Late", "arg"));
        while (sink.dispatched().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        worker.shutdown();
        thread.join(5000);

        assertFalse(thread.isAlive());
        assertNull(failure.get());
        assertTrue(worker.sleeps.get() >= 3);
        assertEquals(List.of(ScheduledJob.of("q", "Late", "arg")), sink.dispatched());
    }

    @Test
    void shutdownBeforeStart_returnsWithoutDraining() {
        store.schedule(Instant.now().minusSeconds(1), ScheduledJob.of("q", "Pending"));
        RecordingSink sink = new RecordingSink();
        CountingWorker worker = new CountingWorker(store, sink, new ShutdownCoordinator(SignalRegistrar.NONE));
        worker.shutdown();

        worker.run(Duration.ofMillis(10));

        assertTrue(sink.dispatched().isEmpty());
        assertEquals(DelayedDispatchWorker.STATUS_STARTING, worker.status());
    }

    @Test
    void interruptWhileIdle_stopsTheLoop() throws Exception {
        CountingWorker worker = new CountingWorker(store, new RecordingSink(), new ShutdownCoordinator(SignalRegistrar.NONE));
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread thread = start(worker, Duration.ofSeconds(30), failure);
        long deadline = System.currentTimeMillis() + 5000;
        while (worker.sleeps.get() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        thread.interrupt();
        thread.join(5000);

        assertFalse(thread.isAlive());
        assertTrue(worker.isShutdownRequested());
    }

    @Test
    void storeFailure_escapesTheLoop() throws Exception {
        store.schedule(Instant.now().minusSeconds(1), ScheduledJob.of("q", "Doomed"));
        CountingWorker worker = new CountingWorker(store,
                (queue, taskId, args) -> { throw new IllegalStateException("ready queue unavailable"); },
                new ShutdownCoordinator(SignalRegistrar.NONE));

        assertThrows(IllegalStateException.class, () -> worker.run(Duration.ofMillis(10)));
        assertEquals(0, worker.sleeps.get());
    }

    @Test
    void negativeInterval_isRejected() {
        CountingWorker worker = new CountingWorker(store, new RecordingSink(), new ShutdownCoordinator(SignalRegistrar.NONE));
        assertThrows(IllegalArgumentException.class, () -> worker.run(Duration.ofMillis(-1)));
    }
}
