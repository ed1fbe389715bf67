package dev.rocksscheduler.event;

import dev.rocksscheduler.api.ScheduledJob;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of {@link SchedulerEventListener}s. Events are delivered synchronously, in
 * registration order, on the thread that fires them.
 */
public final class SchedulerEvents {
    private final List<SchedulerEventListener> listeners = new CopyOnWriteArrayList<>();

    public SchedulerEvents listen(SchedulerEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
        return this;
    }

    public boolean stopListening(SchedulerEventListener listener) {
        return listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void fireAfterSchedule(Instant at, ScheduledJob job) {
        for (SchedulerEventListener listener : listeners) {
            listener.afterSchedule(at, job);
        }
    }

    public void fireBeforeDelayedEnqueue(ScheduledJob job) {
        for (SchedulerEventListener listener : listeners) {
            listener.beforeDelayedEnqueue(job.queue(), job.taskId(), job.args());
        }
    }
}
