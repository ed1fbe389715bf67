package dev.rocksscheduler.event;

import dev.rocksscheduler.api.ScheduledJob;

import java.time.Instant;
import java.util.List;

/**
 * Observer for scheduler lifecycle events. Both callbacks are notifications: their outcome
 * never changes what the scheduler does, but an exception thrown from a callback propagates
 * to the caller that fired the event.
 */
public interface SchedulerEventListener {

    /**
     * Called after a job has been stored for later dispatch.
     *
     * @param at  the due time the job was stored under
     * @param job the stored job
     */
    default void afterSchedule(Instant at, ScheduledJob job) {
    }

    /**
     * Called when a due job has been popped and is about to be handed to its ready queue.
     *
     * @param queue  destination queue
     * @param taskId task identifier
     * @param args   the job's arguments, unmodifiable
     */
    default void beforeDelayedEnqueue(String queue, String taskId, List<Object> args) {
    }

    /**
     * Creates a listener with only a {@link #beforeDelayedEnqueue} callback.
     */
    static SchedulerEventListener onBeforeDelayedEnqueue(BeforeEnqueue callback) {
        return new SchedulerEventListener() {
            @Override
            public void beforeDelayedEnqueue(String queue, String taskId, List<Object> args) {
                callback.accept(queue, taskId, args);
            }
        };
    }

    @FunctionalInterface
    interface BeforeEnqueue {
        void accept(String queue, String taskId, List<Object> args);
    }
}
