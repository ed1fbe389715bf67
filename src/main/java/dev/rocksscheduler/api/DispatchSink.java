package dev.rocksscheduler.api;

/**
 * Immediate-execution side of the scheduler: accepts a job that is now eligible to run.
 *
 * <p>The job's arguments are passed positionally after the queue name and task identifier.
 * Implementations signal a rejected job by throwing an unchecked exception.
 */
@FunctionalInterface
public interface DispatchSink {
    void dispatch(String queue, String taskId, Object... args);
}
