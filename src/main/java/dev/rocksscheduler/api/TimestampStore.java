package dev.rocksscheduler.api;

import java.time.Instant;
import java.util.Optional;

/**
 * Time-ordered store of jobs that are not yet due.
 *
 * <p>Jobs are grouped by due timestamp (second resolution). Within a timestamp, jobs are popped
 * in insertion order. {@link #popJob(Instant)} removes a job atomically: concurrent callers
 * never receive the same job.
 */
public interface TimestampStore extends AutoCloseable {

    /**
     * Stores a job under the given due timestamp.
     *
     * @param at  due time, truncated to seconds
     * @param job the job to store
     * @throws IllegalArgumentException if {@code at} is before the epoch
     */
    void schedule(Instant at, ScheduledJob job);

    /**
     * Returns the earliest timestamp that still has pending jobs and is at or before the horizon.
     * An unset horizon is resolved against the store's clock on every call.
     */
    Optional<Instant> nextDueTimestamp(Horizon horizon);

    /**
     * Atomically removes and returns one job stored at exactly {@code timestamp}.
     *
     * @return the job, or empty once the timestamp is exhausted
     */
    Optional<ScheduledJob> popJob(Instant timestamp);

    /**
     * @return the number of distinct timestamps with pending jobs
     */
    long scheduleSize();

    /**
     * @return the number of jobs pending at exactly {@code timestamp}
     */
    long timestampSize(Instant timestamp);

    /**
     * Removes every pending job equal to {@code job}, whatever its timestamp.
     *
     * @return the number of jobs removed
     */
    int remove(ScheduledJob job);

    /**
     * Removes every pending job equal to {@code job} at exactly {@code timestamp}.
     *
     * @return the number of jobs removed
     */
    int removeFromTimestamp(Instant timestamp, ScheduledJob job);

    @Override
    void close();
}
