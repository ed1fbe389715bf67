package dev.rocksscheduler.core;

import dev.rocksscheduler.api.Horizon;
import dev.rocksscheduler.api.ScheduledJob;
import dev.rocksscheduler.api.SchedulerStoreException;
import dev.rocksscheduler.api.TimestampStore;
import dev.rocksscheduler.config.SchedulerConfig;
import dev.rocksscheduler.ser.JsonSerializer;
import dev.rocksscheduler.ser.Serializer;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static dev.rocksscheduler.core.BinaryKeyEncoder.decodeTimestamp;
import static dev.rocksscheduler.core.BinaryKeyEncoder.isJobKey;

/**
 * Persistent timestamp store backed by RocksDB.
 *
 * <p>Every pending job is one key/value pair. Keys are {@link BinaryKeyEncoder binary encoded}
 * as (due second, insertion sequence), so iterating the database from the first key walks
 * due timestamps in ascending order and jobs of one timestamp in insertion order. Values are
 * JSON encoded {@link ScheduledJob}s. Keys of any other length (the sequence metadata) are
 * skipped by every scan.
 *
 * <p><strong>Thread Safety:</strong> all reads that lead to a delete run under one store lock,
 * so {@link #popJob(Instant)} hands each job to exactly one caller within this process.
 * RocksDB itself allows a single process per database directory.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * SchedulerConfig config = new SchedulerConfig().setBasePath("/tmp/scheduler");
 * try (RocksTimestampStore store = new RocksTimestampStore(config)) {
 *     store.schedule(Instant.now().plusSeconds(30), ScheduledJob.of("emails", "SendWelcome", 42));
 *     store.nextDueTimestamp(Horizon.now()); // empty for the next 30 seconds
 * }
 * }</pre>
 */
public class RocksTimestampStore implements TimestampStore {
    private static final Logger logger = LoggerFactory.getLogger(RocksTimestampStore.class);

    private final String name;
    private final RocksDB db;
    private final Serializer<ScheduledJob> serializer;
    private final Clock clock;
    private final Object lock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong insertionSequence;
    private final WriteOptions writeOpts;
    private final ReadOptions scanOpts;

    public RocksTimestampStore(SchedulerConfig config) {
        this(config, null);
    }

    /**
     * Creates a store with the specified clock.
     *
     * @param config the scheduler configuration
     * @param clock  the clock used to resolve unset horizons, null for system UTC
     * @throws RuntimeException if RocksDB initialization fails
     */
    public RocksTimestampStore(SchedulerConfig config, Clock clock) {
        Objects.requireNonNull(config, "config cannot be null");
        this.name = config.getDelayedDirName();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.serializer = new JsonSerializer<>(ScheduledJob.class);

        logger.info("Initializing RocksTimestampStore '{}'", name);
        this.db = RocksSupport.open(config, name);
        try {
            this.writeOpts = RocksSupport.writeOptions(config);
            this.scanOpts = new ReadOptions()
                    .setFillCache(false)
                    .setReadaheadSize(config.getReadaheadSizeBytes());
        } catch (RuntimeException e) {
            db.close();
            throw e;
        }
        try {
            this.insertionSequence = new AtomicLong(RocksSupport.recoverSequence(db, name,
                    key -> isJobKey(key) ? BinaryKeyEncoder.decodeSequence(key) : -1L));
        } catch (RuntimeException e) {
            scanOpts.close();
            writeOpts.close();
            db.close();
            throw e;
        }
    }

    @Override
    public void schedule(Instant at, ScheduledJob job) {
        Objects.requireNonNull(at, "at cannot be null");
        Objects.requireNonNull(job, "job cannot be null");
        ensureOpen();

        byte[] key = BinaryKeyEncoder.encode(at.getEpochSecond(), insertionSequence.incrementAndGet());
        byte[] value = serializer.serialize(job);
        try {
            db.put(writeOpts, key, value);
        } catch (RocksDBException e) {
            logger.error("Failed to schedule {} in store '{}': {}", job, name, e.getMessage(), e);
            throw new SchedulerStoreException("Failed to schedule job in store " + name, e);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Scheduled {} at {} in store '{}'", job.taskId(), at, name);
        }
    }

    @Override
    public Optional<Instant> nextDueTimestamp(Horizon horizon) {
        Objects.requireNonNull(horizon, "horizon cannot be null");
        ensureOpen();

        long bound = horizon.resolve(clock).getEpochSecond();
        synchronized (lock) {
            try (RocksIterator it = db.newIterator(scanOpts)) {
                for (it.seekToFirst(); it.isValid(); it.next()) {
                    byte[] k = it.key();
                    if (!isJobKey(k)) {
                        continue;
                    }
                    long ts = decodeTimestamp(k);
                    return ts <= bound ? Optional.of(Instant.ofEpochSecond(ts)) : Optional.empty();
                }
                checkIterator(it);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<ScheduledJob> popJob(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        ensureOpen();

        long second = timestamp.getEpochSecond();
        byte[] key;
        byte[] value;
        synchronized (lock) {
            try (RocksIterator it = db.newIterator()) {
                it.seek(BinaryKeyEncoder.lowerBound(second));
                if (!it.isValid()) {
                    checkIterator(it);
                    return Optional.empty();
                }
                key = it.key();
                if (!isJobKey(key) || decodeTimestamp(key) != second) {
                    return Optional.empty();
                }
                value = it.value();
                db.delete(writeOpts, key);
            } catch (RocksDBException e) {
                logger.error("Failed to pop job at {} from store '{}': {}", timestamp, name, e.getMessage(), e);
                throw new SchedulerStoreException("Failed to pop job from store " + name, e);
            }
        }

        // Deserialize outside the lock. The key is already gone, so a corrupt payload is reported, not retried.
        try {
            return Optional.of(serializer.deserialize(value));
        } catch (RuntimeException e) {
            logger.error("Dropping undecodable job at {} (seq {}) in store '{}': {}", timestamp,
                    BinaryKeyEncoder.decodeSequence(key), name, new String(value, StandardCharsets.UTF_8), e);
            throw new SchedulerStoreException("Failed to decode job from store " + name, e);
        }
    }

    @Override
    public long scheduleSize() {
        ensureOpen();
        long timestamps = 0;
        long previous = -1;
        synchronized (lock) {
            try (RocksIterator it = db.newIterator(scanOpts)) {
                for (it.seekToFirst(); it.isValid(); it.next()) {
                    byte[] k = it.key();
                    if (!isJobKey(k)) {
                        continue;
                    }
                    long ts = decodeTimestamp(k);
                    if (ts != previous) {
                        timestamps++;
                        previous = ts;
                    }
                }
                checkIterator(it);
            }
        }
        return timestamps;
    }

    @Override
    public long timestampSize(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        ensureOpen();
        long second = timestamp.getEpochSecond();
        long count = 0;
        synchronized (lock) {
            try (RocksIterator it = db.newIterator(scanOpts)) {
                for (it.seek(BinaryKeyEncoder.lowerBound(second)); it.isValid(); it.next()) {
                    byte[] k = it.key();
                    if (!isJobKey(k) || decodeTimestamp(k) != second) {
                        break;
                    }
                    count++;
                }
                checkIterator(it);
            }
        }
        return count;
    }

    @Override
    public int remove(ScheduledJob job) {
        return removeMatching(null, job);
    }

    @Override
    public int removeFromTimestamp(Instant timestamp, ScheduledJob job) {
        return removeMatching(Objects.requireNonNull(timestamp, "timestamp cannot be null"), job);
    }

    /**
     * Deletes jobs whose serialized form equals {@code job}'s, optionally restricted to one second.
     */
    private int removeMatching(Instant timestamp, ScheduledJob job) {
        Objects.requireNonNull(job, "job cannot be null");
        ensureOpen();

        byte[] wanted = serializer.serialize(job);
        int removed = 0;
        synchronized (lock) {
            try (RocksIterator it = db.newIterator(scanOpts);
                 WriteBatch batch = new WriteBatch()) {
                if (timestamp == null) {
                    it.seekToFirst();
                } else {
                    it.seek(BinaryKeyEncoder.lowerBound(timestamp.getEpochSecond()));
                }
                for (; it.isValid(); it.next()) {
                    byte[] k = it.key();
                    if (!isJobKey(k)) {
                        continue;
                    }
                    if (timestamp != null && decodeTimestamp(k) != timestamp.getEpochSecond()) {
                        break;
                    }
                    if (Arrays.equals(wanted, it.value())) {
                        batch.delete(k);
                        removed++;
                    }
                }
                checkIterator(it);
                if (removed > 0) {
                    db.write(writeOpts, batch);
                }
            } catch (RocksDBException e) {
                logger.error("Failed to remove {} from store '{}': {}", job, name, e.getMessage(), e);
                throw new SchedulerStoreException("Failed to remove job from store " + name, e);
            }
        }
        logger.debug("Removed {} pending copies of {} from store '{}'", removed, job, name);
        return removed;
    }

    /**
     * Closes this store, persisting the insertion sequence first. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            logger.debug("Close called on already closed store '{}'", name);
            return;
        }
        logger.info("Closing RocksTimestampStore '{}'", name);
        synchronized (lock) {
            RocksSupport.persistSequence(db, writeOpts, name, insertionSequence.get());
            scanOpts.close();
            writeOpts.close();
            db.close();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Store is closed: " + name);
        }
    }

    private void checkIterator(RocksIterator it) {
        try {
            it.status();
        } catch (RocksDBException e) {
            throw new SchedulerStoreException("Iterator failed in store " + name, e);
        }
    }
}
