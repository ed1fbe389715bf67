package dev.rocksscheduler.core;

import dev.rocksscheduler.api.DispatchException;
import dev.rocksscheduler.api.DispatchSink;
import dev.rocksscheduler.api.ScheduledJob;
import dev.rocksscheduler.config.SchedulerConfig;
import dev.rocksscheduler.ser.JsonSerializer;
import dev.rocksscheduler.ser.Serializer;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immediate-execution queues backed by RocksDB; the default {@link DispatchSink}.
 *
 * <p>Each named queue is a FIFO. Keys are {@code [queue UTF-8][0x00][8 bytes big-endian sequence]},
 * so all jobs of one queue are contiguous and ordered by arrival. Consumers take jobs with
 * {@link #pop(String)}.
 */
public class RocksReadyQueue implements DispatchSink, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RocksReadyQueue.class);

    private static final int SEQUENCE_LENGTH = 8;

    private final String name;
    private final RocksDB db;
    private final Serializer<ScheduledJob> serializer;
    private final Object lock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong sequence;
    private final WriteOptions writeOpts;
    private final ReadOptions scanOpts;

    public RocksReadyQueue(SchedulerConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.name = config.getQueuesDirName();
        this.serializer = new JsonSerializer<>(ScheduledJob.class);

        logger.info("Initializing RocksReadyQueue '{}'", name);
        this.db = RocksSupport.open(config, name);
        try {
            this.writeOpts = RocksSupport.writeOptions(config);
            this.scanOpts = new ReadOptions().setFillCache(false);
        } catch (RuntimeException e) {
            db.close();
            throw e;
        }
        try {
            this.sequence = new AtomicLong(RocksSupport.recoverSequence(db, name, RocksReadyQueue::sequenceOf));
        } catch (RuntimeException e) {
            scanOpts.close();
            writeOpts.close();
            db.close();
            throw e;
        }
    }

    /**
     * Appends a job to the tail of {@code queue}.
     *
     * @throws DispatchException     if the write fails
     * @throws IllegalStateException if this queue is closed
     */
    @Override
    public void dispatch(String queue, String taskId, Object... args) {
        ScheduledJob job = ScheduledJob.of(queue, taskId, args);
        ensureOpen();

        byte[] key = key(queue, sequence.incrementAndGet());
        try {
            db.put(writeOpts, key, serializer.serialize(job));
        } catch (RocksDBException e) {
            logger.error("Failed to enqueue {} on ready queue '{}': {}", taskId, queue, e.getMessage(), e);
            throw new DispatchException("Failed to enqueue " + taskId + " on queue " + queue, e);
        }
    }

    /**
     * Removes and returns the oldest job of {@code queue}.
     *
     * @return the job, or empty when the queue has nothing ready
     */
    public Optional<ScheduledJob> pop(String queue) {
        Objects.requireNonNull(queue, "queue cannot be null");
        ensureOpen();

        byte[] prefix = prefix(queue);
        byte[] value;
        synchronized (lock) {
            try (RocksIterator it = db.newIterator()) {
                it.seek(prefix);
                if (!it.isValid() || !startsWith(it.key(), prefix) || it.key().length != prefix.length + SEQUENCE_LENGTH) {
                    checkIterator(it);
                    return Optional.empty();
                }
                value = it.value();
                db.delete(writeOpts, it.key());
            } catch (RocksDBException e) {
                logger.error("Failed to pop from ready queue '{}': {}", queue, e.getMessage(), e);
                throw new DispatchException("Failed to pop from queue " + queue, e);
            }
        }
        return Optional.of(serializer.deserialize(value));
    }

    public long size(String queue) {
        Objects.requireNonNull(queue, "queue cannot be null");
        ensureOpen();

        byte[] prefix = prefix(queue);
        long count = 0;
        try (RocksIterator it = db.newIterator(scanOpts)) {
            for (it.seek(prefix); it.isValid() && startsWith(it.key(), prefix); it.next()) {
                if (it.key().length == prefix.length + SEQUENCE_LENGTH) {
                    count++;
                }
            }
            checkIterator(it);
        }
        return count;
    }

    /**
     * @return names of the queues currently holding at least one job
     */
    public Set<String> queues() {
        ensureOpen();
        Set<String> names = new TreeSet<>();
        try (RocksIterator it = db.newIterator(scanOpts)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                byte[] k = it.key();
                if (sequenceOf(k) >= 0) {
                    names.add(new String(k, 0, k.length - SEQUENCE_LENGTH - 1, StandardCharsets.UTF_8));
                }
            }
            checkIterator(it);
        }
        return names;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Closing RocksReadyQueue '{}'", name);
        synchronized (lock) {
            RocksSupport.persistSequence(db, writeOpts, name, sequence.get());
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
            throw new IllegalStateException("Ready queue is closed: " + name);
        }
    }

    private void checkIterator(RocksIterator it) {
        try {
            it.status();
        } catch (RocksDBException e) {
            logger.error("Iterator failed in ready queue '{}': {}", name, e.getMessage(), e);
            throw new DispatchException("Iterator failed in ready queue " + name, e);
        }
    }

    static byte[] prefix(String queue) {
        byte[] q = queue.getBytes(StandardCharsets.UTF_8);
        return Arrays.copyOf(q, q.length + 1); // trailing 0x00 separator
    }

    static byte[] key(String queue, long seq) {
        byte[] prefix = prefix(queue);
        return ByteBuffer.allocate(prefix.length + SEQUENCE_LENGTH)
                .order(ByteOrder.BIG_ENDIAN)
                .put(prefix)
                .putLong(seq)
                .array();
    }

    /**
     * @return the sequence of a job key, or -1 for the metadata key and anything else
     */
    static long sequenceOf(byte[] key) {
        if (key == null || key.length < SEQUENCE_LENGTH + 2 || key[key.length - SEQUENCE_LENGTH - 1] != 0
                || Arrays.equals(key, RocksSupport.META_SEQUENCE_KEY)) {
            return -1L;
        }
        return ByteBuffer.wrap(key).order(ByteOrder.BIG_ENDIAN).getLong(key.length - SEQUENCE_LENGTH);
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
