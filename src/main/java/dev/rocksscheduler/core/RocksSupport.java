package dev.rocksscheduler.core;

import dev.rocksscheduler.config.SchedulerConfig;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.File;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.function.ToLongFunction;

/**
 * Shared RocksDB plumbing for the timestamp store and the ready queue.
 */
final class RocksSupport {

    private static final Logger logger = LoggerFactory.getLogger(RocksSupport.class);

    static final byte[] META_SEQUENCE_KEY = "meta:insertion_counter".getBytes(StandardCharsets.UTF_8);

    static { RocksDB.loadLibrary(); }

    private RocksSupport() {}

    static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    /**
     * Opens (creating if missing) the RocksDB instance living in {@code basePath/dirName}.
     */
    static RocksDB open(SchedulerConfig config, String dirName) {
        String path = config.getBasePath() + File.separator + sanitize(dirName);
        MDC.put("storeDir", path);
        try {
            File dbDir = new File(path);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                throw new RuntimeException("Failed to create directory: " + path);
            }

            logger.debug("Opening RocksDB at path: {}", path);

            try (Options options = new Options()
                    .setCreateIfMissing(true)
                    .setCompressionType(config.getCompressionType())
                    .setWriteBufferSize((long) config.getWriteBufferSizeMB() * 1024 * 1024)
                    .setMaxWriteBufferNumber(config.getMaxWriteBufferNumber())) {
                RocksDB db = RocksDB.open(options, path);
                logger.info("Opened RocksDB at path: {}", path);
                return db;
            }
        } catch (RocksDBException e) {
            logger.error("Failed to open RocksDB at '{}': {}", path, e.getMessage(), e);
            throw new RuntimeException("Failed to open RocksDB at " + path, e);
        } finally {
            MDC.remove("storeDir");
        }
    }

    static WriteOptions writeOptions(SchedulerConfig config) {
        return new WriteOptions()
                .setSync(config.isSyncWrites())
                .setDisableWAL(config.isDisableWAL());
    }

    /**
     * Recovers the insertion sequence, preferring persisted metadata over a full data scan.
     *
     * @param db           the database to read
     * @param name         store name for log lines
     * @param sequenceOf   extracts the sequence from a data key, or -1 for keys that are not data
     * @return the highest sequence in use, 0 for an empty store
     */
    static long recoverSequence(RocksDB db, String name, ToLongFunction<byte[]> sequenceOf) {
        long fromMeta = -1L;
        try {
            byte[] metaBytes = db.get(META_SEQUENCE_KEY);
            if (metaBytes != null && metaBytes.length == 8) {
                fromMeta = ByteBuffer.wrap(metaBytes).order(ByteOrder.BIG_ENDIAN).getLong();
                logger.debug("Recovered insertion sequence {} from metadata for '{}'", fromMeta, name);
            }
        } catch (RocksDBException e) {
            logger.debug("Failed to read sequence metadata for '{}', falling back to data scan: {}",
                    name, e.getMessage());
        }

        // Writes after the last clean close are not reflected in the metadata; the scan covers them.
        long fromData = 0L;
        try (ReadOptions scan = new ReadOptions().setFillCache(false);
             RocksIterator it = db.newIterator(scan)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                fromData = Math.max(fromData, sequenceOf.applyAsLong(it.key()));
            }
            it.status();
        } catch (RocksDBException e) {
            logger.error("Sequence recovery scan failed for '{}': {}", name, e.getMessage(), e);
            throw new RuntimeException("Failed to scan " + name + " for the insertion sequence", e);
        }

        long recovered = Math.max(fromMeta, fromData);
        if (fromData > fromMeta && fromMeta >= 0) {
            logger.warn("Metadata sequence {} is stale for '{}', using {} from data", fromMeta, name, fromData);
        }
        logger.info("Initialized insertion sequence at {} for '{}'", recovered, name);
        return recovered;
    }

    static void persistSequence(RocksDB db, WriteOptions writeOpts, String name, long sequence) {
        try {
            byte[] value = ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN).putLong(sequence).array();
            db.put(writeOpts, META_SEQUENCE_KEY, value);
            logger.debug("Persisted insertion sequence {} for '{}'", sequence, name);
        } catch (RocksDBException e) {
            logger.warn("Failed to persist insertion sequence for '{}': {}", name, e.getMessage(), e);
        }
    }
}
