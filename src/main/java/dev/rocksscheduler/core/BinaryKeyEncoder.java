package dev.rocksscheduler.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Encodes delayed-job keys as fixed-length binary so that RocksDB's lexicographic order is
 * due-time order, then insertion order within one due second.
 * Layout: [8 bytes big-endian epochSecond][8 bytes big-endian insertionSequence]
 */
public final class BinaryKeyEncoder {
    private BinaryKeyEncoder() {}

    public static final int KEY_LENGTH = 16;

    public static byte[] encode(long epochSecond, long insertionSequence) {
        if (epochSecond < 0 || insertionSequence < 0) {
            throw new IllegalArgumentException("epochSecond and insertionSequence must be non-negative");
        }
        ByteBuffer buf = ByteBuffer.allocate(KEY_LENGTH).order(ByteOrder.BIG_ENDIAN);
        buf.putLong(epochSecond);
        buf.putLong(insertionSequence);
        return buf.array();
    }

    /**
     * Smallest possible key for a due second; seeking to it lands on that second's first job.
     */
    public static byte[] lowerBound(long epochSecond) {
        return encode(epochSecond, 0L);
    }

    public static boolean isJobKey(byte[] key) {
        return key != null && key.length == KEY_LENGTH;
    }

    public static long decodeTimestamp(byte[] key) {
        if (!isJobKey(key)) {
            throw new IllegalArgumentException("Invalid key length: expected " + KEY_LENGTH);
        }
        return ByteBuffer.wrap(key).order(ByteOrder.BIG_ENDIAN).getLong(0);
    }

    public static long decodeSequence(byte[] key) {
        if (!isJobKey(key)) {
            throw new IllegalArgumentException("Invalid key length: expected " + KEY_LENGTH);
        }
        return ByteBuffer.wrap(key).order(ByteOrder.BIG_ENDIAN).getLong(8);
    }
}
