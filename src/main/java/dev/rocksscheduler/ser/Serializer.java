package dev.rocksscheduler.ser;

/**
 * Converts stored values to and from the bytes kept in RocksDB.
 */
public interface Serializer<T> {
    byte[] serialize(T value);

    T deserialize(byte[] bytes);
}
