package dev.rocksscheduler.api;

/**
 * Unchecked exception raised when a timestamp store cannot be read or written.
 */
public final class SchedulerStoreException extends RuntimeException {
    public SchedulerStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
