package dev.rocksscheduler.api;

/**
 * Unchecked exception raised when a ready queue fails to accept a dispatched job.
 */
public final class DispatchException extends RuntimeException {
    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
