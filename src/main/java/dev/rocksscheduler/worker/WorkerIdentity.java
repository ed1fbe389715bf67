package dev.rocksscheduler.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * Identity of a worker process, rendered {@code hostname:pid}. Used for log lines and
 * status only; scheduling never depends on it.
 *
 * @param hostname host the worker runs on
 * @param pid      operating system process id
 */
public record WorkerIdentity(String hostname, long pid) {
    private static final Logger logger = LoggerFactory.getLogger(WorkerIdentity.class);

    public WorkerIdentity {
        Objects.requireNonNull(hostname, "hostname cannot be null");
    }

    /**
     * Identity of the current JVM process.
     */
    public static WorkerIdentity current() {
        return new WorkerIdentity(localHostname(), ProcessHandle.current().pid());
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String fromEnv = System.getenv("HOSTNAME");
            logger.debug("Local hostname lookup failed ({}), using '{}'", e.getMessage(), fromEnv);
            return fromEnv != null && !fromEnv.isEmpty() ? fromEnv : "localhost";
        }
    }

    @Override
    public String toString() {
        return hostname + ":" + pid;
    }
}
