package dev.rocksscheduler;

import dev.rocksscheduler.client.SchedulerClient;
import dev.rocksscheduler.config.SchedulerConfig;
import dev.rocksscheduler.worker.DelayedDispatchWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Process entry point: runs one delayed dispatch worker until it receives TERM, INT or QUIT.
 *
 * <p>Configuration comes from {@code -Drs.*} system properties (see {@link SchedulerConfig});
 * the {@code INTERVAL} environment variable, in seconds with an optional fraction, overrides
 * the poll interval.
 */
public final class SchedulerMain {
    private static final Logger logger = LoggerFactory.getLogger(SchedulerMain.class);

    private SchedulerMain() {}

    public static void main(String[] args) {
        SchedulerConfig config = new SchedulerConfig();
        String interval = System.getenv("INTERVAL");
        if (interval != null && !interval.isBlank()) {
            config.setPollInterval(parseSeconds(interval));
        }

        try (SchedulerClient client = new SchedulerClient(config)) {
            DelayedDispatchWorker worker = client.newWorker();
            worker.run(config.getPollInterval());
        } catch (RuntimeException e) {
            logger.error("Delayed dispatch worker failed", e);
            throw e;
        }
    }

    static Duration parseSeconds(String seconds) {
        BigDecimal nanos = new BigDecimal(seconds.trim()).movePointRight(9);
        if (nanos.signum() < 0) {
            throw new IllegalArgumentException("INTERVAL must be >= 0: " + seconds);
        }
        return Duration.ofNanos(nanos.setScale(0, RoundingMode.DOWN).longValueExact());
    }
}
