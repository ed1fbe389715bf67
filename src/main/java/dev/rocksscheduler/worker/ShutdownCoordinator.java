package dev.rocksscheduler.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns termination requests into a cooperative flag.
 *
 * <p>{@code INT}, {@code TERM} and {@code QUIT} all call {@link #requestShutdown()}. The flag
 * is only read between drain cycles, so a cycle in progress always finishes first. Signal
 * handlers run on a JVM signal thread; the flag is an {@link AtomicBoolean} so the worker
 * thread sees the write without further synchronization.
 *
 * <p>Coordinators built with the default registrar share the process-wide handlers, so with
 * several workers in one JVM a single signal stops all of them.
 *
 * <p>Where the runtime cannot deliver signals, {@link #install()} returns {@code false} and the
 * worker can only be stopped through {@link #requestShutdown()} or by killing the process.
 */
public class ShutdownCoordinator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);
    private static final Marker NOTICE = MarkerFactory.getMarker("NOTICE");

    static final List<String> SIGNALS = List.of("TERM", "INT", "QUIT");

    private final SignalRegistrar registrar;
    private final AtomicBoolean requested = new AtomicBoolean(false);
    private final AtomicBoolean installed = new AtomicBoolean(false);
    private final List<SignalRegistrar.Registration> registrations = new ArrayList<>();
    private volatile boolean signalsSupported;

    public ShutdownCoordinator() {
        this(SunSignalRegistrar.INSTANCE);
    }

    public ShutdownCoordinator(SignalRegistrar registrar) {
        this.registrar = Objects.requireNonNull(registrar, "registrar cannot be null");
    }

    /**
     * Registers the termination signal handlers. Only the first call does anything.
     *
     * @return whether at least one termination signal now triggers a graceful shutdown
     */
    public synchronized boolean install() {
        if (!installed.compareAndSet(false, true)) {
            return signalsSupported;
        }
        if (!registrar.isSupported()) {
            logger.info("Signal handling is not available; worker can only be stopped forcefully");
            return false;
        }

        for (String signal : SIGNALS) {
            try {
                registrations.add(registrar.register(signal, this::requestShutdown));
            } catch (IllegalArgumentException e) {
                // QUIT is reserved by HotSpot for thread dumps unless -Xrs is given
                logger.debug("Signal {} not registered: {}", signal, e.getMessage());
            }
        }

        signalsSupported = !registrations.isEmpty();
        if (signalsSupported) {
            logger.debug("Registered signals");
        } else {
            logger.info("No termination signal could be registered; worker can only be stopped forcefully");
        }
        return signalsSupported;
    }

    /**
     * Asks the worker to stop after its current cycle. Repeated calls are no-ops.
     */
    public void requestShutdown() {
        if (requested.compareAndSet(false, true)) {
            logger.info(NOTICE, "Shutting down");
        }
    }

    public boolean isShutdownRequested() {
        return requested.get();
    }

    /**
     * @return the outcome of {@link #install()}; false before it ran
     */
    public boolean signalsSupported() {
        return signalsSupported;
    }

    /**
     * Restores the signal handlers that were in place before {@link #install()}.
     */
    @Override
    public synchronized void close() {
        for (SignalRegistrar.Registration registration : registrations) {
            try {
                registration.close();
            } catch (IllegalArgumentException e) {
                logger.warn("Failed to restore previous signal handler: {}", e.getMessage());
            }
        }
        registrations.clear();
        installed.set(false);
    }
}
