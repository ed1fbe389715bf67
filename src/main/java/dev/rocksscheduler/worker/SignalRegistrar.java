package dev.rocksscheduler.worker;

/**
 * Installs handlers for operating system signals.
 */
public interface SignalRegistrar {

    /**
     * @return whether this runtime can deliver signals to Java code at all
     */
    boolean isSupported();

    /**
     * Installs {@code handler} for the named signal ({@code "TERM"}, {@code "INT"}, ...).
     *
     * @return a registration whose {@code close()} restores the previous handler
     * @throws IllegalArgumentException if the signal is unknown or reserved on this platform
     */
    Registration register(String signal, Runnable handler);

    @FunctionalInterface
    interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Registrar for runtimes (or embedding hosts) where signals must be left alone.
     */
    SignalRegistrar NONE = new SignalRegistrar() {
        @Override
        public boolean isSupported() {
            return false;
        }

        @Override
        public Registration register(String signal, Runnable handler) {
            throw new IllegalArgumentException("Signal handling unavailable: " + signal);
        }
    };
}
