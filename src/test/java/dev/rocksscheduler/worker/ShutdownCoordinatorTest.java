package dev.rocksscheduler.worker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ShutdownCoordinatorTest {

    /**
     * Registrar that records handlers instead of touching process signals.
     */
    static class FakeRegistrar implements SignalRegistrar {
        final Map<String, Runnable> handlers = new LinkedHashMap<>();
        final List<String> restored = new ArrayList<>();
        final List<String> refused;

        FakeRegistrar(String... refused) {
            this.refused = List.of(refused);
        }

        @Override
        public boolean isSupported() {
            return true;
        }

        @Override
        public Registration register(String signal, Runnable handler) {
            if (refused.contains(signal)) {
                throw new IllegalArgumentException("Signal already used by VM or OS: SIG" + signal);
            }
            handlers.put(signal, handler);
            return () -> restored.add(signal);
        }

        void raise(String signal) {
            handlers.get(signal).run();
        }
    }

    @Test
    void installsTermIntAndQuit() {
        FakeRegistrar registrar = new FakeRegistrar();
        ShutdownCoordinator coordinator = new ShutdownCoordinator(registrar);

        assertTrue(coordinator.install());
        assertTrue(coordinator.signalsSupported());
        assertEquals(List.of("TERM", "INT", "QUIT"), new ArrayList<>(registrar.handlers.keySet()));
    }

    @Test
    void anyTerminationSignal_setsTheFlag() {
        for (String signal : List.of("TERM", "INT", "QUIT")) {
            FakeRegistrar registrar = new FakeRegistrar();
            ShutdownCoordinator coordinator = new ShutdownCoordinator(registrar);
            coordinator.install();

            assertFalse(coordinator.isShutdownRequested());
            registrar.raise(signal);
            assertTrue(coordinator.isShutdownRequested(), signal);
        }
    }

    @Test
    void repeatedRequests_areHarmless() {
        FakeRegistrar registrar = new FakeRegistrar();
        ShutdownCoordinator coordinator = new ShutdownCoordinator(registrar);
        coordinator.install();

        registrar.raise("TERM");
        registrar.raise("INT");
        coordinator.requestShutdown();

        assertTrue(coordinator.isShutdownRequested());
    }

    @Test
    void refusedSignalIsSkipped_othersStillWork() {
        FakeRegistrar registrar = new FakeRegistrar("QUIT");
        ShutdownCoordinator coordinator = new ShutdownCoordinator(registrar);

        assertTrue(coordinator.install());
        assertEquals(List.of("TERM", "INT"), new ArrayList<>(registrar.handlers.keySet()));
    }

    @Test
    void noSignalCapability_isReportedNotThrown() {
        ShutdownCoordinator coordinator = new ShutdownCoordinator(SignalRegistrar.NONE);

        assertFalse(coordinator.install());
        assertFalse(coordinator.signalsSupported());
        // the programmatic path still works
        coordinator.requestShutdown();
        assertTrue(coordinator.isShutdownRequested());
    }

    @Test
    void everySignalRefused_meansUnsupported() {
        ShutdownCoordinator coordinator = new ShutdownCoordinator(new FakeRegistrar("TERM", "INT", "QUIT"));

        assertFalse(coordinator.install());
    }

    @Test
    void close_restoresPreviousHandlers() {
        FakeRegistrar registrar = new FakeRegistrar();
        ShutdownCoordinator coordinator = new ShutdownCoordinator(registrar);
        coordinator.install();

        coordinator.close();

        assertEquals(List.of("TERM", "INT", "QUIT"), registrar.restored);
    }
}
