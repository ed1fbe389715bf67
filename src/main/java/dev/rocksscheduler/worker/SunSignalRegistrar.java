package dev.rocksscheduler.worker;

import sun.misc.Signal;
import sun.misc.SignalHandler;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SignalRegistrar} on top of {@code sun.misc.Signal} from the {@code jdk.unsupported} module.
 *
 * <p>The JVM keeps one handler per signal, so this registrar installs a single dispatching
 * handler per signal and fans each delivery out to every live registration. The handler that
 * was in place before is restored when the last registration for that signal is closed.
 */
final class SunSignalRegistrar implements SignalRegistrar {

    static final SunSignalRegistrar INSTANCE = new SunSignalRegistrar(SunSignalRegistrar::installNative);

    /**
     * Installs a process-wide handler and returns the action that restores the previous one.
     */
    @FunctionalInterface
    interface NativeInstaller {
        Runnable install(String signal, Runnable dispatcher);
    }

    private static final class Slot {
        final List<Runnable> handlers = new CopyOnWriteArrayList<>();
        Runnable restore;
    }

    private final NativeInstaller installer;
    private final Map<String, Slot> slots = new HashMap<>();

    SunSignalRegistrar(NativeInstaller installer) {
        this.installer = Objects.requireNonNull(installer, "installer cannot be null");
    }

    @Override
    public boolean isSupported() {
        return ModuleLayer.boot().findModule("jdk.unsupported").isPresent();
    }

    @Override
    public synchronized Registration register(String name, Runnable handler) {
        Objects.requireNonNull(handler, "handler cannot be null");
        Slot slot = slots.get(name);
        if (slot == null) {
            Slot fresh = new Slot();
            fresh.restore = installer.install(name, () -> fresh.handlers.forEach(Runnable::run));
            slots.put(name, fresh);
            slot = fresh;
        }

        // own instance so that removal is by identity even when the same handler registers twice
        Runnable entry = () -> handler.run();
        slot.handlers.add(entry);

        AtomicBoolean closed = new AtomicBoolean(false);
        return () -> {
            if (closed.compareAndSet(false, true)) {
                unregister(name, entry);
            }
        };
    }

    /**
     * @return number of live registrations for {@code name}
     */
    synchronized int registrations(String name) {
        Slot slot = slots.get(name);
        return slot == null ? 0 : slot.handlers.size();
    }

    private synchronized void unregister(String name, Runnable entry) {
        Slot slot = slots.get(name);
        if (slot == null) {
            return;
        }
        slot.handlers.remove(entry);
        if (slot.handlers.isEmpty()) {
            slots.remove(name);
            slot.restore.run();
        }
    }

    private static Runnable installNative(String name, Runnable dispatcher) {
        Signal signal = new Signal(name);
        SignalHandler previous = Signal.handle(signal, s -> dispatcher.run());
        return () -> Signal.handle(signal, previous);
    }
}
