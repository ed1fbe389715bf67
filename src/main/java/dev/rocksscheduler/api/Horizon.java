package dev.rocksscheduler.api;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Upper time bound for due-timestamp queries ("at or before this instant").
 *
 * <p>Either {@link #now() unset}, meaning the current wall-clock time read at the moment of each
 * query, or an explicit instant. Both resolve to whole seconds since due timestamps have
 * second resolution.
 */
public final class Horizon {
    private static final Horizon NOW = new Horizon(null);

    private final Instant instant;

    private Horizon(Instant instant) {
        this.instant = instant;
    }

    /**
     * The unset horizon. Every {@link #resolve(Clock)} call reads the clock again.
     */
    public static Horizon now() {
        return NOW;
    }

    public static Horizon at(Instant instant) {
        return new Horizon(Objects.requireNonNull(instant, "instant cannot be null"));
    }

    public boolean isUnset() {
        return instant == null;
    }

    /**
     * Resolves this horizon to a concrete instant truncated to seconds.
     *
     * @param clock the clock consulted when the horizon is unset
     * @return the resolved bound
     */
    public Instant resolve(Clock clock) {
        Instant bound = instant != null ? instant : clock.instant();
        return bound.truncatedTo(ChronoUnit.SECONDS);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Horizon)) return false;
        return Objects.equals(instant, ((Horizon) o).instant);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(instant);
    }

    @Override
    public String toString() {
        return instant == null ? "Horizon[now]" : "Horizon[" + instant + "]";
    }
}
