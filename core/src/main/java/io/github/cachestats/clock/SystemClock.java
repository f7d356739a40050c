package io.github.cachestats.clock;

/**
 * Source of monotonic time used to timestamp statistics collections.
 *
 * <p>Implementations must never go backwards; two successive reads on any
 * thread return non-decreasing values.</p>
 */
@FunctionalInterface
public interface SystemClock {

    /**
     * Current time in microseconds. The origin is arbitrary.
     */
    long nowMicros();

    /**
     * Process-wide default clock.
     */
    static SystemClock getDefault() {
        return MonotonicSystemClock.INSTANCE;
    }
}
