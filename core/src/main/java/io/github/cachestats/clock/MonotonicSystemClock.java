package io.github.cachestats.clock;

import java.util.concurrent.TimeUnit;

/**
 * {@link SystemClock} backed by {@link System#nanoTime()}.
 */
public final class MonotonicSystemClock implements SystemClock {

    static final MonotonicSystemClock INSTANCE = new MonotonicSystemClock();

    private MonotonicSystemClock() {
    }

    @Override
    public long nowMicros() {
        return TimeUnit.NANOSECONDS.toMicros(System.nanoTime());
    }

    @Override
    public String toString() {
        return "MonotonicSystemClock";
    }
}
