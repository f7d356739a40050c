package io.github.cachestats.clock;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock that only moves when told to.
 */
public class ManualClock implements SystemClock {

    private final AtomicLong nowMicros;

    public ManualClock() {
        this(TimeUnit.SECONDS.toMicros(1_000));
    }

    public ManualClock(long startMicros) {
        this.nowMicros = new AtomicLong(startMicros);
    }

    @Override
    public long nowMicros() {
        return nowMicros.get();
    }

    public void advance(Duration duration) {
        advanceMicros(TimeUnit.NANOSECONDS.toMicros(duration.toNanos()));
    }

    public void advanceMicros(long micros) {
        if (micros < 0) {
            throw new IllegalArgumentException("Clock cannot go backwards");
        }
        nowMicros.addAndGet(micros);
    }
}
