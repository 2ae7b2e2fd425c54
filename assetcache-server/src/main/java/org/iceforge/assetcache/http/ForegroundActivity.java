package org.iceforge.assetcache.http;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Tracks application-initiated (foreground) requests so background work can wait for quiet periods.
 */
public class ForegroundActivity {

    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong lastActivityNanos;
    private final LongSupplier clock;

    public ForegroundActivity() {
        this(System::nanoTime);
    }

    public ForegroundActivity(LongSupplier clock) {
        this.clock = clock;
        // Start out "long idle" so work scheduled before any traffic is not delayed.
        this.lastActivityNanos = new AtomicLong(clock.getAsLong() - Long.MAX_VALUE / 2);
    }

    public void begin() {
        inFlight.incrementAndGet();
        lastActivityNanos.set(clock.getAsLong());
    }

    public void end() {
        inFlight.updateAndGet(n -> Math.max(0, n - 1));
        lastActivityNanos.set(clock.getAsLong());
    }

    public int inFlight() {
        return inFlight.get();
    }

    public long nanosSinceLastActivity() {
        return clock.getAsLong() - lastActivityNanos.get();
    }

    public boolean isQuietFor(long nanos) {
        return inFlight.get() == 0 && nanosSinceLastActivity() >= nanos;
    }
}
