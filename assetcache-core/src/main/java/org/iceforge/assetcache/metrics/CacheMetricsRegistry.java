package org.iceforge.assetcache.metrics;

import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory counters for the diagnostics overlay.
 * <p>
 * Hits, misses and bypasses count intercepted application traffic only; prewarm fetches are
 * tracked separately so they never skew the hit rate.
 */
public class CacheMetricsRegistry {
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder bypassed = new LongAdder();
    private final LongAdder staleServed = new LongAdder();
    private final LongAdder prewarmed = new LongAdder();
    private final LongAdder prewarmFailed = new LongAdder();

    public void recordHit() { hits.increment(); }
    public void recordMiss() { misses.increment(); }
    public void recordBypass() { bypassed.increment(); }
    public void recordStaleServed() { staleServed.increment(); }
    public void recordPrewarmed() { prewarmed.increment(); }
    public void recordPrewarmFailed() { prewarmFailed.increment(); }

    public long hits() { return hits.sum(); }
    public long misses() { return misses.sum(); }
    public long bypassed() { return bypassed.sum(); }
    public long staleServed() { return staleServed.sum(); }
    public long prewarmed() { return prewarmed.sum(); }
    public long prewarmFailed() { return prewarmFailed.sum(); }

    public double hitRate() {
        long h = hits();
        long total = h + misses();
        return total == 0 ? 0.0 : (double) h / total;
    }

    public void reset() {
        hits.reset();
        misses.reset();
        bypassed.reset();
        staleServed.reset();
        prewarmed.reset();
        prewarmFailed.reset();
    }
}
