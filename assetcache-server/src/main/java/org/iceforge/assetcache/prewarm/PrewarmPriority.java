package org.iceforge.assetcache.prewarm;

/**
 * How aggressively a prewarm run may fetch.
 */
public enum PrewarmPriority {
    /** Needed before the application can start; fetched strictly one at a time. */
    CRITICAL,
    HIGH,
    NORMAL;

    int effectiveConcurrency(int configured) {
        return this == CRITICAL ? 1 : Math.max(1, configured);
    }
}
