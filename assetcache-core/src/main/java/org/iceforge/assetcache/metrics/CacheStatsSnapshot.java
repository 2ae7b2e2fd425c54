package org.iceforge.assetcache.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time statistics read by the diagnostics overlay and persisted best-effort on shutdown.
 */
public record CacheStatsSnapshot(
        int cachedCount,
        long totalBytes,
        long maxBytes,
        long hitCount,
        long missCount,
        long bypassedCount,
        long evictionCount,
        double hitRate,
        long staleServedCount,
        long prewarmedCount,
        long prewarmFailedCount,
        @JsonProperty("isPrewarming") boolean isPrewarming,
        int discoveredAssetCount
) {}
