package org.iceforge.assetcache.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.iceforge.assetcache.discovery.DiscoveredAssetRegistry;
import org.iceforge.assetcache.http.CachedResponse;
import org.iceforge.assetcache.persist.MetadataStore;
import org.iceforge.assetcache.prewarm.AssetPrewarmer;
import org.iceforge.assetcache.store.EvictionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Assembles the statistics snapshot for the diagnostics overlay and owns cache-wide resets.
 */
@Service
public class CacheStatsService {
    private static final Logger logger = LoggerFactory.getLogger(CacheStatsService.class);

    private final EvictionStore<CachedResponse> store;
    private final CacheMetricsRegistry metrics;
    private final AssetPrewarmer prewarmer;
    private final DiscoveredAssetRegistry discovered;
    private final MetadataStore metadata;
    private final ObjectMapper mapper;

    public CacheStatsService(EvictionStore<CachedResponse> store,
                             CacheMetricsRegistry metrics,
                             AssetPrewarmer prewarmer,
                             DiscoveredAssetRegistry discovered,
                             MetadataStore metadata,
                             ObjectMapper mapper) {
        this.store = Objects.requireNonNull(store);
        this.metrics = Objects.requireNonNull(metrics);
        this.prewarmer = Objects.requireNonNull(prewarmer);
        this.discovered = Objects.requireNonNull(discovered);
        this.metadata = Objects.requireNonNull(metadata);
        this.mapper = Objects.requireNonNull(mapper);
    }

    public CacheStatsSnapshot snapshot() {
        return new CacheStatsSnapshot(
                store.size(),
                store.currentSizeBytes(),
                store.maxSizeBytes(),
                metrics.hits(),
                metrics.misses(),
                metrics.bypassed(),
                store.evictionCount(),
                metrics.hitRate(),
                metrics.staleServed(),
                metrics.prewarmed(),
                metrics.prewarmFailed(),
                prewarmer.isRunning(),
                discovered.discoveredCount()
        );
    }

    /**
     * Empties the in-memory cache. With {@code includePersisted} the discovered-asset list and
     * the persisted statistics are dropped as well; the build identifier is kept.
     */
    public void clear(boolean includePersisted) {
        store.clear();
        if (includePersisted) {
            discovered.clear();
            metadata.delete(MetadataStore.CACHE_STATS);
            logger.info("Cleared asset cache and persisted asset metadata");
        }
    }

    /** Best effort; the persisted snapshot is informational only. */
    @PreDestroy
    public void persistSnapshot() {
        try {
            metadata.write(MetadataStore.CACHE_STATS, mapper.writeValueAsString(snapshot()));
        } catch (JsonProcessingException | RuntimeException e) {
            logger.warn("Failed to persist cache statistics: {}", e.toString());
        }
    }
}
