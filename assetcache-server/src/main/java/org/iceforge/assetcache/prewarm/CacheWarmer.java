package org.iceforge.assetcache.prewarm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Warms the cache either from an explicit URL list or, when none is given, from the application's
 * asset manifest.
 */
public class CacheWarmer {
    private static final Logger logger = LoggerFactory.getLogger(CacheWarmer.class);

    private final AssetPrewarmer prewarmer;
    private final AssetManifestLoader manifestLoader;
    private final int concurrency;

    public CacheWarmer(AssetPrewarmer prewarmer, AssetManifestLoader manifestLoader, int concurrency) {
        this.prewarmer = Objects.requireNonNull(prewarmer);
        this.manifestLoader = Objects.requireNonNull(manifestLoader);
        this.concurrency = concurrency;
    }

    public Mono<PrewarmResult> warm(List<String> urls) {
        if (urls != null && !urls.isEmpty()) {
            logger.info("Warming cache with {} specific assets", urls.size());
            return prewarmer.prewarm(urls, PrewarmPriority.HIGH, concurrency, null);
        }
        return manifestLoader.loadPreloadList()
                .flatMap(preload -> {
                    if (preload.isEmpty()) {
                        logger.info("No assets to warm, cache will populate on demand");
                        return Mono.just(PrewarmResult.empty());
                    }
                    return prewarmer.prewarm(preload, PrewarmPriority.CRITICAL, concurrency, null);
                });
    }
}
