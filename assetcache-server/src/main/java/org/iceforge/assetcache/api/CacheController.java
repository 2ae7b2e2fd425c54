package org.iceforge.assetcache.api;

import org.iceforge.assetcache.config.AssetCacheProperties;
import org.iceforge.assetcache.discovery.DiscoveredAssetRegistry;
import org.iceforge.assetcache.discovery.PageAssetScanner;
import org.iceforge.assetcache.http.CachedResponse;
import org.iceforge.assetcache.metrics.CacheStatsService;
import org.iceforge.assetcache.metrics.CacheStatsSnapshot;
import org.iceforge.assetcache.prewarm.AssetPrewarmer;
import org.iceforge.assetcache.prewarm.CacheWarmer;
import org.iceforge.assetcache.prewarm.PrewarmAlreadyRunningException;
import org.iceforge.assetcache.prewarm.PrewarmPriority;
import org.iceforge.assetcache.prewarm.PrewarmResult;
import org.iceforge.assetcache.store.EvictionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * Diagnostics and control surface for the embedding shell and its overlay.
 */
@RestController
@RequestMapping("/api/cache")
public class CacheController {
    private static final Logger logger = LoggerFactory.getLogger(CacheController.class);

    private final CacheStatsService stats;
    private final EvictionStore<CachedResponse> store;
    private final AssetPrewarmer prewarmer;
    private final CacheWarmer warmer;
    private final DiscoveredAssetRegistry discovered;
    private final AssetCacheProperties props;

    public CacheController(CacheStatsService stats,
                           EvictionStore<CachedResponse> store,
                           AssetPrewarmer prewarmer,
                           CacheWarmer warmer,
                           DiscoveredAssetRegistry discovered,
                           AssetCacheProperties props) {
        this.stats = Objects.requireNonNull(stats);
        this.store = Objects.requireNonNull(store);
        this.prewarmer = Objects.requireNonNull(prewarmer);
        this.warmer = Objects.requireNonNull(warmer);
        this.discovered = Objects.requireNonNull(discovered);
        this.props = Objects.requireNonNull(props);
    }

    @GetMapping("/stats")
    public CacheStatsSnapshot stats() {
        return stats.snapshot();
    }

    @GetMapping("/entries")
    public List<String> entries() {
        return store.keys();
    }

    @PostMapping("/prewarm")
    public Mono<PrewarmResult> prewarm(@RequestBody CacheApiModels.PrewarmRequest req) {
        int concurrency = req.concurrency() != null ? req.concurrency() : props.getPrewarmConcurrency();
        return prewarmer.prewarm(req.urls(), PrewarmPriority.NORMAL, concurrency,
                p -> logger.debug("Prewarm progress {}% ({}/{})", p.percent(), p.completed(), p.total()));
    }

    @PostMapping("/prewarm/stop")
    public ResponseEntity<Void> stopPrewarm() {
        prewarmer.stop();
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/warm")
    public Mono<PrewarmResult> warm(@RequestBody(required = false) CacheApiModels.WarmRequest req) {
        return warmer.warm(req == null ? List.of() : req.urls());
    }

    @PostMapping("/evict")
    public ResponseEntity<CacheApiModels.EvictResponse> evictOne() {
        return store.evictOne()
                .map(key -> ResponseEntity.ok(new CacheApiModels.EvictResponse(key)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @DeleteMapping
    public ResponseEntity<Void> clear(@RequestParam(name = "includePersisted", defaultValue = "false") boolean includePersisted) {
        stats.clear(includePersisted);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/discovered")
    public List<String> recordDiscovered(@RequestBody CacheApiModels.DiscoverRequest req) {
        URI base = (req.baseUrl() == null || req.baseUrl().isBlank())
                ? URI.create(props.getOrigin())
                : URI.create(req.baseUrl());
        List<String> found = PageAssetScanner.discover(req.html(), base);
        logger.info("Discovered {} assets on rendered page {}", found.size(), base);
        return discovered.recordDiscovered(found);
    }

    @ExceptionHandler(PrewarmAlreadyRunningException.class)
    public ResponseEntity<CacheApiModels.ErrorResponse> prewarmRunning(PrewarmAlreadyRunningException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new CacheApiModels.ErrorResponse(e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<CacheApiModels.ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new CacheApiModels.ErrorResponse(e.getMessage()));
    }
}
