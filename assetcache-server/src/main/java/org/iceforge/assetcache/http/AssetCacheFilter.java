package org.iceforge.assetcache.http;

import org.iceforge.assetcache.metrics.CacheMetricsRegistry;
import org.iceforge.assetcache.policy.CachePolicy;
import org.iceforge.assetcache.store.EvictionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebClient filter that serves cacheable GETs from the {@link EvictionStore}.
 * <ul>
 *   <li>non-cacheable requests pass straight through</li>
 *   <li>hits are answered with a fresh response over a copy of the cached bytes</li>
 *   <li>2xx misses are buffered, stored and replayed to the caller</li>
 *   <li>exchange errors fall back to a cached copy when one exists, else propagate unchanged</li>
 * </ul>
 * Code that must not be counted as application traffic (prewarming, manifest loading) uses a
 * WebClient without this filter.
 */
public class AssetCacheFilter implements ExchangeFilterFunction {
    private static final Logger logger = LoggerFactory.getLogger(AssetCacheFilter.class);

    private final EvictionStore<CachedResponse> store;
    private final CachePolicy policy;
    private final CacheMetricsRegistry metrics;
    private final ForegroundActivity activity;
    private final ExchangeStrategies strategies;

    public AssetCacheFilter(EvictionStore<CachedResponse> store,
                            CachePolicy policy,
                            CacheMetricsRegistry metrics,
                            ForegroundActivity activity) {
        this(store, policy, metrics, activity, CachedResponse.replayStrategies());
    }

    public AssetCacheFilter(EvictionStore<CachedResponse> store,
                            CachePolicy policy,
                            CacheMetricsRegistry metrics,
                            ForegroundActivity activity,
                            ExchangeStrategies strategies) {
        this.store = Objects.requireNonNull(store);
        this.policy = Objects.requireNonNull(policy);
        this.metrics = Objects.requireNonNull(metrics);
        this.activity = Objects.requireNonNull(activity);
        this.strategies = Objects.requireNonNull(strategies);
    }

    /**
     * Adds this filter to {@code builder} unless an {@code AssetCacheFilter} is already installed.
     *
     * @return {@code true} if the filter was added
     */
    public boolean install(WebClient.Builder builder) {
        AtomicBoolean added = new AtomicBoolean();
        builder.filters(filters -> {
            if (filters.stream().anyMatch(f -> f instanceof AssetCacheFilter)) {
                logger.warn("Asset cache filter already installed on this WebClient builder; ignoring");
                return;
            }
            filters.add(this);
            added.set(true);
        });
        return added.get();
    }

    @Override
    public Mono<ClientResponse> filter(ClientRequest request, ExchangeFunction next) {
        return Mono.defer(() -> intercept(request, next))
                .doOnSubscribe(s -> activity.begin())
                .doFinally(signal -> activity.end());
    }

    private Mono<ClientResponse> intercept(ClientRequest request, ExchangeFunction next) {
        String url = request.url().toString();

        if (!policy.shouldCache(url, request.method().name())) {
            metrics.recordBypass();
            return next.exchange(request);
        }

        Optional<CachedResponse> hit = store.get(url);
        if (hit.isPresent()) {
            metrics.recordHit();
            logger.debug("Cache hit for {}", url);
            return Mono.just(hit.get().toClientResponse(strategies));
        }

        metrics.recordMiss();
        logger.debug("Cache miss for {}", url);
        return next.exchange(request)
                .flatMap(response -> response.statusCode().is2xxSuccessful() && !exceedsBudget(response)
                        ? storeAndReplay(url, response)
                        : Mono.just(response))
                .onErrorResume(error -> staleOrError(url, error));
    }

    /** Declared length larger than the whole budget: hand the response over unbuffered. */
    private boolean exceedsBudget(ClientResponse response) {
        long declared = response.headers().contentLength().orElse(-1L);
        if (declared > store.maxSizeBytes()) {
            logger.debug("Not buffering {} byte response, larger than the cache budget", declared);
            return true;
        }
        return false;
    }

    private Mono<ClientResponse> storeAndReplay(String url, ClientResponse response) {
        // Length unknown up front, so the body is buffered in full and the store decides.
        return CachedResponse.readBody(response, -1)
                .map(bytes -> {
                    CachedResponse snapshot = new CachedResponse(
                            response.statusCode().value(), response.headers().asHttpHeaders(), bytes);
                    if (!store.set(url, snapshot, snapshot.sizeBytes())) {
                        logger.debug("Not cached (exceeds budget): {} ({} bytes)", url, snapshot.sizeBytes());
                    }
                    return snapshot.toClientResponse(strategies);
                });
    }

    private Mono<ClientResponse> staleOrError(String url, Throwable error) {
        Optional<CachedResponse> stale = store.get(url);
        if (stale.isEmpty()) {
            return Mono.error(error);
        }
        metrics.recordStaleServed();
        logger.warn("Request for {} failed ({}); serving cached copy", url, error.toString());
        return Mono.just(stale.get().toClientResponse(strategies));
    }
}
