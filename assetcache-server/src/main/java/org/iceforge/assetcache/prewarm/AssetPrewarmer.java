package org.iceforge.assetcache.prewarm;

import org.iceforge.assetcache.discovery.PageAssetScanner;
import org.iceforge.assetcache.http.CachedResponse;
import org.iceforge.assetcache.metrics.CacheMetricsRegistry;
import org.iceforge.assetcache.policy.CachePolicy;
import org.iceforge.assetcache.store.EvictionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Populates the {@link EvictionStore} ahead of demand.
 * <p>
 * Eligible URLs are fetched in sequential batches: a batch starts only once the
 * {@link IdleScheduler} reports spare capacity and the previous batch has fully finished, so at
 * most {@code concurrency} fetches are ever in flight. Fetches go through a WebClient without the
 * cache filter, so prewarming never shows up as hits or misses.
 * <p>
 * Only one run may be active at a time; a concurrent request fails with
 * {@link PrewarmAlreadyRunningException} instead of being queued.
 */
public class AssetPrewarmer {
    private static final Logger logger = LoggerFactory.getLogger(AssetPrewarmer.class);

    private final EvictionStore<CachedResponse> store;
    private final CachePolicy policy;
    private final WebClient rawClient;
    private final IdleScheduler idleScheduler;
    private final CacheMetricsRegistry metrics;
    private final Duration fetchTimeout;
    private final URI origin;

    /** Identity of the active run; released only by the run that claimed it. */
    private static final class Run {
        final AtomicBoolean stopRequested = new AtomicBoolean(false);
    }

    private final AtomicReference<Run> current = new AtomicReference<>();

    public AssetPrewarmer(EvictionStore<CachedResponse> store,
                          CachePolicy policy,
                          WebClient rawClient,
                          IdleScheduler idleScheduler,
                          CacheMetricsRegistry metrics,
                          Duration fetchTimeout,
                          URI origin) {
        this.store = Objects.requireNonNull(store);
        this.policy = Objects.requireNonNull(policy);
        this.rawClient = Objects.requireNonNull(rawClient);
        this.idleScheduler = Objects.requireNonNull(idleScheduler);
        this.metrics = Objects.requireNonNull(metrics);
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout);
        this.origin = PageAssetScanner.withRootPath(origin);
    }

    public boolean isRunning() {
        return current.get() != null;
    }

    /**
     * Stops scheduling further batches. The batch in flight runs to completion.
     */
    public void stop() {
        Run run = current.get();
        if (run != null && run.stopRequested.compareAndSet(false, true)) {
            logger.info("Prewarm stop requested; finishing current batch");
        }
    }

    public Mono<PrewarmResult> prewarm(List<String> urls, PrewarmPriority priority, int concurrency,
                                       Consumer<PrewarmProgress> onProgress) {
        return prewarm(urls, priority.effectiveConcurrency(concurrency), onProgress);
    }

    public Mono<PrewarmResult> prewarm(List<String> urls, int concurrency, Consumer<PrewarmProgress> onProgress) {
        return Mono.defer(() -> {
            Run run = new Run();
            if (!current.compareAndSet(null, run)) {
                return Mono.<PrewarmResult>error(new PrewarmAlreadyRunningException());
            }

            List<String> input = urls == null ? List.of() : urls;
            List<String> eligible = eligible(input);
            int skipped = input.size() - eligible.size();
            int total = eligible.size();
            int batchSize = Math.max(1, concurrency);

            AtomicInteger succeeded = new AtomicInteger();
            AtomicInteger failed = new AtomicInteger();

            logger.info("Prewarming {} assets ({} skipped) in batches of {}", total, skipped, batchSize);

            return Flux.fromIterable(partition(eligible, batchSize))
                    .concatMap(batch -> Mono.defer(() -> {
                        if (run.stopRequested.get()) return Mono.<Void>empty();
                        return idleScheduler.whenIdle()
                                .thenMany(Flux.fromIterable(batch).flatMap(this::fetchAndStore, batch.size()))
                                .doOnNext(ok -> (ok ? succeeded : failed).incrementAndGet())
                                .then(Mono.<Void>fromRunnable(() ->
                                        report(onProgress, PrewarmProgress.of(succeeded.get(), failed.get(), total))));
                    }))
                    .then(Mono.fromCallable(() -> {
                        release(run);
                        return new PrewarmResult(succeeded.get(), failed.get(), skipped);
                    }))
                    .doOnNext(r -> logger.info("Prewarm complete: {}/{} cached, {} failed, {} skipped",
                            r.success(), total, r.failed(), r.skipped()))
                    .doFinally(signal -> release(run));
        });
    }

    private void release(Run run) {
        current.compareAndSet(run, null);
    }

    private List<String> eligible(List<String> urls) {
        Set<String> seen = new LinkedHashSet<>();
        for (String raw : urls) {
            String url = resolve(raw);
            if (url == null) continue;
            if (!policy.shouldCache(url, "GET")) continue;
            if (store.contains(url)) continue;
            seen.add(url);
        }
        return new ArrayList<>(seen);
    }

    private String resolve(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            URI uri = URI.create(raw.trim());
            if (!uri.isAbsolute()) {
                if (origin == null) return null;
                uri = origin.resolve(uri);
            }
            return uri.toString();
        } catch (IllegalArgumentException e) {
            logger.debug("Skipping malformed URL {}", raw);
            return null;
        }
    }

    private Mono<Boolean> fetchAndStore(String url) {
        return rawClient.get()
                .uri(URI.create(url))
                .exchangeToMono(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        return response.releaseBody()
                                .then(Mono.<CachedResponse>error(new PrewarmFetchException(url, response.statusCode().value())));
                    }
                    return CachedResponse.readBody(response, CachedResponse.bufferLimit(store.maxSizeBytes()))
                            .map(bytes -> new CachedResponse(
                                    response.statusCode().value(), response.headers().asHttpHeaders(), bytes));
                })
                .timeout(fetchTimeout)
                .map(snapshot -> {
                    if (!store.set(url, snapshot, snapshot.sizeBytes())) {
                        throw new PrewarmFetchException(url, "larger than the cache budget");
                    }
                    metrics.recordPrewarmed();
                    return true;
                })
                .onErrorResume(e -> {
                    metrics.recordPrewarmFailed();
                    logger.warn("Failed to prewarm {}: {}", url, e.toString());
                    return Mono.just(false);
                });
    }

    private static void report(Consumer<PrewarmProgress> onProgress, PrewarmProgress progress) {
        if (onProgress == null) return;
        try {
            onProgress.accept(progress);
        } catch (RuntimeException e) {
            logger.warn("Prewarm progress callback failed", e);
        }
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            out.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
        }
        return out;
    }
}
