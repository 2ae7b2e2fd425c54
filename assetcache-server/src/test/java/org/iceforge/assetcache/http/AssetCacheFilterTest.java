package org.iceforge.assetcache.http;

import org.iceforge.assetcache.metrics.CacheMetricsRegistry;
import org.iceforge.assetcache.policy.CachePolicy;
import org.iceforge.assetcache.store.EvictionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssetCacheFilterTest {

    private static final String ASSET = "https://game.example/assets/hero.png";
    private static final Duration WAIT = Duration.ofSeconds(5);

    private EvictionStore<CachedResponse> store;
    private CacheMetricsRegistry metrics;
    private AtomicLong clock;
    private ForegroundActivity activity;
    private AssetCacheFilter filter;
    private AtomicInteger exchanges;

    @BeforeEach
    void setUp() {
        store = new EvictionStore<>(1024, CachedResponse::copy);
        metrics = new CacheMetricsRegistry();
        clock = new AtomicLong(1_000_000_000L);
        activity = new ForegroundActivity(clock::get);
        filter = new AssetCacheFilter(store, CachePolicy.defaults(), metrics, activity);
        exchanges = new AtomicInteger();
    }

    private WebClient client(ExchangeFunction origin) {
        ExchangeFunction counting = request -> {
            exchanges.incrementAndGet();
            return origin.exchange(request);
        };
        WebClient.Builder builder = WebClient.builder().exchangeFunction(counting);
        filter.install(builder);
        return builder.build();
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "image/png")
                .body(body)
                .build());
    }

    /** Body delivered in 16 KB chunks, like a network connector would. */
    static ExchangeFunction respondChunked(byte[] body) {
        return request -> {
            List<DataBuffer> chunks = new ArrayList<>();
            for (int i = 0; i < body.length; i += 16 * 1024) {
                int end = Math.min(body.length, i + 16 * 1024);
                chunks.add(DefaultDataBufferFactory.sharedInstance.wrap(Arrays.copyOfRange(body, i, end)));
            }
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, "audio/ogg")
                    .body(Flux.fromIterable(chunks))
                    .build());
        };
    }

    static byte[] randomBytes(int size) {
        byte[] bytes = new byte[size];
        new Random(42).nextBytes(bytes);
        return bytes;
    }

    private static byte[] getBytes(WebClient client, String url) {
        return client.get().uri(url).retrieve().bodyToMono(byte[].class).block(WAIT);
    }

    @Test
    void miss_storesResponse_andSecondRequestIsServedFromCache() {
        WebClient client = client(respond(HttpStatus.OK, "PNGDATA"));

        byte[] first = getBytes(client, ASSET);
        byte[] second = getBytes(client, ASSET);

        assertThat(new String(first, StandardCharsets.UTF_8)).isEqualTo("PNGDATA");
        assertThat(second).isEqualTo(first);
        assertThat(exchanges.get()).isEqualTo(1);
        assertThat(metrics.misses()).isEqualTo(1);
        assertThat(metrics.hits()).isEqualTo(1);
        assertThat(store.contains(ASSET)).isTrue();
        assertThat(store.currentSizeBytes()).isEqualTo(7);
    }

    @Test
    void assetsLargerThanDefaultCodecBuffer_areCachedAndReplayed() {
        store = new EvictionStore<>(10 * 1024 * 1024, CachedResponse::copy);
        filter = new AssetCacheFilter(store, CachePolicy.defaults(), metrics, activity);
        byte[] clip = randomBytes(300 * 1024);
        WebClient client = client(respondChunked(clip));
        String url = "https://game.example/assets/music/theme.ogg";

        byte[] first = getBytes(client, url);
        byte[] second = getBytes(client, url);

        assertThat(first).isEqualTo(clip);
        assertThat(second).isEqualTo(clip);
        assertThat(exchanges.get()).isEqualTo(1);
        assertThat(metrics.hits()).isEqualTo(1);
        assertThat(store.currentSizeBytes()).isEqualTo(clip.length);
    }

    @Test
    void declaredLengthOverBudget_isPassedThroughUnbuffered() {
        store = new EvictionStore<>(4, CachedResponse::copy);
        filter = new AssetCacheFilter(store, CachePolicy.defaults(), metrics, activity);
        WebClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_LENGTH, "7")
                .body("PNGDATA")
                .build()));

        byte[] body = getBytes(client, ASSET);

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("PNGDATA");
        assertThat(store.size()).isZero();
        assertThat(metrics.misses()).isEqualTo(1);
    }

    @Test
    void cachedHeaders_areReplayed() {
        WebClient client = client(respond(HttpStatus.OK, "PNGDATA"));
        getBytes(client, ASSET);

        String contentType = client.get().uri(ASSET)
                .exchangeToMono(r -> Mono.just(r.headers().asHttpHeaders().getFirst(HttpHeaders.CONTENT_TYPE)))
                .block(WAIT);

        assertThat(contentType).isEqualTo("image/png");
        assertThat(metrics.hits()).isEqualTo(1);
    }

    @Test
    void hits_returnIndependentBodies() {
        WebClient client = client(respond(HttpStatus.OK, "PNGDATA"));
        getBytes(client, ASSET);

        byte[] a = getBytes(client, ASSET);
        a[0] = 'X';
        byte[] b = getBytes(client, ASSET);

        assertThat(new String(b, StandardCharsets.UTF_8)).isEqualTo("PNGDATA");
    }

    @Test
    void nonCacheableRequests_passThrough_andCountAsBypassed() {
        WebClient client = client(respond(HttpStatus.OK, "{}"));

        client.get().uri("https://game.example/api/profile").retrieve().bodyToMono(String.class).block(WAIT);
        client.post().uri(ASSET).retrieve().bodyToMono(String.class).block(WAIT);
        client.get().uri("https://game.example/api/profile").retrieve().bodyToMono(String.class).block(WAIT);

        assertThat(exchanges.get()).isEqualTo(3);
        assertThat(metrics.bypassed()).isEqualTo(3);
        assertThat(metrics.hits()).isZero();
        assertThat(metrics.misses()).isZero();
        assertThat(store.size()).isZero();
    }

    @Test
    void nonSuccessResponses_areNotCached() {
        WebClient client = client(respond(HttpStatus.NOT_FOUND, "missing"));

        Integer status = client.get().uri(ASSET).exchangeToMono(r -> Mono.just(r.statusCode().value())).block(WAIT);
        client.get().uri(ASSET).exchangeToMono(r -> Mono.just(r.statusCode().value())).block(WAIT);

        assertThat(status).isEqualTo(404);
        assertThat(store.contains(ASSET)).isFalse();
        assertThat(exchanges.get()).isEqualTo(2);
        assertThat(metrics.misses()).isEqualTo(2);
    }

    @Test
    void responsesOverBudget_areDeliveredButNotCached() {
        store = new EvictionStore<>(4, CachedResponse::copy);
        filter = new AssetCacheFilter(store, CachePolicy.defaults(), metrics, activity);
        WebClient client = client(respond(HttpStatus.OK, "PNGDATA"));

        byte[] body = getBytes(client, ASSET);

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("PNGDATA");
        assertThat(store.size()).isZero();
    }

    @Test
    void exchangeError_withoutCachedCopy_propagatesOriginalError() {
        WebClient client = client(request -> Mono.error(new IllegalStateException("origin offline")));

        assertThatThrownBy(() -> getBytes(client, ASSET)).hasStackTraceContaining("origin offline");
        assertThat(metrics.staleServed()).isZero();
    }

    @Test
    void exchangeError_withCachedCopy_servesStaleCopy() {
        CachedResponse snapshot = new CachedResponse(200, new HttpHeaders(), "OLDDATA".getBytes(StandardCharsets.UTF_8));
        // the entry lands while the request is in flight, so the lookup before the exchange misses
        WebClient client = client(request -> {
            store.set(ASSET, snapshot, snapshot.sizeBytes());
            return Mono.error(new IllegalStateException("origin offline"));
        });

        byte[] body = getBytes(client, ASSET);

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("OLDDATA");
        assertThat(metrics.staleServed()).isEqualTo(1);
        assertThat(metrics.misses()).isEqualTo(1);
    }

    @Test
    void install_isIdempotent() {
        WebClient.Builder builder = WebClient.builder();

        assertThat(filter.install(builder)).isTrue();
        assertThat(filter.install(builder)).isFalse();
        assertThat(new AssetCacheFilter(store, CachePolicy.defaults(), metrics, activity).install(builder)).isFalse();

        AtomicInteger installed = new AtomicInteger();
        builder.filters(filters -> installed.set(filters.size()));
        assertThat(installed.get()).isEqualTo(1);
    }

    @Test
    void requests_markForegroundActivity() {
        clock.addAndGet(10_000_000_000L);
        WebClient client = client(respond(HttpStatus.OK, "PNGDATA"));
        assertThat(activity.isQuietFor(5_000_000_000L)).isTrue();

        getBytes(client, ASSET);

        assertThat(activity.inFlight()).isZero();
        assertThat(activity.isQuietFor(1)).isFalse();
        clock.addAndGet(2);
        assertThat(activity.isQuietFor(1)).isTrue();
    }
}
