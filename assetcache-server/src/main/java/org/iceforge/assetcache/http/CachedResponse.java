package org.iceforge.assetcache.http;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.BodyExtractors;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fully buffered snapshot of a successful response.
 * <p>
 * A response body can only be consumed once, so the cache keeps the bytes and hands every caller
 * a new {@link ClientResponse} over its own copy of them.
 */
public final class CachedResponse {

    private final int statusCode;
    private final HttpHeaders headers;
    private final byte[] body;

    public CachedResponse(int statusCode, HttpHeaders headers, byte[] body) {
        this.statusCode = statusCode;
        HttpHeaders copy = new HttpHeaders();
        if (headers != null) copy.addAll(headers);
        this.headers = HttpHeaders.readOnlyHttpHeaders(copy);
        this.body = Objects.requireNonNull(body, "body").clone();
    }

    /**
     * Largest in-memory buffer WebFlux accepts for a store budget of {@code maxSizeBytes}.
     */
    public static int bufferLimit(long maxSizeBytes) {
        return (int) Math.min(maxSizeBytes, Integer.MAX_VALUE);
    }

    /**
     * Strategies for responses rebuilt from snapshots. The bytes are already in memory, so the
     * decoders are not limited.
     */
    public static ExchangeStrategies replayStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(-1))
                .build();
    }

    /**
     * Reads the whole body of {@code response} into a byte array, independent of the codec limits
     * the response was created with.
     *
     * @param maxBytes upper bound on the body, or {@code -1} for none; exceeding it fails with
     *                 {@link org.springframework.core.io.buffer.DataBufferLimitException}
     */
    public static Mono<byte[]> readBody(ClientResponse response, int maxBytes) {
        return DataBufferUtils.join(response.body(BodyExtractors.toDataBuffers()), maxBytes)
                .map(CachedResponse::drain)
                .defaultIfEmpty(new byte[0]);
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    public int statusCode() {
        return statusCode;
    }

    public HttpHeaders headers() {
        return headers;
    }

    /** Copy of the body; the snapshot itself is never exposed. */
    public byte[] body() {
        return body.clone();
    }

    /** Bytes charged against the store budget. */
    public long sizeBytes() {
        return body.length;
    }

    public CachedResponse copy() {
        return new CachedResponse(statusCode, headers, body);
    }

    public ClientResponse toClientResponse(ExchangeStrategies strategies) {
        return ClientResponse.create(HttpStatusCode.valueOf(statusCode), strategies)
                .headers(h -> h.addAll(headers))
                .body(Flux.defer(() -> Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body.clone()))))
                .build();
    }

    public boolean sameContentAs(CachedResponse other) {
        return other != null
                && statusCode == other.statusCode
                && headers.equals(other.headers)
                && Arrays.equals(body, other.body);
    }
}
