package org.iceforge.assetcache.http;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CachedResponseTest {

    @Test
    void snapshot_isDetachedFromCallerArrays() {
        byte[] source = "abc".getBytes(StandardCharsets.UTF_8);
        CachedResponse response = new CachedResponse(200, new HttpHeaders(), source);

        source[0] = 'z';
        response.body()[1] = 'z';

        assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo("abc");
        assertThat(response.sizeBytes()).isEqualTo(3);
    }

    @Test
    void headers_areReadOnlyCopies() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("ETag", "\"1\"");
        CachedResponse response = new CachedResponse(200, headers, new byte[0]);

        headers.add("ETag", "\"2\"");

        assertThat(response.headers().get("ETag")).containsExactly("\"1\"");
        assertThatThrownBy(() -> response.headers().add("X", "y")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void clientResponse_canBeBuiltRepeatedly() {
        CachedResponse response = new CachedResponse(203, new HttpHeaders(), "data".getBytes(StandardCharsets.UTF_8));

        for (int i = 0; i < 2; i++) {
            ClientResponse r = response.toClientResponse(ExchangeStrategies.withDefaults());
            assertThat(r.statusCode().value()).isEqualTo(203);
            assertThat(r.bodyToMono(String.class).block(Duration.ofSeconds(1))).isEqualTo("data");
        }
    }

    @Test
    void copy_hasSameContent() {
        CachedResponse response = new CachedResponse(200, new HttpHeaders(), new byte[]{1, 2, 3});
        assertThat(response.copy().sameContentAs(response)).isTrue();
        assertThat(response.sameContentAs(new CachedResponse(200, new HttpHeaders(), new byte[]{1, 2}))).isFalse();
    }
}
