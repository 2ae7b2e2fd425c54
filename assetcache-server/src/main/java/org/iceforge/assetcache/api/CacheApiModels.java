package org.iceforge.assetcache.api;

import java.util.List;

public final class CacheApiModels {
    private CacheApiModels() {}

    /** {@code concurrency} falls back to the configured value when absent. */
    public record PrewarmRequest(List<String> urls, Integer concurrency) {}

    /** No URLs means "warm from the asset manifest". */
    public record WarmRequest(List<String> urls) {}

    /** Snapshot of the rendered page, posted by the shell once the application has settled. */
    public record DiscoverRequest(String html, String baseUrl) {}

    public record EvictResponse(String evictedKey) {}

    public record ErrorResponse(String error) {}
}
