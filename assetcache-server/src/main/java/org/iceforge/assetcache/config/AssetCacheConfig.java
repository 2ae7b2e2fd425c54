package org.iceforge.assetcache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.assetcache.discovery.DiscoveredAssetRegistry;
import org.iceforge.assetcache.http.AssetCacheFilter;
import org.iceforge.assetcache.http.CachedResponse;
import org.iceforge.assetcache.http.ForegroundActivity;
import org.iceforge.assetcache.metrics.CacheMetricsRegistry;
import org.iceforge.assetcache.persist.FileMetadataStore;
import org.iceforge.assetcache.persist.InMemoryMetadataStore;
import org.iceforge.assetcache.persist.MetadataStore;
import org.iceforge.assetcache.policy.CachePolicy;
import org.iceforge.assetcache.prewarm.ActivityIdleScheduler;
import org.iceforge.assetcache.prewarm.AssetManifestLoader;
import org.iceforge.assetcache.prewarm.AssetPrewarmer;
import org.iceforge.assetcache.prewarm.CacheWarmer;
import org.iceforge.assetcache.prewarm.IdleScheduler;
import org.iceforge.assetcache.size.DataSizeParser;
import org.iceforge.assetcache.store.EvictionStore;
import org.iceforge.assetcache.version.BuildVersionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.nio.file.Path;

@Configuration
public class AssetCacheConfig {
    private static final Logger logger = LoggerFactory.getLogger(AssetCacheConfig.class);

    @Bean
    public MetadataStore metadataStore(AssetCacheProperties props) {
        String dir = props.getMetadataDir();
        if (dir == null || dir.isBlank()) {
            logger.info("No metadata directory configured, asset metadata will not survive restarts");
            return new InMemoryMetadataStore();
        }
        return new FileMetadataStore(Path.of(dir));
    }

    @Bean
    public EvictionStore<CachedResponse> assetStore(AssetCacheProperties props) {
        long maxBytes = DataSizeParser.parseBytes(props.getMaxSize());
        logger.info("Asset cache budget {} bytes from property value {}", maxBytes, props.getMaxSize());
        return new EvictionStore<>(maxBytes, CachedResponse::copy);
    }

    @Bean
    public CachePolicy cachePolicy(AssetCacheProperties props) {
        return CachePolicy.withExtraRules(props.getNeverCachePatterns(), props.getCacheablePatterns());
    }

    @Bean
    public CacheMetricsRegistry cacheMetricsRegistry() {
        return new CacheMetricsRegistry();
    }

    @Bean
    public ForegroundActivity foregroundActivity() {
        return new ForegroundActivity();
    }

    @Bean
    public AssetCacheFilter assetCacheFilter(EvictionStore<CachedResponse> assetStore,
                                             CachePolicy cachePolicy,
                                             CacheMetricsRegistry metrics,
                                             ForegroundActivity activity) {
        return new AssetCacheFilter(assetStore, cachePolicy, metrics, activity);
    }

    /**
     * Client for application traffic; every request goes through the asset cache.
     */
    @Bean
    @Primary
    public WebClient assetWebClient(WebClient.Builder builder,
                                    AssetCacheFilter filter,
                                    EvictionStore<CachedResponse> assetStore,
                                    AssetCacheProperties props) {
        filter.install(builder);
        return withBufferLimit(builder, assetStore).baseUrl(props.getOrigin()).build();
    }

    /**
     * Client that bypasses the asset cache, for background fetches that must not count as traffic.
     */
    @Bean
    public WebClient originWebClient(WebClient.Builder builder, EvictionStore<CachedResponse> assetStore) {
        return withBufferLimit(builder, assetStore).build();
    }

    /** Any asset that fits the cache budget must also fit a WebFlux decode buffer. */
    private static WebClient.Builder withBufferLimit(WebClient.Builder builder, EvictionStore<CachedResponse> assetStore) {
        int limit = CachedResponse.bufferLimit(assetStore.maxSizeBytes());
        return builder.codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(limit));
    }

    @Bean
    public IdleScheduler idleScheduler(ForegroundActivity activity, AssetCacheProperties props) {
        return new ActivityIdleScheduler(activity, props.getIdleQuietPeriod(), props.getIdlePollInterval(),
                props.getIdleMaxWait());
    }

    @Bean
    public AssetPrewarmer assetPrewarmer(EvictionStore<CachedResponse> assetStore,
                                         CachePolicy cachePolicy,
                                         @Qualifier("originWebClient") WebClient originWebClient,
                                         IdleScheduler idleScheduler,
                                         CacheMetricsRegistry metrics,
                                         AssetCacheProperties props) {
        return new AssetPrewarmer(assetStore, cachePolicy, originWebClient, idleScheduler, metrics,
                props.getFetchTimeout(), URI.create(props.getOrigin()));
    }

    @Bean
    public AssetManifestLoader assetManifestLoader(@Qualifier("originWebClient") WebClient originWebClient,
                                                   ObjectMapper mapper,
                                                   AssetCacheProperties props) {
        URI manifest = URI.create(props.getOrigin()).resolve(props.getManifestPath());
        return new AssetManifestLoader(originWebClient, mapper, manifest, props.getFetchTimeout());
    }

    @Bean
    public CacheWarmer cacheWarmer(AssetPrewarmer prewarmer, AssetManifestLoader loader, AssetCacheProperties props) {
        return new CacheWarmer(prewarmer, loader, props.getPrewarmConcurrency());
    }

    @Bean
    public BuildVersionGuard buildVersionGuard(MetadataStore metadataStore, ObjectMapper mapper) {
        return new BuildVersionGuard(metadataStore, mapper);
    }

    @Bean
    public DiscoveredAssetRegistry discoveredAssetRegistry(MetadataStore metadataStore,
                                                           EvictionStore<CachedResponse> assetStore,
                                                           ObjectMapper mapper,
                                                           AssetCacheProperties props) {
        return new DiscoveredAssetRegistry(metadataStore, assetStore, mapper, props.getDiscoveredMaxCount());
    }
}
