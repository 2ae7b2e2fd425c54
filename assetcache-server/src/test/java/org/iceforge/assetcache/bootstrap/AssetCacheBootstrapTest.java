package org.iceforge.assetcache.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.assetcache.config.AssetCacheProperties;
import org.iceforge.assetcache.discovery.DiscoveredAssetRegistry;
import org.iceforge.assetcache.http.CachedResponse;
import org.iceforge.assetcache.persist.InMemoryMetadataStore;
import org.iceforge.assetcache.prewarm.AssetPrewarmer;
import org.iceforge.assetcache.prewarm.PrewarmAlreadyRunningException;
import org.iceforge.assetcache.prewarm.PrewarmPriority;
import org.iceforge.assetcache.prewarm.PrewarmResult;
import org.iceforge.assetcache.store.EvictionStore;
import org.iceforge.assetcache.version.BuildVersionGuard;
import org.iceforge.assetcache.version.VersionCheck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AssetCacheBootstrapTest {

    private static final List<String> DISCOVERED = List.of(
            "https://game.example/assets/a.png",
            "https://game.example/assets/b.ogg");

    private InMemoryMetadataStore metadata;
    private ObjectMapper mapper;
    private AssetCacheProperties props;
    private AssetPrewarmer prewarmer;

    @BeforeEach
    void setUp() {
        metadata = new InMemoryMetadataStore();
        mapper = new ObjectMapper();
        props = new AssetCacheProperties();
        props.setPrewarmConcurrency(2);
        prewarmer = mock(AssetPrewarmer.class);
        when(prewarmer.prewarm(anyList(), any(PrewarmPriority.class), anyInt(), any()))
                .thenReturn(Mono.just(new PrewarmResult(2, 0, 0)));
    }

    /** A new process over the same persisted metadata. */
    private AssetCacheBootstrap session(String buildId) {
        props.setBuildId(buildId);
        DiscoveredAssetRegistry discovered = new DiscoveredAssetRegistry(
                metadata, new EvictionStore<CachedResponse>(1024, CachedResponse::copy), mapper, 500);
        return new AssetCacheBootstrap(props, new BuildVersionGuard(metadata, mapper), discovered, prewarmer);
    }

    private void recordDiscoveredInPreviousSession() {
        new DiscoveredAssetRegistry(metadata, new EvictionStore<CachedResponse>(1024, CachedResponse::copy), mapper, 500)
                .recordDiscovered(DISCOVERED);
    }

    @Test
    void firstLaunch_withNothingDiscovered_doesNotPrewarm() {
        AssetCacheBootstrap.InitResult result = session("v1").init().orElseThrow();

        assertEquals(VersionCheck.FRESH_INSTALL, result.version());
        assertFalse(result.prewarmStarted());
        verifyNoInteractions(prewarmer);
    }

    @Test
    void sameBuild_prewarmsDiscoveredAssets() {
        session("v1").init();
        recordDiscoveredInPreviousSession();

        AssetCacheBootstrap.InitResult result = session("v1").init().orElseThrow();

        assertEquals(VersionCheck.UNCHANGED, result.version());
        assertTrue(result.prewarmStarted());
        verify(prewarmer).prewarm(eq(DISCOVERED), eq(PrewarmPriority.NORMAL), eq(2), any());
    }

    @Test
    void newBuild_clearsDiscoveredAssets_andSkipsPrewarm() {
        session("v1").init();
        recordDiscoveredInPreviousSession();

        AssetCacheBootstrap.InitResult result = session("v2").init().orElseThrow();

        assertEquals(VersionCheck.CHANGED, result.version());
        assertFalse(result.prewarmStarted());
        verify(prewarmer, never()).prewarm(anyList(), any(PrewarmPriority.class), anyInt(), any());

        // nothing left over for the session after that either
        AssetCacheBootstrap.InitResult next = session("v2").init().orElseThrow();
        assertFalse(next.prewarmStarted());
    }

    @Test
    void autoPrewarmDisabled_onlyChecksVersion() {
        session("v1").init();
        recordDiscoveredInPreviousSession();
        props.setAutoPrewarm(false);

        AssetCacheBootstrap.InitResult result = session("v1").init().orElseThrow();

        assertFalse(result.prewarmStarted());
        verifyNoInteractions(prewarmer);
    }

    @Test
    void repeatedInit_isIgnored() {
        AssetCacheBootstrap bootstrap = session("v1");

        assertTrue(bootstrap.init().isPresent());
        assertTrue(bootstrap.isInitialized());
        assertTrue(bootstrap.init().isEmpty());
    }

    @Test
    void prewarmRejection_doesNotFailStartup() {
        session("v1").init();
        recordDiscoveredInPreviousSession();
        when(prewarmer.prewarm(anyList(), any(PrewarmPriority.class), anyInt(), any()))
                .thenReturn(Mono.error(new PrewarmAlreadyRunningException()));

        assertDoesNotThrow(() -> session("v1").init());
    }

    @Test
    void shutdown_stopsPrewarming() {
        session("v1").shutdown();
        verify(prewarmer).stop();
    }
}
