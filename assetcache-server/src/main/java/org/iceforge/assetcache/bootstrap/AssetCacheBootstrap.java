package org.iceforge.assetcache.bootstrap;

import jakarta.annotation.PreDestroy;
import org.iceforge.assetcache.config.AssetCacheProperties;
import org.iceforge.assetcache.discovery.DiscoveredAssetRegistry;
import org.iceforge.assetcache.prewarm.AssetPrewarmer;
import org.iceforge.assetcache.prewarm.PrewarmPriority;
import org.iceforge.assetcache.version.BuildVersionGuard;
import org.iceforge.assetcache.version.VersionCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Startup sequence: check the build identifier, then prewarm from the previous session's
 * discovered assets unless the build changed.
 */
@Component
public class AssetCacheBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(AssetCacheBootstrap.class);

    public record InitResult(VersionCheck version, boolean prewarmStarted) {}

    private final AssetCacheProperties props;
    private final BuildVersionGuard versionGuard;
    private final DiscoveredAssetRegistry discovered;
    private final AssetPrewarmer prewarmer;

    private final AtomicBoolean initialized = new AtomicBoolean(false);

    public AssetCacheBootstrap(AssetCacheProperties props,
                               BuildVersionGuard versionGuard,
                               DiscoveredAssetRegistry discovered,
                               AssetPrewarmer prewarmer) {
        this.props = Objects.requireNonNull(props);
        this.versionGuard = Objects.requireNonNull(versionGuard);
        this.discovered = Objects.requireNonNull(discovered);
        this.prewarmer = Objects.requireNonNull(prewarmer);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        init();
    }

    /**
     * Runs the startup sequence once. Later calls log a warning and return empty.
     */
    public Optional<InitResult> init() {
        if (!initialized.compareAndSet(false, true)) {
            logger.warn("Asset cache already initialized; ignoring repeated init");
            return Optional.empty();
        }

        VersionCheck version = versionGuard.check(props.getBuildId());

        if (!props.isAutoPrewarm()) {
            logger.info("Auto-prewarm disabled");
            return Optional.of(new InitResult(version, false));
        }
        if (version.changed()) {
            logger.info("Skipping auto-prewarm: discovered assets belong to a previous build");
            return Optional.of(new InitResult(version, false));
        }

        List<String> urls = discovered.loadDiscovered();
        if (urls.isEmpty()) {
            logger.info("No discovered assets from earlier sessions, cache will populate on demand");
            return Optional.of(new InitResult(version, false));
        }

        logger.info("Auto-prewarming {} assets discovered in earlier sessions", urls.size());
        prewarmer.prewarm(urls, PrewarmPriority.NORMAL, props.getPrewarmConcurrency(),
                        p -> logger.debug("Auto-prewarm progress {}% ({}/{}, {} failed)",
                                p.percent(), p.completed(), p.total(), p.failed()))
                .subscribe(
                        r -> logger.info("Auto-prewarm finished: {} cached, {} failed, {} skipped",
                                r.success(), r.failed(), r.skipped()),
                        e -> logger.warn("Auto-prewarm did not run: {}", e.toString()));
        return Optional.of(new InitResult(version, true));
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    @PreDestroy
    public void shutdown() {
        prewarmer.stop();
    }
}
