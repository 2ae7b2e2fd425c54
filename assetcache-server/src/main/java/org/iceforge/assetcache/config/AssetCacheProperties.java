package org.iceforge.assetcache.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings supplied by the embedding shell.
 * <p>
 * Defaults are sized for a desktop client talking to a single remote application.
 */
@ConfigurationProperties(prefix = "assetcache")
public class AssetCacheProperties {

    /** Identifier of the embedded application build, e.g. a content hash of its bundle. */
    private String buildId = "";

    /** Memory budget for cached responses, e.g. "256MB" or "512MiB". */
    private String maxSize = "256MB";

    /** Prewarm from the previous session's discovered assets on startup (skipped after a rebuild). */
    private boolean autoPrewarm = true;

    /** Fetches per prewarm batch. */
    private int prewarmConcurrency = 3;

    /** Upper bound for a single prewarm fetch; a timeout counts as a failure. */
    private Duration fetchTimeout = Duration.ofSeconds(30);

    /** Base URL of the remote application. Relative asset URLs are resolved against it. */
    private String origin = "http://localhost:8080";

    /** Location of the asset manifest, relative to {@link #origin}. */
    private String manifestPath = "/assets/manifest.json";

    /** Directory for durable metadata. Blank keeps metadata in memory only. */
    private String metadataDir = "./data/assetcache";

    /** Cap on the persisted discovered-asset list. */
    private int discoveredMaxCount = 500;

    /** Foreground silence required before a prewarm batch is dispatched. */
    private Duration idleQuietPeriod = Duration.ofMillis(250);

    private Duration idlePollInterval = Duration.ofMillis(50);

    /** Longest a prewarm batch waits for an idle window before running anyway. */
    private Duration idleMaxWait = Duration.ofSeconds(3);

    /** Extra regular expressions for URLs that must never be cached. */
    private List<String> neverCachePatterns = new ArrayList<>();

    /** Extra regular expressions for URLs that may be cached. */
    private List<String> cacheablePatterns = new ArrayList<>();

    public String getBuildId() {
        return buildId;
    }

    public void setBuildId(String buildId) {
        this.buildId = buildId;
    }

    public String getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(String maxSize) {
        this.maxSize = maxSize;
    }

    public boolean isAutoPrewarm() {
        return autoPrewarm;
    }

    public void setAutoPrewarm(boolean autoPrewarm) {
        this.autoPrewarm = autoPrewarm;
    }

    public int getPrewarmConcurrency() {
        return prewarmConcurrency;
    }

    public void setPrewarmConcurrency(int prewarmConcurrency) {
        this.prewarmConcurrency = prewarmConcurrency;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public String getOrigin() {
        return origin;
    }

    public void setOrigin(String origin) {
        this.origin = origin;
    }

    public String getManifestPath() {
        return manifestPath;
    }

    public void setManifestPath(String manifestPath) {
        this.manifestPath = manifestPath;
    }

    public String getMetadataDir() {
        return metadataDir;
    }

    public void setMetadataDir(String metadataDir) {
        this.metadataDir = metadataDir;
    }

    public int getDiscoveredMaxCount() {
        return discoveredMaxCount;
    }

    public void setDiscoveredMaxCount(int discoveredMaxCount) {
        this.discoveredMaxCount = discoveredMaxCount;
    }

    public Duration getIdleQuietPeriod() {
        return idleQuietPeriod;
    }

    public void setIdleQuietPeriod(Duration idleQuietPeriod) {
        this.idleQuietPeriod = idleQuietPeriod;
    }

    public Duration getIdlePollInterval() {
        return idlePollInterval;
    }

    public void setIdlePollInterval(Duration idlePollInterval) {
        this.idlePollInterval = idlePollInterval;
    }

    public Duration getIdleMaxWait() {
        return idleMaxWait;
    }

    public void setIdleMaxWait(Duration idleMaxWait) {
        this.idleMaxWait = idleMaxWait;
    }

    public List<String> getNeverCachePatterns() {
        return neverCachePatterns;
    }

    public void setNeverCachePatterns(List<String> neverCachePatterns) {
        this.neverCachePatterns = neverCachePatterns;
    }

    public List<String> getCacheablePatterns() {
        return cacheablePatterns;
    }

    public void setCacheablePatterns(List<String> cacheablePatterns) {
        this.cacheablePatterns = cacheablePatterns;
    }
}
