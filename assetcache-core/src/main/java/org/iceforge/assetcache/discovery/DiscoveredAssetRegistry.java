package org.iceforge.assetcache.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.assetcache.persist.MetadataStore;
import org.iceforge.assetcache.store.EvictionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Remembers which asset URLs the application needed, so the next session can prewarm them.
 */
public class DiscoveredAssetRegistry {
    private static final Logger logger = LoggerFactory.getLogger(DiscoveredAssetRegistry.class);

    public static final int DEFAULT_MAX_COUNT = 500;

    private static final TypeReference<List<String>> URL_LIST = new TypeReference<>() {};

    private final MetadataStore metadata;
    private final EvictionStore<?> store;
    private final ObjectMapper mapper;
    private final int maxCount;

    public DiscoveredAssetRegistry(MetadataStore metadata, EvictionStore<?> store, ObjectMapper mapper, int maxCount) {
        this.metadata = Objects.requireNonNull(metadata);
        this.store = Objects.requireNonNull(store);
        this.mapper = Objects.requireNonNull(mapper);
        if (maxCount < 1) {
            throw new IllegalArgumentException("maxCount must be at least 1: " + maxCount);
        }
        this.maxCount = maxCount;
    }

    /**
     * Merges {@code discovered} with the keys currently cached, deduplicates, caps the list and
     * persists it. Fresh discoveries come first, then cached keys from most to least recently
     * used, so the cap drops the stalest entries.
     *
     * @return the list as persisted
     */
    public List<String> recordDiscovered(Collection<String> discovered) {
        Set<String> merged = new LinkedHashSet<>();
        if (discovered != null) {
            for (String url : discovered) {
                if (url != null && !url.isBlank()) merged.add(url);
            }
        }
        List<String> cached = store.keys();
        Collections.reverse(cached);
        merged.addAll(cached);
        List<String> capped = new ArrayList<>(merged);
        if (capped.size() > maxCount) {
            capped = new ArrayList<>(capped.subList(0, maxCount));
        }

        try {
            metadata.write(MetadataStore.DISCOVERED_ASSETS, mapper.writeValueAsString(capped));
            logger.info("Recorded {} discovered assets", capped.size());
        } catch (JsonProcessingException e) {
            logger.warn("Failed to encode discovered asset list", e);
        }
        return capped;
    }

    public List<String> loadDiscovered() {
        String raw = metadata.read(MetadataStore.DISCOVERED_ASSETS).orElse(null);
        if (raw == null || raw.isBlank()) return List.of();
        try {
            List<String> urls = mapper.readValue(raw, URL_LIST);
            if (urls == null) return List.of();
            return urls.stream().filter(u -> u != null && !u.isBlank()).distinct().limit(maxCount).toList();
        } catch (JsonProcessingException e) {
            logger.warn("Discarding corrupt discovered asset list: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    public int discoveredCount() {
        return loadDiscovered().size();
    }

    public void clear() {
        metadata.delete(MetadataStore.DISCOVERED_ASSETS);
    }

    public int maxCount() {
        return maxCount;
    }
}
