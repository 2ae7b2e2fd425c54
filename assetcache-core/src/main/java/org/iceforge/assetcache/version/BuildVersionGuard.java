package org.iceforge.assetcache.version;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.assetcache.persist.MetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Invalidates persisted discovery metadata when the embedded application is rebuilt.
 * <p>
 * Only persisted state is touched. In-memory entries belong to the current process, which was
 * started against the current build anyway.
 */
public class BuildVersionGuard {
    private static final Logger logger = LoggerFactory.getLogger(BuildVersionGuard.class);

    private final MetadataStore metadata;
    private final ObjectMapper mapper;

    public BuildVersionGuard(MetadataStore metadata, ObjectMapper mapper) {
        this.metadata = Objects.requireNonNull(metadata);
        this.mapper = Objects.requireNonNull(mapper);
    }

    public VersionCheck check(String buildId) {
        if (buildId == null || buildId.isBlank()) {
            logger.warn("No build identifier supplied; persisted asset metadata is kept as-is");
            return VersionCheck.UNCHANGED;
        }

        Optional<String> previous = readPersisted();
        if (previous.isEmpty()) {
            persist(buildId);
            logger.info("No persisted build identifier, recording {}", buildId);
            return VersionCheck.FRESH_INSTALL;
        }
        if (previous.get().equals(buildId)) {
            logger.debug("Build identifier unchanged: {}", buildId);
            return VersionCheck.UNCHANGED;
        }

        metadata.delete(MetadataStore.DISCOVERED_ASSETS);
        metadata.delete(MetadataStore.CACHE_STATS);
        persist(buildId);
        logger.info("Build changed {} -> {}, cleared discovered assets and cache statistics", previous.get(), buildId);
        return VersionCheck.CHANGED;
    }

    public Optional<String> persistedBuildId() {
        return readPersisted();
    }

    private Optional<String> readPersisted() {
        Optional<String> raw = metadata.read(MetadataStore.BUILD_VERSION);
        if (raw.isEmpty()) return Optional.empty();
        try {
            String value = mapper.readValue(raw.get(), String.class);
            return (value == null || value.isBlank()) ? Optional.empty() : Optional.of(value);
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring unreadable persisted build identifier: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void persist(String buildId) {
        try {
            metadata.write(MetadataStore.BUILD_VERSION, mapper.writeValueAsString(buildId));
        } catch (JsonProcessingException e) {
            logger.warn("Failed to encode build identifier {}", buildId, e);
        }
    }
}
