package org.iceforge.assetcache.persist;

import java.util.Optional;

/**
 * Durable key/value storage for cache metadata that must survive restarts.
 * <p>
 * Implementations never throw on I/O problems: a failed read looks like an absent key and a
 * failed write is logged and dropped. Cache metadata is advisory, so losing it only costs a
 * colder start.
 */
public interface MetadataStore {

    /** Build identifier of the application bundle the metadata belongs to. */
    String BUILD_VERSION = "build-version";

    /** JSON array of asset URLs discovered in earlier sessions. */
    String DISCOVERED_ASSETS = "discovered-assets";

    /** Best-effort JSON statistics snapshot. */
    String CACHE_STATS = "cache-stats";

    Optional<String> read(String key);

    void write(String key, String value);

    void delete(String key);
}
