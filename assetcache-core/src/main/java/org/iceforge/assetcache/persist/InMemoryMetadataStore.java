package org.iceforge.assetcache.persist;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link MetadataStore}, used when no metadata directory is configured and in tests.
 */
public class InMemoryMetadataStore implements MetadataStore {

    private final ConcurrentHashMap<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> read(String key) {
        return Optional.ofNullable(values.get(Objects.requireNonNull(key)));
    }

    @Override
    public void write(String key, String value) {
        values.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
    }

    @Override
    public void delete(String key) {
        values.remove(Objects.requireNonNull(key));
    }
}
