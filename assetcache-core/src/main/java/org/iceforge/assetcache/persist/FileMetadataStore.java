package org.iceforge.assetcache.persist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link MetadataStore} keeping one file per key:
 * <pre>
 *   {baseDir}/{key}.json
 * </pre>
 * Writes go to a temp file in the same directory and are then moved over the target, so a crash
 * never leaves a half-written value behind.
 */
public class FileMetadataStore implements MetadataStore {
    private static final Logger log = LoggerFactory.getLogger(FileMetadataStore.class);

    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path baseDir;

    public FileMetadataStore(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            // Reads will report absence and writes will be skipped until the directory appears.
            log.warn("Failed to create metadata directory {}: {}", this.baseDir, e.toString());
        }
        log.info("Using file metadata store: baseDir={}", this.baseDir);
    }

    public Path baseDir() {
        return baseDir;
    }

    private Path pathFor(String key) {
        if (key == null || !SAFE_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Illegal metadata key: " + key);
        }
        return baseDir.resolve(key + ".json");
    }

    @Override
    public Optional<String> read(String key) {
        Path p = pathFor(key);
        if (!Files.exists(p)) return Optional.empty();
        try {
            return Optional.of(Files.readString(p, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read metadata {}: {}", p, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public void write(String key, String value) {
        Path dst = pathFor(key);
        try {
            Files.createDirectories(baseDir);
            Path tmp = Files.createTempFile(baseDir, "assetcache-", ".tmp");
            try {
                Files.writeString(tmp, Objects.requireNonNull(value), StandardCharsets.UTF_8);
                Files.move(tmp, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            log.warn("Failed to write metadata {}: {}", dst, e.toString());
        }
    }

    @Override
    public void delete(String key) {
        Path p = pathFor(key);
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("Failed to delete metadata {}: {}", p, e.toString());
        }
    }
}
