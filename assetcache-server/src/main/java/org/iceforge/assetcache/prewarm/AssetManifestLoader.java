package org.iceforge.assetcache.prewarm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the application's asset manifest, a JSON document of the form
 * <pre>
 *   { "preload": ["/assets/ui/atlas.json", "/assets/ui/atlas.png", ...] }
 * </pre>
 * A missing, unreachable or malformed manifest yields an empty list.
 */
public class AssetManifestLoader {
    private static final Logger logger = LoggerFactory.getLogger(AssetManifestLoader.class);

    private final WebClient rawClient;
    private final ObjectMapper mapper;
    private final URI manifestUri;
    private final Duration timeout;

    public AssetManifestLoader(WebClient rawClient, ObjectMapper mapper, URI manifestUri, Duration timeout) {
        this.rawClient = Objects.requireNonNull(rawClient);
        this.mapper = Objects.requireNonNull(mapper);
        this.manifestUri = Objects.requireNonNull(manifestUri);
        this.timeout = Objects.requireNonNull(timeout);
    }

    public Mono<List<String>> loadPreloadList() {
        return rawClient.get()
                .uri(manifestUri)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .map(this::parse)
                .defaultIfEmpty(List.of())
                .onErrorResume(e -> {
                    logger.info("No usable asset manifest at {}: {}", manifestUri, e.toString());
                    return Mono.just(List.of());
                });
    }

    List<String> parse(String json) {
        try {
            JsonNode preload = mapper.readTree(json).path("preload");
            if (!preload.isArray()) {
                logger.info("Asset manifest at {} has no preload array", manifestUri);
                return List.of();
            }
            List<String> urls = new ArrayList<>();
            for (JsonNode n : preload) {
                if (n.isTextual() && !n.asText().isBlank()) urls.add(n.asText());
            }
            logger.info("Found {} assets in manifest {}", urls.size(), manifestUri);
            return urls;
        } catch (Exception e) {
            logger.warn("Malformed asset manifest at {}: {}", manifestUri, e.toString());
            return List.of();
        }
    }
}
