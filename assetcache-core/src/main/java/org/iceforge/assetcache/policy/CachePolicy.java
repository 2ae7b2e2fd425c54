package org.iceforge.assetcache.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decides whether a request may be served from, and stored in, the asset cache.
 * <p>
 * Never-cache rules are evaluated before static-resource rules, so an image served from a
 * game-server host or carrying a query string is still rejected. Matching is done on the raw URL
 * text: a static file whose name happens to contain an excluded token (for example
 * {@code /img/api/logo.png}) is rejected as well.
 */
public final class CachePolicy {

    public static final List<Pattern> DEFAULT_NEVER_CACHE = List.of(
            // application API
            Pattern.compile("/api/", Pattern.CASE_INSENSITIVE),
            // authentication and identity providers
            Pattern.compile("accounts\\.google\\.com|identitytoolkit|securetoken|firebaseauth|oauth|/auth/",
                    Pattern.CASE_INSENSITIVE),
            // realtime game server and sockets
            Pattern.compile("^wss?://|colyseus|/socket|/matchmake/", Pattern.CASE_INSENSITIVE),
            // hot reload
            Pattern.compile("hot-update|__webpack_hmr|sockjs-node", Pattern.CASE_INSENSITIVE),
            // query strings mean dynamic content
            Pattern.compile("\\?")
    );

    public static final List<Pattern> DEFAULT_CACHEABLE = List.of(
            Pattern.compile("\\.(png|jpe?g|gif|webp|svg|ico|avif)$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.(mp3|ogg|wav|m4a)$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.(woff2?|ttf|otf|eot)$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.(json|xml|atlas)$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("/(assets|static)/", Pattern.CASE_INSENSITIVE)
    );

    private final List<Pattern> neverCache;
    private final List<Pattern> cacheable;

    public CachePolicy(List<Pattern> neverCache, List<Pattern> cacheable) {
        this.neverCache = List.copyOf(Objects.requireNonNull(neverCache, "neverCache"));
        this.cacheable = List.copyOf(Objects.requireNonNull(cacheable, "cacheable"));
    }

    public static CachePolicy defaults() {
        return new CachePolicy(DEFAULT_NEVER_CACHE, DEFAULT_CACHEABLE);
    }

    /**
     * Default rules extended with extra regular expressions, e.g. from configuration.
     */
    public static CachePolicy withExtraRules(List<String> extraNeverCache, List<String> extraCacheable) {
        List<Pattern> never = new ArrayList<>(DEFAULT_NEVER_CACHE);
        List<Pattern> allow = new ArrayList<>(DEFAULT_CACHEABLE);
        if (extraNeverCache != null) {
            extraNeverCache.stream().filter(s -> s != null && !s.isBlank()).map(Pattern::compile).forEach(never::add);
        }
        if (extraCacheable != null) {
            extraCacheable.stream().filter(s -> s != null && !s.isBlank()).map(Pattern::compile).forEach(allow::add);
        }
        return new CachePolicy(never, allow);
    }

    public boolean shouldCache(String url, String method) {
        if (url == null || url.isBlank()) return false;
        if (!"GET".equalsIgnoreCase(method)) return false;

        for (Pattern p : neverCache) {
            if (p.matcher(url).find()) return false;
        }
        for (Pattern p : cacheable) {
            if (p.matcher(url).find()) return true;
        }
        return false;
    }
}
