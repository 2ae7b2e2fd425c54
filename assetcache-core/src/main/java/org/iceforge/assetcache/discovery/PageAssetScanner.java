package org.iceforge.assetcache.discovery;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds resource references in a snapshot of the rendered page: image elements, inline
 * {@code background-image} declarations and audio sources.
 * <p>
 * This is a heuristic over markup text. Anything not rendered yet, or loaded purely from script,
 * is missed.
 */
public final class PageAssetScanner {
    private PageAssetScanner() {}

    private static final Pattern IMG_SRC = Pattern.compile(
            "<img\\b[^>]*?\\bsrc\\s*=\\s*([\"'])(.*?)\\1", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern BACKGROUND_IMAGE = Pattern.compile(
            "background(?:-image)?\\s*:[^;\"]*?url\\(\\s*(?:&quot;|[\"'])?([^\"')&]+)(?:&quot;|[\"'])?\\s*\\)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern AUDIO_BLOCK = Pattern.compile(
            "<audio\\b([^>]*)>(.*?)</audio>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern SRC_ATTR = Pattern.compile(
            "\\bsrc\\s*=\\s*([\"'])(.*?)\\1", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern SOURCE_TAG = Pattern.compile(
            "<source\\b[^>]*>", Pattern.CASE_INSENSITIVE);

    /**
     * @param html    page markup, may be {@code null}
     * @param baseUri used to resolve relative references; {@code null} keeps them as written
     * @return distinct absolute (where resolvable) URLs in first-seen order
     */
    public static List<String> discover(String html, URI baseUri) {
        if (html == null || html.isBlank()) return List.of();
        baseUri = withRootPath(baseUri);

        Set<String> found = new LinkedHashSet<>();

        Matcher img = IMG_SRC.matcher(html);
        while (img.find()) add(found, img.group(2), baseUri);

        Matcher bg = BACKGROUND_IMAGE.matcher(html);
        while (bg.find()) add(found, bg.group(1), baseUri);

        Matcher audio = AUDIO_BLOCK.matcher(html);
        while (audio.find()) {
            Matcher own = SRC_ATTR.matcher(audio.group(1));
            if (own.find()) add(found, own.group(2), baseUri);

            Matcher source = SOURCE_TAG.matcher(audio.group(2));
            while (source.find()) {
                Matcher src = SRC_ATTR.matcher(source.group());
                if (src.find()) add(found, src.group(2), baseUri);
            }
        }
        return new ArrayList<>(found);
    }

    /** {@code https://host} resolves {@code a.png} to {@code https://hosta.png}; give it a root path first. */
    public static URI withRootPath(URI uri) {
        if (uri != null && uri.isAbsolute() && !uri.isOpaque()
                && (uri.getRawPath() == null || uri.getRawPath().isEmpty())) {
            return uri.resolve("/");
        }
        return uri;
    }

    private static void add(Set<String> found, String raw, URI baseUri) {
        if (raw == null) return;
        String ref = raw.trim();
        if (ref.isEmpty() || ref.startsWith("data:") || ref.startsWith("blob:") || ref.startsWith("#")) return;
        if (baseUri == null) {
            found.add(ref);
            return;
        }
        try {
            found.add(baseUri.resolve(ref).toString());
        } catch (IllegalArgumentException e) {
            // unresolvable reference, keep it verbatim
            found.add(ref);
        }
    }
}
