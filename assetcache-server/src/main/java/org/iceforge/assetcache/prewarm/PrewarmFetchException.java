package org.iceforge.assetcache.prewarm;

public class PrewarmFetchException extends RuntimeException {
    private final String url;

    public PrewarmFetchException(String url, int statusCode) {
        super("Prewarm fetch of " + url + " returned HTTP " + statusCode);
        this.url = url;
    }

    public PrewarmFetchException(String url, String reason) {
        super("Prewarm of " + url + " not cached: " + reason);
        this.url = url;
    }

    public String url() { return url; }
}
