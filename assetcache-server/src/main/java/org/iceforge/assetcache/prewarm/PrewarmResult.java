package org.iceforge.assetcache.prewarm;

/**
 * Final counts of a prewarm run. {@code success + failed} is the number of eligible URLs that were
 * attempted; {@code skipped} covers URLs that were not cacheable, already cached or duplicated.
 * A run stopped early leaves the unattempted remainder out of all three counts.
 */
public record PrewarmResult(int success, int failed, int skipped) {

    public static PrewarmResult empty() {
        return new PrewarmResult(0, 0, 0);
    }

    public int attempted() {
        return success + failed;
    }
}
