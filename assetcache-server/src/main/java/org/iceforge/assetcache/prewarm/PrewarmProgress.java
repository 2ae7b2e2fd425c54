package org.iceforge.assetcache.prewarm;

/**
 * Reported after every finished batch. {@code completed} counts successes and failures alike.
 */
public record PrewarmProgress(int completed, int failed, int total, int percent) {

    static PrewarmProgress of(int succeeded, int failed, int total) {
        int completed = succeeded + failed;
        int percent = total == 0 ? 100 : (int) Math.round(completed * 100.0 / total);
        return new PrewarmProgress(completed, failed, total, percent);
    }
}
