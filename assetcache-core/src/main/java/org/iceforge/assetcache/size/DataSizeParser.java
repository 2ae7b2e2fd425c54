package org.iceforge.assetcache.size;

/**
 * Parses human-friendly budgets like "256MB", "512MiB" or "64*1024*1024".
 * <p>
 * IEC spellings are mapped onto {@link DataSizeExpressionEvaluator}'s binary units.
 */
public final class DataSizeParser {
    private DataSizeParser() {}

    public static long parseBytes(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new IllegalArgumentException("size expression is blank");
        }
        String s = expr.trim()
                .replace("KiB", "KB").replace("MiB", "MB").replace("GiB", "GB").replace("TiB", "TB");
        long v = DataSizeExpressionEvaluator.evaluate(s);
        if (v <= 0L) {
            throw new IllegalArgumentException("size out of range: " + expr);
        }
        return v;
    }
}
