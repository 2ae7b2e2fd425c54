package org.iceforge.assetcache.size;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates byte-size expressions such as {@code 256MB}, {@code 1.5GB} or {@code 64*1024*1024}.
 * Units are binary (1KB = 1024 bytes).
 */
public final class DataSizeExpressionEvaluator {
    private DataSizeExpressionEvaluator() {}

    private static final Pattern TOKEN = Pattern.compile("\\d+\\.\\d*|\\d+|\\*|L|B|KB|MB|GB|TB");

    public static long evaluate(String expression) {
        List<String> tokens = tokenize(expression);
        BigDecimal result = BigDecimal.ONE;
        for (String token : tokens) {
            switch (token) {
                case "*", "L", "B" -> { }
                case "KB" -> result = result.multiply(BigDecimal.valueOf(1024L));
                case "MB" -> result = result.multiply(BigDecimal.valueOf(1024L * 1024L));
                case "GB" -> result = result.multiply(BigDecimal.valueOf(1024L * 1024L * 1024L));
                case "TB" -> result = result.multiply(BigDecimal.valueOf(1024L * 1024L * 1024L * 1024L));
                default -> result = result.multiply(new BigDecimal(token));
            }
        }
        try {
            return result.setScale(0, RoundingMode.FLOOR).longValueExact();
        } catch (ArithmeticException e) {
            throw new NumberFormatException("Out of long range: " + expression);
        }
    }

    public static List<String> tokenize(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new NumberFormatException("Empty or null expression: " + expression);
        }
        String s = expression.replaceAll("\\s+", "").toUpperCase();

        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(s);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        // Anything the pattern skipped over is garbage.
        if (!String.join("", tokens).equals(s)) {
            throw new NumberFormatException("Invalid input: " + expression);
        }
        return tokens;
    }
}
