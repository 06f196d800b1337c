package org.mimir.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-friendly byte sizes such as {@code "10GB"}, {@code "512MiB"}, {@code "1.5 GB"}
 * or {@code "4*1024*1024"}. Units are binary: KB and KiB both mean 1024.
 */
public final class DataSizes {
    private DataSizes() {}

    private static final Pattern TOKEN = Pattern.compile("\\d+\\.\\d*|\\d+|\\*|KIB|MIB|GIB|TIB|KB|MB|GB|TB|B");
    private static final Map<String, Long> UNITS = Map.of(
            "B", 1L,
            "KB", 1L << 10, "KIB", 1L << 10,
            "MB", 1L << 20, "MIB", 1L << 20,
            "GB", 1L << 30, "GIB", 1L << 30,
            "TB", 1L << 40, "TIB", 1L << 40);

    /**
     * @throws NumberFormatException if the expression contains anything but numbers, units and '*'
     */
    public static long evaluate(String expression) {
        BigDecimal result = BigDecimal.ONE;
        for (String token : tokenize(expression)) {
            if (token.equals("*")) continue;
            Long unit = UNITS.get(token);
            result = result.multiply(unit != null ? BigDecimal.valueOf(unit) : new BigDecimal(token));
        }
        return result.setScale(0, RoundingMode.FLOOR).longValueExact();
    }

    /** Like {@link #evaluate} but rejects zero and negative results. */
    public static long parseBytes(String expression) {
        long v;
        try {
            v = evaluate(expression);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("size out of range: " + expression, e);
        }
        if (v <= 0L) {
            throw new IllegalArgumentException("size must be positive: " + expression);
        }
        return v;
    }

    static List<String> tokenize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new NumberFormatException("Empty or null size expression: " + expression);
        }
        String s = expression.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(s);
        int consumed = 0;
        while (m.find()) {
            if (m.start() != consumed) break;
            tokens.add(m.group());
            consumed = m.end();
        }
        if (consumed != s.length()) {
            throw new NumberFormatException("Invalid size expression: " + expression);
        }
        return tokens;
    }
}
