package com.swingtrader.common.cache;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Builds deterministic cache keys from a prefix and a named-argument map.
 *
 * <p>Arguments are rendered in sorted name order, so insertion order never matters.
 * Strings are quoted and every structural character is escaped, which keeps the
 * rendering injective: two argument sets produce the same key only if they are equal.
 * Numbers are normalised ({@code 5} and {@code 5.0} render alike).
 *
 * <pre>
 *   generateKey("scouting", Map.of("top_n", 5))  →  scouting|top_n=5
 * </pre>
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String generateKey(String prefix, Map<String, ?> args) {
        StringBuilder sb = new StringBuilder(escape(prefix));
        sb.append('|');
        if (args == null || args.isEmpty()) {
            return sb.toString();
        }
        StringJoiner joiner = new StringJoiner("&");
        new TreeMap<String, Object>(args).forEach((name, value) ->
            joiner.add(escape(name) + "=" + render(value)));
        return sb.append(joiner).toString();
    }

    private static String render(Object value) {
        if (value == null) {
            return "~";
        }
        if (value instanceof CharSequence s) {
            return "\"" + escape(s.toString()) + "\"";
        }
        if (value instanceof Number n) {
            return renderNumber(n);
        }
        if (value instanceof Boolean b) {
            return b.toString();
        }
        if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), v));
            StringJoiner joiner = new StringJoiner(",", "{", "}");
            sorted.forEach((k, v) -> joiner.add(escape(k) + "=" + render(v)));
            return joiner.toString();
        }
        if (value instanceof Collection<?> items) {
            StringJoiner joiner = new StringJoiner(",", "[", "]");
            items.forEach(item -> joiner.add(render(item)));
            return joiner.toString();
        }
        if (value instanceof Enum<?> e) {
            return "\"" + escape(e.name()) + "\"";
        }
        return "<" + escape(value.toString()) + ">";
    }

    private static String renderNumber(Number n) {
        try {
            BigDecimal decimal = new BigDecimal(n.toString()).stripTrailingZeros();
            return decimal.toPlainString();
        } catch (NumberFormatException e) {
            // NaN and infinities
            return n.toString();
        }
    }

    private static String escape(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (char c : raw.toCharArray()) {
            switch (c) {
                case '\\', '"', '|', '&', '=', ',', '[', ']', '{', '}', '<', '>', '~' -> sb.append('\\').append(c);
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
