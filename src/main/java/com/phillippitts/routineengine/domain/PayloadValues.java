package com.phillippitts.routineengine.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical form for free-form payloads (action parameters, condition settings, extra trigger keys).
 *
 * <p>JSON does not keep Java number types, so numbers are normalised on the way in: whole values
 * become {@link Long}, everything else {@link Double}. A routine read back from storage therefore
 * equals the one that was written. Nested maps and lists are copied and made unmodifiable.
 */
public final class PayloadValues {

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    // Doubles above 2^53 are not exact integers any more
    private static final double EXACT_DOUBLE_LIMIT = 9_007_199_254_740_992d;

    private PayloadValues() {}

    /**
     * @return an unmodifiable, normalised copy; empty for null
     */
    public static Map<String, Object> normalize(Map<String, ?> payload) {
        if (payload == null || payload.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : payload.entrySet()) {
            out.put(e.getKey(), normalizeValue(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    public static Object normalizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(String.valueOf(e.getKey()), normalizeValue(e.getValue()));
            }
            return Collections.unmodifiableMap(out);
        }
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(normalizeValue(item));
            }
            return Collections.unmodifiableList(out);
        }
        if (value instanceof Number n) {
            return normalizeNumber(n);
        }
        return value;
    }

    static Number normalizeNumber(Number n) {
        if (n instanceof Long) {
            return n;
        }
        if (n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return n.longValue();
        }
        if (n instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? big.longValue() : big.doubleValue();
        }
        if (n instanceof BigDecimal decimal) {
            BigDecimal stripped = decimal.stripTrailingZeros();
            if (stripped.scale() <= 0 && stripped.compareTo(LONG_MIN) >= 0 && stripped.compareTo(LONG_MAX) <= 0) {
                return stripped.longValue();
            }
            return decimal.doubleValue();
        }
        double d = n.doubleValue();
        if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) <= EXACT_DOUBLE_LIMIT) {
            return (long) d;
        }
        return d;
    }
}
