package io.hearthwarrio.outlinium.core;

import java.util.List;
import java.util.Map;

/**
 * Lenient accessors for protocol-shaped data (maps, lists, boxed numbers) as delivered by a browser's
 * introspection protocol.
 * <p>
 * Every accessor degrades to an empty/absent value instead of throwing: snapshots are routinely partial
 * when taken while a page is still loading.
 */
public final class ProtocolValues {

    private ProtocolValues() {
    }

    public static Map<?, ?> map(Object value) {
        return value instanceof Map ? (Map<?, ?>) value : Map.of();
    }

    public static Map<?, ?> map(Map<?, ?> owner, String key) {
        return owner == null ? Map.of() : map(owner.get(key));
    }

    public static List<?> list(Object value) {
        return value instanceof List ? (List<?>) value : List.of();
    }

    public static List<?> list(Map<?, ?> owner, String key) {
        return owner == null ? List.of() : list(owner.get(key));
    }

    /**
     * @return element at {@code index}, or null when the index is out of range
     */
    public static Object at(List<?> values, int index) {
        if (values == null || index < 0 || index >= values.size()) {
            return null;
        }
        return values.get(index);
    }

    /**
     * Reads an integral number. Floating point values are not integers here, even when whole.
     *
     * @return integer value, or null when the value is absent, not integral or out of int range
     */
    public static Integer integer(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long) {
            long l = (Long) value;
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return (int) l;
            }
        }
        return null;
    }

    public static Integer integerAt(List<?> values, int index) {
        return integer(at(values, index));
    }

    /**
     * @return numeric value, or null when the value is not a number
     */
    public static Double decimal(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    public static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    public static boolean flag(Object value) {
        return Boolean.TRUE.equals(value);
    }
}
