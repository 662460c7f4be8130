package com.lineguard.transparency;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds stage input/output snapshots from key/value pairs. Decimals are stored as plain strings and enums
 * by name so the stored document reads back exactly as written; null values are dropped.
 */
public final class Snapshots {

    private Snapshots() {
    }

    public static Map<String, Object> of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("snapshot needs key/value pairs");
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object value = simplify(keyValues[i + 1]);
            if (value != null) {
                snapshot.put(String.valueOf(keyValues[i]), value);
            }
        }
        return snapshot;
    }

    private static Object simplify(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(Snapshots::simplify).toList();
        }
        return value;
    }
}
