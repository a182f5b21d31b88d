package com.platform.tripcleaning.store.source;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One untyped row as read from a trip source. Field lookup is case-insensitive.
 */
public final class RawTripRow {

    private final long rowNumber;
    private final Map<String, Object> values;

    public RawTripRow(long rowNumber, Map<String, ?> values) {
        this.rowNumber = rowNumber;
        Map<String, Object> normalized = new HashMap<>();
        values.forEach((k, v) -> normalized.put(k.toLowerCase(Locale.ROOT), v));
        this.values = Collections.unmodifiableMap(normalized);
    }

    public long rowNumber() {
        return rowNumber;
    }

    /**
     * Returns the value stored under the first alias present in the row, or null.
     */
    public Object get(String... aliases) {
        for (String alias : aliases) {
            String key = alias.toLowerCase(Locale.ROOT);
            if (values.containsKey(key)) {
                return values.get(key);
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "RawTripRow{row=" + rowNumber + ", values=" + values + "}";
    }
}
