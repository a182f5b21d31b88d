package com.platform.tripcleaning.domain;

import java.util.Arrays;
import java.util.function.Function;

/**
 * Numeric trip columns the outlier detector can watch.
 */
public enum MonitoredColumn {

    FARE_AMOUNT("fare_amount", TripRecord::fareAmount),
    TRIP_DISTANCE("trip_distance", TripRecord::tripDistance),
    TIP_AMOUNT("tip_amount", TripRecord::tipAmount),
    TOLLS_AMOUNT("tolls_amount", TripRecord::tollsAmount),
    TOTAL_AMOUNT("total_amount", TripRecord::totalAmount);

    private final String columnName;
    private final Function<TripRecord, Double> extractor;

    MonitoredColumn(String columnName, Function<TripRecord, Double> extractor) {
        this.columnName = columnName;
        this.extractor = extractor;
    }

    public String columnName() {
        return columnName;
    }

    /**
     * The column value, or null when absent. NaN is passed through; callers treat it as invalid.
     */
    public Double valueOf(TripRecord trip) {
        return extractor.apply(trip);
    }

    public static MonitoredColumn fromName(String name) {
        String normalized = name.trim();
        return Arrays.stream(values())
                .filter(c -> c.columnName.equalsIgnoreCase(normalized) || c.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown monitored column: " + name));
    }
}
