package com.platform.tripcleaning.service;

/**
 * Bounds applied by {@link TripValidator}.
 */
public record ValidationSettings(
        int expectedYear,
        double minFare,
        double maxFare,
        double maxDistance,
        int minPassengers,
        int maxPassengers,
        long minDurationSeconds,
        long maxDurationSeconds,
        double maxSpeedMph,
        boolean sanityRulesEnabled
) {

    public static ValidationSettings defaults(int expectedYear) {
        return new ValidationSettings(expectedYear, 0.01, 500.0, 100.0, 1, 6,
                10, 86_400, 200.0, true);
    }
}
