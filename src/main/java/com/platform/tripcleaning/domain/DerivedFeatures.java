package com.platform.tripcleaning.domain;

/**
 * The five derived metrics for one trip. {@code tripId} is null until the owning trip has been
 * persisted; rows written to {@code derived_features} always carry it.
 */
public record DerivedFeatures(
        Long tripId,
        double tipPercentage,
        Double durationMinutes,
        String timeOfDay,
        double speedMph,
        String dayType
) {

    public DerivedFeatures withTripId(long id) {
        return new DerivedFeatures(id, tipPercentage, durationMinutes, timeOfDay, speedMph, dayType);
    }
}
