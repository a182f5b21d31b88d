package com.platform.tripcleaning.domain;

import java.time.LocalDateTime;

/**
 * The columns of a stored trip needed to compute its derived features.
 */
public record PersistedTrip(
        long tripId,
        LocalDateTime pickupDatetime,
        LocalDateTime dropoffDatetime,
        Double tripDistance,
        Double fareAmount,
        Double tipAmount
) {}
