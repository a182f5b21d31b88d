package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.DerivedFeatures;
import com.platform.tripcleaning.domain.PersistedTrip;
import com.platform.tripcleaning.domain.TimeOfDayScheme;
import com.platform.tripcleaning.domain.TripRecord;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Computes the per-trip derived metrics. Every function is total: missing or non-finite inputs
 * map to a documented fallback instead of an exception.
 */
public class FeatureDeriver {

    public static final String UNKNOWN = "Unknown";
    public static final String WEEKDAY = "Weekday";
    public static final String WEEKEND = "Weekend";
    public static final double DEFAULT_MAX_SPEED_MPH = 200.0;

    private final TimeOfDayScheme scheme;
    private final double maxSpeedMph;

    public FeatureDeriver(TimeOfDayScheme scheme, double maxSpeedMph) {
        if (!(maxSpeedMph > 0)) {
            throw new IllegalArgumentException("Speed cap must be positive: " + maxSpeedMph);
        }
        this.scheme = scheme;
        this.maxSpeedMph = maxSpeedMph;
    }

    public TimeOfDayScheme getScheme() {
        return scheme;
    }

    /**
     * Features for an in-memory record; the trip id is left null.
     */
    public DerivedFeatures derive(TripRecord trip) {
        return derive(null, trip.pickupDatetime(), trip.dropoffDatetime(),
                trip.tripDistance(), trip.fareAmount(), trip.tipAmount());
    }

    public DerivedFeatures derive(PersistedTrip trip) {
        return derive(trip.tripId(), trip.pickupDatetime(), trip.dropoffDatetime(),
                trip.tripDistance(), trip.fareAmount(), trip.tipAmount());
    }

    private DerivedFeatures derive(Long tripId, LocalDateTime pickup, LocalDateTime dropoff,
                                   Double distance, Double fare, Double tip) {
        Double duration = durationMinutes(pickup, dropoff);
        return new DerivedFeatures(
                tripId,
                tipPercentage(tip, fare),
                duration,
                timeOfDay(pickup),
                speedMph(distance, duration),
                dayType(pickup));
    }

    public static double tipPercentage(Double tip, Double fare) {
        if (fare == null || !Double.isFinite(fare) || fare <= 0) {
            return 0.0;
        }
        if (tip == null || !Double.isFinite(tip) || tip < 0) {
            return 0.0;
        }
        return round2(tip / fare * 100.0);
    }

    public static Double durationMinutes(LocalDateTime pickup, LocalDateTime dropoff) {
        if (pickup == null || dropoff == null) {
            return null;
        }
        double seconds = Duration.between(pickup, dropoff).toNanos() / 1e9;
        return round2(Math.max(0.0, seconds) / 60.0);
    }

    public String timeOfDay(LocalDateTime pickup) {
        return pickup == null ? UNKNOWN : scheme.bucket(pickup.getHour());
    }

    /**
     * Average speed from the rounded duration, rounded and then capped.
     */
    public double speedMph(Double distance, Double durationMinutes) {
        if (distance == null || !Double.isFinite(distance)
                || durationMinutes == null || durationMinutes <= 0) {
            return 0.0;
        }
        double speed = round2(distance / (durationMinutes / 60.0));
        return Math.min(speed, maxSpeedMph);
    }

    public static String dayType(LocalDateTime pickup) {
        if (pickup == null) {
            return UNKNOWN;
        }
        DayOfWeek day = pickup.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY ? WEEKEND : WEEKDAY;
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
