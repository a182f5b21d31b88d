package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.TripRecord;

/**
 * Record-level validation rules in evaluation order. Rules are conjunctive: a record is accepted
 * only when every enabled rule accepts it. The order only decides which failure is reported.
 */
public enum ValidationRule {

    MISSING_FIELD("MissingField") {
        @Override
        boolean accepts(TripRecord t, ValidationSettings s) {
            return t.pickupDatetime() != null
                    && t.dropoffDatetime() != null
                    && t.tripDistance() != null
                    && t.fareAmount() != null
                    && t.pickupZoneId() != null
                    && t.dropoffZoneId() != null;
        }
    },

    INVALID_FARE("InvalidFare") {
        @Override
        boolean accepts(TripRecord t, ValidationSettings s) {
            Double fare = t.fareAmount();
            return fare != null && fare >= s.minFare() && fare <= s.maxFare();
        }
    },

    INVALID_DISTANCE("InvalidDistance") {
        @Override
        boolean accepts(TripRecord t, ValidationSettings s) {
            Double distance = t.tripDistance();
            return distance != null && distance > 0 && distance <= s.maxDistance();
        }
    },

    INVALID_PASSENGER_COUNT("InvalidPassengerCount") {
        @Override
        boolean accepts(TripRecord t, ValidationSettings s) {
            Integer count = t.passengerCount();
            return count != null && count >= s.minPassengers() && count <= s.maxPassengers();
        }
    },

    INVALID_DATETIME_RANGE("InvalidDatetimeRange") {
        @Override
        boolean accepts(TripRecord t, ValidationSettings s) {
            if (t.pickupDatetime() == null || t.dropoffDatetime() == null
                    || !t.dropoffDatetime().isAfter(t.pickupDatetime())) {
                return false;
            }
            double seconds = t.durationSeconds();
            return seconds >= s.minDurationSeconds() && seconds <= s.maxDurationSeconds();
        }
    },

    INVALID_YEAR("InvalidYear") {
        @Override
        boolean accepts(TripRecord t, ValidationSettings s) {
            return t.pickupDatetime() != null && t.dropoffDatetime() != null
                    && t.pickupDatetime().getYear() == s.expectedYear()
                    && t.dropoffDatetime().getYear() == s.expectedYear();
        }
    },

    NEGATIVE_EXTRA("NegativeExtra", true) {
        @Override
        boolean accepts(TripRecord t, ValidationSettings s) {
            return t.extra() == null || !(t.extra() < 0);
        }
    },

    IMPLAUSIBLE_SPEED("ImplausibleSpeed", true) {
        @Override
        boolean accepts(TripRecord t, ValidationSettings s) {
            Double seconds = t.durationSeconds();
            if (seconds == null || seconds <= 0 || t.tripDistance() == null) {
                return true;
            }
            double mph = t.tripDistance() / (seconds / 3600.0);
            return mph <= s.maxSpeedMph();
        }
    };

    private final String reason;
    private final boolean sanityRule;

    ValidationRule(String reason) {
        this(reason, false);
    }

    ValidationRule(String reason, boolean sanityRule) {
        this.reason = reason;
        this.sanityRule = sanityRule;
    }

    /**
     * Name reported in rejection counts, e.g. {@code InvalidFare}.
     */
    public String reason() {
        return reason;
    }

    public boolean isSanityRule() {
        return sanityRule;
    }

    /**
     * True when the record satisfies this rule. Every rule tolerates null fields on its own.
     */
    abstract boolean accepts(TripRecord trip, ValidationSettings settings);
}
