package com.platform.tripcleaning.domain;

/**
 * Named partitions of the 24-hour clock into time-of-day categories. Each scheme covers every
 * hour 0-23 exactly once.
 */
public enum TimeOfDayScheme {

    /**
     * Morning 06-11, Afternoon 12-16, Evening 17-20, Night 21-05.
     */
    FOUR_BUCKET {
        @Override
        public String bucket(int hour) {
            if (hour >= 6 && hour < 12) return "Morning";
            if (hour >= 12 && hour < 17) return "Afternoon";
            if (hour >= 17 && hour < 21) return "Evening";
            return "Night";
        }
    },

    /**
     * Early Morning 00-04, Morning Rush 05-09, Midday 10-15, Evening Rush 16-19, Night 20-23.
     */
    FIVE_BUCKET {
        @Override
        public String bucket(int hour) {
            if (hour < 5) return "Early Morning";
            if (hour < 10) return "Morning Rush";
            if (hour < 16) return "Midday";
            if (hour < 20) return "Evening Rush";
            return "Night";
        }
    };

    public abstract String bucket(int hour);
}
