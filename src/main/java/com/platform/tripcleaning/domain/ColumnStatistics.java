package com.platform.tripcleaning.domain;

/**
 * Per-column statistics used by the z-score pass. {@code std} is 0 when fewer than two valid
 * values exist, in which case every z-score in the column is 0.
 */
public record ColumnStatistics(
        String column,
        double mean,
        double std,
        double threshold,
        long validCount
) {

    public double zScore(double value) {
        if (std == 0.0) {
            return 0.0;
        }
        return (value - mean) / std;
    }

    public boolean isOutlier(double value) {
        return Math.abs(zScore(value)) > threshold;
    }
}
