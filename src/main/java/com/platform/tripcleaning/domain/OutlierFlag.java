package com.platform.tripcleaning.domain;

/**
 * One column of one record whose z-score exceeded the threshold.
 */
public record OutlierFlag(
        long sourceRow,
        String column,
        double value,
        double zScore,
        double mean,
        double std
) {}
