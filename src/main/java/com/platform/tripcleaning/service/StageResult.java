package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.TripRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one filter stage: the surviving records plus how many were removed and why.
 */
public record StageResult(
        String stage,
        int inputCount,
        List<TripRecord> survivors,
        Map<String, Long> rejections
) {

    public StageResult {
        survivors = List.copyOf(survivors);
        rejections = Collections.unmodifiableMap(new LinkedHashMap<>(rejections));
    }

    public int removed() {
        return inputCount - survivors.size();
    }
}
