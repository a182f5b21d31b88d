package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.DerivedFeatures;
import com.platform.tripcleaning.domain.TripRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the in-memory stages produced for one run. {@code features} is aligned index by
 * index with {@code cleaned}.
 */
public record CleaningResult(
        String source,
        long initialRows,
        long parseErrors,
        List<StageResult> stages,
        OutlierReport outliers,
        List<TripRecord> cleaned,
        List<DerivedFeatures> features
) {

    public CleaningResult {
        stages = List.copyOf(stages);
        cleaned = List.copyOf(cleaned);
        features = List.copyOf(features);
    }

    public long finalRows() {
        return cleaned.size();
    }

    public long removedTotal() {
        return initialRows - finalRows();
    }

    /** Percentage of input rows that survived every stage. */
    public double retentionRate() {
        return initialRows == 0 ? 0.0 : finalRows() * 100.0 / initialRows;
    }

    public StageResult stage(String name) {
        return stages.stream()
                .filter(s -> s.stage().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No stage named " + name));
    }

    /**
     * Removal counts for the whole run keyed by reason, starting with parse failures.
     */
    public Map<String, Long> rejectionCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("ParseError", parseErrors);
        for (StageResult stage : stages) {
            counts.putAll(stage.rejections());
        }
        return counts;
    }
}
