package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.ColumnStatistics;
import com.platform.tripcleaning.domain.OutlierFlag;
import com.platform.tripcleaning.domain.TripRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one outlier detection run: column statistics, every flag grouped by record, and the
 * records that were not flagged.
 */
public record OutlierReport(
        int inputCount,
        Map<String, ColumnStatistics> statistics,
        Map<Long, List<OutlierFlag>> flagsByRecord,
        List<TripRecord> survivors
) {

    public OutlierReport {
        statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
        flagsByRecord = Collections.unmodifiableMap(new LinkedHashMap<>(flagsByRecord));
        survivors = List.copyOf(survivors);
    }

    public int outlierCount() {
        return flagsByRecord.size();
    }

    public List<OutlierFlag> allFlags() {
        return flagsByRecord.values().stream().flatMap(List::stream).toList();
    }

    /**
     * Number of records flagged in the given column. A record flagged in several columns is
     * counted once per column.
     */
    public long flaggedIn(String column) {
        return flagsByRecord.values().stream()
                .filter(flags -> flags.stream().anyMatch(f -> f.column().equals(column)))
                .count();
    }

    StageResult toStageResult(String stageName) {
        Map<String, Long> rejections = new LinkedHashMap<>();
        for (String column : statistics.keySet()) {
            rejections.put("Outlier:" + column, flaggedIn(column));
        }
        return new StageResult(stageName, inputCount, survivors, rejections);
    }
}
