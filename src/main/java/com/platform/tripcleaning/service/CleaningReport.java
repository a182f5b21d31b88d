package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.ColumnStatistics;
import com.platform.tripcleaning.domain.DerivedFeatures;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Summary of one cleaning run, shaped for both the text and the JSON report.
 */
public record CleaningReport(
        String source,
        OffsetDateTime generatedAt,
        long initialRows,
        long finalRows,
        long removedRows,
        double retentionRate,
        Map<String, Long> removedByStage,
        Map<String, Long> removedByReason,
        List<ColumnSummary> columnStatistics,
        Map<String, Long> timeOfDayDistribution,
        Map<String, Long> dayTypeDistribution,
        Map<String, Summary> featureSummaries
) {

    public static CleaningReport from(CleaningResult result) {
        Map<String, Long> byStage = new LinkedHashMap<>();
        byStage.put("parse", result.parseErrors());
        for (StageResult stage : result.stages()) {
            byStage.put(stage.stage(), (long) stage.removed());
        }

        OutlierReport outliers = result.outliers();
        List<ColumnSummary> columns = new ArrayList<>();
        for (ColumnStatistics stats : outliers.statistics().values()) {
            columns.add(new ColumnSummary(stats.column(), stats.mean(), stats.std(), stats.threshold(),
                    stats.validCount(), outliers.flaggedIn(stats.column())));
        }

        List<DerivedFeatures> features = result.features();
        Map<String, Summary> summaries = new LinkedHashMap<>();
        summaries.put("tip_percentage", Summary.of(values(features, DerivedFeatures::tipPercentage)));
        summaries.put("trip_duration_minutes", Summary.of(values(features, DerivedFeatures::durationMinutes)));
        summaries.put("trip_speed_mph", Summary.of(values(features, DerivedFeatures::speedMph)));

        return new CleaningReport(
                result.source(),
                OffsetDateTime.now(),
                result.initialRows(),
                result.finalRows(),
                result.removedTotal(),
                result.retentionRate(),
                byStage,
                result.rejectionCounts(),
                columns,
                distribution(features, DerivedFeatures::timeOfDay),
                distribution(features, DerivedFeatures::dayType),
                summaries);
    }

    private static List<Double> values(List<DerivedFeatures> features, Function<DerivedFeatures, Double> field) {
        List<Double> values = new ArrayList<>(features.size());
        for (DerivedFeatures f : features) {
            Double v = field.apply(f);
            if (v != null && !v.isNaN()) {
                values.add(v);
            }
        }
        return values;
    }

    private static Map<String, Long> distribution(List<DerivedFeatures> features,
                                                  Function<DerivedFeatures, String> field) {
        Map<String, Long> counts = new TreeMap<>();
        for (DerivedFeatures f : features) {
            counts.merge(field.apply(f), 1L, Long::sum);
        }
        return counts;
    }

    public record ColumnSummary(String column, double mean, double std, double threshold,
                                long validCount, long outliers) {}

    /**
     * Descriptive statistics over the non-null values of one feature. All zero when empty.
     */
    public record Summary(long count, double mean, double median, double min, double max) {

        public static Summary of(List<Double> values) {
            if (values.isEmpty()) {
                return new Summary(0, 0.0, 0.0, 0.0, 0.0);
            }
            List<Double> sorted = new ArrayList<>(values);
            Collections.sort(sorted);
            int n = sorted.size();
            double sum = 0.0;
            for (double v : sorted) {
                sum += v;
            }
            double median = n % 2 == 1
                    ? sorted.get(n / 2)
                    : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
            return new Summary(n, sum / n, median, sorted.get(0), sorted.get(n - 1));
        }
    }
}
