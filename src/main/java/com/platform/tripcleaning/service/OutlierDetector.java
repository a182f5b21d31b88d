package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.ColumnStatistics;
import com.platform.tripcleaning.domain.MonitoredColumn;
import com.platform.tripcleaning.domain.OutlierFlag;
import com.platform.tripcleaning.domain.TripRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Z-score outlier detection over the whole dataset.
 * <p>
 * For each monitored column: a mean pass, a sample-variance pass (n - 1 denominator), then a flag
 * pass marking values with |z| above the threshold. Null, NaN and infinite values are skipped for
 * that column only. A record flagged in any column is rejected.
 * <p>
 * Each call to {@link #detect(List)} computes fresh statistics and returns them in the report;
 * the detector itself holds no per-run state.
 */
public class OutlierDetector implements TripFilterStage {

    private static final Logger log = LoggerFactory.getLogger(OutlierDetector.class);

    public static final double DEFAULT_THRESHOLD = 3.0;

    private final double threshold;
    private final List<MonitoredColumn> columns;

    public OutlierDetector(double threshold, List<MonitoredColumn> columns) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("Outlier threshold must be positive: " + threshold);
        }
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("At least one monitored column is required");
        }
        this.threshold = threshold;
        this.columns = List.copyOf(columns);
    }

    public OutlierReport detect(List<TripRecord> records) {
        Map<String, ColumnStatistics> statistics = new LinkedHashMap<>();
        for (MonitoredColumn column : columns) {
            Iterable<Double> values = () -> records.stream().map(column::valueOf).iterator();
            ColumnStatistics stats = computeStatistics(column.columnName(), values, threshold);
            statistics.put(column.columnName(), stats);
            log.info("Column {}: mean={}, std={}, valid={}", column.columnName(),
                    String.format("%.4f", stats.mean()), String.format("%.4f", stats.std()), stats.validCount());
        }

        Map<Long, List<OutlierFlag>> flags = new LinkedHashMap<>();
        List<TripRecord> survivors = new ArrayList<>(records.size());
        for (TripRecord trip : records) {
            List<OutlierFlag> tripFlags = null;
            for (MonitoredColumn column : columns) {
                Double value = column.valueOf(trip);
                if (!isValid(value)) {
                    continue;
                }
                ColumnStatistics stats = statistics.get(column.columnName());
                if (stats.isOutlier(value)) {
                    if (tripFlags == null) {
                        tripFlags = new ArrayList<>(columns.size());
                    }
                    tripFlags.add(new OutlierFlag(trip.sourceRow(), column.columnName(), value,
                            stats.zScore(value), stats.mean(), stats.std()));
                }
            }
            if (tripFlags == null) {
                survivors.add(trip);
            } else {
                flags.put(trip.sourceRow(), List.copyOf(tripFlags));
            }
        }

        log.info("Outlier detection flagged {} of {} rows (threshold |z| > {})",
                flags.size(), records.size(), threshold);
        return new OutlierReport(records.size(), statistics, flags, survivors);
    }

    @Override
    public String name() {
        return "outliers";
    }

    @Override
    public StageResult apply(List<TripRecord> input) {
        return detect(input).toStageResult(name());
    }

    /**
     * Two passes over {@code values}: mean, then sample standard deviation.
     */
    public static ColumnStatistics computeStatistics(String column, Iterable<Double> values, double threshold) {
        double sum = 0.0;
        long count = 0;
        for (Double v : values) {
            if (isValid(v)) {
                sum += v;
                count++;
            }
        }
        double mean = count == 0 ? 0.0 : sum / count;

        double squaredDiffs = 0.0;
        if (count >= 2) {
            for (Double v : values) {
                if (isValid(v)) {
                    double diff = v - mean;
                    squaredDiffs += diff * diff;
                }
            }
        }
        double variance = count >= 2 ? squaredDiffs / (count - 1) : 0.0;
        return new ColumnStatistics(column, mean, Math.sqrt(variance), threshold, count);
    }

    public static double mean(List<Double> values) {
        return computeStatistics("values", values, DEFAULT_THRESHOLD).mean();
    }

    public static double stdDev(List<Double> values) {
        return computeStatistics("values", values, DEFAULT_THRESHOLD).std();
    }

    static boolean isValid(Double value) {
        return value != null && Double.isFinite(value);
    }
}
