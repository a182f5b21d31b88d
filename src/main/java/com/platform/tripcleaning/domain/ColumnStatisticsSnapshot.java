package com.platform.tripcleaning.domain;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "column_statistics")
public class ColumnStatisticsSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    @Column(name = "stat_id")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", nullable = false)
    private CleaningRun run;

    @Column(name = "column_name", nullable = false, length = 100)
    private String columnName;

    private double mean;
    private double stddev;
    private double threshold;

    @Column(name = "valid_count")
    private long validCount;

    @Column(name = "outlier_count")
    private long outlierCount;

    @Column(name = "computed_at", nullable = false)
    private OffsetDateTime computedAt;

    @PrePersist
    protected void onCreate() {
        if (computedAt == null) {
            computedAt = OffsetDateTime.now();
        }
    }

    // Getters and setters

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public CleaningRun getRun() { return run; }
    public void setRun(CleaningRun run) { this.run = run; }

    public String getColumnName() { return columnName; }
    public void setColumnName(String columnName) { this.columnName = columnName; }

    public double getMean() { return mean; }
    public void setMean(double mean) { this.mean = mean; }

    public double getStddev() { return stddev; }
    public void setStddev(double stddev) { this.stddev = stddev; }

    public double getThreshold() { return threshold; }
    public void setThreshold(double threshold) { this.threshold = threshold; }

    public long getValidCount() { return validCount; }
    public void setValidCount(long validCount) { this.validCount = validCount; }

    public long getOutlierCount() { return outlierCount; }
    public void setOutlierCount(long outlierCount) { this.outlierCount = outlierCount; }

    public OffsetDateTime getComputedAt() { return computedAt; }
    public void setComputedAt(OffsetDateTime computedAt) { this.computedAt = computedAt; }
}
