package com.platform.tripcleaning.domain;

import jakarta.persistence.*;
import java.util.UUID;

@Entity
@Table(name = "outlier_flags")
public class OutlierAuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    @Column(name = "flag_id")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", nullable = false)
    private CleaningRun run;

    @Column(name = "source_row", nullable = false)
    private long sourceRow;

    @Column(name = "column_name", nullable = false, length = 100)
    private String columnName;

    @Column(name = "raw_value")
    private double rawValue;

    @Column(name = "z_score")
    private double zScore;

    @Column(name = "column_mean")
    private double columnMean;

    @Column(name = "column_std")
    private double columnStd;

    public static OutlierAuditEntry of(CleaningRun run, OutlierFlag flag) {
        OutlierAuditEntry entry = new OutlierAuditEntry();
        entry.setRun(run);
        entry.setSourceRow(flag.sourceRow());
        entry.setColumnName(flag.column());
        entry.setRawValue(flag.value());
        entry.setZScore(flag.zScore());
        entry.setColumnMean(flag.mean());
        entry.setColumnStd(flag.std());
        return entry;
    }

    // Getters and setters

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public CleaningRun getRun() { return run; }
    public void setRun(CleaningRun run) { this.run = run; }

    public long getSourceRow() { return sourceRow; }
    public void setSourceRow(long sourceRow) { this.sourceRow = sourceRow; }

    public String getColumnName() { return columnName; }
    public void setColumnName(String columnName) { this.columnName = columnName; }

    public double getRawValue() { return rawValue; }
    public void setRawValue(double rawValue) { this.rawValue = rawValue; }

    public double getZScore() { return zScore; }
    public void setZScore(double zScore) { this.zScore = zScore; }

    public double getColumnMean() { return columnMean; }
    public void setColumnMean(double columnMean) { this.columnMean = columnMean; }

    public double getColumnStd() { return columnStd; }
    public void setColumnStd(double columnStd) { this.columnStd = columnStd; }
}
