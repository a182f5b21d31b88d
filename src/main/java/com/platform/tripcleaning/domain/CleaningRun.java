package com.platform.tripcleaning.domain;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Audit row for one execution of the cleaning pipeline.
 */
@Entity
@Table(name = "cleaning_runs")
public class CleaningRun {

    public static final String STATUS_RUNNING = "RUNNING";
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_FAILED = "FAILED";

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    @Column(name = "run_id")
    private UUID id;

    @Column(name = "source_file", length = 1000)
    private String sourceFile;

    @Column(name = "expected_year", nullable = false)
    private int expectedYear;

    @Column(name = "time_of_day_scheme", nullable = false, length = 30)
    private String timeOfDayScheme;

    @Column(nullable = false, length = 20)
    private String status = STATUS_RUNNING;

    @Column(name = "initial_rows")
    private long initialRows;

    @Column(name = "parse_errors")
    private long parseErrors;

    @Column(name = "removed_invalid")
    private long removedInvalid;

    @Column(name = "removed_outliers")
    private long removedOutliers;

    @Column(name = "removed_duplicates")
    private long removedDuplicates;

    @Column(name = "final_rows")
    private long finalRows;

    @Column(name = "retention_rate")
    private double retentionRate;

    @Column(name = "trips_loaded")
    private long tripsLoaded;

    @Column(name = "features_loaded")
    private long featuresLoaded;

    @Column(name = "rejection_counts", columnDefinition = "TEXT")
    private String rejectionCounts;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @PrePersist
    protected void onCreate() {
        if (startedAt == null) {
            startedAt = OffsetDateTime.now();
        }
    }

    // Getters and setters

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getSourceFile() { return sourceFile; }
    public void setSourceFile(String sourceFile) { this.sourceFile = sourceFile; }

    public int getExpectedYear() { return expectedYear; }
    public void setExpectedYear(int expectedYear) { this.expectedYear = expectedYear; }

    public String getTimeOfDayScheme() { return timeOfDayScheme; }
    public void setTimeOfDayScheme(String timeOfDayScheme) { this.timeOfDayScheme = timeOfDayScheme; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public long getInitialRows() { return initialRows; }
    public void setInitialRows(long initialRows) { this.initialRows = initialRows; }

    public long getParseErrors() { return parseErrors; }
    public void setParseErrors(long parseErrors) { this.parseErrors = parseErrors; }

    public long getRemovedInvalid() { return removedInvalid; }
    public void setRemovedInvalid(long removedInvalid) { this.removedInvalid = removedInvalid; }

    public long getRemovedOutliers() { return removedOutliers; }
    public void setRemovedOutliers(long removedOutliers) { this.removedOutliers = removedOutliers; }

    public long getRemovedDuplicates() { return removedDuplicates; }
    public void setRemovedDuplicates(long removedDuplicates) { this.removedDuplicates = removedDuplicates; }

    public long getFinalRows() { return finalRows; }
    public void setFinalRows(long finalRows) { this.finalRows = finalRows; }

    public double getRetentionRate() { return retentionRate; }
    public void setRetentionRate(double retentionRate) { this.retentionRate = retentionRate; }

    public long getTripsLoaded() { return tripsLoaded; }
    public void setTripsLoaded(long tripsLoaded) { this.tripsLoaded = tripsLoaded; }

    public long getFeaturesLoaded() { return featuresLoaded; }
    public void setFeaturesLoaded(long featuresLoaded) { this.featuresLoaded = featuresLoaded; }

    public String getRejectionCounts() { return rejectionCounts; }
    public void setRejectionCounts(String rejectionCounts) { this.rejectionCounts = rejectionCounts; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public OffsetDateTime getStartedAt() { return startedAt; }
    public void setStartedAt(OffsetDateTime startedAt) { this.startedAt = startedAt; }

    public OffsetDateTime getCompletedAt() { return completedAt; }
    public void setCompletedAt(OffsetDateTime completedAt) { this.completedAt = completedAt; }
}
