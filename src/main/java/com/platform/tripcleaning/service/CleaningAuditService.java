package com.platform.tripcleaning.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.tripcleaning.domain.CleaningRun;
import com.platform.tripcleaning.domain.ColumnStatistics;
import com.platform.tripcleaning.domain.ColumnStatisticsSnapshot;
import com.platform.tripcleaning.domain.OutlierAuditEntry;
import com.platform.tripcleaning.domain.OutlierFlag;
import com.platform.tripcleaning.repository.CleaningRunRepository;
import com.platform.tripcleaning.repository.ColumnStatisticsSnapshotRepository;
import com.platform.tripcleaning.repository.OutlierAuditEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Records each cleaning run, its column statistics and every outlier flag in the audit tables.
 */
@Service
public class CleaningAuditService {

    private static final Logger log = LoggerFactory.getLogger(CleaningAuditService.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final CleaningRunRepository runRepo;
    private final ColumnStatisticsSnapshotRepository statsRepo;
    private final OutlierAuditEntryRepository flagRepo;

    public CleaningAuditService(CleaningRunRepository runRepo,
                                ColumnStatisticsSnapshotRepository statsRepo,
                                OutlierAuditEntryRepository flagRepo) {
        this.runRepo = runRepo;
        this.statsRepo = statsRepo;
        this.flagRepo = flagRepo;
    }

    @Transactional
    public CleaningRun startRun(String sourceFile, int expectedYear, String timeOfDayScheme) {
        CleaningRun run = new CleaningRun();
        run.setSourceFile(sourceFile);
        run.setExpectedYear(expectedYear);
        run.setTimeOfDayScheme(timeOfDayScheme);
        run.setStatus(CleaningRun.STATUS_RUNNING);
        CleaningRun saved = runRepo.save(run);
        log.info("Started cleaning run {} for {}", saved.getId(), sourceFile);
        return saved;
    }

    /**
     * Stores stage counts, one statistics snapshot per monitored column and one audit entry per
     * outlier flag.
     */
    @Transactional
    public CleaningRun recordCleaning(UUID runId, CleaningResult result) {
        CleaningRun run = findRun(runId);
        run.setInitialRows(result.initialRows());
        run.setParseErrors(result.parseErrors());
        run.setRemovedInvalid(result.stage("validation").removed());
        run.setRemovedOutliers(result.stage("outliers").removed());
        run.setRemovedDuplicates(result.stage("dedup").removed());
        run.setFinalRows(result.finalRows());
        run.setRetentionRate(result.retentionRate());
        run.setRejectionCounts(toJson(result.rejectionCounts()));
        CleaningRun saved = runRepo.save(run);

        OutlierReport outliers = result.outliers();
        List<ColumnStatisticsSnapshot> snapshots = new ArrayList<>();
        for (ColumnStatistics stats : outliers.statistics().values()) {
            ColumnStatisticsSnapshot snapshot = new ColumnStatisticsSnapshot();
            snapshot.setRun(saved);
            snapshot.setColumnName(stats.column());
            snapshot.setMean(stats.mean());
            snapshot.setStddev(stats.std());
            snapshot.setThreshold(stats.threshold());
            snapshot.setValidCount(stats.validCount());
            snapshot.setOutlierCount(outliers.flaggedIn(stats.column()));
            snapshots.add(snapshot);
        }
        statsRepo.saveAll(snapshots);

        List<OutlierAuditEntry> entries = new ArrayList<>();
        for (OutlierFlag flag : outliers.allFlags()) {
            entries.add(OutlierAuditEntry.of(saved, flag));
        }
        flagRepo.saveAll(entries);

        log.info("Recorded run {}: {} column statistics, {} outlier flags", runId, snapshots.size(), entries.size());
        return saved;
    }

    @Transactional
    public CleaningRun completeRun(UUID runId, BatchLoader.LoadResult load) {
        CleaningRun run = findRun(runId);
        run.setTripsLoaded(load.tripsLoaded());
        run.setFeaturesLoaded(load.featuresLoaded());
        run.setStatus(CleaningRun.STATUS_COMPLETED);
        run.setCompletedAt(OffsetDateTime.now());
        return runRepo.save(run);
    }

    @Transactional
    public CleaningRun failRun(UUID runId, Throwable cause) {
        CleaningRun run = findRun(runId);
        run.setStatus(CleaningRun.STATUS_FAILED);
        run.setErrorMessage(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        run.setCompletedAt(OffsetDateTime.now());
        log.warn("Cleaning run {} marked FAILED", runId);
        return runRepo.save(run);
    }

    private CleaningRun findRun(UUID runId) {
        return runRepo.findById(runId)
                .orElseThrow(() -> new NoSuchElementException("Cleaning run not found: " + runId));
    }

    private static String toJson(Map<String, Long> counts) {
        try {
            return mapper.writeValueAsString(counts);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize rejection counts", e);
        }
    }
}
