package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.DerivedFeatures;
import com.platform.tripcleaning.domain.TripRecord;
import com.platform.tripcleaning.store.source.TripSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the in-memory part of a cleaning run: ingest, validation, outlier removal, deduplication
 * and feature derivation. Persistence is left to {@link BatchLoader}.
 */
@Service
public class CleaningPipeline {

    private static final Logger log = LoggerFactory.getLogger(CleaningPipeline.class);

    private final TripIngestor ingestor;
    private final TripValidator validator;
    private final OutlierDetector outlierDetector;
    private final TripDeduplicator deduplicator;
    private final FeatureDeriver featureDeriver;

    public CleaningPipeline(TripIngestor ingestor,
                            TripValidator validator,
                            OutlierDetector outlierDetector,
                            TripDeduplicator deduplicator,
                            FeatureDeriver featureDeriver) {
        this.ingestor = ingestor;
        this.validator = validator;
        this.outlierDetector = outlierDetector;
        this.deduplicator = deduplicator;
        this.featureDeriver = featureDeriver;
    }

    public CleaningResult clean(TripSource source) throws IOException {
        TripIngestor.IngestResult ingest = ingestor.ingest(source);
        return clean(source.description(), ingest);
    }

    CleaningResult clean(String sourceDescription, TripIngestor.IngestResult ingest) {
        List<StageResult> stages = new ArrayList<>();

        StageResult validated = validator.apply(ingest.records());
        stages.add(validated);
        logStage(validated);

        OutlierReport outliers = outlierDetector.detect(validated.survivors());
        StageResult outlierStage = outliers.toStageResult(outlierDetector.name());
        stages.add(outlierStage);
        logStage(outlierStage);

        StageResult deduplicated = deduplicator.apply(outlierStage.survivors());
        stages.add(deduplicated);
        logStage(deduplicated);

        List<TripRecord> cleaned = deduplicated.survivors();
        List<DerivedFeatures> features = new ArrayList<>(cleaned.size());
        for (TripRecord trip : cleaned) {
            features.add(featureDeriver.derive(trip));
        }

        CleaningResult result = new CleaningResult(sourceDescription, ingest.totalRows(), ingest.parseErrors(),
                stages, outliers, cleaned, features);
        log.info("Cleaning finished: {} -> {} rows ({}% retained)", result.initialRows(), result.finalRows(),
                String.format("%.2f", result.retentionRate()));
        return result;
    }

    private static void logStage(StageResult stage) {
        log.info("Stage {}: {} in, {} removed, {} remaining", stage.stage(), stage.inputCount(),
                stage.removed(), stage.survivors().size());
    }
}
