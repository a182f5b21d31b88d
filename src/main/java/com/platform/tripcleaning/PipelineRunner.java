package com.platform.tripcleaning;

import com.platform.tripcleaning.config.ConfigurationException;
import com.platform.tripcleaning.config.JobSettings;
import com.platform.tripcleaning.domain.CleaningRun;
import com.platform.tripcleaning.service.BatchLoader;
import com.platform.tripcleaning.service.CleaningAuditService;
import com.platform.tripcleaning.service.CleaningPipeline;
import com.platform.tripcleaning.service.CleaningReport;
import com.platform.tripcleaning.service.CleaningReportWriter;
import com.platform.tripcleaning.service.CleaningResult;
import com.platform.tripcleaning.service.FeatureDeriver;
import com.platform.tripcleaning.service.ValidationSettings;
import com.platform.tripcleaning.service.ZoneLoader;
import com.platform.tripcleaning.store.TripJdbcStore;
import com.platform.tripcleaning.store.source.TripSource;
import com.platform.tripcleaning.store.source.TripSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one cleaning job end to end: zones, ingest and clean, audit and report, then load.
 * Any fatal error is logged, the audit run is marked FAILED and the process exits with 1.
 */
@Component
@ConditionalOnProperty(name = "trip-cleaning.runner.enabled", havingValue = "true", matchIfMissing = true)
public class PipelineRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final JobSettings job;
    private final ValidationSettings validationSettings;
    private final FeatureDeriver featureDeriver;
    private final ZoneLoader zoneLoader;
    private final CleaningPipeline pipeline;
    private final CleaningAuditService auditService;
    private final CleaningReportWriter reportWriter;
    private final TripJdbcStore tripStore;
    private final BatchLoader batchLoader;

    private int exitCode = 0;

    public PipelineRunner(JobSettings job,
                          ValidationSettings validationSettings,
                          FeatureDeriver featureDeriver,
                          ZoneLoader zoneLoader,
                          CleaningPipeline pipeline,
                          CleaningAuditService auditService,
                          CleaningReportWriter reportWriter,
                          TripJdbcStore tripStore,
                          BatchLoader batchLoader) {
        this.job = job;
        this.validationSettings = validationSettings;
        this.featureDeriver = featureDeriver;
        this.zoneLoader = zoneLoader;
        this.pipeline = pipeline;
        this.auditService = auditService;
        this.reportWriter = reportWriter;
        this.tripStore = tripStore;
        this.batchLoader = batchLoader;
    }

    @Override
    public void run(String... args) {
        try {
            zoneLoader.loadIfEmpty(job.zoneFile());
            try (TripSource source = TripSources.open(job.inputFile(), job.inputFormat())) {
                CleaningRun run = auditService.startRun(job.inputFile().toString(),
                        validationSettings.expectedYear(), featureDeriver.getScheme().name());
                execute(run.getId(), source);
            }
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            exitCode = 1;
        } catch (IOException | RuntimeException e) {
            log.error("Cleaning job aborted", e);
            exitCode = 1;
        }
    }

    private void execute(UUID runId, TripSource source) throws IOException {
        try {
            CleaningResult result = pipeline.clean(source);
            auditService.recordCleaning(runId, result);
            reportWriter.write(CleaningReport.from(result), job.reportDirectory());
            logSummary(result);

            if (job.truncateBeforeLoad()) {
                tripStore.truncate();
            }
            BatchLoader.LoadResult load = batchLoader.load(result.cleaned());
            auditService.completeRun(runId, load);
            log.info("Run {} complete: {} trips and {} feature rows stored", runId,
                    load.tripsLoaded(), load.featuresLoaded());
        } catch (IOException | RuntimeException e) {
            markFailed(runId, e);
            throw e;
        }
    }

    private void markFailed(UUID runId, Exception cause) {
        try {
            auditService.failRun(runId, cause);
        } catch (RuntimeException auditError) {
            log.error("Could not mark run {} as failed", runId, auditError);
            cause.addSuppressed(auditError);
        }
    }

    private static void logSummary(CleaningResult result) {
        log.info("Initial rows: {}, final rows: {}, retention {}%", result.initialRows(), result.finalRows(),
                String.format("%.2f", result.retentionRate()));
        for (Map.Entry<String, Long> e : result.rejectionCounts().entrySet()) {
            if (e.getValue() > 0) {
                log.info("  removed {} rows: {}", e.getValue(), e.getKey());
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
