package com.platform.tripcleaning;

import com.platform.tripcleaning.config.JobSettings;
import com.platform.tripcleaning.domain.CleaningRun;
import com.platform.tripcleaning.domain.TimeOfDayScheme;
import com.platform.tripcleaning.service.BatchLoader;
import com.platform.tripcleaning.service.CleaningAuditService;
import com.platform.tripcleaning.service.CleaningPipeline;
import com.platform.tripcleaning.service.CleaningReportWriter;
import com.platform.tripcleaning.service.CleaningResult;
import com.platform.tripcleaning.service.FeatureDeriver;
import com.platform.tripcleaning.service.OutlierReport;
import com.platform.tripcleaning.service.StageResult;
import com.platform.tripcleaning.service.ValidationSettings;
import com.platform.tripcleaning.service.ZoneLoader;
import com.platform.tripcleaning.store.TripJdbcStore;
import com.platform.tripcleaning.store.TripPersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

    @TempDir
    Path tempDir;

    @Mock
    private ZoneLoader zoneLoader;

    @Mock
    private CleaningPipeline pipeline;

    @Mock
    private CleaningAuditService auditService;

    @Mock
    private CleaningReportWriter reportWriter;

    @Mock
    private TripJdbcStore tripStore;

    @Mock
    private BatchLoader batchLoader;

    private Path inputFile;
    private final UUID runId = UUID.randomUUID();

    @BeforeEach
    void setUp() throws Exception {
        inputFile = tempDir.resolve("trips.csv");
        Files.writeString(inputFile, "fare_amount\n10.0\n");
    }

    @Test
    void testSuccessfulRun() throws Exception {
        stubRunStart();
        when(pipeline.clean(any())).thenReturn(emptyResult());
        when(batchLoader.load(anyList())).thenReturn(new BatchLoader.LoadResult(0, 0, 0));

        PipelineRunner runner = runner(false);
        runner.run();

        assertEquals(0, runner.getExitCode());
        verify(zoneLoader).loadIfEmpty(tempDir.resolve("zones.csv"));
        verify(auditService).recordCleaning(eq(runId), any());
        verify(reportWriter).write(any(), eq(tempDir.resolve("reports")));
        verify(auditService).completeRun(eq(runId), any());
        verify(tripStore, never()).truncate();
    }

    @Test
    void testTruncateBeforeLoad() throws Exception {
        stubRunStart();
        when(pipeline.clean(any())).thenReturn(emptyResult());
        when(batchLoader.load(anyList())).thenReturn(new BatchLoader.LoadResult(0, 0, 0));

        runner(true).run();

        InOrder order = inOrder(tripStore, batchLoader);
        order.verify(tripStore).truncate();
        order.verify(batchLoader).load(anyList());
    }

    @Test
    void testPersistenceFailureMarksRunFailed() throws Exception {
        stubRunStart();
        when(pipeline.clean(any())).thenReturn(emptyResult());
        TripPersistenceException failure = new TripPersistenceException("chunk failed",
                new QueryTimeoutException("timeout"));
        when(batchLoader.load(anyList())).thenThrow(failure);

        PipelineRunner runner = runner(false);
        runner.run();

        assertEquals(1, runner.getExitCode());
        verify(auditService).failRun(runId, failure);
        verify(auditService, never()).completeRun(any(), any());
    }

    @Test
    void testMissingInputIsFatal() throws Exception {
        Files.delete(inputFile);

        PipelineRunner runner = runner(false);
        runner.run();

        assertEquals(1, runner.getExitCode());
        verify(auditService, never()).startRun(anyString(), anyInt(), anyString());
    }

    private void stubRunStart() {
        CleaningRun run = new CleaningRun();
        run.setId(runId);
        when(auditService.startRun(anyString(), eq(2019), eq("FOUR_BUCKET"))).thenReturn(run);
    }

    private PipelineRunner runner(boolean truncate) {
        JobSettings job = new JobSettings(inputFile, "auto", tempDir.resolve("zones.csv"),
                tempDir.resolve("reports"), truncate);
        return new PipelineRunner(job, ValidationSettings.defaults(2019),
                new FeatureDeriver(TimeOfDayScheme.FOUR_BUCKET, 200.0), zoneLoader, pipeline,
                auditService, reportWriter, tripStore, batchLoader);
    }

    private static CleaningResult emptyResult() {
        return new CleaningResult("csv:trips.csv", 0, 0,
                List.of(new StageResult("validation", 0, List.of(), Map.of())),
                new OutlierReport(0, Map.of(), Map.of(), List.of()),
                List.of(), List.of());
    }
}
