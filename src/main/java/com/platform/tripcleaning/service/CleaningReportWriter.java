package com.platform.tripcleaning.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Writes {@code cleaning_report.txt} and {@code cleaning_report.json} for a finished cleaning run.
 */
@Service
public class CleaningReportWriter {

    private static final Logger log = LoggerFactory.getLogger(CleaningReportWriter.class);
    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static final String TEXT_REPORT = "cleaning_report.txt";
    public static final String JSON_REPORT = "cleaning_report.json";

    public void write(CleaningReport report, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path text = directory.resolve(TEXT_REPORT);
        Path json = directory.resolve(JSON_REPORT);
        Files.writeString(text, render(report), StandardCharsets.UTF_8);
        mapper.writeValue(json.toFile(), report);
        log.info("Wrote cleaning report to {} and {}", text, json);
    }

    String render(CleaningReport report) {
        StringWriter buffer = new StringWriter();
        PrintWriter out = new PrintWriter(buffer);

        out.println("NYC Taxi Trip Cleaning Report");
        out.println("=============================");
        out.println("Source: " + report.source());
        out.println("Generated: " + report.generatedAt());
        out.println();
        out.printf(Locale.ROOT, "Initial rows:   %,d%n", report.initialRows());
        out.printf(Locale.ROOT, "Final rows:     %,d%n", report.finalRows());
        out.printf(Locale.ROOT, "Removed rows:   %,d%n", report.removedRows());
        out.printf(Locale.ROOT, "Retention rate: %.2f%%%n", report.retentionRate());

        out.println();
        out.println("Removed by stage:");
        printCounts(out, report.removedByStage());

        out.println();
        out.println("Removed by reason:");
        printCounts(out, report.removedByReason());

        out.println();
        out.println("Column statistics:");
        for (CleaningReport.ColumnSummary c : report.columnStatistics()) {
            out.printf(Locale.ROOT, "  %-16s mean=%.4f std=%.4f |z|>%.2f valid=%,d outliers=%,d%n",
                    c.column(), c.mean(), c.std(), c.threshold(), c.validCount(), c.outliers());
        }

        out.println();
        out.println("Time of day:");
        printCounts(out, report.timeOfDayDistribution());
        out.println("Day type:");
        printCounts(out, report.dayTypeDistribution());

        out.println();
        out.println("Feature summary:");
        for (Map.Entry<String, CleaningReport.Summary> e : report.featureSummaries().entrySet()) {
            CleaningReport.Summary s = e.getValue();
            out.printf(Locale.ROOT, "  %-22s mean=%.2f median=%.2f min=%.2f max=%.2f%n",
                    e.getKey(), s.mean(), s.median(), s.min(), s.max());
        }
        out.flush();
        return buffer.toString();
    }

    private static void printCounts(PrintWriter out, Map<String, Long> counts) {
        for (Map.Entry<String, Long> e : counts.entrySet()) {
            out.printf(Locale.ROOT, "  %-24s %,d%n", e.getKey(), e.getValue());
        }
    }
}
