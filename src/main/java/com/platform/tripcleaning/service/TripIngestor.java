package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.TripRecord;
import com.platform.tripcleaning.store.source.TripSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a trip source into typed records. Malformed rows are dropped and counted; they never
 * abort the run.
 */
@Service
public class TripIngestor {

    private static final Logger log = LoggerFactory.getLogger(TripIngestor.class);
    private static final int MAX_LOGGED_PARSE_ERRORS = 10;

    private final TripRecordParser parser;

    public TripIngestor(TripRecordParser parser) {
        this.parser = parser;
    }

    public IngestResult ingest(TripSource source) throws IOException {
        log.info("Loading trips from {}", source.description());
        List<TripRecord> records = new ArrayList<>();
        long[] counters = new long[2]; // total rows, parse errors

        source.forEachRow(row -> {
            counters[0]++;
            try {
                records.add(parser.parse(row));
            } catch (TripParseException e) {
                counters[1]++;
                if (counters[1] <= MAX_LOGGED_PARSE_ERRORS) {
                    log.debug("Dropping malformed row: {}", e.getMessage());
                }
            }
        });

        log.info("Loaded {} rows ({} parsed, {} malformed)", counters[0], records.size(), counters[1]);
        return new IngestResult(List.copyOf(records), counters[0], counters[1]);
    }

    public record IngestResult(List<TripRecord> records, long totalRows, long parseErrors) {}
}
