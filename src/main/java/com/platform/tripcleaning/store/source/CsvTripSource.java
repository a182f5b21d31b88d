package com.platform.tripcleaning.store.source;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Trip rows from a CSV file with a header line. All values arrive as strings.
 * <p>
 * Bad values are left to the parser downstream. Broken CSV structure, such as an unterminated
 * quote, ends the read: the underlying parser cannot resynchronise past it.
 */
public class CsvTripSource implements TripSource {

    private static final Logger log = LoggerFactory.getLogger(CsvTripSource.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    private final Path file;
    private final Reader reader;

    public CsvTripSource(Path file) throws IOException {
        this.file = file;
        this.reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
    }

    @Override
    public void forEachRow(Consumer<RawTripRow> consumer) throws IOException {
        long rowNumber = 0;
        try (CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                consumer.accept(new RawTripRow(rowNumber++, record.toMap()));
            }
        } catch (UncheckedIOException e) {
            log.error("Malformed CSV structure in {} after {} rows; aborting the read", file, rowNumber, e);
            throw new IOException("Failed to read CSV " + file + " after " + rowNumber + " rows: "
                    + e.getCause().getMessage(), e.getCause());
        }
    }

    @Override
    public String description() {
        return "csv:" + file;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
