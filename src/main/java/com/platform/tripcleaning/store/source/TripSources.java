package com.platform.tripcleaning.store.source;

import com.platform.tripcleaning.config.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Opens the trip source matching a file's format.
 */
public final class TripSources {

    public static final String FORMAT_AUTO = "auto";
    public static final String FORMAT_CSV = "csv";
    public static final String FORMAT_PARQUET = "parquet";

    private TripSources() {}

    public static TripSource open(Path file, String format) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Trip input file not found: " + file);
        }
        String resolved = resolveFormat(file, format);
        return switch (resolved) {
            case FORMAT_CSV -> new CsvTripSource(file);
            case FORMAT_PARQUET -> new ParquetTripSource(file);
            default -> throw new ConfigurationException("Unsupported trip input format: " + format);
        };
    }

    static String resolveFormat(Path file, String format) {
        String requested = format == null ? FORMAT_AUTO : format.trim().toLowerCase(Locale.ROOT);
        if (!requested.equals(FORMAT_AUTO)) {
            return requested;
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".parquet")) {
            return FORMAT_PARQUET;
        }
        if (name.endsWith(".csv")) {
            return FORMAT_CSV;
        }
        throw new ConfigurationException("Cannot infer input format from file name: " + file
                + " (set trip-cleaning.input.format to csv or parquet)");
    }
}
