package com.platform.tripcleaning.store.source;

import com.platform.tripcleaning.config.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvTripSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadsRowsInOrder() throws Exception {
        Path file = tempDir.resolve("trips.csv");
        Files.writeString(file, String.join("\n",
                "tpep_pickup_datetime,tpep_dropoff_datetime,PULocationID,fare_amount",
                "2019-01-01 08:00:00,2019-01-01 08:15:00,142, 10.0",
                "",
                "2019-01-02 09:00:00,2019-01-02 09:05:00,7,"));

        List<RawTripRow> rows = new ArrayList<>();
        try (TripSource source = TripSources.open(file, "auto")) {
            assertInstanceOf(CsvTripSource.class, source);
            source.forEachRow(rows::add);
        }

        assertEquals(2, rows.size());
        assertEquals(0, rows.get(0).rowNumber());
        assertEquals("2019-01-01 08:00:00", rows.get(0).get("tpep_pickup_datetime"));
        assertEquals("10.0", rows.get(0).get("fare_amount"));
        assertEquals("142", rows.get(0).get("pulocationid", "pickup_zone_id"));
        assertEquals("", rows.get(1).get("fare_amount"));
        assertNull(rows.get(1).get("tip_amount"));
    }

    @Test
    void testUnterminatedQuoteAbortsRead() throws Exception {
        Path file = tempDir.resolve("broken.csv");
        Files.writeString(file, String.join("\n",
                "tpep_pickup_datetime,tpep_dropoff_datetime,PULocationID,fare_amount",
                "2019-01-01 08:00:00,2019-01-01 08:15:00,142,10.0",
                "2019-01-01 09:00:00,\"2019-01-01 09:15:00,7,12.5"));

        List<RawTripRow> rows = new ArrayList<>();
        try (TripSource source = TripSources.open(file, "csv")) {
            IOException e = assertThrows(IOException.class, () -> source.forEachRow(rows::add));
            assertTrue(e.getMessage().contains("after 1 rows"), e.getMessage());
        }

        assertEquals(1, rows.size());
        assertEquals("142", rows.get(0).get("PULocationID"));
    }

    @Test
    void testFormatResolution() {
        assertEquals("parquet", TripSources.resolveFormat(Path.of("yellow_tripdata_2019-01.parquet"), "auto"));
        assertEquals("csv", TripSources.resolveFormat(Path.of("cleaned.CSV"), null));
        assertEquals("csv", TripSources.resolveFormat(Path.of("export.dat"), "CSV"));
        assertThrows(ConfigurationException.class, () -> TripSources.resolveFormat(Path.of("export.dat"), "auto"));
    }

    @Test
    void testMissingFileIsConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> TripSources.open(tempDir.resolve("absent.parquet"), "auto"));
    }
}
