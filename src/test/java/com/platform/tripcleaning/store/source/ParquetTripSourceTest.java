package com.platform.tripcleaning.store.source;

import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParquetTripSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadsTlcStyleFile() throws Exception {
        Schema timestamp = LogicalTypes.timestampMicros().addToSchema(Schema.create(Schema.Type.LONG));
        Schema schema = SchemaBuilder.record("Trip").fields()
                .name("VendorID").type().nullable().longType().noDefault()
                .name("tpep_pickup_datetime").type(timestamp).noDefault()
                .name("tpep_dropoff_datetime").type(timestamp).noDefault()
                .name("passenger_count").type().nullable().doubleType().noDefault()
                .name("trip_distance").type().doubleType().noDefault()
                .name("store_and_fwd_flag").type().nullable().stringType().noDefault()
                .name("PULocationID").type().longType().noDefault()
                .name("fare_amount").type().doubleType().noDefault()
                .endRecord();

        LocalDateTime pickup = LocalDateTime.of(2019, 1, 1, 8, 0, 5);
        LocalDateTime dropoff = pickup.plusMinutes(15);
        Path file = tempDir.resolve("trips.parquet");

        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(
                        new org.apache.hadoop.fs.Path(file.toUri()))
                .withSchema(schema)
                .withCompressionCodec(CompressionCodecName.UNCOMPRESSED)
                .withConf(new Configuration())
                .build()) {
            GenericRecord first = new GenericData.Record(schema);
            first.put("VendorID", 2L);
            first.put("tpep_pickup_datetime", toMicros(pickup));
            first.put("tpep_dropoff_datetime", toMicros(dropoff));
            first.put("passenger_count", 1.0);
            first.put("trip_distance", 3.0);
            first.put("store_and_fwd_flag", "N");
            first.put("PULocationID", 142L);
            first.put("fare_amount", 10.0);
            writer.write(first);

            GenericRecord second = new GenericData.Record(schema);
            second.put("VendorID", null);
            second.put("tpep_pickup_datetime", toMicros(pickup));
            second.put("tpep_dropoff_datetime", toMicros(dropoff));
            second.put("passenger_count", null);
            second.put("trip_distance", 1.2);
            second.put("store_and_fwd_flag", null);
            second.put("PULocationID", 7L);
            second.put("fare_amount", 6.5);
            writer.write(second);
        }

        List<RawTripRow> rows = new ArrayList<>();
        try (ParquetTripSource source = new ParquetTripSource(file)) {
            source.forEachRow(rows::add);
            assertTrue(source.description().startsWith("parquet:"));
        }

        assertEquals(2, rows.size());
        RawTripRow row = rows.get(0);
        assertEquals(0, row.rowNumber());
        assertEquals(pickup, row.get("tpep_pickup_datetime"));
        assertEquals(dropoff, row.get("tpep_dropoff_datetime"));
        assertEquals("N", row.get("store_and_fwd_flag"));
        assertEquals(142L, row.get("pulocationid"));
        assertEquals(2L, row.get("VendorID"));

        assertEquals(1, rows.get(1).rowNumber());
        assertNull(rows.get(1).get("passenger_count"));
    }

    @Test
    void testConvertHandlesMillisAndStrings() {
        Schema millis = LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
        LocalDateTime when = LocalDateTime.of(2019, 6, 30, 23, 59, 59);
        long epochMillis = when.toInstant(ZoneOffset.UTC).toEpochMilli();

        assertEquals(when, ParquetTripSource.convert(millis, epochMillis));
        assertEquals("Y", ParquetTripSource.convert(Schema.create(Schema.Type.STRING), new org.apache.avro.util.Utf8("Y")));
        assertEquals(5L, ParquetTripSource.convert(Schema.create(Schema.Type.LONG), 5L));
        assertNull(ParquetTripSource.convert(millis, null));
    }

    private static long toMicros(LocalDateTime time) {
        return time.toEpochSecond(ZoneOffset.UTC) * 1_000_000L;
    }
}
