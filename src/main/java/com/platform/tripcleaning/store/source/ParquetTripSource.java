package com.platform.tripcleaning.store.source;

import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Trip rows from a Parquet file such as the TLC monthly {@code yellow_tripdata} releases.
 * <p>
 * Timestamp columns stored as epoch micros or millis are converted to {@link LocalDateTime}
 * using UTC, which reproduces the naive wall-clock values the TLC files carry. Readers that
 * already apply Avro logical-type conversions hand over {@link Instant}s, treated the same way.
 */
public class ParquetTripSource implements TripSource {

    private final Path file;
    private final ParquetReader<GenericRecord> reader;

    public ParquetTripSource(Path file) throws IOException {
        this(file, new Configuration());
    }

    public ParquetTripSource(Path file, Configuration conf) throws IOException {
        this.file = file;
        org.apache.hadoop.fs.Path hadoopPath = new org.apache.hadoop.fs.Path(file.toUri());
        this.reader = AvroParquetReader.<GenericRecord>builder(HadoopInputFile.fromPath(hadoopPath, conf))
                .withConf(conf)
                .build();
    }

    @Override
    public void forEachRow(Consumer<RawTripRow> consumer) throws IOException {
        long rowNumber = 0;
        GenericRecord record;
        while ((record = reader.read()) != null) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Schema.Field field : record.getSchema().getFields()) {
                values.put(field.name(), convert(field.schema(), record.get(field.pos())));
            }
            consumer.accept(new RawTripRow(rowNumber++, values));
        }
    }

    static Object convert(Schema schema, Object value) {
        if (value == null) {
            return null;
        }
        Schema effective = unwrapNullable(schema);
        LogicalType logicalType = effective.getLogicalType();
        if (value instanceof Long raw && logicalType != null) {
            if (logicalType instanceof LogicalTypes.TimestampMicros
                    || logicalType instanceof LogicalTypes.LocalTimestampMicros) {
                return fromEpoch(raw, TimeUnit.MICROSECONDS);
            }
            if (logicalType instanceof LogicalTypes.TimestampMillis
                    || logicalType instanceof LogicalTypes.LocalTimestampMillis) {
                return fromEpoch(raw, TimeUnit.MILLISECONDS);
            }
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        return value;
    }

    private static Schema unwrapNullable(Schema schema) {
        if (schema.getType() != Schema.Type.UNION) {
            return schema;
        }
        for (Schema member : schema.getTypes()) {
            if (member.getType() != Schema.Type.NULL) {
                return member;
            }
        }
        return schema;
    }

    private static LocalDateTime fromEpoch(long amount, TimeUnit unit) {
        long micros = unit.toMicros(amount);
        long seconds = Math.floorDiv(micros, 1_000_000L);
        long nanos = Math.floorMod(micros, 1_000_000L) * 1_000L;
        return LocalDateTime.ofEpochSecond(seconds, (int) nanos, ZoneOffset.UTC);
    }

    @Override
    public String description() {
        return "parquet:" + file;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
