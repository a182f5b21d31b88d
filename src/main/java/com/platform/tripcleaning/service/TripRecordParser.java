package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.TripRecord;
import com.platform.tripcleaning.store.source.RawTripRow;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Converts raw source rows into typed {@link TripRecord}s.
 * <p>
 * Absent or empty values become null. Optional charges default to 0 and a missing passenger
 * count defaults to 1. Values that are present but cannot be read as their field type raise
 * {@link TripParseException}.
 */
@Component
public class TripRecordParser {

    static final String[] PICKUP_DATETIME = {"tpep_pickup_datetime", "pickup_datetime"};
    static final String[] DROPOFF_DATETIME = {"tpep_dropoff_datetime", "dropoff_datetime"};
    static final String[] PICKUP_ZONE_ID = {"PULocationID", "pickup_zone_id"};
    static final String[] DROPOFF_ZONE_ID = {"DOLocationID", "dropoff_zone_id"};
    static final String[] PASSENGER_COUNT = {"passenger_count"};
    static final String[] TRIP_DISTANCE = {"trip_distance"};
    static final String[] FARE_AMOUNT = {"fare_amount"};
    static final String[] TIP_AMOUNT = {"tip_amount"};
    static final String[] TOLLS_AMOUNT = {"tolls_amount"};
    static final String[] EXTRA = {"extra"};
    static final String[] MTA_TAX = {"mta_tax"};
    static final String[] IMPROVEMENT_SURCHARGE = {"improvement_surcharge"};
    static final String[] CONGESTION_SURCHARGE = {"congestion_surcharge"};
    static final String[] AIRPORT_FEE = {"Airport_fee", "airport_fee"};
    static final String[] TOTAL_AMOUNT = {"total_amount"};
    static final String[] VENDOR_ID = {"VendorID", "vendor_id"};
    static final String[] RATECODE_ID = {"RatecodeID", "ratecode_id"};
    static final String[] STORE_AND_FWD_FLAG = {"store_and_fwd_flag"};
    static final String[] PAYMENT_TYPE = {"payment_type"};

    private static final int DEFAULT_PASSENGER_COUNT = 1;
    private static final double DEFAULT_CHARGE = 0.0;

    public TripRecord parse(RawTripRow row) throws TripParseException {
        long n = row.rowNumber();
        Integer passengers = readInteger(row, PASSENGER_COUNT);

        return TripRecord.builder()
                .sourceRow(n)
                .pickupDatetime(readTimestamp(row, PICKUP_DATETIME))
                .dropoffDatetime(readTimestamp(row, DROPOFF_DATETIME))
                .pickupZoneId(readInteger(row, PICKUP_ZONE_ID))
                .dropoffZoneId(readInteger(row, DROPOFF_ZONE_ID))
                .passengerCount(passengers != null ? passengers : DEFAULT_PASSENGER_COUNT)
                .tripDistance(readDouble(row, TRIP_DISTANCE))
                .fareAmount(readDouble(row, FARE_AMOUNT))
                .tipAmount(orDefault(readDouble(row, TIP_AMOUNT)))
                .tollsAmount(orDefault(readDouble(row, TOLLS_AMOUNT)))
                .extra(orDefault(readDouble(row, EXTRA)))
                .mtaTax(orDefault(readDouble(row, MTA_TAX)))
                .improvementSurcharge(orDefault(readDouble(row, IMPROVEMENT_SURCHARGE)))
                .congestionSurcharge(orDefault(readDouble(row, CONGESTION_SURCHARGE)))
                .airportFee(orDefault(readDouble(row, AIRPORT_FEE)))
                .totalAmount(readDouble(row, TOTAL_AMOUNT))
                .vendorId(readInteger(row, VENDOR_ID))
                .ratecodeId(readInteger(row, RATECODE_ID))
                .storeAndFwdFlag(readString(row, STORE_AND_FWD_FLAG))
                .paymentType(readInteger(row, PAYMENT_TYPE))
                .build();
    }

    private static Double orDefault(Double value) {
        return value != null ? value : DEFAULT_CHARGE;
    }

    static LocalDateTime readTimestamp(RawTripRow row, String[] field) throws TripParseException {
        Object value = row.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt;
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return LocalDateTime.parse(text.replace(' ', 'T'));
        } catch (DateTimeParseException e) {
            throw new TripParseException(row.rowNumber(), field[0], "unparseable timestamp '" + text + "'");
        }
    }

    static Double readDouble(RawTripRow row, String[] field) throws TripParseException {
        Object value = row.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new TripParseException(row.rowNumber(), field[0], "not a number '" + text + "'");
        }
    }

    static Integer readInteger(RawTripRow row, String[] field) throws TripParseException {
        Double value = readDouble(row, field);
        if (value == null || value.isNaN()) {
            return null;
        }
        if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
            throw new TripParseException(row.rowNumber(), field[0], "not an integer '" + value + "'");
        }
        return value.intValue();
    }

    static String readString(RawTripRow row, String[] field) {
        Object value = row.get(field);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
