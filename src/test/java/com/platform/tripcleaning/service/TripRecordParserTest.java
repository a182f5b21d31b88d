package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.TripRecord;
import com.platform.tripcleaning.store.source.RawTripRow;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TripRecordParserTest {

    private final TripRecordParser parser = new TripRecordParser();

    @Test
    void testParsesRawTlcNames() throws Exception {
        Map<String, Object> values = new HashMap<>();
        values.put("VendorID", 2L);
        values.put("tpep_pickup_datetime", LocalDateTime.of(2019, 1, 1, 8, 0));
        values.put("tpep_dropoff_datetime", LocalDateTime.of(2019, 1, 1, 8, 15));
        values.put("passenger_count", 2.0);
        values.put("trip_distance", 3.0);
        values.put("RatecodeID", 1.0);
        values.put("store_and_fwd_flag", "N");
        values.put("PULocationID", 142L);
        values.put("DOLocationID", 236L);
        values.put("payment_type", 1L);
        values.put("fare_amount", 10.0);
        values.put("tip_amount", 2.0);
        values.put("total_amount", 13.3);
        values.put("Airport_fee", 1.25);

        TripRecord trip = parser.parse(new RawTripRow(5, values));

        assertEquals(5, trip.sourceRow());
        assertEquals(2, trip.vendorId());
        assertEquals(LocalDateTime.of(2019, 1, 1, 8, 0), trip.pickupDatetime());
        assertEquals(2, trip.passengerCount());
        assertEquals(142, trip.pickupZoneId());
        assertEquals(236, trip.dropoffZoneId());
        assertEquals(1, trip.ratecodeId());
        assertEquals(10.0, trip.fareAmount());
        assertEquals(1.25, trip.airportFee());
        assertEquals(13.3, trip.totalAmount());
        assertEquals(900.0, trip.durationSeconds(), 1e-9);
    }

    @Test
    void testParsesCleanedCsvNamesAndText() throws Exception {
        Map<String, Object> values = new HashMap<>();
        values.put("pickup_datetime", "2019-03-02 22:10:00");
        values.put("dropoff_datetime", "2019-03-02T22:30:00");
        values.put("pickup_zone_id", "48");
        values.put("dropoff_zone_id", "50");
        values.put("trip_distance", "1.7");
        values.put("fare_amount", "9.5");

        TripRecord trip = parser.parse(new RawTripRow(0, values));

        assertEquals(LocalDateTime.of(2019, 3, 2, 22, 10), trip.pickupDatetime());
        assertEquals(LocalDateTime.of(2019, 3, 2, 22, 30), trip.dropoffDatetime());
        assertEquals(48, trip.pickupZoneId());
        assertEquals(1.7, trip.tripDistance());
    }

    @Test
    void testDefaultsForOptionalFields() throws Exception {
        Map<String, Object> values = new HashMap<>();
        values.put("fare_amount", "7.0");
        values.put("tip_amount", "");
        values.put("passenger_count", null);

        TripRecord trip = parser.parse(new RawTripRow(0, values));

        assertEquals(1, trip.passengerCount());
        assertEquals(0.0, trip.tipAmount());
        assertEquals(0.0, trip.tollsAmount());
        assertEquals(0.0, trip.extra());
        assertEquals(0.0, trip.mtaTax());
        assertEquals(0.0, trip.improvementSurcharge());
        assertEquals(0.0, trip.congestionSurcharge());
        assertEquals(0.0, trip.airportFee());
        assertNull(trip.totalAmount());
        assertNull(trip.pickupDatetime());
        assertNull(trip.tripDistance());
    }

    @Test
    void testMalformedValuesRaiseParseException() {
        TripParseException badNumber = assertThrows(TripParseException.class,
                () -> parser.parse(new RawTripRow(3, Map.of("fare_amount", "ten"))));
        assertEquals(3, badNumber.getRowNumber());
        assertEquals("fare_amount", badNumber.getField());

        assertThrows(TripParseException.class,
                () -> parser.parse(new RawTripRow(4, Map.of("tpep_pickup_datetime", "yesterday"))));
        assertThrows(TripParseException.class,
                () -> parser.parse(new RawTripRow(5, Map.of("passenger_count", "1.5"))));
    }
}
