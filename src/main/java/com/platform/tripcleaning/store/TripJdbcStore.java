package com.platform.tripcleaning.store;

import com.platform.tripcleaning.domain.DerivedFeatures;
import com.platform.tripcleaning.domain.PersistedTrip;
import com.platform.tripcleaning.domain.TripRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Bulk access to the {@code trips} and {@code derived_features} tables. Callers own the
 * transaction boundaries; every method runs in whatever transaction is active.
 */
@Repository
public class TripJdbcStore {

    private static final Logger log = LoggerFactory.getLogger(TripJdbcStore.class);

    static final String INSERT_TRIP_SQL = """
            INSERT INTO trips (pickup_datetime, dropoff_datetime, pickup_zone_id, dropoff_zone_id,
                passenger_count, trip_distance, fare_amount, tip_amount, tolls_amount, extra, mta_tax,
                improvement_surcharge, congestion_surcharge, airport_fee, total_amount, vendor_id,
                ratecode_id, store_and_fwd_flag, payment_type)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    static final String INSERT_FEATURES_SQL = """
            INSERT INTO derived_features (trip_id, tip_percentage, trip_duration_minutes, time_of_day,
                trip_speed_mph, day_type)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    static final String SELECT_PAGE_SQL = """
            SELECT trip_id, pickup_datetime, dropoff_datetime, trip_distance, fare_amount, tip_amount
            FROM trips
            WHERE trip_id > ?
            ORDER BY trip_id
            LIMIT ?
            """;

    private static final RowMapper<PersistedTrip> PERSISTED_TRIP_MAPPER = (rs, rowNum) -> new PersistedTrip(
            rs.getLong("trip_id"),
            rs.getObject("pickup_datetime", LocalDateTime.class),
            rs.getObject("dropoff_datetime", LocalDateTime.class),
            nullableDouble(rs, "trip_distance"),
            nullableDouble(rs, "fare_amount"),
            nullableDouble(rs, "tip_amount"));

    private final JdbcTemplate jdbcTemplate;

    public TripJdbcStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts the batch as one JDBC batch statement.
     *
     * @return number of rows inserted
     */
    public int insertTrips(List<TripRecord> trips) {
        if (trips.isEmpty()) {
            return 0;
        }
        jdbcTemplate.batchUpdate(INSERT_TRIP_SQL, trips, trips.size(), TripJdbcStore::bindTrip);
        return trips.size();
    }

    public int insertDerivedFeatures(List<DerivedFeatures> features) {
        if (features.isEmpty()) {
            return 0;
        }
        jdbcTemplate.batchUpdate(INSERT_FEATURES_SQL, features, features.size(), (ps, f) -> {
            ps.setLong(1, f.tripId());
            ps.setDouble(2, f.tipPercentage());
            setDouble(ps, 3, f.durationMinutes());
            ps.setString(4, f.timeOfDay());
            ps.setDouble(5, f.speedMph());
            ps.setString(6, f.dayType());
        });
        return features.size();
    }

    /**
     * Next page of stored trips with an id strictly greater than {@code afterTripId}, ordered by id.
     * An empty list means there are no more rows.
     */
    public List<PersistedTrip> fetchPage(long afterTripId, int limit) {
        return jdbcTemplate.query(SELECT_PAGE_SQL, PERSISTED_TRIP_MAPPER, afterTripId, limit);
    }

    public long countTrips() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM trips", Long.class);
        return count != null ? count : 0L;
    }

    public long countDerivedFeatures() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM derived_features", Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Empties both destination tables and resets the trip id sequence.
     */
    public void truncate() {
        jdbcTemplate.execute("TRUNCATE TABLE derived_features, trips RESTART IDENTITY");
        log.warn("Truncated trips and derived_features");
    }

    private static void bindTrip(PreparedStatement ps, TripRecord t) throws SQLException {
        ps.setObject(1, t.pickupDatetime());
        ps.setObject(2, t.dropoffDatetime());
        setInteger(ps, 3, t.pickupZoneId());
        setInteger(ps, 4, t.dropoffZoneId());
        setInteger(ps, 5, t.passengerCount());
        setDouble(ps, 6, t.tripDistance());
        setDouble(ps, 7, t.fareAmount());
        setDouble(ps, 8, t.tipAmount());
        setDouble(ps, 9, t.tollsAmount());
        setDouble(ps, 10, t.extra());
        setDouble(ps, 11, t.mtaTax());
        setDouble(ps, 12, t.improvementSurcharge());
        setDouble(ps, 13, t.congestionSurcharge());
        setDouble(ps, 14, t.airportFee());
        setDouble(ps, 15, t.totalAmount());
        setInteger(ps, 16, t.vendorId());
        setInteger(ps, 17, t.ratecodeId());
        ps.setString(18, t.storeAndFwdFlag());
        setInteger(ps, 19, t.paymentType());
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null || value.isNaN()) {
            ps.setNull(index, Types.DOUBLE);
        } else {
            ps.setDouble(index, value);
        }
    }

    private static void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
