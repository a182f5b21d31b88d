package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.TripRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drops repeated trips, keeping the first occurrence in input order. Two records are the same
 * trip when pickup, dropoff, both zones and the fare all match.
 */
public class TripDeduplicator implements TripFilterStage {

    private static final Logger log = LoggerFactory.getLogger(TripDeduplicator.class);

    public static final String DUPLICATE = "Duplicate";

    @Override
    public String name() {
        return "dedup";
    }

    @Override
    public StageResult apply(List<TripRecord> input) {
        Set<TripKey> seen = new HashSet<>(input.size() * 2);
        List<TripRecord> survivors = new ArrayList<>(input.size());
        for (TripRecord trip : input) {
            if (seen.add(TripKey.of(trip))) {
                survivors.add(trip);
            }
        }
        long duplicates = input.size() - survivors.size();
        log.info("Removed {} duplicate trips", duplicates);

        Map<String, Long> rejections = new LinkedHashMap<>();
        rejections.put(DUPLICATE, duplicates);
        return new StageResult(name(), input.size(), survivors, rejections);
    }

    record TripKey(LocalDateTime pickup, LocalDateTime dropoff, Integer pickupZone,
                   Integer dropoffZone, Double fare) {

        static TripKey of(TripRecord t) {
            return new TripKey(t.pickupDatetime(), t.dropoffDatetime(), t.pickupZoneId(),
                    t.dropoffZoneId(), t.fareAmount());
        }
    }
}
