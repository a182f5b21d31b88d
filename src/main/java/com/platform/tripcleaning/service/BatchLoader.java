package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.DerivedFeatures;
import com.platform.tripcleaning.domain.PersistedTrip;
import com.platform.tripcleaning.domain.TripRecord;
import com.platform.tripcleaning.store.TripJdbcStore;
import com.platform.tripcleaning.store.TripPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes cleaned trips and then backfills their derived features.
 * <p>
 * Trips go in fixed-size chunks, one transaction per chunk. The backfill re-reads {@code trips}
 * by ascending id (keyset paging) and stops at the first empty page. A failed chunk or page is
 * rolled back and aborts the load; earlier commits are kept.
 */
public class BatchLoader {

    private static final Logger log = LoggerFactory.getLogger(BatchLoader.class);

    private final TripJdbcStore store;
    private final TransactionTemplate transactionTemplate;
    private final FeatureDeriver featureDeriver;
    private final int chunkSize;
    private final int pageSize;

    public BatchLoader(TripJdbcStore store, TransactionTemplate transactionTemplate,
                       FeatureDeriver featureDeriver, int chunkSize, int pageSize) {
        if (chunkSize <= 0 || pageSize <= 0) {
            throw new IllegalArgumentException("Chunk and page sizes must be positive");
        }
        this.store = store;
        this.transactionTemplate = transactionTemplate;
        this.featureDeriver = featureDeriver;
        this.chunkSize = chunkSize;
        this.pageSize = pageSize;
    }

    public LoadResult load(List<TripRecord> trips) {
        long inserted = loadTrips(trips);
        BackfillResult backfill = backfillFeatures();
        return new LoadResult(inserted, backfill.featuresWritten(), backfill.pagesRead());
    }

    /**
     * Phase A: chunked trip insert.
     *
     * @return number of trips committed
     */
    public long loadTrips(List<TripRecord> trips) {
        int total = trips.size();
        long committed = 0;
        log.info("Inserting {} trips in chunks of {}", total, chunkSize);

        for (int start = 0; start < total; start += chunkSize) {
            int end = Math.min(start + chunkSize, total);
            List<TripRecord> chunk = trips.subList(start, end);
            try {
                Integer written = transactionTemplate.execute(status -> store.insertTrips(chunk));
                committed += written != null ? written : 0;
            } catch (DataAccessException | TransactionException e) {
                log.error("Trip chunk {}-{} failed and was rolled back", start, end - 1, e);
                throw new TripPersistenceException(
                        "Failed to insert trips " + start + "-" + (end - 1) + " of " + total, e);
            }
            log.info("Inserted {}/{} trips", committed, total);
        }
        return committed;
    }

    /**
     * Phase B: derive and store features for every stored trip.
     */
    public BackfillResult backfillFeatures() {
        long total = store.countTrips();
        log.info("Backfilling derived features for {} trips (page size {})", total, pageSize);

        long lastTripId = 0L;
        long written = 0;
        int pages = 0;
        while (true) {
            List<PersistedTrip> page = store.fetchPage(lastTripId, pageSize);
            if (page.isEmpty()) {
                break;
            }
            pages++;

            List<DerivedFeatures> features = new ArrayList<>(page.size());
            for (PersistedTrip trip : page) {
                features.add(featureDeriver.derive(trip));
            }
            long firstId = page.get(0).tripId();
            lastTripId = page.get(page.size() - 1).tripId();
            try {
                Integer count = transactionTemplate.execute(status -> store.insertDerivedFeatures(features));
                written += count != null ? count : 0;
            } catch (DataAccessException | TransactionException e) {
                log.error("Feature page for trips {}-{} failed and was rolled back", firstId, lastTripId, e);
                throw new TripPersistenceException(
                        "Failed to insert derived features for trips " + firstId + "-" + lastTripId, e);
            }
            log.info("Processed {}/{} trips", written, total);
        }

        log.info("Backfill complete: {} feature rows in {} pages", written, pages);
        return new BackfillResult(written, pages);
    }

    public record BackfillResult(long featuresWritten, int pagesRead) {}

    public record LoadResult(long tripsLoaded, long featuresLoaded, int featurePages) {}
}
