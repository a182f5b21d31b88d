package com.platform.tripcleaning.service;

import com.platform.tripcleaning.TripFixtures;
import com.platform.tripcleaning.domain.DerivedFeatures;
import com.platform.tripcleaning.domain.PersistedTrip;
import com.platform.tripcleaning.domain.TimeOfDayScheme;
import com.platform.tripcleaning.domain.TripRecord;
import com.platform.tripcleaning.store.TripJdbcStore;
import com.platform.tripcleaning.store.TripPersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchLoaderTest {

    private static final int TOTAL_TRIPS = 120_000;
    private static final int PAGE_SIZE = 50_000;

    @Mock
    private TripJdbcStore store;

    @Mock
    private PlatformTransactionManager transactionManager;

    private final FeatureDeriver deriver = new FeatureDeriver(TimeOfDayScheme.FOUR_BUCKET, 200.0);

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
    }

    @Test
    void testBackfillStopsOnEmptyPage() {
        BatchLoader loader = loader(2, PAGE_SIZE);
        when(store.countTrips()).thenReturn((long) TOTAL_TRIPS);
        when(store.fetchPage(anyLong(), eq(PAGE_SIZE))).thenAnswer(invocation -> {
            Long after = invocation.getArgument(0);
            long last = Math.min(after + PAGE_SIZE, TOTAL_TRIPS);
            List<PersistedTrip> page = new ArrayList<>();
            for (long id = after + 1; id <= last; id++) {
                page.add(new PersistedTrip(id, TripFixtures.PICKUP, TripFixtures.DROPOFF, 3.0, 10.0, 2.0));
            }
            return page;
        });
        when(store.insertDerivedFeatures(anyList())).thenAnswer(invocation -> ((List<?>) invocation.getArgument(0)).size());

        BatchLoader.BackfillResult result = loader.backfillFeatures();

        assertEquals(TOTAL_TRIPS, result.featuresWritten());
        assertEquals(3, result.pagesRead());

        InOrder order = inOrder(store);
        order.verify(store).fetchPage(0L, PAGE_SIZE);
        order.verify(store).fetchPage(50_000L, PAGE_SIZE);
        order.verify(store).fetchPage(100_000L, PAGE_SIZE);
        order.verify(store).fetchPage(120_000L, PAGE_SIZE);
        verify(store, times(4)).fetchPage(anyLong(), anyInt());
        verify(store, times(1)).countTrips();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DerivedFeatures>> captor = ArgumentCaptor.forClass(List.class);
        verify(store, times(3)).insertDerivedFeatures(captor.capture());
        assertEquals(List.of(50_000, 50_000, 20_000), captor.getAllValues().stream().map(List::size).toList());
        DerivedFeatures firstRow = captor.getAllValues().get(0).get(0);
        assertEquals(1L, firstRow.tripId());
        assertEquals(20.0, firstRow.tipPercentage());
        verify(transactionManager, times(3)).commit(any());
    }

    @Test
    void testBackfillOfEmptyTable() {
        BatchLoader loader = loader(2, PAGE_SIZE);
        when(store.fetchPage(0L, PAGE_SIZE)).thenReturn(List.of());

        BatchLoader.BackfillResult result = loader.backfillFeatures();

        assertEquals(0, result.featuresWritten());
        assertEquals(0, result.pagesRead());
        verify(store, never()).insertDerivedFeatures(anyList());
    }

    @Test
    void testTripsInsertedInChunks() {
        BatchLoader loader = loader(2, PAGE_SIZE);
        when(store.insertTrips(anyList())).thenAnswer(invocation -> ((List<?>) invocation.getArgument(0)).size());

        long inserted = loader.loadTrips(trips(5));

        assertEquals(5, inserted);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<TripRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(store, times(3)).insertTrips(captor.capture());
        assertEquals(List.of(2, 2, 1), captor.getAllValues().stream().map(List::size).toList());
        verify(transactionManager, times(3)).commit(any());
    }

    @Test
    void testFailedChunkRollsBackAndAborts() {
        BatchLoader loader = loader(2, PAGE_SIZE);
        when(store.insertTrips(anyList()))
                .thenReturn(2)
                .thenThrow(new DataIntegrityViolationException("violates foreign key constraint"));

        TripPersistenceException e = assertThrows(TripPersistenceException.class,
                () -> loader.loadTrips(trips(5)));

        assertInstanceOf(DataIntegrityViolationException.class, e.getCause());
        assertTrue(e.getMessage().contains("2-3"));
        verify(store, times(2)).insertTrips(anyList());
        verify(transactionManager, times(1)).commit(any());
        verify(transactionManager, times(1)).rollback(any());
    }

    @Test
    void testFailedFeaturePageRollsBackAndAborts() {
        BatchLoader loader = loader(2, 10);
        when(store.countTrips()).thenReturn(1L);
        when(store.fetchPage(0L, 10)).thenReturn(List.of(
                new PersistedTrip(1L, TripFixtures.PICKUP, TripFixtures.DROPOFF, 3.0, 10.0, 2.0)));
        when(store.insertDerivedFeatures(anyList())).thenThrow(new DataIntegrityViolationException("boom"));

        assertThrows(TripPersistenceException.class, loader::backfillFeatures);
        verify(transactionManager).rollback(any());
        verify(store, times(1)).fetchPage(anyLong(), anyInt());
    }

    @Test
    void testFailedCommitWrappedWithChunkRange() {
        BatchLoader loader = loader(2, PAGE_SIZE);
        when(store.insertTrips(anyList())).thenReturn(2);
        doNothing().doThrow(new TransactionSystemException("Could not commit JDBC transaction"))
                .when(transactionManager).commit(any());

        TripPersistenceException e = assertThrows(TripPersistenceException.class,
                () -> loader.loadTrips(trips(5)));

        assertInstanceOf(TransactionSystemException.class, e.getCause());
        assertTrue(e.getMessage().contains("2-3"));
        verify(store, times(2)).insertTrips(anyList());
    }

    @Test
    void testUnavailableConnectionWrappedDuringBackfill() {
        BatchLoader loader = loader(2, 10);
        when(store.countTrips()).thenReturn(1L);
        when(store.fetchPage(0L, 10)).thenReturn(List.of(
                new PersistedTrip(1L, TripFixtures.PICKUP, TripFixtures.DROPOFF, 3.0, 10.0, 2.0)));
        when(transactionManager.getTransaction(any()))
                .thenThrow(new CannotCreateTransactionException("Could not open JDBC Connection"));

        TripPersistenceException e = assertThrows(TripPersistenceException.class, loader::backfillFeatures);

        assertInstanceOf(CannotCreateTransactionException.class, e.getCause());
        verify(store, never()).insertDerivedFeatures(anyList());
    }

    @Test
    void testInvalidSizesRejected() {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        assertThrows(IllegalArgumentException.class, () -> new BatchLoader(store, template, deriver, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new BatchLoader(store, template, deriver, 10, -1));
    }

    private BatchLoader loader(int chunkSize, int pageSize) {
        return new BatchLoader(store, new TransactionTemplate(transactionManager), deriver, chunkSize, pageSize);
    }

    private static List<TripRecord> trips(int count) {
        List<TripRecord> trips = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            trips.add(TripFixtures.validTrip(i));
        }
        return trips;
    }
}
