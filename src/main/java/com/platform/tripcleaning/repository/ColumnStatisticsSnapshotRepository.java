package com.platform.tripcleaning.repository;

import com.platform.tripcleaning.domain.ColumnStatisticsSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ColumnStatisticsSnapshotRepository extends JpaRepository<ColumnStatisticsSnapshot, UUID> {
    List<ColumnStatisticsSnapshot> findByRunIdOrderByColumnNameAsc(UUID runId);
}
