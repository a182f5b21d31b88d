package com.platform.tripcleaning.repository;

import com.platform.tripcleaning.domain.OutlierAuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface OutlierAuditEntryRepository extends JpaRepository<OutlierAuditEntry, UUID> {
    long countByRunId(UUID runId);
}
