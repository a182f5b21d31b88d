package com.platform.tripcleaning.repository;

import com.platform.tripcleaning.domain.CleaningRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CleaningRunRepository extends JpaRepository<CleaningRun, UUID> {
    Optional<CleaningRun> findFirstByOrderByStartedAtDesc();
}
