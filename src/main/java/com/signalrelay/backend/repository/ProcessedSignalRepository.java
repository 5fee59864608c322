package com.signalrelay.backend.repository;

import com.signalrelay.backend.model.ProcessedSignal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface ProcessedSignalRepository extends JpaRepository<ProcessedSignal, String> {

    @Modifying
    @Transactional
    @Query("DELETE FROM ProcessedSignal s WHERE s.processedAt < :cutoff")
    int deleteProcessedBefore(@Param("cutoff") Instant cutoff);
}
