package com.signalrelay.backend.repository;

import com.signalrelay.backend.model.ProcessedEmail;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface ProcessedEmailRepository extends JpaRepository<ProcessedEmail, String> {

    @Modifying
    @Transactional
    @Query("DELETE FROM ProcessedEmail e WHERE e.processedAt < :cutoff")
    int deleteProcessedBefore(@Param("cutoff") Instant cutoff);
}
