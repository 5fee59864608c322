package com.signalrelay.backend.service.dedup;

import com.signalrelay.backend.config.DedupProperties;
import com.signalrelay.backend.repository.ProcessedEmailRepository;
import com.signalrelay.backend.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class DedupMaintenanceServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-03T03:30:00Z");

    @Mock
    private JpaDedupStore dedupStore;

    @Mock
    private ProcessedEmailRepository processedEmailRepository;

    @Test
    void pruneExpiredRecords_shouldUseRetentionCutoffForBothTables() {
        DedupProperties properties = new DedupProperties();
        properties.setRetentionDays(30);
        DedupMaintenanceService service = new DedupMaintenanceService(dedupStore, processedEmailRepository,
                properties, new MutableClock(NOW));
        Instant cutoff = Instant.parse("2024-04-03T03:30:00Z");
        when(dedupStore.pruneOlderThan(cutoff)).thenReturn(2);
        when(processedEmailRepository.deleteProcessedBefore(cutoff)).thenReturn(1);

        service.pruneExpiredRecords();

        verify(dedupStore).pruneOlderThan(cutoff);
        verify(processedEmailRepository).deleteProcessedBefore(cutoff);
    }

    @Test
    void pruneExpiredRecords_whenDatabaseFails_shouldNotPropagate() {
        DedupMaintenanceService service = new DedupMaintenanceService(dedupStore, processedEmailRepository,
                new DedupProperties(), new MutableClock(NOW));
        when(dedupStore.pruneOlderThan(any(Instant.class))).thenThrow(new DataAccessResourceFailureException("db locked"));

        assertDoesNotThrow(service::pruneExpiredRecords);
    }
}
