package com.example.voter.service;

import com.example.voter.config.VoterConfig;
import com.example.voter.dto.HealthResponseDTO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApiStatsTest {

    @Mock
    private Clock clock;

    @Test
    void snapshot_reportsUptimeSinceConstructionAndCounters() {
        Instant start = Instant.parse("2024-03-05T10:00:00Z");
        when(clock.instant()).thenReturn(start, start.plusSeconds(90));
        VoterConfig config = new VoterConfig();
        config.setVersion("2.1.0");

        ApiStats stats = new ApiStats(config, clock);
        stats.recordProcessed();
        stats.recordProcessed();
        stats.recordError();

        HealthResponseDTO health = stats.snapshot();

        assertEquals("ok", health.getStatus());
        assertEquals("2.1.0", health.getVersion());
        assertEquals(90, health.getUptime());
        assertEquals(2, health.getUsersProcessed());
        assertEquals(1, health.getErrorsEncountered());
    }
}
