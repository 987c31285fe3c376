package com.example.voter.service;

import com.example.voter.config.VoterConfig;
import com.example.voter.dto.HealthResponseDTO;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Request counters reported by the health endpoint.
 */
@Component
public class ApiStats {
    private final VoterConfig voterConfig;
    private final Clock clock;
    private final Instant startedAt;

    private final AtomicLong usersProcessed = new AtomicLong();
    private final AtomicLong errorsEncountered = new AtomicLong();

    public ApiStats(VoterConfig voterConfig, Clock clock) {
        this.voterConfig = voterConfig;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void recordProcessed() {
        usersProcessed.incrementAndGet();
    }

    public void recordError() {
        errorsEncountered.incrementAndGet();
    }

    public HealthResponseDTO snapshot() {
        long uptime = Duration.between(startedAt, clock.instant()).getSeconds();
        return new HealthResponseDTO("ok", voterConfig.getVersion(), uptime,
                usersProcessed.get(), errorsEncountered.get());
    }
}
