package com.example.voter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of GET /voters/health.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponseDTO {
    private String status;
    private String version;
    private long uptime;

    @JsonProperty("users_processed")
    private long usersProcessed;

    @JsonProperty("errors_encountered")
    private long errorsEncountered;
}
