package com.example.voter.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration for the voter service, loaded from application.properties.
 * The store address itself is {@code spring.datasource.url}, fed by the STORE_URL environment variable.
 * The backend is picked by {@code voter.store.type} (h2 | memory), read by the stores' own conditions.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "voter")
public class VoterConfig {

    private String keyPrefix = "voters:";

    private String version = "1.0.0";

    private final Store store = new Store();

    @Getter
    @Setter
    public static class Store {
        private int casMaxAttempts = 5;
    }
}
