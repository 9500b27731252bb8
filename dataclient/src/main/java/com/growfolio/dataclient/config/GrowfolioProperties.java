package com.growfolio.dataclient.config;

/*
 * 09/22/2026 - 9:50 AM
 * @author Growfolio Engineering
 */

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Type-safe configuration for the data client.
 * Maps to YAML properties under the 'growfolio' prefix.
 */
@ConfigurationProperties(prefix = "growfolio")
public record GrowfolioProperties(
        ApiConfig api,
        CacheConfig cache,
        FundingConfig funding,
        DashboardConfig dashboard
) {

    /**
     * Constructor with null-safe defaults.
     */
    public GrowfolioProperties {
        if (api == null) {
            api = new ApiConfig(null, null, null, 0, null, 0);
        }
        if (cache == null) {
            cache = new CacheConfig(0);
        }
        if (funding == null) {
            funding = new FundingConfig(null);
        }
        if (dashboard == null) {
            dashboard = new DashboardConfig(0, null);
        }
    }

    public static GrowfolioProperties defaults() {
        return new GrowfolioProperties(null, null, null, null);
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // API CLIENT CONFIGURATION
    // ═══════════════════════════════════════════════════════════════════════════

    /**
     * Growfolio REST API connection settings.
     */
    public record ApiConfig(
            String baseUrl,
            String version,
            Duration timeout,
            int maxRetryAttempts,
            Duration retryDelay,
            int maxPageSize
    ) {
        public ApiConfig {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "http://localhost:3000";
            }
            if (version == null || version.isBlank()) version = "v1";
            if (timeout == null) timeout = Duration.ofSeconds(30);
            if (maxRetryAttempts <= 0) maxRetryAttempts = 3;
            if (retryDelay == null) retryDelay = Duration.ofSeconds(1);
            if (maxPageSize <= 0) maxPageSize = 100;
        }
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // CACHE CONFIGURATION
    // ═══════════════════════════════════════════════════════════════════════════

    /**
     * Bound on entries per cache store. Freshness windows are fixed per domain and not configured here.
     */
    public record CacheConfig(long maxEntriesPerStore) {
        public CacheConfig {
            if (maxEntriesPerStore <= 0) maxEntriesPerStore = 1000;
        }
    }

    public record FundingConfig(String currency) {
        public FundingConfig {
            if (currency == null || currency.isBlank()) currency = "GBP";
        }
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // DASHBOARD CONFIGURATION
    // ═══════════════════════════════════════════════════════════════════════════

    /**
     * Worker threads used to load dashboard sections in parallel, and how long a load may take.
     */
    public record DashboardConfig(int threads, Duration timeout) {
        public DashboardConfig {
            if (threads <= 0) threads = 3;
            if (timeout == null) timeout = Duration.ofSeconds(30);
        }
    }
}
