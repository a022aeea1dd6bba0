package com.example.blockalert.config;

import com.example.blockalert.dto.EntitlementDecision;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

@Configuration
public class CaffeineConfig {

    /**
     * Entitlement snapshots used by sessions for local validation. Entries expire after the
     * refresh interval; a reconnect evicts the entry to force a reload.
     */
    @Bean
    public Cache<String, EntitlementDecision> entitlementSnapshotCache(AppProperties appProperties) {
        return Caffeine.newBuilder()
                .maximumSize(50_000)
                .expireAfterWrite(appProperties.getEntitlement().getSnapshotRefreshInterval())
                .recordStats()
                .build();
    }

    @Bean
    public Cache<String, Set<String>> plateSnapshotCache(AppProperties appProperties) {
        return Caffeine.newBuilder()
                .maximumSize(50_000)
                .expireAfterWrite(appProperties.getEntitlement().getSnapshotRefreshInterval())
                .recordStats()
                .build();
    }
}
