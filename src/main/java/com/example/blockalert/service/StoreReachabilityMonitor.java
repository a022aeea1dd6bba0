package com.example.blockalert.service;

import com.example.blockalert.session.AlertSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic probe of the alert store. Sessions are told only when reachability flips.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoreReachabilityMonitor {

    private final JdbcTemplate jdbcTemplate;
    private final AlertSessionRegistry alertSessionRegistry;

    private final AtomicBoolean reachable = new AtomicBoolean(true);

    @Scheduled(fixedDelayString = "${block-alert.connectivity.probe-interval}")
    public void probe() {
        boolean current = ping();
        if (reachable.compareAndSet(!current, current)) {
            alertSessionRegistry.onStoreReachabilityChanged(current);
        }
    }

    public boolean isReachable() {
        return reachable.get();
    }

    private boolean ping() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.debug("Store probe failed: {}", e.getMessage());
            return false;
        }
    }
}
