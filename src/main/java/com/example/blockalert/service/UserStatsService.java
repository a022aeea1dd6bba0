package com.example.blockalert.service;

import com.example.blockalert.model.UserStats;
import com.example.blockalert.repository.UserStatsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Best-effort counters. Each increment commits on its own and a failure is only logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserStatsService {

    static final String ALERTS_SENT = "alerts_sent";
    static final String ALERTS_RECEIVED = "alerts_received";
    static final String CARS_FREED = "cars_freed";
    static final String SITUATIONS_RESOLVED = "situations_resolved";

    private final UserStatsRepository userStatsRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordAlertSent(String userId) {
        increment(userId, ALERTS_SENT);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordAlertReceived(String userId) {
        increment(userId, ALERTS_RECEIVED);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordCarFreed(String userId) {
        increment(userId, CARS_FREED);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordSituationResolved(String userId) {
        increment(userId, SITUATIONS_RESOLVED);
    }

    public UserStats getStats(String userId) {
        return userStatsRepository.findByUserId(userId)
                .orElseGet(() -> UserStats.builder().userId(userId).build());
    }

    private void increment(String userId, String column) {
        try {
            userStatsRepository.increment(userId, column);
        } catch (DataAccessException e) {
            log.warn("Failed to update {} for user {}: {}", column, userId, e.getMessage());
        }
    }
}
