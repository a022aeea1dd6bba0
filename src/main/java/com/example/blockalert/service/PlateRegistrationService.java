package com.example.blockalert.service;

import com.example.blockalert.aspect.Monitored;
import com.example.blockalert.config.AppProperties;
import com.example.blockalert.exception.ConflictException;
import com.example.blockalert.exception.RateLimitExceededException;
import com.example.blockalert.exception.ResourceNotFoundException;
import com.example.blockalert.model.PlateRegistration;
import com.example.blockalert.repository.PlateRepository;
import com.example.blockalert.util.DbTime;
import com.example.blockalert.util.PlateFingerprints;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Monitored("service")
@RequiredArgsConstructor
@Slf4j
public class PlateRegistrationService implements PlateDirectory {

    private final PlateRepository plateRepository;
    private final EntitlementGate entitlementGate;
    private final AppProperties appProperties;
    private final Cache<String, Set<String>> plateSnapshotCache;

    @Override
    public List<String> resolveOwners(String plateHash) {
        PlateFingerprints.requireWellFormed(plateHash);
        return plateRepository.findDistinctOwners(plateHash);
    }

    /**
     * Registers a plate for a user. The raw text is hashed here and discarded.
     */
    @Transactional
    public PlateRegistration registerPlate(String userId, String rawPlate) {
        String plateHash = PlateFingerprints.fingerprint(rawPlate);
        if (plateRepository.existsByUserIdAndPlateHash(userId, plateHash)) {
            throw new ConflictException("Plate already registered");
        }
        int limit = entitlementGate.isPremium(userId)
                ? appProperties.getPlates().getPremiumMaxPlates()
                : appProperties.getPlates().getFreeMaxPlates();
        if (plateRepository.countByUserId(userId) >= limit) {
            throw new RateLimitExceededException("Plate limit of " + limit + " reached", limit);
        }
        try {
            PlateRegistration saved = plateRepository.save(PlateRegistration.builder()
                    .userId(userId)
                    .plateHash(plateHash)
                    .createdAt(DbTime.now())
                    .build());
            plateSnapshotCache.invalidate(userId);
            log.info("Registered plate {} for user {}", saved.getId(), userId);
            return saved;
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Plate already registered");
        }
    }

    @Transactional
    public void deletePlate(String userId, Long plateId) {
        int deleted = plateRepository.deleteByIdAndUserId(plateId, userId);
        if (deleted == 0) {
            throw new ResourceNotFoundException("Plate " + plateId + " not found for user " + userId);
        }
        plateSnapshotCache.invalidate(userId);
        log.info("Deleted plate {} for user {}", plateId, userId);
    }

    public List<PlateRegistration> myPlates(String userId) {
        return plateRepository.findByUserId(userId);
    }

    public Set<String> plateHashes(String userId) {
        return plateRepository.findByUserId(userId).stream()
                .map(PlateRegistration::getPlateHash)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
