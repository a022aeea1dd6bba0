package com.example.blockalert.controller;

import com.example.blockalert.dto.EntitlementDecision;
import com.example.blockalert.dto.TierUpdateRequest;
import com.example.blockalert.service.EntitlementGate;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/entitlements")
@RequiredArgsConstructor
@Slf4j
public class EntitlementController {

    private final EntitlementGate entitlementGate;

    @GetMapping("/{userId}")
    public ResponseEntity<EntitlementDecision> check(@PathVariable String userId) {
        return ResponseEntity.ok(entitlementGate.check(userId));
    }

    /**
     * Called by the subscription oracle once a purchase or expiry is confirmed.
     */
    @PutMapping("/{userId}/tier")
    public ResponseEntity<EntitlementDecision> updateTier(@PathVariable String userId, @Valid @RequestBody TierUpdateRequest request) {
        log.info("Tier update for user {} to {}", userId, request.getTier());
        return ResponseEntity.ok(entitlementGate.updateTier(userId, request.getTier()));
    }
}
