package com.example.blockalert.controller;

import com.example.blockalert.dto.AcknowledgmentSummary;
import com.example.blockalert.dto.SessionStatus;
import com.example.blockalert.session.AlertSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final AlertSessionRegistry alertSessionRegistry;

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionStatus> status(@PathVariable String sessionId) {
        return ResponseEntity.ok(alertSessionRegistry.status(sessionId));
    }

    @PostMapping("/{sessionId}/connectivity")
    public ResponseEntity<SessionStatus> connectivity(@PathVariable String sessionId, @RequestParam boolean online) {
        log.info("Session {} reports {}", sessionId, online ? "online" : "offline");
        return ResponseEntity.ok(alertSessionRegistry.reportConnectivity(sessionId, online));
    }

    @PostMapping("/{sessionId}/reconcile")
    public ResponseEntity<Map<String, Object>> reconcile(@PathVariable String sessionId) {
        int changes = alertSessionRegistry.reconcile(sessionId);
        return ResponseEntity.ok(Map.of(
                "changes", changes,
                "acknowledgments", alertSessionRegistry.acknowledgments(sessionId)));
    }

    @GetMapping("/{sessionId}/acknowledgments")
    public ResponseEntity<AcknowledgmentSummary> acknowledgments(@PathVariable String sessionId) {
        return ResponseEntity.ok(alertSessionRegistry.acknowledgments(sessionId));
    }
}
