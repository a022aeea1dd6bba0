package com.example.blockalert.controller;

import com.example.blockalert.dto.AlertView;
import com.example.blockalert.dto.RespondRequest;
import com.example.blockalert.dto.SendAlertRequest;
import com.example.blockalert.dto.SendAlertResult;
import com.example.blockalert.mapper.AlertMapper;
import com.example.blockalert.service.AlertService;
import com.example.blockalert.session.AlertSessionRegistry;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@Slf4j
public class AlertController {

    private final AlertService alertService;
    private final AlertSessionRegistry alertSessionRegistry;
    private final AlertMapper alertMapper;

    @PostMapping
    @RateLimiter(name = "sendAlertLimiter")
    public ResponseEntity<SendAlertResult> sendAlert(@Valid @RequestBody SendAlertRequest request) {
        log.info("Alert request from sender {} (session {})", request.getSenderId(), request.getSessionId());
        SendAlertResult result = alertSessionRegistry.sendAlert(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PostMapping("/{id}/read")
    public ResponseEntity<AlertView> markRead(@PathVariable UUID id) {
        return ResponseEntity.ok(alertMapper.toView(alertService.markAlertRead(id)));
    }

    @PostMapping("/{id}/response")
    public ResponseEntity<AlertView> respond(@PathVariable UUID id, @Valid @RequestBody RespondRequest request) {
        log.info("Response '{}' for alert {}", request.getResponse(), id);
        return ResponseEntity.ok(alertMapper.toView(
                alertService.sendResponse(id, request.getResponse(), request.getResponseMessage())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AlertView> getAlert(@PathVariable UUID id) {
        return ResponseEntity.ok(alertMapper.toView(alertService.findAlert(id)));
    }

    @GetMapping("/incoming")
    public ResponseEntity<List<AlertView>> incoming(@RequestParam String userId) {
        return ResponseEntity.ok(alertMapper.toViews(alertService.incomingAlerts(userId)));
    }

    @GetMapping("/sent")
    public ResponseEntity<List<AlertView>> sent(@RequestParam String userId) {
        return ResponseEntity.ok(alertMapper.toViews(alertService.sentAlerts(userId)));
    }
}
