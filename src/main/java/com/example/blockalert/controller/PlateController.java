package com.example.blockalert.controller;

import com.example.blockalert.dto.RegisterPlateRequest;
import com.example.blockalert.model.PlateRegistration;
import com.example.blockalert.service.PlateRegistrationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/plates")
@RequiredArgsConstructor
@Slf4j
public class PlateController {

    private final PlateRegistrationService plateRegistrationService;

    @PostMapping
    public ResponseEntity<PlateRegistration> register(@Valid @RequestBody RegisterPlateRequest request) {
        log.info("Plate registration for user {}", request.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(plateRegistrationService.registerPlate(request.getUserId(), request.getPlate()));
    }

    @GetMapping
    public ResponseEntity<List<PlateRegistration>> myPlates(@RequestParam String userId) {
        return ResponseEntity.ok(plateRegistrationService.myPlates(userId));
    }

    @DeleteMapping("/{plateId}")
    public ResponseEntity<Void> delete(@PathVariable Long plateId, @RequestParam String userId) {
        plateRegistrationService.deletePlate(userId, plateId);
        return ResponseEntity.noContent().build();
    }
}
