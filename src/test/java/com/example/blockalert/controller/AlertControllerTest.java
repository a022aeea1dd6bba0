package com.example.blockalert.controller;

import com.example.blockalert.dto.SendAlertRequest;
import com.example.blockalert.dto.SendAlertResult;
import com.example.blockalert.exception.ConflictException;
import com.example.blockalert.exception.NetworkUnavailableException;
import com.example.blockalert.exception.PartialFailureException;
import com.example.blockalert.exception.RateLimitExceededException;
import com.example.blockalert.exception.ResourceNotFoundException;
import com.example.blockalert.mapper.AlertMapperImpl;
import com.example.blockalert.model.Alert;
import com.example.blockalert.model.AlertResponse;
import com.example.blockalert.service.AlertService;
import com.example.blockalert.session.AlertSessionRegistry;
import com.example.blockalert.util.DbTime;
import com.example.blockalert.util.PlateFingerprints;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(AlertController.class)
@Import(AlertMapperImpl.class)
class AlertControllerTest {

    private static final String PLATE = PlateFingerprints.fingerprint("AB 123");

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private AlertService alertService;

    @MockBean
    private AlertSessionRegistry alertSessionRegistry;

    @Test
    void shouldCreateAlertAndReturnIds() {
        UUID id = UUID.randomUUID();
        when(alertSessionRegistry.sendAlert(any(SendAlertRequest.class)))
                .thenReturn(SendAlertResult.builder().alertIds(List.of(id)).recipientCount(1).build());

        webTestClient.post().uri("/api/alerts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("senderId", "alice", "plate", "AB 123", "urgency", "high"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.recipientCount").isEqualTo(1)
                .jsonPath("$.alertIds[0]").isEqualTo(id.toString());
    }

    @Test
    void shouldRejectRequestWithoutTarget() {
        webTestClient.post().uri("/api/alerts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("senderId", "alice"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400);

        verify(alertSessionRegistry, never()).sendAlert(any());
    }

    @Test
    void shouldMapUnregisteredPlateToNotFound() {
        when(alertSessionRegistry.sendAlert(any(SendAlertRequest.class)))
                .thenThrow(new ResourceNotFoundException("License plate not registered"));

        webTestClient.post().uri("/api/alerts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("senderId", "alice", "plateHash", PLATE))
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.message").isEqualTo("License plate not registered");
    }

    @Test
    void shouldMapExhaustedQuotaToTooManyRequests() {
        when(alertSessionRegistry.sendAlert(any(SendAlertRequest.class)))
                .thenThrow(new RateLimitExceededException("Daily alert limit reached", 3));

        webTestClient.post().uri("/api/alerts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("senderId", "alice", "plateHash", PLATE))
                .exchange()
                .expectStatus().isEqualTo(429);
    }

    @Test
    void shouldReportPartialDelivery() {
        UUID written = UUID.randomUUID();
        when(alertSessionRegistry.sendAlert(any(SendAlertRequest.class)))
                .thenThrow(new PartialFailureException(List.of(written), List.of("carol")));

        webTestClient.post().uri("/api/alerts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("senderId", "alice", "plateHash", PLATE))
                .exchange()
                .expectStatus().isEqualTo(207)
                .expectBody()
                .jsonPath("$.succeeded[0]").isEqualTo(written.toString())
                .jsonPath("$.failedReceivers[0]").isEqualTo("carol");
    }

    @Test
    void shouldMapOfflineSessionToServiceUnavailable() {
        when(alertSessionRegistry.sendAlert(any(SendAlertRequest.class)))
                .thenThrow(new NetworkUnavailableException("Offline. Try again once the connection is back."));

        webTestClient.post().uri("/api/alerts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("senderId", "alice", "plateHash", PLATE, "sessionId", "s-1"))
                .exchange()
                .expectStatus().isEqualTo(503);
    }

    @Test
    void shouldReturnAnsweredAlert() {
        UUID id = UUID.randomUUID();
        when(alertService.sendResponse(eq(id), eq("moving_now"), isNull())).thenReturn(Alert.builder()
                .id(id)
                .senderId("alice")
                .receiverId("bob")
                .plateHash(PLATE)
                .response(AlertResponse.MOVING_NOW)
                .createdAt(DbTime.now())
                .readAt(DbTime.now())
                .respondedAt(DbTime.now())
                .build());

        webTestClient.post().uri("/api/alerts/{id}/response", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("response", "moving_now"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.response").isEqualTo("moving_now")
                .jsonPath("$.responseText").isEqualTo("Moving now");
    }

    @Test
    void shouldMapSecondAnswerToConflict() {
        UUID id = UUID.randomUUID();
        when(alertService.sendResponse(eq(id), eq("wrong_car"), isNull()))
                .thenThrow(new ConflictException("Alert " + id + " has already been answered"));

        webTestClient.post().uri("/api/alerts/{id}/response", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("response", "wrong_car"))
                .exchange()
                .expectStatus().isEqualTo(409);
    }

    @Test
    void shouldRejectMalformedAlertId() {
        webTestClient.get().uri("/api/alerts/not-a-uuid")
                .exchange()
                .expectStatus().isBadRequest();
    }
}
