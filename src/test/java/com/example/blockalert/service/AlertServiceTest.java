package com.example.blockalert.service;

import com.example.blockalert.config.AppProperties;
import com.example.blockalert.config.MonitoringConfig.AlertMetricsCollector;
import com.example.blockalert.dto.EntitlementDecision;
import com.example.blockalert.dto.SendAlertResult;
import com.example.blockalert.exception.ConflictException;
import com.example.blockalert.exception.PartialFailureException;
import com.example.blockalert.exception.PersistenceException;
import com.example.blockalert.exception.RateLimitExceededException;
import com.example.blockalert.exception.ResourceNotFoundException;
import com.example.blockalert.exception.ValidationException;
import com.example.blockalert.model.Alert;
import com.example.blockalert.model.AlertResponse;
import com.example.blockalert.repository.AlertRepository;
import com.example.blockalert.util.Constants.EventType;
import com.example.blockalert.util.Constants.ResponsePolicy;
import com.example.blockalert.util.Constants.Tier;
import com.example.blockalert.util.Constants.UrgencyLevel;
import com.example.blockalert.util.DbTime;
import com.example.blockalert.util.PlateFingerprints;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AlertServiceTest {

    private static final String PLATE = PlateFingerprints.fingerprint("AB 123");

    @Mock
    private AlertRepository alertRepository;
    @Mock
    private PlateDirectory plateDirectory;
    @Mock
    private EntitlementGate entitlementGate;
    @Mock
    private AlertChangePublisher alertChangePublisher;
    @Mock
    private UserStatsService userStatsService;
    @Mock
    private TransactionTemplate transactionTemplate;

    private AppProperties appProperties;
    private AlertService alertService;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        alertService = new AlertService(alertRepository, plateDirectory, entitlementGate, alertChangePublisher,
                userStatsService, transactionTemplate, new AlertMetricsCollector(new SimpleMeterRegistry()), appProperties);

        when(transactionTemplate.execute(any())).thenAnswer(invocation ->
                invocation.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
        when(entitlementGate.tryConsume("alice")).thenReturn(allowed());
        when(alertRepository.insert(any(Alert.class))).thenAnswer(invocation -> invocation.<Alert>getArgument(0).toBuilder()
                .id(UUID.randomUUID())
                .createdAt(DbTime.now())
                .build());
    }

    @Test
    void shouldWriteOneRowPerDistinctOwner() {
        when(plateDirectory.resolveOwners(PLATE)).thenReturn(List.of("bob", "carol", "bob"));

        SendAlertResult result = alertService.sendAlert(PLATE, "alice", "You are blocking my garage", UrgencyLevel.HIGH);

        ArgumentCaptor<Alert> rows = ArgumentCaptor.forClass(Alert.class);
        verify(alertRepository, times(2)).insert(rows.capture());
        assertThat(rows.getAllValues()).extracting(Alert::getReceiverId).containsExactlyInAnyOrder("bob", "carol");
        assertThat(rows.getAllValues()).allSatisfy(row -> {
            assertThat(row.getSenderId()).isEqualTo("alice");
            assertThat(row.getPlateHash()).isEqualTo(PLATE);
            assertThat(row.getMessage()).isEqualTo("You are blocking my garage");
            assertThat(row.getUrgency()).isEqualTo(UrgencyLevel.HIGH);
        });
        assertThat(result.getRecipientCount()).isEqualTo(2);
        assertThat(result.getAlertIds()).hasSize(2).doesNotHaveDuplicates();
        verify(alertChangePublisher, times(2)).publish(any(Alert.class), eq(EventType.CREATED));
        verify(userStatsService).recordAlertSent("alice");
        verify(userStatsService).recordAlertReceived("bob");
        verify(userStatsService).recordAlertReceived("carol");
        verify(entitlementGate, never()).release(any());
    }

    @Test
    void shouldReturnNotFoundAndWriteNothingForUnregisteredPlate() {
        when(plateDirectory.resolveOwners(PLATE)).thenReturn(List.of());

        assertThatThrownBy(() -> alertService.sendAlert(PLATE, "alice", null, null))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("License plate not registered");

        verify(alertRepository, never()).insert(any());
        verify(entitlementGate).release("alice");
    }

    @Test
    void shouldRejectAlertToOwnVehicle() {
        when(plateDirectory.resolveOwners(PLATE)).thenReturn(List.of("alice"));

        assertThatThrownBy(() -> alertService.sendAlert(PLATE, "alice", null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Cannot alert your own vehicle");

        verify(alertRepository, never()).insert(any());
        verify(entitlementGate).release("alice");
    }

    @Test
    void shouldSkipSenderWhenPlateIsShared() {
        when(plateDirectory.resolveOwners(PLATE)).thenReturn(List.of("alice", "bob"));

        SendAlertResult result = alertService.sendAlert(PLATE, "alice", null, null);

        assertThat(result.getRecipientCount()).isEqualTo(1);
        ArgumentCaptor<Alert> row = ArgumentCaptor.forClass(Alert.class);
        verify(alertRepository).insert(row.capture());
        assertThat(row.getValue().getReceiverId()).isEqualTo("bob");
        assertThat(row.getValue().getUrgency()).isEqualTo(UrgencyLevel.NORMAL);
    }

    @Test
    void shouldRejectWhenQuotaExhaustedWithoutWriting() {
        when(entitlementGate.tryConsume("alice")).thenReturn(EntitlementDecision.builder()
                .allowed(false)
                .remaining(0)
                .dailyQuota(3)
                .tier(Tier.FREE)
                .reason("Daily alert limit reached")
                .build());

        assertThatThrownBy(() -> alertService.sendAlert(PLATE, "alice", null, null))
                .isInstanceOf(RateLimitExceededException.class)
                .hasMessage("Daily alert limit reached");

        verify(plateDirectory, never()).resolveOwners(any());
        verify(alertRepository, never()).insert(any());
    }

    @Test
    void shouldValidateBeforeTouchingQuota() {
        assertThatThrownBy(() -> alertService.sendAlert("ab123", "alice", null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> alertService.sendAlert(PLATE, "alice", "x".repeat(281), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> alertService.sendAlert(PLATE, " ", null, null))
                .isInstanceOf(ValidationException.class);

        verify(entitlementGate, never()).tryConsume(any());
    }

    @Test
    void shouldReportPartialFailureWithWrittenIds() {
        when(plateDirectory.resolveOwners(PLATE)).thenReturn(List.of("bob", "carol"));
        when(alertRepository.insert(any(Alert.class))).thenAnswer(invocation -> {
            Alert alert = invocation.getArgument(0);
            if (alert.getReceiverId().equals("carol")) {
                throw new DataIntegrityViolationException("boom");
            }
            return alert.toBuilder().id(UUID.randomUUID()).createdAt(DbTime.now()).build();
        });

        assertThatThrownBy(() -> alertService.sendAlert(PLATE, "alice", null, null))
                .isInstanceOfSatisfying(PartialFailureException.class, e -> {
                    assertThat(e.getSucceeded()).hasSize(1);
                    assertThat(e.getFailedReceivers()).containsExactly("carol");
                });

        verify(entitlementGate, never()).release(any());
        verify(userStatsService).recordAlertReceived("bob");
        verify(userStatsService, never()).recordAlertReceived("carol");
    }

    @Test
    void shouldReleaseQuotaWhenEveryInsertFails() {
        when(plateDirectory.resolveOwners(PLATE)).thenReturn(List.of("bob"));
        when(alertRepository.insert(any(Alert.class))).thenThrow(new DataIntegrityViolationException("boom"));

        assertThatThrownBy(() -> alertService.sendAlert(PLATE, "alice", null, null))
                .isInstanceOf(PersistenceException.class);

        verify(entitlementGate).release("alice");
        verify(userStatsService, never()).recordAlertSent(any());
    }

    @Test
    void shouldPublishReadOnlyOnFirstMark() {
        UUID id = UUID.randomUUID();
        Alert stored = storedAlert(id);
        when(alertRepository.findById(id)).thenReturn(Optional.of(stored));
        when(alertRepository.markRead(eq(id), any())).thenReturn(1, 0);

        alertService.markAlertRead(id);
        alertService.markAlertRead(id);

        verify(alertChangePublisher, times(1)).publish(stored, EventType.READ);
    }

    @Test
    void shouldReturnNotFoundWhenMarkingUnknownAlert() {
        UUID id = UUID.randomUUID();
        when(alertRepository.markRead(eq(id), any())).thenReturn(0);
        when(alertRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> alertService.markAlertRead(id)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void shouldRejectUnknownResponseValue() {
        assertThatThrownBy(() -> alertService.sendResponse(UUID.randomUUID(), "on_my_way", null))
                .isInstanceOf(ValidationException.class);
        verify(alertRepository, never()).updateResponse(any(), any(), any(), any(), anyBoolean());
    }

    @Test
    void shouldOverwriteResponseUnderLastWriteWins() {
        UUID id = UUID.randomUUID();
        Alert answered = storedAlert(id).toBuilder()
                .response(AlertResponse.FIVE_MINUTES)
                .respondedAt(DbTime.now())
                .readAt(DbTime.now())
                .build();
        when(alertRepository.findById(id)).thenReturn(Optional.of(answered));
        when(alertRepository.updateResponse(eq(id), eq(AlertResponse.MOVING_NOW), any(), any(), eq(false))).thenReturn(1);

        alertService.sendResponse(id, "moving_now", "On my way");

        verify(alertRepository).updateResponse(eq(id), eq(AlertResponse.MOVING_NOW), eq("On my way"), any(), eq(false));
        verify(alertChangePublisher).publish(any(Alert.class), eq(EventType.RESPONDED));
        verify(userStatsService).recordCarFreed("bob");
    }

    @Test
    void shouldRejectSecondResponseUnderFirstWriteWins() {
        appProperties.getAlert().setResponsePolicy(ResponsePolicy.FIRST_WRITE_WINS);
        UUID id = UUID.randomUUID();
        when(alertRepository.findById(id)).thenReturn(Optional.of(storedAlert(id)));
        when(alertRepository.updateResponse(eq(id), any(), any(), any(), eq(true))).thenReturn(0);

        assertThatThrownBy(() -> alertService.sendResponse(id, "wrong_car", null))
                .isInstanceOf(ConflictException.class);

        verify(alertChangePublisher, never()).publish(any(), any());
        verify(userStatsService, never()).recordCarFreed(any());
    }

    @Test
    void shouldReturnNotFoundWhenRespondingToUnknownAlert() {
        UUID id = UUID.randomUUID();
        when(alertRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> alertService.sendResponse(id, "moving_now", null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private EntitlementDecision allowed() {
        return EntitlementDecision.builder()
                .allowed(true)
                .remaining(2)
                .dailyQuota(3)
                .tier(Tier.FREE)
                .build();
    }

    private Alert storedAlert(UUID id) {
        return Alert.builder()
                .id(id)
                .senderId("alice")
                .receiverId("bob")
                .plateHash(PLATE)
                .createdAt(DbTime.now())
                .build();
    }
}
