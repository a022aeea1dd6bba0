package com.example.blockalert.mapper;

import com.example.blockalert.dto.AlertView;
import com.example.blockalert.model.Alert;
import com.example.blockalert.model.AlertResponse;
import com.example.blockalert.util.Constants.UrgencyLevel;
import com.example.blockalert.util.DbTime;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class AlertMapperTest {

    private final AlertMapper alertMapper = Mappers.getMapper(AlertMapper.class);

    @Test
    void shouldWriteWireValuesForAnsweredAlert() {
        Alert alert = Alert.builder()
                .id(UUID.randomUUID())
                .senderId("alice")
                .receiverId("bob")
                .plateHash("c".repeat(64))
                .message("Blocking the gate")
                .urgency(UrgencyLevel.HIGH)
                .response(AlertResponse.MOVING_NOW)
                .responseMessage("Two minutes")
                .createdAt(DbTime.now())
                .readAt(DbTime.now())
                .respondedAt(DbTime.now())
                .build();

        AlertView view = alertMapper.toView(alert);

        assertThat(view.getId()).isEqualTo(alert.getId());
        assertThat(view.getUrgency()).isEqualTo("high");
        assertThat(view.getResponse()).isEqualTo("moving_now");
        assertThat(view.getResponseText()).isEqualTo(AlertResponse.MOVING_NOW.getDisplayText());
        assertThat(view.getResponseMessage()).isEqualTo("Two minutes");
        assertThat(view.getRespondedAt()).isEqualTo(alert.getRespondedAt());
    }

    @Test
    void shouldLeaveResponseFieldsEmptyForUnansweredAlert() {
        Alert alert = Alert.builder()
                .id(UUID.randomUUID())
                .senderId("alice")
                .receiverId("bob")
                .plateHash("c".repeat(64))
                .createdAt(DbTime.now())
                .build();

        AlertView view = alertMapper.toView(alert);

        assertThat(view.getUrgency()).isEqualTo("normal");
        assertThat(view.getResponse()).isNull();
        assertThat(view.getResponseText()).isNull();
        assertThat(view.getReadAt()).isNull();
    }

    @Test
    void shouldMapListsAndNull() {
        assertThat(alertMapper.toView(null)).isNull();
        assertThat(alertMapper.toViews(List.of())).isEmpty();
    }
}
