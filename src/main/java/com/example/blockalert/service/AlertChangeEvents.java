package com.example.blockalert.service;

import com.example.blockalert.dto.AlertChangeEvent;
import com.example.blockalert.model.Alert;
import com.example.blockalert.util.Constants.EventType;
import com.example.blockalert.util.DbTime;

import java.util.UUID;

final class AlertChangeEvents {

    private AlertChangeEvents() {}

    static AlertChangeEvent of(Alert alert, EventType eventType, String podId) {
        return AlertChangeEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .alertId(alert.getId())
                .senderId(alert.getSenderId())
                .receiverId(alert.getReceiverId())
                .eventType(eventType.name())
                .podId(podId)
                .timestamp(DbTime.now())
                .build();
    }
}
