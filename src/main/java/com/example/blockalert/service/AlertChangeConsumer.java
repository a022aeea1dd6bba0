package com.example.blockalert.service;

import com.example.blockalert.dto.AlertChangeEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Every pod reads every alert change (pod-specific group) and feeds its own local streams.
 */
@Service
@Profile("kafka")
@RequiredArgsConstructor
@Slf4j
public class AlertChangeConsumer {

    private final AlertChangeDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = "${block-alert.kafka.topic}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory")
    public void onAlertChange(@Payload String payload,
                              Acknowledgment acknowledgment,
                              @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
                              @Header(KafkaHeaders.OFFSET) long offset) {
        AlertChangeEvent event;
        try {
            event = objectMapper.readValue(payload, AlertChangeEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable alert change at partition " + partition + ", offset " + offset, e);
        }
        log.debug("Received {} for alert {} [partition {}, offset {}]", event.getEventType(), event.getAlertId(), partition, offset);
        dispatcher.dispatch(event);
        acknowledgment.acknowledge();
    }
}
