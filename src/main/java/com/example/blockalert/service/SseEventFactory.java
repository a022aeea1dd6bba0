package com.example.blockalert.service;

import com.example.blockalert.util.Constants.SseEventType;
import com.example.blockalert.util.DbTime;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class SseEventFactory {

    private final ObjectMapper objectMapper;

    /**
     * @return the event, or null if the payload cannot be serialized
     */
    public ServerSentEvent<String> createEvent(SseEventType eventType, String eventId, Object data) {
        try {
            return ServerSentEvent.<String>builder()
                    .event(eventType.name())
                    .id(eventId)
                    .data(objectMapper.writeValueAsString(data))
                    .build();
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} event payload: {}", eventType, e.getMessage());
            return null;
        }
    }

    public ServerSentEvent<String> createHeartbeatEvent() {
        return createEvent(SseEventType.HEARTBEAT, null, Map.of("timestamp", DbTime.now().toString()));
    }

    public ServerSentEvent<String> createConnectedEvent(String sessionId, String userId) {
        return createEvent(SseEventType.CONNECTED, sessionId, Map.of(
                "sessionId", sessionId,
                "userId", userId,
                "timestamp", DbTime.now().toString()));
    }

    public ServerSentEvent<String> createShutdownEvent() {
        return ServerSentEvent.<String>builder()
                .event(SseEventType.SERVER_SHUTDOWN.name())
                .data("Server is shutting down. Reconnect shortly.")
                .build();
    }
}
