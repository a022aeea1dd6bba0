package com.example.blockalert.service;

import com.example.blockalert.model.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingPushNotificationSink implements PushNotificationSink {

    @Override
    public void send(Alert alert) {
        log.info("PUSH -> user {}: alert {} ({} urgency)", alert.getReceiverId(), alert.getId(), alert.getUrgency().wireValue());
    }
}
