package com.example.blockalert.service;

import com.example.blockalert.model.Alert;

/**
 * Out-of-band notification for receivers with no live session.
 */
public interface PushNotificationSink {

    void send(Alert alert);
}
