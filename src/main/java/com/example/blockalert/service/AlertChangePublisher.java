package com.example.blockalert.service;

import com.example.blockalert.model.Alert;
import com.example.blockalert.util.Constants.EventType;

/**
 * Records that an alert row changed. Called inside the transaction that wrote the row; the change
 * reaches live streams only once that transaction has committed.
 */
public interface AlertChangePublisher {

    void publish(Alert alert, EventType eventType);
}
