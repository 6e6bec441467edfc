package com.inventoryforecast.client;

import com.inventoryforecast.model.AlertBatch;

/** Hands threshold breaches to the external notification service. */
public interface AlertPublisher {

    void publish(String sessionId, AlertBatch batch);
}
