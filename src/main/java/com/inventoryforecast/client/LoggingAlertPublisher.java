package com.inventoryforecast.client;

import com.inventoryforecast.model.Alert;
import com.inventoryforecast.model.AlertBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Default publisher: delivery is out of process, breaches are only logged. */
@Slf4j
@Component
public class LoggingAlertPublisher implements AlertPublisher {

    @Override
    public void publish(String sessionId, AlertBatch batch) {
        if (batch.isEmpty()) {
            log.info("No alerts to publish | session={}", sessionId);
            return;
        }
        log.warn("Publishing alerts | session={} | count={} | breakdown={}",
                 sessionId, batch.getAlerts().size(), batch.getCounts());
        for (Alert alert : batch.getAlerts()) {
            log.warn("Alert | session={} | type={} | date={} | value={} | threshold={}",
                     sessionId, alert.type(), alert.date(), alert.value(), alert.threshold());
        }
    }
}
