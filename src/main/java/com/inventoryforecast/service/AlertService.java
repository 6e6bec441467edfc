package com.inventoryforecast.service;

import com.inventoryforecast.client.AlertPublisher;
import com.inventoryforecast.config.PipelineProperties;
import com.inventoryforecast.exception.ValidationException;
import com.inventoryforecast.model.Alert;
import com.inventoryforecast.model.AlertBatch;
import com.inventoryforecast.model.AlertThresholds;
import com.inventoryforecast.model.AlertType;
import com.inventoryforecast.model.Forecast;
import com.inventoryforecast.model.ForecastPoint;
import com.inventoryforecast.model.InsightSet;
import com.inventoryforecast.model.PipelineStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checks a forecast against demand thresholds and hands the breaches to the
 * {@link AlertPublisher}. Published batches are kept per session, newest last,
 * up to {@code pipeline.alerts.history-limit}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    private final PipelineProperties properties;
    private final AlertPublisher alertPublisher;
    private final Map<String, Deque<AlertBatch>> history = new ConcurrentHashMap<>();

    public AlertThresholds defaultThresholds() {
        PipelineProperties.Alerts cfg = properties.getAlerts();
        return new AlertThresholds(cfg.getCriticalDemand(), cfg.getLowDemand(), cfg.getSpikeDemand());
    }

    public AlertBatch checkAndPublish(String sessionId, Forecast forecast, InsightSet insights,
                                      AlertThresholds thresholds) {
        AlertThresholds limits = thresholds != null ? thresholds : defaultThresholds();
        if (limits.criticalDemand() > limits.lowDemand()) {
            throw new ValidationException(PipelineStage.FORECASTING,
                "criticalDemand must not exceed lowDemand");
        }
        AlertBatch batch = evaluate(sessionId, forecast, insights, limits);
        alertPublisher.publish(sessionId, batch);
        record(batch);
        return batch;
    }

    /** Batches of the session generated within the last {@code days} days, oldest first. */
    public List<AlertBatch> history(String sessionId, Integer days) {
        int window = days != null ? days : properties.getAlerts().getHistoryDays();
        if (window < 1) {
            throw new ValidationException(PipelineStage.FORECASTING, "days must be at least 1, got " + window);
        }
        Instant cutoff = Instant.now().minus(Duration.ofDays(window));
        Deque<AlertBatch> batches = history.get(sessionId);
        if (batches == null) {
            return List.of();
        }
        synchronized (batches) {
            return batches.stream().filter(b -> !b.getGeneratedAt().isBefore(cutoff)).toList();
        }
    }

    void record(AlertBatch batch) {
        Deque<AlertBatch> batches = history.computeIfAbsent(batch.getSessionId(), k -> new ArrayDeque<>());
        synchronized (batches) {
            batches.addLast(batch);
            while (batches.size() > properties.getAlerts().getHistoryLimit()) {
                batches.removeFirst();
            }
        }
    }

    AlertBatch evaluate(String sessionId, Forecast forecast, InsightSet insights, AlertThresholds limits) {
        List<Alert> alerts = new ArrayList<>();
        for (ForecastPoint p : forecast.getPoints()) {
            if (p.point() < limits.criticalDemand()) {
                alerts.add(new Alert(AlertType.CRITICAL, p.date(), p.point(), limits.criticalDemand(),
                    String.format(Locale.ROOT, "CRITICAL: predicted demand on %s is critically low: %.0f", p.date(), p.point())));
            } else if (p.point() < limits.lowDemand()) {
                alerts.add(new Alert(AlertType.LOW, p.date(), p.point(), limits.lowDemand(),
                    String.format(Locale.ROOT, "WARNING: predicted demand on %s is below threshold: %.0f", p.date(), p.point())));
            }
            if (p.upper() > limits.spikeDemand()) {
                alerts.add(new Alert(AlertType.SPIKE, p.date(), p.upper(), limits.spikeDemand(),
                    String.format(Locale.ROOT, "SPIKE: demand on %s may reach %.0f", p.date(), p.upper())));
            }
        }
        if (insights != null && !forecast.getPoints().isEmpty()) {
            int leadTime = insights.getPolicy().getLeadTimeDays();
            double leadTimeDemand = forecast.getPoints().stream()
                .limit(leadTime)
                .mapToDouble(ForecastPoint::point)
                .sum();
            double reorderPoint = insights.getPolicy().getReorderPoint();
            if (leadTimeDemand > reorderPoint) {
                alerts.add(new Alert(AlertType.REORDER, forecast.getPoints().get(0).date(), leadTimeDemand, reorderPoint,
                    String.format(Locale.ROOT, "REORDER: forecast demand over the %d-day lead time (%.0f) exceeds the reorder point (%.0f)",
                        leadTime, leadTimeDemand, reorderPoint)));
            }
        }

        Map<AlertType, Integer> counts = new EnumMap<>(AlertType.class);
        alerts.forEach(a -> counts.merge(a.type(), 1, Integer::sum));
        log.info("Alerts evaluated | session={} | total={} | breakdown={}", sessionId, alerts.size(), counts);
        return AlertBatch.builder()
            .sessionId(sessionId)
            .alerts(List.copyOf(alerts))
            .counts(counts)
            .generatedAt(Instant.now())
            .build();
    }
}
