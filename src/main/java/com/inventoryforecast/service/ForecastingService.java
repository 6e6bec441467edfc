package com.inventoryforecast.service;

import com.inventoryforecast.config.PipelineProperties;
import com.inventoryforecast.exception.ArtifactNotFoundException;
import com.inventoryforecast.exception.ValidationException;
import com.inventoryforecast.model.DailyDemand;
import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.FeatureTable;
import com.inventoryforecast.model.Forecast;
import com.inventoryforecast.model.ForecastPoint;
import com.inventoryforecast.model.ForecastSummary;
import com.inventoryforecast.model.ModelKind;
import com.inventoryforecast.model.PipelineStage;
import com.inventoryforecast.model.TrainedModel;
import com.inventoryforecast.model.TrainedModelSet;
import com.inventoryforecast.model.WeatherObservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive multi-day forecast: each predicted day is appended to the demand
 * buffer before the next day's features are built, so later lags and rolling
 * windows see earlier predictions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastingService {

    private final PipelineProperties properties;
    private final FeatureEngineeringService featureEngineeringService;

    public Forecast forecast(TrainedModelSet modelSet, ModelKind kind, int horizonDays,
                             List<WeatherObservation> weather) {
        if (kind == null) {
            throw new ValidationException(PipelineStage.FORECASTING, "modelKind is required");
        }
        TrainedModel model = modelSet.find(kind).orElseThrow(() -> new ArtifactNotFoundException(
            PipelineStage.TRAINING, "No trained model of kind " + kind + " is available; train it first"));
        int maxHorizon = properties.getForecast().getMaxHorizonDays();
        if (horizonDays < 1 || horizonDays > maxHorizon) {
            throw new ValidationException(PipelineStage.FORECASTING,
                "horizonDays must be between 1 and " + maxHorizon + ", got " + horizonDays);
        }

        FeatureTable table = modelSet.getFeatures();
        boolean priceAvailable = table.getColumns().contains("price_level");
        FeatureRowBuilder builder = featureEngineeringService.rowBuilderFor(table, priceAvailable, weather);

        List<DailyDemand> history = table.getHistory();
        int n = history.size();
        double[] demand = new double[n + horizonDays];
        Double[] prices = new Double[n + horizonDays];
        for (int i = 0; i < n; i++) {
            demand[i] = history.get(i).demand();
            prices[i] = history.get(i).priceLevel();
        }
        LocalDate start = history.get(0).date();

        double confidence = properties.getForecast().getConfidenceLevel();
        double z = zScore(confidence);
        double halfWidth = z * model.getResidualStd();

        List<ForecastPoint> points = new ArrayList<>(horizonDays);
        for (int h = 0; h < horizonDays; h++) {
            int t = n + h;
            FeatureRow row = builder.build(demand, prices, start, t, Double.NaN)
                .orElseThrow(() -> new IllegalStateException("Feature row unavailable for forecast day " + t));
            double predicted = model.getPredictor().predict(row);
            if (!Double.isFinite(predicted)) {
                throw new IllegalStateException("Model " + kind + " produced a non-finite forecast for " + row.getDate());
            }
            double point = Math.max(0.0, predicted);
            demand[t] = point;
            points.add(new ForecastPoint(row.getDate(), point, Math.max(0.0, point - halfWidth), point + halfWidth));
        }

        ForecastSummary summary = summarize(points);
        log.info("Forecast generated | kind={} | horizon={} | total={} | peak={} on {}",
                 kind, horizonDays, round(summary.getTotal()), round(summary.getPeak()), summary.getPeakDate());

        return Forecast.builder()
            .modelKind(kind)
            .horizonDays(horizonDays)
            .confidenceLevel(confidence)
            .zScore(z)
            .residualStd(model.getResidualStd())
            .points(List.copyOf(points))
            .summary(summary)
            .sourceFingerprint(modelSet.getFingerprint())
            .fingerprint(Fingerprints.of(modelSet.getFingerprint(), kind, horizonDays, confidence, weather, points))
            .generatedAt(Instant.now())
            .build();
    }

    /** Two-sided z for the given confidence level, 0.95 gives about 1.96. */
    static double zScore(double confidenceLevel) {
        return new NormalDistribution().inverseCumulativeProbability(0.5 + confidenceLevel / 2.0);
    }

    static ForecastSummary summarize(List<ForecastPoint> points) {
        double total = 0;
        ForecastPoint peak = null;
        for (ForecastPoint p : points) {
            total += p.point();
            if (peak == null || p.point() > peak.point()) {
                peak = p;
            }
        }
        return ForecastSummary.builder()
            .total(total)
            .averageDaily(points.isEmpty() ? 0.0 : total / points.size())
            .peak(peak != null ? peak.point() : 0.0)
            .peakDate(peak != null ? peak.date() : null)
            .build();
    }

    private static double round(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
