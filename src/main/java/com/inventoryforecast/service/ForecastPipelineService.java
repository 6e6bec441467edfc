package com.inventoryforecast.service;

import com.inventoryforecast.exception.ArtifactNotFoundException;
import com.inventoryforecast.model.AlertBatch;
import com.inventoryforecast.model.AlertThresholds;
import com.inventoryforecast.model.CleanedTable;
import com.inventoryforecast.model.EvaluationReport;
import com.inventoryforecast.model.FeatureOptions;
import com.inventoryforecast.model.FeatureTable;
import com.inventoryforecast.model.Forecast;
import com.inventoryforecast.model.InsightParameters;
import com.inventoryforecast.model.InsightSet;
import com.inventoryforecast.model.ModelKind;
import com.inventoryforecast.model.PipelineStage;
import com.inventoryforecast.model.PreprocessingOptions;
import com.inventoryforecast.model.RawRecord;
import com.inventoryforecast.model.StageStatus;
import com.inventoryforecast.model.TrainedModelSet;
import com.inventoryforecast.model.WeatherObservation;
import com.inventoryforecast.store.RecordStoreAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Runs pipeline stages for a session. Each stage reads its upstream artifact
 * from the store (failing when it is missing or stale) and stores its own
 * result, which marks every downstream artifact stale.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastPipelineService {

    private final RecordStoreAdapter store;
    private final PreprocessingService preprocessingService;
    private final FeatureEngineeringService featureEngineeringService;
    private final ModelTrainingService modelTrainingService;
    private final ForecastingService forecastingService;
    private final ModelEvaluationService modelEvaluationService;
    private final InsightService insightService;
    private final AlertService alertService;
    private final ReportExporter reportExporter;

    public int uploadRecords(String sessionId, List<RawRecord> records, String requestId) {
        return store.replaceActiveDataset(sessionId, records, requestId);
    }

    public int uploadWeather(String sessionId, List<WeatherObservation> observations) {
        store.replaceWeather(sessionId, observations);
        log.info("Weather replaced | session={} | observations={}", sessionId, observations.size());
        return observations.size();
    }

    public CleanedTable preprocess(String sessionId, PreprocessingOptions options) {
        List<RawRecord> raw = store.readActiveDataset(sessionId);
        if (raw.isEmpty()) {
            throw ArtifactNotFoundException.missing(sessionId, PipelineStage.UPLOAD);
        }
        CleanedTable cleaned = preprocessingService.clean(raw, options);
        store.writeArtifact(sessionId, PipelineStage.PREPROCESSING, cleaned);
        return cleaned;
    }

    public FeatureTable engineerFeatures(String sessionId, FeatureOptions options) {
        CleanedTable cleaned = store.readArtifact(sessionId, PipelineStage.PREPROCESSING, CleanedTable.class);
        FeatureTable features = featureEngineeringService.engineer(cleaned, options, store.readWeather(sessionId));
        store.writeArtifact(sessionId, PipelineStage.FEATURE_ENGINEERING, features);
        return features;
    }

    public TrainedModelSet train(String sessionId, Collection<ModelKind> kinds, Double testFraction) {
        FeatureTable features = store.readArtifact(sessionId, PipelineStage.FEATURE_ENGINEERING, FeatureTable.class);
        TrainedModelSet models = modelTrainingService.train(features, kinds, testFraction);
        store.writeArtifact(sessionId, PipelineStage.TRAINING, models);
        return models;
    }

    public Forecast forecast(String sessionId, ModelKind kind, int horizonDays) {
        TrainedModelSet models = store.readArtifact(sessionId, PipelineStage.TRAINING, TrainedModelSet.class);
        Forecast forecast = forecastingService.forecast(models, kind, horizonDays, store.readWeather(sessionId));
        store.writeArtifact(sessionId, PipelineStage.FORECASTING, forecast);
        return forecast;
    }

    public EvaluationReport evaluate(String sessionId) {
        TrainedModelSet models = store.readArtifact(sessionId, PipelineStage.TRAINING, TrainedModelSet.class);
        EvaluationReport report = modelEvaluationService.evaluate(models);
        store.writeArtifact(sessionId, PipelineStage.EVALUATION, report);
        return report;
    }

    public InsightSet insights(String sessionId, InsightParameters params) {
        Forecast forecast = store.readArtifact(sessionId, PipelineStage.FORECASTING, Forecast.class);
        TrainedModelSet models = store.readArtifact(sessionId, PipelineStage.TRAINING, TrainedModelSet.class);
        CleanedTable cleaned = store.readArtifact(sessionId, PipelineStage.PREPROCESSING, CleanedTable.class);
        InsightSet insights = insightService.generate(forecast, models.getFeatures().getHistory(), cleaned,
            params != null ? params : InsightParameters.defaults());
        store.writeArtifact(sessionId, PipelineStage.INSIGHTS, insights);
        return insights;
    }

    public AlertBatch alerts(String sessionId, AlertThresholds thresholds) {
        Forecast forecast = store.readArtifact(sessionId, PipelineStage.FORECASTING, Forecast.class);
        InsightSet insights = store.findFreshArtifact(sessionId, PipelineStage.INSIGHTS, InsightSet.class).orElse(null);
        return alertService.checkAndPublish(sessionId, forecast, insights, thresholds);
    }

    public List<AlertBatch> alertHistory(String sessionId, Integer days) {
        return alertService.history(sessionId, days);
    }

    public AlertThresholds defaultAlertThresholds() {
        return alertService.defaultThresholds();
    }

    public String report(String sessionId) {
        Forecast forecast = store.readArtifact(sessionId, PipelineStage.FORECASTING, Forecast.class);
        EvaluationReport evaluation = store.findFreshArtifact(sessionId, PipelineStage.EVALUATION, EvaluationReport.class)
            .orElse(null);
        InsightSet insights = store.findFreshArtifact(sessionId, PipelineStage.INSIGHTS, InsightSet.class).orElse(null);
        return reportExporter.render(forecast, evaluation, insights);
    }

    public List<StageStatus> status(String sessionId) {
        return store.stageStatus(sessionId);
    }
}
