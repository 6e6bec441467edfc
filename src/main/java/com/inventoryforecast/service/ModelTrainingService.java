package com.inventoryforecast.service;

import com.inventoryforecast.algorithm.ForecastingAlgorithm;
import com.inventoryforecast.algorithm.ForecastingAlgorithms;
import com.inventoryforecast.config.PipelineProperties;
import com.inventoryforecast.exception.TrainingException;
import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.FeatureTable;
import com.inventoryforecast.model.FittedModel;
import com.inventoryforecast.model.ModelKind;
import com.inventoryforecast.model.SplitInfo;
import com.inventoryforecast.model.TrainedModel;
import com.inventoryforecast.model.TrainedModelSet;
import com.inventoryforecast.model.TrainingReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fits every requested model kind on a chronological split of the feature
 * table. Kinds are isolated: one failing does not stop the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelTrainingService {

    private final PipelineProperties properties;
    private final ForecastingAlgorithms algorithms;

    public TrainedModelSet train(FeatureTable table, Collection<ModelKind> kinds, Double testFraction) {
        if (kinds == null || kinds.isEmpty()) {
            throw new TrainingException("At least one model kind must be requested");
        }
        double fraction = testFraction != null ? testFraction : properties.getTraining().getDefaultTestFraction();
        if (!(fraction > 0.0 && fraction < 1.0)) {
            throw new TrainingException("testFraction must lie strictly between 0 and 1, got " + fraction);
        }

        List<FeatureRow> rows = table.getRows();
        int splitIndex = (int) Math.floor(rows.size() * (1.0 - fraction));
        List<FeatureRow> train = rows.subList(0, splitIndex);
        List<FeatureRow> test = rows.subList(splitIndex, rows.size());
        int minTrainRows = properties.getTraining().getMinTrainRows();
        if (train.size() < minTrainRows) {
            throw new TrainingException("Training split has " + train.size()
                + " rows, at least " + minTrainRows + " are required");
        }
        if (test.isEmpty()) {
            throw new TrainingException("Test split is empty; increase testFraction or supply more data");
        }
        SplitInfo split = new SplitInfo(train.size(), test.size(),
            train.get(train.size() - 1).getDate(), test.get(0).getDate());

        Instant started = Instant.now();
        Map<ModelKind, TrainedModel> models = new EnumMap<>(ModelKind.class);
        Map<ModelKind, String> failures = new LinkedHashMap<>();
        Map<ModelKind, String> parameters = new LinkedHashMap<>();
        Set<ModelKind> requested = new LinkedHashSet<>(kinds);

        for (ModelKind kind : requested) {
            Instant kindStart = Instant.now();
            try {
                ForecastingAlgorithm algorithm = algorithms.forKind(kind);
                FittedModel fitted = algorithm.fit(train, table.getColumns());
                List<Double> actuals = new ArrayList<>(test.size());
                List<Double> predictions = new ArrayList<>(test.size());
                double[] residuals = new double[test.size()];
                for (int i = 0; i < test.size(); i++) {
                    FeatureRow row = test.get(i);
                    double predicted = fitted.predict(row);
                    if (!Double.isFinite(predicted)) {
                        throw new IllegalStateException("non-finite prediction for " + row.getDate());
                    }
                    actuals.add(row.getTarget());
                    predictions.add(predicted);
                    residuals[i] = row.getTarget() - predicted;
                }
                Duration elapsed = Duration.between(kindStart, Instant.now());
                models.put(kind, TrainedModel.builder()
                    .kind(kind)
                    .predictor(fitted.updatedWith(test))
                    .featureColumns(table.getColumns())
                    .split(split)
                    .trainingDuration(elapsed)
                    .residualStd(new StandardDeviation(false).evaluate(residuals))
                    .testActuals(List.copyOf(actuals))
                    .testPredictions(List.copyOf(predictions))
                    .sourceFingerprint(table.getFingerprint())
                    .trainedAt(Instant.now())
                    .build());
                parameters.put(kind, fitted.describe());
                log.info("Model trained | kind={} | train={} | test={} | elapsedMs={}",
                         kind, train.size(), test.size(), elapsed.toMillis());
            } catch (Exception e) {
                failures.put(kind, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                log.warn("Model training failed | kind={} | reason={}", kind, e.getMessage(), e);
            }
        }

        if (models.isEmpty()) {
            throw new TrainingException("All requested model kinds failed to train", failures);
        }

        TrainingReport report = TrainingReport.builder()
            .trained(List.copyOf(models.keySet()))
            .failures(failures)
            .parameters(parameters)
            .split(split)
            .featureCount(table.getColumns().size())
            .totalDuration(Duration.between(started, Instant.now()))
            .build();

        return TrainedModelSet.builder()
            .models(models)
            .report(report)
            .features(table)
            .fingerprint(Fingerprints.of(table.getFingerprint(), requested, fraction, parameters))
            .build();
    }
}
