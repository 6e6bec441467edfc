package com.inventoryforecast.service;

import com.inventoryforecast.exception.ArtifactNotFoundException;
import com.inventoryforecast.model.AccuracyBreakdown;
import com.inventoryforecast.model.EvaluationReport;
import com.inventoryforecast.model.EvaluationResult;
import com.inventoryforecast.model.ModelKind;
import com.inventoryforecast.model.PipelineStage;
import com.inventoryforecast.model.ResidualDiagnostics;
import com.inventoryforecast.model.TrainedModel;
import com.inventoryforecast.model.TrainedModelSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class ModelEvaluationService {

    static final Comparator<EvaluationResult> RANKING = Comparator
        .comparingDouble(EvaluationResult::getRmse)
        .thenComparingDouble(EvaluationResult::getMae)
        .thenComparing(EvaluationResult::getKind);

    private static final int MAX_AUTOCORRELATION_LAG = 7;
    private static final double WHITE_NOISE_LIMIT = 0.2;
    private static final double MEAN_ZERO_TOLERANCE = 0.01;

    static final String MORE_HISTORY = "Consider collecting more historical data to improve accuracy";
    static final String RICHER_FEATURES = "Feature engineering could be improved to capture more variance";
    static final String TRY_ENSEMBLE = "Current model error is high; consider ensemble methods";
    static final String READY_TO_DEPLOY = "Model performance is excellent; consider deploying to production";
    static final String KEEP_MONITORING = "Model performance is satisfactory; continue monitoring";

    public EvaluationReport evaluate(TrainedModelSet modelSet) {
        if (modelSet == null || modelSet.getModels().isEmpty()) {
            throw new ArtifactNotFoundException(PipelineStage.TRAINING, "No trained models to evaluate");
        }
        Map<ModelKind, EvaluationResult> results = new EnumMap<>(ModelKind.class);
        for (TrainedModel model : modelSet.getModels().values()) {
            EvaluationResult result = metrics(model.getKind(), model.getTestActuals(), model.getTestPredictions(),
                model.getResidualStd());
            results.put(model.getKind(), result);
            log.info("Model evaluated | kind={} | mae={} | rmse={} | mape={} | r2={}",
                     model.getKind(), round(result.getMae()), round(result.getRmse()),
                     round(result.getMape()), round(result.getR2()));
        }
        List<EvaluationResult> ranking = results.values().stream().sorted(RANKING).toList();
        List<String> guidance = guidance(ranking.get(0));
        log.info("Best model selected | kind={} | guidance={}", ranking.get(0).getKind(), guidance.size());
        return EvaluationReport.builder()
            .results(results)
            .ranking(ranking)
            .bestModel(ranking.get(0).getKind())
            .guidance(guidance)
            .fingerprint(Fingerprints.of(modelSet.getFingerprint(), ranking))
            .evaluatedAt(Instant.now())
            .build();
    }

    /**
     * Rows whose actual is 0 do not contribute to MAPE; with no such row MAPE is 0.
     * R² is 0 when the actuals have no variance.
     */
    static EvaluationResult metrics(ModelKind kind, List<Double> actuals, List<Double> predictions, double residualStd) {
        int n = actuals.size();
        double absSum = 0;
        double sqSum = 0;
        double pctSum = 0;
        int pctCount = 0;
        double biasSum = 0;
        double maxError = 0;
        double actualSum = 0;
        for (int i = 0; i < n; i++) {
            actualSum += actuals.get(i);
        }
        double actualMean = n > 0 ? actualSum / n : 0;
        double ssTot = 0;

        for (int i = 0; i < n; i++) {
            double actual = actuals.get(i);
            double predicted = predictions.get(i);
            double error = predicted - actual;
            absSum += Math.abs(error);
            sqSum += error * error;
            biasSum += error;
            maxError = Math.max(maxError, Math.abs(error));
            ssTot += (actual - actualMean) * (actual - actualMean);
            if (actual != 0) {
                pctSum += Math.abs(error / actual);
                pctCount++;
            }
        }
        double mae = n > 0 ? absSum / n : 0;
        double rmse = n > 0 ? Math.sqrt(sqSum / n) : 0;
        double mape = pctCount > 0 ? pctSum / pctCount * 100.0 : 0.0;
        double r2 = ssTot > 0 ? 1.0 - sqSum / ssTot : 0.0;

        return EvaluationResult.builder()
            .kind(kind)
            .mae(mae)
            .rmse(rmse)
            .mape(mape)
            .r2(r2)
            .accuracyPercentage(Math.max(0.0, 100.0 - mape))
            .bias(n > 0 ? biasSum / n : 0)
            .maxError(maxError)
            .residualStd(residualStd)
            .sampleCount(n)
            .mapeSampleCount(pctCount)
            .accuracy(accuracyBreakdown(actuals, predictions))
            .residuals(residualDiagnostics(actuals, predictions))
            .build();
    }

    static AccuracyBreakdown accuracyBreakdown(List<Double> actuals, List<Double> predictions) {
        int n = actuals.size();
        int sameDirection = 0;
        int under = 0;
        int over = 0;
        double pctSum = 0;
        int pctCount = 0;
        double peakActual = n > 0 ? Double.NEGATIVE_INFINITY : 0;
        double peakPredicted = n > 0 ? Double.NEGATIVE_INFINITY : 0;
        for (int i = 0; i < n; i++) {
            double actual = actuals.get(i);
            double predicted = predictions.get(i);
            peakActual = Math.max(peakActual, actual);
            peakPredicted = Math.max(peakPredicted, predicted);
            if (actual > predicted) {
                under++;
            } else if (actual < predicted) {
                over++;
            }
            if (actual != 0) {
                pctSum += (actual - predicted) / actual;
                pctCount++;
            }
            if (i > 0 && Math.signum(actual - actuals.get(i - 1)) == Math.signum(predicted - predictions.get(i - 1))) {
                sameDirection++;
            }
        }
        return AccuracyBreakdown.builder()
            .directionalAccuracy(n > 1 ? (double) sameDirection / (n - 1) : 0.0)
            .peakActual(peakActual)
            .peakPredicted(peakPredicted)
            .peakAccuracy(peakActual != 0 ? 1.0 - Math.abs(peakActual - peakPredicted) / peakActual : 0.0)
            .underForecastPercentage(n > 0 ? under * 100.0 / n : 0.0)
            .overForecastPercentage(n > 0 ? over * 100.0 / n : 0.0)
            .meanPercentageBias(pctCount > 0 ? pctSum / pctCount * 100.0 : 0.0)
            .build();
    }

    static ResidualDiagnostics residualDiagnostics(List<Double> actuals, List<Double> predictions) {
        int n = actuals.size();
        double[] residuals = new double[n];
        SimpleRegression spread = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            residuals[i] = actuals.get(i) - predictions.get(i);
            spread.addData(i, Math.abs(residuals[i]));
        }
        double mean = Arrays.stream(residuals).average().orElse(0.0);

        List<Double> autocorrelation = new ArrayList<>(MAX_AUTOCORRELATION_LAG);
        PearsonsCorrelation correlation = new PearsonsCorrelation();
        double maxAbs = 0;
        for (int lag = 1; lag <= MAX_AUTOCORRELATION_LAG; lag++) {
            double r = 0.0;
            if (n - lag >= 2) {
                r = correlation.correlation(Arrays.copyOfRange(residuals, 0, n - lag), Arrays.copyOfRange(residuals, lag, n));
                if (Double.isNaN(r)) {
                    r = 0.0;
                }
            }
            autocorrelation.add(r);
            maxAbs = Math.max(maxAbs, Math.abs(r));
        }
        double slope = spread.getSlope();

        return ResidualDiagnostics.builder()
            .mean(mean)
            .std(n > 0 ? new StandardDeviation(false).evaluate(residuals) : 0.0)
            .autocorrelation(List.copyOf(autocorrelation))
            .heteroscedasticitySlope(Double.isNaN(slope) ? 0.0 : slope)
            .whiteNoise(maxAbs < WHITE_NOISE_LIMIT)
            .meanNearZero(Math.abs(mean) < MEAN_ZERO_TOLERANCE)
            .build();
    }

    /** Checked in order, every matching rule contributes; with no match the model just needs monitoring. */
    static List<String> guidance(EvaluationResult best) {
        List<String> advice = new ArrayList<>();
        if (best.getMape() > 20) {
            advice.add(MORE_HISTORY);
        }
        if (best.getR2() < 0.8) {
            advice.add(RICHER_FEATURES);
        }
        if (best.getMae() > 15) {
            advice.add(TRY_ENSEMBLE);
        }
        if (best.getR2() > 0.9) {
            advice.add(READY_TO_DEPLOY);
        }
        if (advice.isEmpty()) {
            advice.add(KEEP_MONITORING);
        }
        return List.copyOf(advice);
    }

    private static double round(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
