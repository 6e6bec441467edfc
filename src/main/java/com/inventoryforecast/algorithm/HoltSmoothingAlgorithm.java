package com.inventoryforecast.algorithm;

import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.FittedModel;
import com.inventoryforecast.model.ModelKind;

import java.util.List;
import java.util.Locale;

/**
 * Holt's linear exponential smoothing on the target series alone. Smoothing
 * constants are chosen by grid search on a validation tail of the training rows.
 */
public class HoltSmoothingAlgorithm implements ForecastingAlgorithm {

    private static final double[] ALPHA_GRID = {0.2, 0.4, 0.6, 0.8};
    private static final double[] BETA_GRID = {0.1, 0.2, 0.3, 0.4};
    private static final int VALIDATION_WINDOW = 14;

    @Override
    public ModelKind kind() {
        return ModelKind.CLASSICAL_TIME_SERIES;
    }

    @Override
    public FittedModel fit(List<FeatureRow> trainRows, List<String> columns) {
        if (trainRows.size() < 2) {
            throw new IllegalArgumentException("Holt smoothing needs at least 2 observations");
        }
        double[] values = trainRows.stream().mapToDouble(FeatureRow::getTarget).toArray();
        double alpha = ALPHA_GRID[0];
        double beta = BETA_GRID[0];

        int validationSize = Math.min(VALIDATION_WINDOW, Math.max(1, values.length / 4));
        int trainingSize = values.length - validationSize;
        if (trainingSize >= 2) {
            double bestMae = Double.POSITIVE_INFINITY;
            for (double a : ALPHA_GRID) {
                for (double b : BETA_GRID) {
                    HoltState state = runHolt(values, trainingSize, a, b);
                    double error = 0;
                    for (int i = 1; i <= validationSize; i++) {
                        error += Math.abs(values[trainingSize + i - 1] - (state.level() + i * state.trend()));
                    }
                    double mae = error / validationSize;
                    if (mae < bestMae) {
                        bestMae = mae;
                        alpha = a;
                        beta = b;
                    }
                }
            }
        }

        HoltState state = runHolt(values, values.length, alpha, beta);
        int lastIndex = trainRows.get(trainRows.size() - 1).getDayIndex();
        return new HoltModel(state.level(), state.trend(), lastIndex, alpha, beta);
    }

    static HoltState runHolt(double[] values, int length, double alpha, double beta) {
        double level = values[0];
        double trend = length > 1 ? values[1] - values[0] : 0;
        HoltState state = new HoltState(level, trend);
        for (int i = 1; i < length; i++) {
            state = state.next(values[i], alpha, beta);
        }
        return state;
    }

    record HoltState(double level, double trend) {

        HoltState next(double value, double alpha, double beta) {
            double nextLevel = alpha * value + (1 - alpha) * (level + trend);
            return new HoltState(nextLevel, beta * (nextLevel - level) + (1 - beta) * trend);
        }
    }

    record HoltModel(double level, double trend, int lastIndex, double alpha, double beta) implements FittedModel {

        @Override
        public double predict(FeatureRow row) {
            return level + (row.getDayIndex() - lastIndex) * trend;
        }

        @Override
        public String describe() {
            return String.format(Locale.ROOT, "holt smoothing [alpha=%.1f, beta=%.1f]", alpha, beta);
        }

        /** Runs the recursion on with the same constants, so forecasts start from the newest observation. */
        @Override
        public FittedModel updatedWith(List<FeatureRow> observed) {
            HoltState state = new HoltState(level, trend);
            int last = lastIndex;
            for (FeatureRow row : observed) {
                if (row.getDayIndex() <= last) {
                    continue;
                }
                state = state.next(row.getTarget(), alpha, beta);
                last = row.getDayIndex();
            }
            return new HoltModel(state.level(), state.trend(), last, alpha, beta);
        }
    }
}
