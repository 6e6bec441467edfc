package com.inventoryforecast.algorithm;

import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.FittedModel;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HoltSmoothingAlgorithmTest {

    private final HoltSmoothingAlgorithm algorithm = new HoltSmoothingAlgorithm();

    @Test
    void fit_linearSeries_extrapolatesTheLine() {
        List<FeatureRow> rows = rows(40, i -> 10.0 + 2.0 * i);

        FittedModel model = algorithm.fit(rows, List.of());

        assertThat(model.predict(row(39 + 3))).isCloseTo(10.0 + 2.0 * 42, within(1e-6));
    }

    @Test
    void fit_constantSeries_forecastsTheConstant() {
        FittedModel model = algorithm.fit(rows(30, i -> 25.0), List.of());

        assertThat(model.predict(row(45))).isCloseTo(25.0, within(1e-9));
        assertThat(model.describe()).startsWith("holt smoothing");
    }

    @Test
    void updatedWith_laterObservations_moveTheForecastOrigin() {
        List<FeatureRow> series = rows(60, i -> i < 40 ? 10.0 : 100.0);
        FittedModel model = algorithm.fit(series.subList(0, 40), List.of());

        FittedModel updated = model.updatedWith(series.subList(40, 60));

        assertThat(model.predict(row(61))).isCloseTo(10.0, within(1e-9));
        assertThat(updated.predict(row(60))).isGreaterThan(90.0);
        assertThat(updated.describe()).isEqualTo(model.describe());
    }

    @Test
    void updatedWith_rowsAlreadySeen_leaveStateUnchanged() {
        List<FeatureRow> series = rows(30, i -> 5.0 + i);
        FittedModel model = algorithm.fit(series, List.of());

        FittedModel updated = model.updatedWith(series.subList(20, 30));

        assertThat(updated.predict(row(35))).isCloseTo(model.predict(row(35)), within(1e-9));
    }

    @Test
    void fit_singleRow_throws() {
        assertThatThrownBy(() -> algorithm.fit(rows(1, i -> 5.0), List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void runHolt_updatesLevelAndTrend() {
        HoltSmoothingAlgorithm.HoltState state = HoltSmoothingAlgorithm.runHolt(new double[] {10, 12, 20}, 3, 0.5, 0.5);

        // level 12 trend 2, then level 0.5*20 + 0.5*14 = 17, trend 0.5*5 + 0.5*2 = 3.5
        assertThat(state.level()).isCloseTo(17.0, within(1e-9));
        assertThat(state.trend()).isCloseTo(3.5, within(1e-9));
    }

    private static List<FeatureRow> rows(int n, java.util.function.IntToDoubleFunction value) {
        List<FeatureRow> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            rows.add(FeatureRow.builder()
                .date(LocalDate.of(2024, 1, 1).plusDays(i))
                .dayIndex(i)
                .target(value.applyAsDouble(i))
                .features(Map.of())
                .build());
        }
        return rows;
    }

    private static FeatureRow row(int dayIndex) {
        return FeatureRow.builder()
            .date(LocalDate.of(2024, 1, 1).plusDays(dayIndex))
            .dayIndex(dayIndex)
            .target(Double.NaN)
            .features(Map.of())
            .build();
    }
}
