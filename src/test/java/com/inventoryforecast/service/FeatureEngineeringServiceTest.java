package com.inventoryforecast.service;

import com.inventoryforecast.TestDatasets;
import com.inventoryforecast.client.HolidayCalendar;
import com.inventoryforecast.client.StaticHolidayCalendar;
import com.inventoryforecast.config.PipelineProperties;
import com.inventoryforecast.exception.ValidationException;
import com.inventoryforecast.model.CleanedRow;
import com.inventoryforecast.model.CleanedTable;
import com.inventoryforecast.model.DailyDemand;
import com.inventoryforecast.model.FeatureOptions;
import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.FeatureTable;
import com.inventoryforecast.model.PreprocessingOptions;
import com.inventoryforecast.model.WeatherObservation;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureEngineeringServiceTest {

    private final FeatureEngineeringService service =
        new FeatureEngineeringService(new PipelineProperties(), new StaticHolidayCalendar());

    @Test
    void engineer_dropsRowsWithoutFullHistory() {
        FeatureTable table = service.engineer(TestDatasets.dailyTable(TestDatasets.seasonalSeries(60)),
            FeatureOptions.defaults(), List.of());

        assertThat(table.getHistory()).hasSize(60);
        assertThat(table.size()).isEqualTo(30);
        assertThat(table.getDroppedRowCount()).isEqualTo(30);
        assertThat(table.getRows().get(0).getDate()).isEqualTo(TestDatasets.START.plusDays(30));
        assertThat(table.getColumns()).contains("demand_lag_1", "demand_lag_7", "demand_lag_14",
            "demand_ma_30", "demand_std_30", "trend", "is_holiday", "weather_present");
    }

    @Test
    void engineer_zeroLag_isRejectedBeforeReadingTheTargetDay() {
        PipelineProperties properties = new PipelineProperties();
        properties.getFeatures().setLags(new ArrayList<>(List.of(0, 7)));
        FeatureEngineeringService misconfigured = new FeatureEngineeringService(properties, new StaticHolidayCalendar());

        assertThatThrownBy(() -> misconfigured.engineer(TestDatasets.dailyTable(TestDatasets.seasonalSeries(60)),
                FeatureOptions.defaults(), List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("lag");
    }

    @Test
    void rowBuilder_nonPositiveWindow_throws() {
        assertThatThrownBy(() -> new FeatureRowBuilder(FeatureOptions.defaults(), List.of(1), List.of(7, -1),
                false, new StaticHolidayCalendar(), Map.of(), 25.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("window");
    }

    @Test
    void engineer_holidayKnownFollowsCalendarCoverage() {
        LocalDate coveredUntil = TestDatasets.START.plusDays(44);
        HolidayCalendar partial = new HolidayCalendar() {
            @Override
            public boolean isHoliday(LocalDate date) {
                return covers(date) && date.equals(TestDatasets.START.plusDays(40));
            }

            @Override
            public boolean covers(LocalDate date) {
                return !date.isAfter(coveredUntil);
            }
        };
        FeatureTable table = new FeatureEngineeringService(new PipelineProperties(), partial)
            .engineer(TestDatasets.dailyTable(TestDatasets.seasonalSeries(60)), FeatureOptions.defaults(), List.of());

        for (FeatureRow row : table.getRows()) {
            double expected = row.getDate().isAfter(coveredUntil) ? 0.0 : 1.0;
            assertThat(row.feature("holiday_known")).as("holiday_known on %s", row.getDate()).isEqualTo(expected);
        }
        assertThat(table.getRows()).filteredOn(r -> r.feature("is_holiday") == 1.0)
            .extracting(FeatureRow::getDate)
            .containsExactly(TestDatasets.START.plusDays(40));
    }

    @Test
    void engineer_lagsAndWindowsUseOnlyEarlierDays() {
        double[] series = TestDatasets.seasonalSeries(60);
        FeatureTable table = service.engineer(TestDatasets.dailyTable(series), FeatureOptions.defaults(), List.of());

        FeatureRow row = table.getRows().get(5);
        int t = row.getDayIndex();
        double expectedMa7 = 0;
        for (int i = t - 7; i < t; i++) {
            expectedMa7 += series[i];
        }
        expectedMa7 /= 7;

        assertThat(row.getTarget()).isEqualTo(series[t]);
        assertThat(row.feature("demand_lag_1")).isEqualTo(series[t - 1]);
        assertThat(row.feature("demand_lag_14")).isEqualTo(series[t - 14]);
        assertThat(row.feature("demand_ma_7")).isCloseTo(expectedMa7, within(1e-9));
        assertThat(row.feature("trend")).isEqualTo((double) t);
    }

    @Test
    void engineer_changingALaterDayNeverChangesEarlierRows() {
        double[] series = TestDatasets.seasonalSeries(60);
        double[] altered = series.clone();
        altered[59] = 10_000.0;

        FeatureTable original = service.engineer(TestDatasets.dailyTable(series), FeatureOptions.defaults(), List.of());
        FeatureTable changed = service.engineer(TestDatasets.dailyTable(altered), FeatureOptions.defaults(), List.of());

        int last = original.size() - 1;
        for (int i = 0; i < last; i++) {
            assertThat(changed.getRows().get(i).getFeatures()).isEqualTo(original.getRows().get(i).getFeatures());
        }
        assertThat(changed.getRows().get(last).getFeatures()).isEqualTo(original.getRows().get(last).getFeatures());
        assertThat(changed.getRows().get(last).getTarget()).isEqualTo(10_000.0);
    }

    @Test
    void engineer_fillsCalendarGapsWithZeroDemand() {
        List<CleanedRow> rows = new ArrayList<>(TestDatasets.dailyTable(TestDatasets.seasonalSeries(50)).getRows());
        rows.remove(40);
        CleanedTable gapped = CleanedTable.builder()
            .rows(rows).options(PreprocessingOptions.defaults()).encodings(Map.of()).scaling(Map.of())
            .priceAvailable(false).fingerprint("gapped").build();

        List<DailyDemand> history = FeatureEngineeringService.aggregateDaily(gapped);

        assertThat(history).hasSize(50);
        assertThat(history.get(40).demand()).isZero();
        assertThat(history.get(40).date()).isEqualTo(TestDatasets.START.plusDays(40));
    }

    @Test
    void engineer_joinsWeatherAndDefaultsUnmatchedDays() {
        LocalDate matched = TestDatasets.START.plusDays(45);
        List<WeatherObservation> weather = List.of(WeatherObservation.builder()
            .date(matched).temperature(31.0).precipitation(2.5).build());

        FeatureTable table = service.engineer(TestDatasets.dailyTable(TestDatasets.seasonalSeries(60)),
            FeatureOptions.defaults(), weather);

        FeatureRow hot = table.getRows().stream().filter(r -> r.getDate().equals(matched)).findFirst().orElseThrow();
        FeatureRow other = table.getRows().get(0);
        assertThat(hot.feature("temperature")).isEqualTo(31.0);
        assertThat(hot.feature("is_hot_day")).isEqualTo(1.0);
        assertThat(hot.feature("is_rainy_day")).isEqualTo(1.0);
        assertThat(hot.feature("weather_present")).isEqualTo(1.0);
        assertThat(other.feature("temperature")).isZero();
        assertThat(other.feature("weather_present")).isZero();
    }

    @Test
    void engineer_marksHolidaysAndTheirNeighbours() {
        double[] series = new double[70];
        java.util.Arrays.fill(series, 20.0);
        CleanedTable table = TestDatasets.dailyTable(series);
        FeatureTable features = service.engineer(table, FeatureOptions.defaults(), List.of());

        // Presidents Day 2024
        FeatureRow presidentsDay = row(features, LocalDate.of(2024, 2, 19));
        FeatureRow dayBefore = row(features, LocalDate.of(2024, 2, 18));
        FeatureRow dayAfter = row(features, LocalDate.of(2024, 2, 20));
        assertThat(presidentsDay.feature("is_holiday")).isEqualTo(1.0);
        assertThat(dayBefore.feature("is_pre_holiday")).isEqualTo(1.0);
        assertThat(dayAfter.feature("is_post_holiday")).isEqualTo(1.0);
        assertThat(dayAfter.feature("is_holiday")).isZero();
        assertThat(presidentsDay.feature("holiday_known")).isEqualTo(1.0);
    }

    @Test
    void engineer_respectsDisabledFeatureGroups() {
        FeatureOptions lagsOnly = FeatureOptions.builder()
            .movingAverages(false).dateFeatures(false).weatherFeatures(false)
            .holidayFeatures(false).trendFeatures(false).build();

        FeatureTable table = service.engineer(TestDatasets.dailyTable(TestDatasets.seasonalSeries(30)), lagsOnly, List.of());

        assertThat(table.getColumns()).containsExactly("demand_lag_1", "demand_lag_7", "demand_lag_14");
        assertThat(table.size()).isEqualTo(16);
    }

    @Test
    void engineer_addsPriceLevelFromEarlierDays() {
        List<CleanedRow> rows = new ArrayList<>();
        for (int d = 0; d < 45; d++) {
            rows.add(CleanedRow.builder().date(TestDatasets.START.plusDays(d)).productId("SKU-1")
                .quantity(10 + d % 4).unitPrice(5.0 + d).scaledUnitPrice((double) d).build());
        }
        CleanedTable priced = CleanedTable.builder()
            .rows(rows).options(PreprocessingOptions.defaults()).encodings(Map.of()).scaling(Map.of())
            .priceAvailable(true).fingerprint("priced").build();

        FeatureTable table = service.engineer(priced, FeatureOptions.defaults(), List.of());

        FeatureRow first = table.getRows().get(0);
        assertThat(table.getColumns()).contains("price_level");
        assertThat(first.feature("price_level")).isEqualTo(first.getDayIndex() - 1.0);
    }

    @Test
    void engineer_tooShortForWindows_throwsValidation() {
        assertThatThrownBy(() -> service.engineer(TestDatasets.dailyTable(TestDatasets.seasonalSeries(25)),
                FeatureOptions.defaults(), List.of()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("30 are required");
    }

    @Test
    void engineer_recordsSourceFingerprint() {
        CleanedTable cleaned = TestDatasets.dailyTable(TestDatasets.seasonalSeries(40));

        FeatureTable a = service.engineer(cleaned, FeatureOptions.defaults(), List.of());
        FeatureTable b = service.engineer(cleaned, FeatureOptions.defaults(), List.of());

        assertThat(a.getSourceFingerprint()).isEqualTo(cleaned.getFingerprint());
        assertThat(a.getFingerprint()).isEqualTo(b.getFingerprint());
    }

    private static FeatureRow row(FeatureTable table, LocalDate date) {
        return table.getRows().stream().filter(r -> r.getDate().equals(date)).findFirst().orElseThrow();
    }
}
