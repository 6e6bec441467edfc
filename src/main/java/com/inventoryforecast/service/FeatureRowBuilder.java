package com.inventoryforecast.service;

import com.inventoryforecast.client.HolidayCalendar;
import com.inventoryforecast.model.FeatureOptions;
import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.WeatherObservation;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the feature row of one day from a daily demand buffer. Used both for
 * historical rows and for the days of a recursive forecast, so the two are
 * computed identically.
 *
 * <p>Only values strictly before day {@code t} feed lags, rolling windows and the
 * price level. Calendar and weather lookups use day {@code t} itself.
 */
public class FeatureRowBuilder {

    private final FeatureOptions options;
    private final List<Integer> lags;
    private final List<Integer> windows;
    private final boolean priceAvailable;
    private final HolidayCalendar holidays;
    private final Map<LocalDate, WeatherObservation> weather;
    private final double hotDayTemperature;
    private final List<String> columns;
    private final int requiredHistory;

    public FeatureRowBuilder(FeatureOptions options, List<Integer> lags, List<Integer> windows,
                             boolean priceAvailable, HolidayCalendar holidays,
                             Map<LocalDate, WeatherObservation> weather, double hotDayTemperature) {
        requirePositive("lag", lags);
        requirePositive("window", windows);
        this.options = options;
        this.lags = List.copyOf(lags);
        this.windows = List.copyOf(windows);
        this.priceAvailable = priceAvailable;
        this.holidays = holidays;
        this.weather = weather;
        this.hotDayTemperature = hotDayTemperature;
        this.columns = resolveColumns();
        int history = 0;
        if (options.isCreateLags() && !lags.isEmpty()) {
            history = Math.max(history, Collections.max(lags));
        }
        if (options.isMovingAverages() && !windows.isEmpty()) {
            history = Math.max(history, Collections.max(windows));
        }
        this.requiredHistory = history;
    }

    private static void requirePositive(String name, List<Integer> values) {
        for (Integer value : values) {
            if (value == null || value < 1) {
                throw new IllegalArgumentException(name + " lengths must be at least 1 day, got " + values);
            }
        }
    }

    public List<String> columns() {
        return columns;
    }

    /** Days of history a row needs before its lags and windows are complete. */
    public int requiredHistory() {
        return requiredHistory;
    }

    /**
     * @param demand daily demand by day index; only indices below {@code t} are read
     * @param priceLevels mean scaled price per day index, null for days without sales
     * @param start date of day index 0
     * @return empty when day {@code t} lacks the history its features need
     */
    public Optional<FeatureRow> build(double[] demand, Double[] priceLevels, LocalDate start, int t, double target) {
        if (t < requiredHistory) {
            return Optional.empty();
        }
        LocalDate date = start.plusDays(t);
        Map<String, Double> features = new LinkedHashMap<>();

        if (options.isCreateLags()) {
            for (int lag : lags) {
                features.put("demand_lag_" + lag, demand[t - lag]);
            }
        }
        if (options.isMovingAverages()) {
            for (int window : windows) {
                features.put("demand_ma_" + window, new Mean().evaluate(demand, t - window, window));
                features.put("demand_std_" + window, new StandardDeviation().evaluate(demand, t - window, window));
            }
        }
        if (options.isDateFeatures()) {
            int dow = date.getDayOfWeek().getValue();
            int month = date.getMonthValue();
            features.put("day_of_week", (double) dow);
            features.put("day_of_month", (double) date.getDayOfMonth());
            features.put("month", (double) month);
            features.put("quarter", (double) ((month - 1) / 3 + 1));
            features.put("is_weekend", flag(date.getDayOfWeek() == DayOfWeek.SATURDAY
                || date.getDayOfWeek() == DayOfWeek.SUNDAY));
            features.put("is_month_start", flag(date.getDayOfMonth() == 1));
            features.put("is_month_end", flag(date.getDayOfMonth() == date.lengthOfMonth()));
            features.put("month_sin", Math.sin(2 * Math.PI * month / 12));
            features.put("month_cos", Math.cos(2 * Math.PI * month / 12));
            features.put("dow_sin", Math.sin(2 * Math.PI * dow / 7));
            features.put("dow_cos", Math.cos(2 * Math.PI * dow / 7));
        }
        if (options.isHolidayFeatures()) {
            features.put("is_holiday", flag(holidays.isHoliday(date)));
            features.put("is_pre_holiday", flag(holidays.isHoliday(date.plusDays(1))));
            features.put("is_post_holiday", flag(holidays.isHoliday(date.minusDays(1))));
            features.put("holiday_known", flag(holidays.covers(date)));
        } else if (options.isDateFeatures()) {
            features.put("is_holiday", flag(holidays.isHoliday(date)));
        }
        if (options.isWeatherFeatures()) {
            WeatherObservation observation = weather.get(date);
            double temperature = observation != null ? observation.getTemperature() : 0.0;
            double precipitation = observation != null ? observation.getPrecipitation() : 0.0;
            features.put("temperature", temperature);
            features.put("precipitation", precipitation);
            features.put("is_hot_day", flag(temperature > hotDayTemperature));
            features.put("is_rainy_day", flag(precipitation > 0));
            features.put("weather_present", flag(observation != null));
        }
        if (priceAvailable) {
            Double level = lastPriceBefore(priceLevels, t);
            if (level == null) {
                return Optional.empty();
            }
            features.put("price_level", level);
        }
        if (options.isTrendFeatures()) {
            features.put("trend", (double) t);
            features.put("trend_squared", (double) t * t);
        }

        return Optional.of(FeatureRow.builder()
            .date(date)
            .dayIndex(t)
            .target(target)
            .features(Collections.unmodifiableMap(features))
            .build());
    }

    private List<String> resolveColumns() {
        List<String> cols = new ArrayList<>();
        if (options.isCreateLags()) {
            lags.forEach(lag -> cols.add("demand_lag_" + lag));
        }
        if (options.isMovingAverages()) {
            windows.forEach(w -> {
                cols.add("demand_ma_" + w);
                cols.add("demand_std_" + w);
            });
        }
        if (options.isDateFeatures()) {
            cols.addAll(List.of("day_of_week", "day_of_month", "month", "quarter", "is_weekend",
                "is_month_start", "is_month_end", "month_sin", "month_cos", "dow_sin", "dow_cos"));
        }
        if (options.isHolidayFeatures()) {
            cols.addAll(List.of("is_holiday", "is_pre_holiday", "is_post_holiday", "holiday_known"));
        } else if (options.isDateFeatures()) {
            cols.add("is_holiday");
        }
        if (options.isWeatherFeatures()) {
            cols.addAll(List.of("temperature", "precipitation", "is_hot_day", "is_rainy_day", "weather_present"));
        }
        if (priceAvailable) {
            cols.add("price_level");
        }
        if (options.isTrendFeatures()) {
            cols.addAll(List.of("trend", "trend_squared"));
        }
        return List.copyOf(cols);
    }

    private static Double lastPriceBefore(Double[] priceLevels, int t) {
        for (int i = Math.min(t, priceLevels.length) - 1; i >= 0; i--) {
            if (priceLevels[i] != null) {
                return priceLevels[i];
            }
        }
        return null;
    }

    private static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
