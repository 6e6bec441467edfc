package com.inventoryforecast.service;

import com.inventoryforecast.client.HolidayCalendar;
import com.inventoryforecast.config.PipelineProperties;
import com.inventoryforecast.exception.ValidationException;
import com.inventoryforecast.model.CleanedRow;
import com.inventoryforecast.model.CleanedTable;
import com.inventoryforecast.model.DailyDemand;
import com.inventoryforecast.model.FeatureOptions;
import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.FeatureTable;
import com.inventoryforecast.model.PipelineStage;
import com.inventoryforecast.model.WeatherObservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureEngineeringService {

    private final PipelineProperties properties;
    private final HolidayCalendar holidayCalendar;

    public FeatureTable engineer(CleanedTable cleaned, FeatureOptions options, List<WeatherObservation> weather) {
        FeatureOptions opts = options != null ? options : FeatureOptions.defaults();
        List<DailyDemand> history = aggregateDaily(cleaned);
        FeatureRowBuilder builder = rowBuilder(opts, cleaned.isPriceAvailable(), weather);
        if (builder.columns().isEmpty()) {
            throw new ValidationException(PipelineStage.FEATURE_ENGINEERING, "Feature options select no feature columns");
        }

        double[] demand = history.stream().mapToDouble(DailyDemand::demand).toArray();
        Double[] prices = history.stream().map(DailyDemand::priceLevel).toArray(Double[]::new);
        LocalDate start = history.get(0).date();

        List<FeatureRow> rows = new ArrayList<>();
        int dropped = 0;
        for (int t = 0; t < demand.length; t++) {
            Optional<FeatureRow> row = builder.build(demand, prices, start, t, demand[t]);
            if (row.isPresent()) {
                rows.add(row.get());
            } else {
                dropped++;
            }
        }
        if (rows.isEmpty()) {
            throw new ValidationException(PipelineStage.FEATURE_ENGINEERING,
                "No rows have enough history for the requested features: the series spans "
                    + demand.length + " days and " + builder.requiredHistory() + " are required before the first row");
        }

        log.info("Feature engineering complete | days={} | rows={} | dropped={} | columns={}",
                 demand.length, rows.size(), dropped, builder.columns().size());

        List<Integer> lags = List.copyOf(properties.getFeatures().getLags());
        List<Integer> windows = List.copyOf(properties.getFeatures().getWindows());
        return FeatureTable.builder()
            .rows(List.copyOf(rows))
            .columns(builder.columns())
            .history(history)
            .options(opts)
            .lags(lags)
            .windows(windows)
            .droppedRowCount(dropped)
            .sourceFingerprint(cleaned.getFingerprint())
            .fingerprint(Fingerprints.of(cleaned.getFingerprint(), opts, lags, windows, rows))
            .createdAt(Instant.now())
            .build();
    }

    /** A row builder configured exactly as the one that produced {@code table}. */
    public FeatureRowBuilder rowBuilderFor(FeatureTable table, boolean priceAvailable, List<WeatherObservation> weather) {
        return new FeatureRowBuilder(table.getOptions(), table.getLags(), table.getWindows(), priceAvailable,
            holidayCalendar, weatherByDate(table.getOptions(), weather), properties.getFeatures().getHotDayTemperature());
    }

    private FeatureRowBuilder rowBuilder(FeatureOptions opts, boolean priceAvailable, List<WeatherObservation> weather) {
        return new FeatureRowBuilder(opts, properties.getFeatures().getLags(), properties.getFeatures().getWindows(),
            priceAvailable, holidayCalendar, weatherByDate(opts, weather), properties.getFeatures().getHotDayTemperature());
    }

    /**
     * Sums quantity per calendar day between the first and last date. Days
     * without transactions are days of zero sales.
     */
    static List<DailyDemand> aggregateDaily(CleanedTable cleaned) {
        Map<LocalDate, double[]> byDay = new HashMap<>();
        LocalDate first = null;
        LocalDate last = null;
        for (CleanedRow row : cleaned.getRows()) {
            // [quantity sum, price sum, price count]
            double[] acc = byDay.computeIfAbsent(row.getDate(), d -> new double[3]);
            acc[0] += row.getQuantity();
            if (row.getScaledUnitPrice() != null) {
                acc[1] += row.getScaledUnitPrice();
                acc[2]++;
            }
            first = first == null || row.getDate().isBefore(first) ? row.getDate() : first;
            last = last == null || row.getDate().isAfter(last) ? row.getDate() : last;
        }
        long days = ChronoUnit.DAYS.between(first, last) + 1;
        List<DailyDemand> series = new ArrayList<>((int) days);
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            double[] acc = byDay.get(day);
            if (acc == null) {
                series.add(new DailyDemand(day, 0.0, null));
            } else {
                series.add(new DailyDemand(day, acc[0], acc[2] > 0 ? acc[1] / acc[2] : null));
            }
        }
        return List.copyOf(series);
    }

    private static Map<LocalDate, WeatherObservation> weatherByDate(FeatureOptions opts, List<WeatherObservation> weather) {
        Map<LocalDate, WeatherObservation> byDate = new HashMap<>();
        if (opts.isWeatherFeatures() && weather != null) {
            // later observations for the same date win
            weather.forEach(w -> byDate.put(w.getDate(), w));
        }
        return byDate;
    }
}
