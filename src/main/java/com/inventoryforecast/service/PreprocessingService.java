package com.inventoryforecast.service;

import com.inventoryforecast.config.PipelineProperties;
import com.inventoryforecast.exception.ValidationException;
import com.inventoryforecast.model.CleanedRow;
import com.inventoryforecast.model.CleanedTable;
import com.inventoryforecast.model.PipelineStage;
import com.inventoryforecast.model.PreprocessingOptions;
import com.inventoryforecast.model.RawRecord;
import com.inventoryforecast.model.ScalingParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw uploaded records into a cleaned, encoded and scaled table.
 * Pure: the same records and options always give an equal table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PreprocessingService {

    static final String UNKNOWN = "unknown";
    static final String PRODUCT = "productId";
    static final String STORE = "store";
    static final String SEGMENT = "customerSegment";
    static final String UNIT_PRICE = "unitPrice";

    private final PipelineProperties properties;

    public CleanedTable clean(List<RawRecord> raw, PreprocessingOptions options) {
        PreprocessingOptions opts = options != null ? options : PreprocessingOptions.defaults();
        if (raw == null || raw.stream().allMatch(r -> r.getDate() == null)) {
            throw new ValidationException(PipelineStage.PREPROCESSING, "Required column 'date' is absent from the dataset");
        }
        if (raw.stream().allMatch(r -> r.getQuantity() == null)) {
            throw new ValidationException(PipelineStage.PREPROCESSING, "Required column 'quantity' is absent from the dataset");
        }
        boolean priceAvailable = raw.stream().anyMatch(r -> r.getUnitPrice() != null);

        List<WorkingRow> rows = new ArrayList<>(raw.size());
        int imputed = 0;
        int droppedMissing = 0;

        if (opts.isHandleMissing()) {
            double quantityMedian = median(raw.stream().map(RawRecord::getQuantity).filter(Objects::nonNull).toList());
            Double priceMedian = priceAvailable
                ? median(raw.stream().map(RawRecord::getUnitPrice).filter(Objects::nonNull).toList())
                : null;
            LocalDate lastDate = null;
            for (RawRecord record : raw) {
                LocalDate date = record.getDate();
                if (date == null) {
                    if (lastDate == null) {
                        droppedMissing++;
                        continue;
                    }
                    date = lastDate;
                    imputed++;
                }
                lastDate = date;
                Double quantity = record.getQuantity();
                if (quantity == null) {
                    quantity = quantityMedian;
                    imputed++;
                }
                Double price = record.getUnitPrice();
                if (priceAvailable && price == null) {
                    price = priceMedian;
                    imputed++;
                }
                rows.add(new WorkingRow(date, category(record.getProductId()), category(record.getStore()),
                    category(record.getCustomerSegment()), quantity, price));
            }
        } else {
            for (RawRecord record : raw) {
                if (record.getDate() == null || record.getQuantity() == null
                        || (priceAvailable && record.getUnitPrice() == null)) {
                    droppedMissing++;
                    continue;
                }
                rows.add(new WorkingRow(record.getDate(), category(record.getProductId()), category(record.getStore()),
                    category(record.getCustomerSegment()), record.getQuantity(), record.getUnitPrice()));
            }
        }

        // List.sort is stable, rows sharing a date keep upload order
        rows.sort(Comparator.comparing(WorkingRow::date));

        int droppedOutliers = 0;
        Double lowerFence = null;
        Double upperFence = null;
        if (opts.isRemoveOutliers() && !rows.isEmpty()) {
            double[] quantities = rows.stream().mapToDouble(WorkingRow::quantity).toArray();
            Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
            percentile.setData(quantities);
            double q1 = percentile.evaluate(25);
            double q3 = percentile.evaluate(75);
            double iqr = q3 - q1;
            double multiplier = properties.getPreprocessing().getIqrMultiplier();
            double lower = q1 - multiplier * iqr;
            double upper = q3 + multiplier * iqr;
            int before = rows.size();
            rows.removeIf(r -> r.quantity() < lower || r.quantity() > upper);
            droppedOutliers = before - rows.size();
            lowerFence = lower;
            upperFence = upper;
        }

        int minRows = properties.getPreprocessing().getMinRows();
        if (rows.size() < minRows) {
            throw new ValidationException(PipelineStage.PREPROCESSING,
                "Only " + rows.size() + " rows remain after cleaning, at least " + minRows + " are required");
        }

        Map<String, Map<String, Integer>> encodings = new LinkedHashMap<>();
        if (opts.isEncodeCategorical()) {
            encodings.put(PRODUCT, encode(rows.stream().map(WorkingRow::product).toList()));
            encodings.put(STORE, encode(rows.stream().map(WorkingRow::store).toList()));
            encodings.put(SEGMENT, encode(rows.stream().map(WorkingRow::segment).toList()));
        }

        Map<String, ScalingParameters> scaling = new LinkedHashMap<>();
        ScalingParameters priceScaling = null;
        if (opts.isScaleFeatures() && priceAvailable) {
            double[] prices = rows.stream().mapToDouble(WorkingRow::price).toArray();
            double mean = new Mean().evaluate(prices);
            double std = new StandardDeviation(false).evaluate(prices);
            priceScaling = new ScalingParameters(mean, std > 0 ? std : 1.0);
            scaling.put(UNIT_PRICE, priceScaling);
        }

        List<CleanedRow> cleaned = new ArrayList<>(rows.size());
        for (WorkingRow row : rows) {
            Double scaled = row.price() == null ? null
                : priceScaling != null ? priceScaling.transform(row.price()) : row.price();
            cleaned.add(CleanedRow.builder()
                .date(row.date())
                .productId(row.product())
                .productCode(code(encodings, PRODUCT, row.product()))
                .storeCode(code(encodings, STORE, row.store()))
                .segmentCode(code(encodings, SEGMENT, row.segment()))
                .quantity(row.quantity())
                .unitPrice(row.price())
                .scaledUnitPrice(scaled)
                .build());
        }

        String fingerprint = Fingerprints.of(cleaned, opts, encodings, scaling, lowerFence, upperFence);
        log.info("Preprocessing complete | input={} | output={} | imputed={} | droppedMissing={} | droppedOutliers={}",
                 raw.size(), cleaned.size(), imputed, droppedMissing, droppedOutliers);

        return CleanedTable.builder()
            .rows(List.copyOf(cleaned))
            .options(opts)
            .encodings(encodings)
            .scaling(scaling)
            .inputRowCount(raw.size())
            .imputedValueCount(imputed)
            .droppedMissingCount(droppedMissing)
            .droppedOutlierCount(droppedOutliers)
            .outlierLowerFence(lowerFence)
            .outlierUpperFence(upperFence)
            .priceAvailable(priceAvailable)
            .fingerprint(fingerprint)
            .createdAt(Instant.now())
            .build();
    }

    private static String category(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }

    private static double median(List<Double> values) {
        return new Median().evaluate(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    private static Map<String, Integer> encode(List<String> values) {
        Map<String, Integer> codes = new LinkedHashMap<>();
        for (String value : values) {
            codes.putIfAbsent(value, codes.size());
        }
        return codes;
    }

    private static int code(Map<String, Map<String, Integer>> encodings, String column, String value) {
        Map<String, Integer> codes = encodings.get(column);
        return codes != null ? codes.get(value) : -1;
    }

    private record WorkingRow(LocalDate date, String product, String store, String segment,
                              double quantity, Double price) {
    }
}
