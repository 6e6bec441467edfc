package com.inventoryforecast.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the forecasting pipeline, bound from {@code pipeline.*}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private Preprocessing preprocessing = new Preprocessing();

    @Valid
    private Features features = new Features();

    private Training training = new Training();

    private ForecastConfig forecast = new ForecastConfig();

    private Insights insights = new Insights();

    private Holidays holidays = new Holidays();

    private Alerts alerts = new Alerts();

    @Data
    public static class Preprocessing {
        /** Fewer rows than this after cleaning is a validation failure. */
        private int minRows = 10;
        private double iqrMultiplier = 1.5;
    }

    @Data
    public static class Features {
        private List<@NotNull @Min(1) Integer> lags = new ArrayList<>(List.of(1, 7, 14));
        private List<@NotNull @Min(1) Integer> windows = new ArrayList<>(List.of(7, 14, 30));
        private double hotDayTemperature = 25.0;
    }

    @Data
    public static class Training {
        private double defaultTestFraction = 0.2;
        private int minTrainRows = 20;
        private int randomSeed = 42;
        private int forestTrees = 100;
        private int forestMaxDepth = 15;
        private int boostingIterations = 100;
        private double boostingShrinkage = 0.1;
        private int boostingMaxDepth = 5;
    }

    @Data
    public static class ForecastConfig {
        private double confidenceLevel = 0.95;
        private int maxHorizonDays = 365;
    }

    @Data
    public static class Insights {
        /** Cumulative value share covered by class A. */
        private double classAShare = 0.80;
        /** Additional cumulative share covered by class B. */
        private double classBShare = 0.15;
        private double peakMultiplier = 1.5;
        private double trendThresholdPercent = 10.0;
        private double highVolatilityCv = 0.5;
        private double mediumVolatilityCv = 0.3;
    }

    @Data
    public static class Holidays {
        /** {@code static} or {@code remote}. */
        private String provider = "static";
        private String countryCode = "US";
    }

    @Data
    public static class Alerts {
        private double criticalDemand = 50;
        private double lowDemand = 100;
        private double spikeDemand = 500;
        /** Default look-back of the alert history, in days. */
        private int historyDays = 30;
        /** Batches kept per session; older ones are dropped first. */
        private int historyLimit = 100;
    }
}
