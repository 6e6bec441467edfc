package com.inventoryforecast.service;

import com.inventoryforecast.config.PipelineProperties;
import com.inventoryforecast.exception.InsufficientDataException;
import com.inventoryforecast.exception.ValidationException;
import com.inventoryforecast.model.AbcClass;
import com.inventoryforecast.model.AbcItem;
import com.inventoryforecast.model.AbcSummary;
import com.inventoryforecast.model.CleanedRow;
import com.inventoryforecast.model.CleanedTable;
import com.inventoryforecast.model.DailyDemand;
import com.inventoryforecast.model.Forecast;
import com.inventoryforecast.model.ForecastPoint;
import com.inventoryforecast.model.InsightParameters;
import com.inventoryforecast.model.InsightSet;
import com.inventoryforecast.model.InventoryPolicy;
import com.inventoryforecast.model.PipelineStage;
import com.inventoryforecast.model.PriorityTier;
import com.inventoryforecast.model.Recommendation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class InsightService {

    private static final int TREND_WEEK = 7;

    private final PipelineProperties properties;

    public InsightSet generate(Forecast forecast, List<DailyDemand> history, CleanedTable cleaned,
                               InsightParameters params) {
        validate(params);
        if (history.size() < params.leadTimeDays()) {
            throw new InsufficientDataException(PipelineStage.INSIGHTS, "History covers " + history.size()
                + " days, fewer than the lead time of " + params.leadTimeDays() + " days");
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        history.forEach(d -> stats.addValue(d.demand()));
        double mean = stats.getMean();
        double std = stats.getN() > 1 ? stats.getStandardDeviation() : 0.0;

        InventoryPolicy policy = policy(mean, std, params);
        List<AbcItem> abc = classify(cleaned);
        List<AbcSummary> abcSummary = summarize(abc);
        double trend = trendPercent(forecast.getPoints());
        double cv = mean > 0 ? std / mean : 0.0;
        PriorityTier volatility = volatility(cv);

        List<Recommendation> recommendations = recommend(forecast, mean, policy, trend, volatility, abcSummary);
        Map<PriorityTier, Integer> tierCounts = new EnumMap<>(PriorityTier.class);
        for (PriorityTier tier : PriorityTier.values()) {
            tierCounts.put(tier, (int) recommendations.stream().filter(r -> r.getPriority() == tier).count());
        }

        log.info("Insights generated | kind={} | avgDaily={} | reorderPoint={} | eoq={} | recommendations={}",
                 forecast.getModelKind(), round(mean), round(policy.getReorderPoint()),
                 policy.getEconomicOrderQuantity(), recommendations.size());

        return InsightSet.builder()
            .modelKind(forecast.getModelKind())
            .abcClassification(abc)
            .abcSummary(abcSummary)
            .policy(policy)
            .demandTrendPercent(round(trend))
            .coefficientOfVariation(round(cv))
            .volatility(volatility)
            .recommendations(recommendations)
            .tierCounts(tierCounts)
            .fingerprint(Fingerprints.of(forecast.getFingerprint(), cleaned.getFingerprint(), params))
            .generatedAt(Instant.now())
            .build();
    }

    private void validate(InsightParameters params) {
        if (params.leadTimeDays() < 1) {
            throw new ValidationException(PipelineStage.INSIGHTS, "leadTimeDays must be >= 1");
        }
        if (!(params.serviceLevel() > 0.0 && params.serviceLevel() < 1.0)) {
            throw new ValidationException(PipelineStage.INSIGHTS, "serviceLevel must lie strictly between 0 and 1");
        }
        if (params.orderCost() < 0) {
            throw new ValidationException(PipelineStage.INSIGHTS, "orderCost must be >= 0");
        }
        if (params.holdingCost() <= 0) {
            throw new ValidationException(PipelineStage.INSIGHTS, "holdingCost must be > 0");
        }
    }

    private InventoryPolicy policy(double mean, double std, InsightParameters params) {
        double z = InventoryPolicyCalculator.serviceLevelZ(params.serviceLevel());
        double safetyStock = InventoryPolicyCalculator.safetyStock(z, std, params.leadTimeDays());
        double reorderPoint = InventoryPolicyCalculator.reorderPoint(mean, params.leadTimeDays(), safetyStock);
        double annualDemand = mean * InventoryPolicyCalculator.DAYS_PER_YEAR;
        long eoq = InventoryPolicyCalculator.economicOrderQuantity(annualDemand, params.orderCost(), params.holdingCost());
        double ordersPerYear = eoq > 0 ? annualDemand / eoq : 0.0;
        double holding = eoq / 2.0 * params.holdingCost();
        double ordering = ordersPerYear * params.orderCost();
        return InventoryPolicy.builder()
            .averageDailyDemand(round(mean))
            .demandStd(round(std))
            .leadTimeDays(params.leadTimeDays())
            .serviceLevel(params.serviceLevel())
            .zScore(round(z))
            .safetyStock(round(safetyStock))
            .reorderPoint(round(reorderPoint))
            .annualDemand(round(annualDemand))
            .economicOrderQuantity(eoq)
            .ordersPerYear(round(ordersPerYear))
            .daysBetweenOrders(ordersPerYear > 0 ? round(InventoryPolicyCalculator.DAYS_PER_YEAR / ordersPerYear) : 0.0)
            .annualHoldingCost(round(holding))
            .annualOrderingCost(round(ordering))
            .totalInventoryCost(round(holding + ordering))
            .build();
    }

    /**
     * Products sorted by demand value; a product is A while the share of value
     * ranked above it is below the A share, B while below A plus B, else C.
     */
    List<AbcItem> classify(CleanedTable cleaned) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (CleanedRow row : cleaned.getRows()) {
            double price = row.getUnitPrice() != null ? row.getUnitPrice() : 1.0;
            values.merge(row.getProductId(), row.getQuantity() * price, Double::sum);
        }
        double total = values.values().stream().mapToDouble(Double::doubleValue).sum();
        double aShare = properties.getInsights().getClassAShare();
        double abShare = aShare + properties.getInsights().getClassBShare();

        List<Map.Entry<String, Double>> sorted = values.entrySet().stream()
            .sorted(Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.<String, Double>comparingByKey()))
            .toList();
        List<AbcItem> items = new ArrayList<>(sorted.size());
        double preceding = 0.0;
        for (Map.Entry<String, Double> entry : sorted) {
            double share = total > 0 ? entry.getValue() / total : 0.0;
            AbcClass abcClass = preceding < aShare ? AbcClass.A : preceding < abShare ? AbcClass.B : AbcClass.C;
            preceding += share;
            items.add(AbcItem.builder()
                .productId(entry.getKey())
                .demandValue(round(entry.getValue()))
                .share(round(share))
                .cumulativeShare(round(preceding))
                .abcClass(abcClass)
                .build());
        }
        return List.copyOf(items);
    }

    private static List<AbcSummary> summarize(List<AbcItem> items) {
        List<AbcSummary> summary = new ArrayList<>();
        for (AbcClass abcClass : AbcClass.values()) {
            List<AbcItem> inClass = items.stream().filter(i -> i.getAbcClass() == abcClass).toList();
            double share = inClass.stream().mapToDouble(AbcItem::getShare).sum();
            summary.add(new AbcSummary(abcClass, inClass.size(), round(share)));
        }
        return List.copyOf(summary);
    }

    /** Percent change of the mean of the last forecast week against the first. */
    static double trendPercent(List<ForecastPoint> points) {
        if (points.isEmpty()) {
            return 0.0;
        }
        int week = Math.min(TREND_WEEK, points.size());
        double first = points.subList(0, week).stream().mapToDouble(ForecastPoint::point).average().orElse(0);
        double last = points.subList(points.size() - week, points.size()).stream()
            .mapToDouble(ForecastPoint::point).average().orElse(0);
        return first > 0 ? (last - first) / first * 100.0 : 0.0;
    }

    private PriorityTier volatility(double cv) {
        PipelineProperties.Insights cfg = properties.getInsights();
        if (cv > cfg.getHighVolatilityCv()) {
            return PriorityTier.HIGH;
        }
        return cv > cfg.getMediumVolatilityCv() ? PriorityTier.MEDIUM : PriorityTier.LOW;
    }

    private List<Recommendation> recommend(Forecast forecast, double mean, InventoryPolicy policy, double trend,
                                           PriorityTier volatility, List<AbcSummary> abcSummary) {
        PipelineProperties.Insights cfg = properties.getInsights();
        List<Recommendation> list = new ArrayList<>();

        double peak = forecast.getSummary().getPeak();
        if (peak > cfg.getPeakMultiplier() * mean) {
            list.add(rec(PriorityTier.HIGH, "restock", "Stock Up Before Peak Demand",
                String.format(Locale.ROOT, "Forecast peaks at %.0f units on %s, above %.1fx the historical daily average of %.1f",
                    peak, forecast.getSummary().getPeakDate(), cfg.getPeakMultiplier(), mean),
                "Increase inventory ahead of " + forecast.getSummary().getPeakDate(),
                "Avoid stockouts during the demand peak"));
        }
        list.add(rec(PriorityTier.HIGH, "reorder", "Set Reorder Point",
            String.format(Locale.ROOT, "Configure reorder alert at %.0f units to prevent stockouts", policy.getReorderPoint()),
            "Update inventory management system with new reorder point",
            String.format(Locale.ROOT, "Cover lead-time demand at a %.0f%% service level", policy.getServiceLevel() * 100)));

        double threshold = cfg.getTrendThresholdPercent();
        if (trend > threshold) {
            list.add(rec(PriorityTier.HIGH, "trend", "Prepare for Increased Demand",
                String.format(Locale.ROOT, "Demand is trending upward by %.1f%% across the forecast horizon", trend),
                "Increase inventory levels and secure additional supplier capacity",
                "Meet growing demand without stockouts"));
        } else if (trend < -threshold) {
            list.add(rec(PriorityTier.MEDIUM, "trend", "Reduce Inventory for Declining Demand",
                String.format(Locale.ROOT, "Demand is trending downward by %.1f%% across the forecast horizon", -trend),
                "Lower order quantities and run down excess stock",
                "Reduce holding costs and obsolescence risk"));
        } else {
            list.add(rec(PriorityTier.LOW, "trend", "Maintain Current Stock Levels",
                String.format(Locale.ROOT, "Demand is stable (%.1f%% change across the forecast horizon)", trend),
                "Keep the current replenishment cadence",
                "Steady service level at current cost"));
        }

        switch (volatility) {
            case HIGH -> list.add(rec(PriorityTier.HIGH, "volatility", "Manage High Volatility",
                "Demand volatility is high - implement demand buffering strategies",
                "Increase safety stock and improve forecast accuracy with more data",
                "Reduce stockout risk during demand spikes"));
            case MEDIUM -> list.add(rec(PriorityTier.MEDIUM, "volatility", "Monitor Demand Variability",
                "Demand shows moderate variability",
                "Review safety stock monthly against realised demand",
                "Balance stockout risk and holding cost"));
            case LOW -> list.add(rec(PriorityTier.LOW, "volatility", "Demand Is Predictable",
                "Demand variability is low",
                "Consider leaner safety stock",
                "Lower holding cost without hurting service level"));
        }

        list.add(rec(PriorityTier.MEDIUM, "safety-stock", "Maintain Safety Stock",
            String.format(Locale.ROOT, "Keep %.0f units as safety stock to handle demand variability", policy.getSafetyStock()),
            "Allocate warehouse space for safety stock",
            "Handle unexpected demand spikes"));
        list.add(rec(PriorityTier.MEDIUM, "order-quantity", "Optimize Order Quantity",
            String.format(Locale.ROOT, "Use economic order quantity of %d units to minimize costs", policy.getEconomicOrderQuantity()),
            "Update ordering policies with calculated EOQ",
            String.format(Locale.ROOT, "Annual inventory cost of about %.2f", policy.getTotalInventoryCost())));

        int aCount = abcSummary.stream().filter(s -> s.abcClass() == AbcClass.A).mapToInt(AbcSummary::productCount).sum();
        if (aCount > 0) {
            list.add(rec(PriorityTier.MEDIUM, "abc", "Prioritize A-Class Products",
                String.format(Locale.ROOT, "%d products account for the bulk of demand value", aCount),
                "Review A-category items weekly, B-category bi-weekly, C-category monthly",
                "Optimize inventory management resources"));
        }

        // stable: insertion order is kept within a tier
        return list.stream().sorted(Comparator.comparing(Recommendation::getPriority)).toList();
    }

    private static Recommendation rec(PriorityTier tier, String category, String title, String description,
                                      String action, String impact) {
        return Recommendation.builder()
            .priority(tier)
            .category(category)
            .title(title)
            .description(description)
            .action(action)
            .expectedImpact(impact)
            .build();
    }

    private static double round(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
