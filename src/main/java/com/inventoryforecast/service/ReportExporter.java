package com.inventoryforecast.service;

import com.inventoryforecast.model.AbcSummary;
import com.inventoryforecast.model.AccuracyBreakdown;
import com.inventoryforecast.model.EvaluationReport;
import com.inventoryforecast.model.EvaluationResult;
import com.inventoryforecast.model.Forecast;
import com.inventoryforecast.model.ForecastPoint;
import com.inventoryforecast.model.InsightSet;
import com.inventoryforecast.model.InventoryPolicy;
import com.inventoryforecast.model.Recommendation;
import com.inventoryforecast.model.ResidualDiagnostics;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/** Renders pipeline results as a flat text report. Pure, no I/O. */
@Component
public class ReportExporter {

    private static final String RULE = "-".repeat(64);
    private static final String NOT_AVAILABLE = "  not available";

    public String render(Forecast forecast, EvaluationReport evaluation, InsightSet insights) {
        Objects.requireNonNull(forecast, "forecast is required");
        StringBuilder out = new StringBuilder();
        out.append("DEMAND FORECAST REPORT\n").append(RULE).append('\n');
        line(out, "Model", forecast.getModelKind());
        line(out, "Horizon (days)", forecast.getHorizonDays());
        line(out, "Confidence level", fmt(forecast.getConfidenceLevel()));
        line(out, "Generated at", forecast.getGeneratedAt());

        section(out, "FORECAST SUMMARY");
        line(out, "Total demand", fmt(forecast.getSummary().getTotal()));
        line(out, "Average daily demand", fmt(forecast.getSummary().getAverageDaily()));
        line(out, "Peak demand", fmt(forecast.getSummary().getPeak()) + " on " + forecast.getSummary().getPeakDate());
        out.append(String.format(Locale.ROOT, "%n  %-12s %12s %12s %12s%n", "date", "forecast", "lower", "upper"));
        for (ForecastPoint p : forecast.getPoints()) {
            out.append(String.format(Locale.ROOT, "  %-12s %12.2f %12.2f %12.2f%n", p.date(), p.point(), p.lower(), p.upper()));
        }

        section(out, "MODEL COMPARISON");
        if (evaluation == null) {
            out.append(NOT_AVAILABLE).append('\n');
        } else {
            out.append(String.format(Locale.ROOT, "  %-4s %-22s %10s %10s %10s %8s%n", "rank", "model", "mae", "rmse", "mape", "r2"));
            int rank = 1;
            for (EvaluationResult r : evaluation.getRanking()) {
                out.append(String.format(Locale.ROOT, "  %-4d %-22s %10.2f %10.2f %10.2f %8.3f%n",
                    rank++, r.getKind(), r.getMae(), r.getRmse(), r.getMape(), r.getR2()));
            }
            line(out, "Best model", evaluation.getBestModel());
            renderDiagnostics(out, evaluation.getResults().get(evaluation.getBestModel()));
            out.append("\n  Guidance:\n");
            for (String advice : evaluation.getGuidance()) {
                out.append("    - ").append(advice).append('\n');
            }
        }

        section(out, "INVENTORY POLICY");
        if (insights == null) {
            out.append(NOT_AVAILABLE).append('\n');
        } else {
            InventoryPolicy policy = insights.getPolicy();
            line(out, "Average daily demand", fmt(policy.getAverageDailyDemand()));
            line(out, "Lead time (days)", policy.getLeadTimeDays());
            line(out, "Service level", fmt(policy.getServiceLevel()));
            line(out, "Safety stock", fmt(policy.getSafetyStock()));
            line(out, "Reorder point", fmt(policy.getReorderPoint()));
            line(out, "Economic order quantity", policy.getEconomicOrderQuantity());
            line(out, "Total annual cost", fmt(policy.getTotalInventoryCost()));
            line(out, "Demand trend (%)", fmt(insights.getDemandTrendPercent()));
            line(out, "Volatility", insights.getVolatility());

            section(out, "ABC CLASSIFICATION");
            for (AbcSummary s : insights.getAbcSummary()) {
                out.append(String.format(Locale.ROOT, "  %s: %d products, %.1f%% of value%n",
                    s.abcClass(), s.productCount(), s.valueShare() * 100));
            }

            section(out, "RECOMMENDATIONS");
            for (Recommendation r : insights.getRecommendations()) {
                out.append(String.format(Locale.ROOT, "  [%s] %s%n      %s%n      action: %s%n",
                    r.getPriority(), r.getTitle(), r.getDescription(), r.getAction()));
            }
        }
        return out.toString();
    }

    private static void renderDiagnostics(StringBuilder out, EvaluationResult best) {
        AccuracyBreakdown accuracy = best.getAccuracy();
        ResidualDiagnostics residuals = best.getResiduals();
        line(out, "Directional accuracy (%)", fmt(accuracy.getDirectionalAccuracy() * 100));
        line(out, "Under-forecast (%)", fmt(accuracy.getUnderForecastPercentage()));
        line(out, "Over-forecast (%)", fmt(accuracy.getOverForecastPercentage()));
        line(out, "Peak accuracy", fmt(accuracy.getPeakAccuracy()));
        line(out, "Residual mean", fmt(residuals.getMean()));
        line(out, "Residual autocorrelation", residuals.getAutocorrelation().stream()
            .map(ReportExporter::fmt)
            .collect(Collectors.joining(" ")));
        line(out, "Heteroscedasticity slope", String.format(Locale.ROOT, "%.4f", residuals.getHeteroscedasticitySlope()));
        line(out, "Residuals white noise", residuals.isWhiteNoise() ? "yes" : "no");
    }

    private static void section(StringBuilder out, String title) {
        out.append('\n').append(title).append('\n').append(RULE).append('\n');
    }

    private static void line(StringBuilder out, String label, Object value) {
        out.append(String.format(Locale.ROOT, "  %-26s %s%n", label + ":", value));
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
