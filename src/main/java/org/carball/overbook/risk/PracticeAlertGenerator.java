package org.carball.overbook.risk;

import org.carball.overbook.config.OptimizerConfig;
import org.carball.overbook.model.risk.PracticeAlert;
import org.carball.overbook.model.schedule.Booking;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Day-level alerts for a practice, computed from bookings and their no-show probabilities
 * without building a schedule.
 */
public class PracticeAlertGenerator {

    static final double OPTIMIZATION_OPPORTUNITY_THRESHOLD = 0.15;
    static final int TYPICAL_DAILY_CAPACITY = 20;

    private final OptimizerConfig config;

    public PracticeAlertGenerator(OptimizerConfig config) {
        this.config = config;
    }

    public List<PracticeAlert> generate(List<Booking> bookings, Map<String, Double> noShowProbabilities) {
        List<PracticeAlert> alerts = new ArrayList<>();

        long highRiskCount = bookings.stream()
                .filter(b -> probabilityOf(b, noShowProbabilities) > config.getHighRiskThreshold())
                .count();
        if (highRiskCount > 0) {
            alerts.add(new PracticeAlert("high_risk_alert", "high",
                    highRiskCount + " appointments have high no-show risk",
                    "Send additional reminders or consider overbooking"));
        }

        int total = bookings.size();
        if (total > 0) {
            double average = bookings.stream()
                    .mapToDouble(b -> probabilityOf(b, noShowProbabilities))
                    .sum() / total;
            if (average > OPTIMIZATION_OPPORTUNITY_THRESHOLD) {
                alerts.add(new PracticeAlert("optimization_opportunity", "medium",
                        String.format(Locale.ROOT, "Average no-show probability is %.1f%%", average * 100),
                        "Consider running schedule optimization"));
            }
        }

        if (total < TYPICAL_DAILY_CAPACITY) {
            alerts.add(new PracticeAlert("capacity_alert", "low",
                    "Only " + total + " appointments scheduled",
                    "Open slots for same-day bookings or promote availability"));
        }

        return alerts;
    }

    private double probabilityOf(Booking booking, Map<String, Double> noShowProbabilities) {
        return noShowProbabilities.getOrDefault(booking.id(), config.getDefaultNoShowProbability());
    }
}
