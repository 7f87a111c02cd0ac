package org.carball.overbook.optimizer;

import org.carball.overbook.config.OptimizerConfig;
import org.carball.overbook.model.schedule.TimeSlot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Advisory messages derived from the optimized schedule. Each rule is checked on its own,
 * and messages always come out in rule order.
 */
public class RecommendationGenerator {

    private static final int MORNING_CUTOFF_HOUR = 12;

    static final String MORNING_REMINDER_TIP = "Send morning appointment reminders by 6 PM the day before";

    private final OptimizerConfig config;

    public RecommendationGenerator(OptimizerConfig config) {
        this.config = config;
    }

    public List<String> generate(List<TimeSlot> optimizedSlots, Map<String, Double> noShowProbabilities) {
        List<String> recommendations = new ArrayList<>();

        long highRiskCount = noShowProbabilities.values().stream()
                .filter(p -> p > config.getHighRiskThreshold())
                .count();
        if (highRiskCount > 0) {
            recommendations.add("Send additional reminders to " + highRiskCount + " high-risk patients");
        }

        long emptySlots = optimizedSlots.stream()
                .filter(s -> s.bookings().isEmpty())
                .count();
        if (emptySlots > 0) {
            recommendations.add("Consider opening " + emptySlots + " empty slots for same-day bookings");
        }

        boolean hasMorningSlots = optimizedSlots.stream()
                .anyMatch(s -> s.start().getHour() < MORNING_CUTOFF_HOUR);
        if (hasMorningSlots) {
            recommendations.add(MORNING_REMINDER_TIP);
        }

        return recommendations;
    }
}
