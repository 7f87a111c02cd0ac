package org.carball.overbook.reschedule;

import lombok.extern.slf4j.Slf4j;
import org.carball.overbook.config.OptimizerConfig;
import org.carball.overbook.model.reschedule.PatientPreferences;
import org.carball.overbook.model.reschedule.RescheduleSuggestion;
import org.carball.overbook.model.schedule.Booking;
import org.carball.overbook.model.schedule.TimeSlot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ranks open slots as new times for a cancelled booking by how well they match the
 * patient's preferred hours and days and how empty they are.
 */
@Slf4j
public class RescheduleAdvisor {

    private static final double PREFERRED_HOUR_SCORE = 2.0;
    private static final double PREFERRED_DAY_SCORE = 1.0;
    private static final double AVAILABILITY_WEIGHT = 1.5;
    private static final double CONFIDENCE_SCALE = 5.0;

    private final int topN;

    public RescheduleAdvisor(OptimizerConfig config) {
        this.topN = config.getRescheduleTopN();
    }

    public List<RescheduleSuggestion> suggest(Booking cancelled,
                                              List<TimeSlot> availableSlots,
                                              PatientPreferences preferences) {
        List<ScoredSlot> candidates = new ArrayList<>();

        for (TimeSlot slot : availableSlots) {
            if (slot.hasOpenCapacity()) {
                candidates.add(new ScoredSlot(slot, score(slot, preferences)));
            }
        }

        // List.sort is stable, so equal scores keep slot order
        candidates.sort(Comparator.comparingDouble(ScoredSlot::score).reversed());

        log.debug("Booking {}: {} of {} slots open for rescheduling",
                cancelled.id(), candidates.size(), availableSlots.size());

        return candidates.stream()
                .limit(topN)
                .map(c -> new RescheduleSuggestion(c.slot().start(), c.slot().providerId(), toConfidence(c.score())))
                .collect(Collectors.toList());
    }

    double score(TimeSlot slot, PatientPreferences preferences) {
        double score = 0.0;

        if (preferences.preferredHours().contains(slot.start().getHour())) {
            score += PREFERRED_HOUR_SCORE;
        }

        if (preferences.preferredDays().contains(dayIndex(slot))) {
            score += PREFERRED_DAY_SCORE;
        }

        score += (1.0 - slot.occupancy()) * AVAILABILITY_WEIGHT;
        return score;
    }

    // 0 = Monday
    private static int dayIndex(TimeSlot slot) {
        return slot.start().getDayOfWeek().getValue() - 1;
    }

    static double toConfidence(double score) {
        return Math.max(0.0, Math.min(1.0, score / CONFIDENCE_SCALE));
    }

    private record ScoredSlot(TimeSlot slot, double score) {}
}
