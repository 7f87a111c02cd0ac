package org.carball.overbook.optimizer;

import lombok.extern.slf4j.Slf4j;
import org.carball.overbook.config.OptimizerConfig;
import org.carball.overbook.model.schedule.Booking;
import org.carball.overbook.model.schedule.TimeSlot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decides per-slot overbooking from expected no-shows. Slots are treated independently:
 * the overbook cap is a fraction of each slot's own bookings, with no practice-wide budget.
 */
@Slf4j
public class CapacityOptimizer {

    private static final int EARLY_HOUR_LIMIT = 10;
    private static final int LATE_HOUR_LIMIT = 16;
    private static final double EDGE_HOUR_DAMPING = 0.7;

    private final OptimizerConfig config;

    public CapacityOptimizer(OptimizerConfig config) {
        this.config = config;
    }

    /**
     * Returns a new slot list of the same size and order; slots are never modified in place.
     */
    public List<TimeSlot> optimize(List<TimeSlot> slots, Map<String, Double> noShowProbabilities) {
        List<TimeSlot> optimized = new ArrayList<>(slots.size());

        for (TimeSlot slot : slots) {
            double expectedNoShows = expectedNoShows(slot, noShowProbabilities);

            if (expectedNoShows < config.getMinNoShowThreshold()) {
                optimized.add(slot);
                continue;
            }

            int overbookCount = calculateOverbookCount(slot, expectedNoShows);
            log.debug("Slot {} ({}): expected no-shows {}, overbook {}",
                    slot.start(), slot.providerId(), expectedNoShows, overbookCount);

            optimized.add(overbookCount > 0 ? slot.withCapacity(slot.capacity() + overbookCount) : slot);
        }

        return optimized;
    }

    public double expectedNoShows(TimeSlot slot, Map<String, Double> noShowProbabilities) {
        double expected = 0.0;
        for (Booking booking : slot.bookings()) {
            expected += noShowProbabilities.getOrDefault(booking.id(), config.getDefaultNoShowProbability());
        }
        return expected;
    }

    int calculateOverbookCount(TimeSlot slot, double expectedNoShows) {
        int baseOverbook = (int) Math.floor(expectedNoShows * config.getStrategy().getOverbookFactor());
        int maxOverbook = (int) Math.floor(slot.bookingCount() * config.getMaxOverbookPct());

        int hour = slot.start().getHour();
        if (hour < EARLY_HOUR_LIMIT || hour > LATE_HOUR_LIMIT) {
            baseOverbook = (int) Math.floor(baseOverbook * EDGE_HOUR_DAMPING);
        }

        return Math.max(0, Math.min(baseOverbook, maxOverbook));
    }
}
