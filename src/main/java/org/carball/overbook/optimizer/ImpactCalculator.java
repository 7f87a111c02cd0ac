package org.carball.overbook.optimizer;

import org.carball.overbook.config.OptimizerConfig;
import org.carball.overbook.model.optimization.SlotImpact;
import org.carball.overbook.model.schedule.TimeSlot;

import java.util.List;

public class ImpactCalculator {

    private static final double UTILIZATION_WEIGHT = 0.6;
    private static final double BALANCE_WEIGHT = 0.4;

    private final OptimizerConfig config;

    public ImpactCalculator(OptimizerConfig config) {
        this.config = config;
    }

    public SlotImpact assess(List<TimeSlot> original, List<TimeSlot> optimized) {
        return new SlotImpact(
                calculateRevenueImpact(original, optimized),
                calculateOptimizationScore(optimized));
    }

    /**
     * Added capacity across all slots, valued at the average booking value and discounted by fill rate.
     */
    public double calculateRevenueImpact(List<TimeSlot> original, List<TimeSlot> optimized) {
        int originalCapacity = original.stream().mapToInt(TimeSlot::capacity).sum();
        int optimizedCapacity = optimized.stream().mapToInt(TimeSlot::capacity).sum();
        int additionalSlots = optimizedCapacity - originalCapacity;

        double revenueGain = additionalSlots * config.getAvgBookingValue() * config.getFillRate();
        return Math.max(0.0, revenueGain);
    }

    /**
     * Mean of per-slot scores weighing utilization against how far capacity exceeds one.
     * Returns 0.0 when there are no slots.
     */
    public double calculateOptimizationScore(List<TimeSlot> optimized) {
        if (optimized.isEmpty()) {
            return 0.0;
        }

        double total = 0.0;
        for (TimeSlot slot : optimized) {
            total += scoreSlot(slot);
        }
        return total / optimized.size();
    }

    double scoreSlot(TimeSlot slot) {
        int bookings = slot.bookingCount();

        double utilization = Math.min((double) bookings / Math.max(slot.capacity(), 1), 1.0);

        double overbookRatio = (double) (slot.capacity() - 1) / Math.max(bookings, 1);
        double balance = 1.0 - Math.min(overbookRatio, 1.0);

        return utilization * UTILIZATION_WEIGHT + balance * BALANCE_WEIGHT;
    }
}
