package org.carball.overbook.optimizer;

import lombok.extern.slf4j.Slf4j;
import org.carball.overbook.config.OptimizerConfig;
import org.carball.overbook.model.optimization.OptimizationResult;
import org.carball.overbook.model.optimization.ScheduleChange;
import org.carball.overbook.model.optimization.SlotImpact;
import org.carball.overbook.model.schedule.Booking;
import org.carball.overbook.model.schedule.ProviderCalendar;
import org.carball.overbook.model.schedule.SlotLayout;
import org.carball.overbook.model.schedule.TimeSlot;
import org.carball.overbook.schedule.SlotBuilder;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Runs one day's optimization: build slots, size their capacity, then diff, score and advise.
 * Holds no per-run state, so one instance can serve concurrent calls.
 */
@Slf4j
public class ScheduleOptimizer {

    private final OptimizerConfig config;
    private final SlotBuilder slotBuilder;
    private final CapacityOptimizer capacityOptimizer;
    private final ScheduleDiffer scheduleDiffer;
    private final ImpactCalculator impactCalculator;
    private final RecommendationGenerator recommendationGenerator;

    public ScheduleOptimizer(OptimizerConfig config) {
        this.config = config;
        this.slotBuilder = new SlotBuilder(config.getBufferMinutes());
        this.capacityOptimizer = new CapacityOptimizer(config);
        this.scheduleDiffer = new ScheduleDiffer();
        this.impactCalculator = new ImpactCalculator(config);
        this.recommendationGenerator = new RecommendationGenerator(config);

        log.info("Initialized ScheduleOptimizer: {}", config.getConfigurationSummary());
    }

    public OptimizationResult optimizeDailySchedule(LocalDate date,
                                                    List<Booking> bookings,
                                                    Map<String, Double> noShowProbabilities,
                                                    Map<String, ProviderCalendar> providerCalendars)
            throws EmptyScheduleException {
        if (bookings.isEmpty()) {
            throw new EmptyScheduleException(date);
        }

        log.info("Optimizing schedule for {} bookings on {}", bookings.size(), date);

        SlotLayout layout = slotBuilder.build(date, bookings, providerCalendars);
        List<TimeSlot> original = layout.slots();

        List<TimeSlot> optimized = capacityOptimizer.optimize(original, noShowProbabilities);

        List<ScheduleChange> changes = scheduleDiffer.diff(original, optimized);
        SlotImpact impact = impactCalculator.assess(original, optimized);
        List<String> recommendations = recommendationGenerator.generate(optimized, noShowProbabilities);

        log.info("Optimization complete: {} changes, revenue gain {}, score {}",
                changes.size(), impact.predictedRevenueGain(), impact.optimizationScore());

        return new OptimizationResult(
                OptimizationResult.toSchedule(original),
                OptimizationResult.toSchedule(optimized),
                changes,
                impact.predictedRevenueGain(),
                impact.optimizationScore(),
                recommendations);
    }

    public OptimizerConfig getConfig() {
        return config;
    }
}
