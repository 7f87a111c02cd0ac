package org.carball.overbook.store;

import lombok.extern.slf4j.Slf4j;
import org.carball.overbook.model.optimization.OptimizationResult;
import org.carball.overbook.model.schedule.Booking;
import org.carball.overbook.model.schedule.ProviderCalendar;
import org.carball.overbook.optimizer.EmptyScheduleException;
import org.carball.overbook.optimizer.ScheduleOptimizer;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs optimizations for a practice, stores them, and later marks them applied.
 */
@Slf4j
public class OptimizationService {

    private final ScheduleOptimizer optimizer;
    private final OptimizationStore store;
    private final Clock clock;

    public OptimizationService(ScheduleOptimizer optimizer, OptimizationStore store) {
        this(optimizer, store, Clock.systemUTC());
    }

    public OptimizationService(ScheduleOptimizer optimizer, OptimizationStore store, Clock clock) {
        this.optimizer = optimizer;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Optimizes the day and stores the result. When {@code providerId} is not null only that provider's
     * calendar, bookings and predictions take part.
     */
    public StoredOptimization optimizeAndStore(String practiceId,
                                               String providerId,
                                               LocalDate date,
                                               List<Booking> bookings,
                                               Map<String, Double> noShowProbabilities,
                                               Map<String, ProviderCalendar> providerCalendars)
            throws EmptyScheduleException {
        if (providerId == null) {
            OptimizationResult result = optimizer.optimizeDailySchedule(date, bookings, noShowProbabilities, providerCalendars);
            return save(practiceId, null, date, result);
        }

        List<Booking> scoped = bookings.stream()
                .filter(b -> b.providerId().equals(providerId))
                .collect(Collectors.toList());

        Map<String, Double> scopedProbabilities = new LinkedHashMap<>();
        for (Booking booking : scoped) {
            Double probability = noShowProbabilities.get(booking.id());
            if (probability != null) {
                scopedProbabilities.put(booking.id(), probability);
            }
        }

        Map<String, ProviderCalendar> scopedCalendars = new LinkedHashMap<>();
        if (providerCalendars.containsKey(providerId)) {
            scopedCalendars.put(providerId, providerCalendars.get(providerId));
        } else {
            log.warn("No calendar for provider {}", providerId);
        }

        OptimizationResult result = optimizer.optimizeDailySchedule(date, scoped, scopedProbabilities, scopedCalendars);
        return save(practiceId, providerId, date, result);
    }

    private StoredOptimization save(String practiceId, String providerId, LocalDate date, OptimizationResult result) {
        StoredOptimization stored = store.save(StoredOptimization.pending(practiceId, providerId, date, result));

        log.info("Stored optimization {} for practice {} on {}", stored.id(), practiceId, date);
        return stored;
    }

    /**
     * Marks a stored optimization applied and returns the number of changes it carries.
     */
    public int apply(UUID optimizationId, String appliedBy) {
        StoredOptimization optimization = store.findById(optimizationId)
                .orElseThrow(() -> new OptimizationNotFoundException(optimizationId));

        if (optimization.applied()) {
            throw new OptimizationAlreadyAppliedException(optimizationId);
        }

        store.save(optimization.markApplied(clock.instant(), appliedBy));
        int appliedChanges = optimization.result().changes().size();

        log.info("Optimization {} applied by {} ({} changes)", optimizationId, appliedBy, appliedChanges);
        return appliedChanges;
    }
}
