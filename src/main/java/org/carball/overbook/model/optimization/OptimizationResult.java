package org.carball.overbook.model.optimization;

import org.carball.overbook.model.schedule.TimeSlot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record OptimizationResult(
    Map<String, List<ScheduledSlot>> originalSchedule,
    Map<String, List<ScheduledSlot>> optimizedSchedule,
    List<ScheduleChange> changes,
    double predictedRevenueGain,
    double optimizationScore,
    List<String> recommendations
) {
    public OptimizationResult {
        originalSchedule = copyOf(originalSchedule);
        optimizedSchedule = copyOf(optimizedSchedule);
        changes = List.copyOf(changes);
        recommendations = List.copyOf(recommendations);
    }

    /**
     * Groups slots by provider, keeping the order providers are first seen in.
     */
    public static Map<String, List<ScheduledSlot>> toSchedule(List<TimeSlot> slots) {
        Map<String, List<ScheduledSlot>> schedule = new LinkedHashMap<>();
        for (TimeSlot slot : slots) {
            schedule.computeIfAbsent(slot.providerId(), k -> new ArrayList<>()).add(ScheduledSlot.from(slot));
        }
        return schedule;
    }

    // Unmodifiable, keeps provider order
    private static Map<String, List<ScheduledSlot>> copyOf(Map<String, List<ScheduledSlot>> schedule) {
        Map<String, List<ScheduledSlot>> copy = new LinkedHashMap<>();
        schedule.forEach((provider, slots) -> copy.put(provider, List.copyOf(slots)));
        return Collections.unmodifiableMap(copy);
    }

    public int totalSlots() {
        return optimizedSchedule.values().stream().mapToInt(List::size).sum();
    }

    public int addedCapacity() {
        return changes.stream()
                .filter(c -> c instanceof ScheduleChange.OverbookAdded)
                .mapToInt(c -> ((ScheduleChange.OverbookAdded) c).additionalCapacity())
                .sum();
    }
}
