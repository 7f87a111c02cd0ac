package org.carball.overbook.reschedule;

import lombok.extern.slf4j.Slf4j;
import org.carball.overbook.config.OptimizerConfig;
import org.carball.overbook.model.reschedule.RescheduleSuggestion;
import org.carball.overbook.model.schedule.Booking;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks the upcoming weekdays hour by hour and suggests free times, sooner days first.
 * Scanning stops after the day on which the scan budget is reached.
 */
@Slf4j
public class DayScanRescheduler {

    static final List<Integer> CANDIDATE_HOURS = List.of(9, 10, 11, 14, 15, 16);
    static final int MAX_DAYS_AHEAD = 30;

    private static final double BASE_CONFIDENCE = 0.9;
    private static final double DAILY_CONFIDENCE_DECAY = 0.02;

    private final SlotAvailability availability;
    private final int scanBudget;

    public DayScanRescheduler(OptimizerConfig config, SlotAvailability availability) {
        this.availability = availability;
        this.scanBudget = config.getDayScanBudget();
    }

    public List<RescheduleSuggestion> suggest(Booking cancelled, LocalDate fromDate, int daysAhead) {
        if (daysAhead < 1 || daysAhead > MAX_DAYS_AHEAD) {
            throw new IllegalArgumentException("Days ahead must be between 1 and " + MAX_DAYS_AHEAD + ", was " + daysAhead);
        }

        List<RescheduleSuggestion> suggestions = new ArrayList<>();

        for (int day = 1; day <= daysAhead; day++) {
            LocalDate target = fromDate.plusDays(day);
            if (isWeekend(target)) {
                continue;
            }

            double confidence = BASE_CONFIDENCE - day * DAILY_CONFIDENCE_DECAY;
            for (int hour : CANDIDATE_HOURS) {
                LocalDateTime time = target.atTime(hour, 0);
                if (!availability.isBooked(cancelled.providerId(), time)) {
                    suggestions.add(new RescheduleSuggestion(time, cancelled.providerId(), confidence));
                }
            }

            if (suggestions.size() >= scanBudget) {
                break;
            }
        }

        log.debug("Booking {}: {} free times found within {} days", cancelled.id(), suggestions.size(), daysAhead);
        return suggestions.size() > scanBudget ? List.copyOf(suggestions.subList(0, scanBudget)) : suggestions;
    }

    private boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }
}
