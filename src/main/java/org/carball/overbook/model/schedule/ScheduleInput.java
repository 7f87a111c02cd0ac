package org.carball.overbook.model.schedule;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A day's scheduling data as read from an input file.
 */
public record ScheduleInput(
    LocalDate date,
    List<Booking> bookings,
    LinkedHashMap<String, ProviderCalendar> providerCalendars,
    Map<String, Double> noShowProbabilities
) {
    public ScheduleInput {
        bookings = bookings != null ? bookings : List.of();
        providerCalendars = providerCalendars != null ? providerCalendars : new LinkedHashMap<>();
        noShowProbabilities = noShowProbabilities != null ? noShowProbabilities : Map.of();
    }
}
