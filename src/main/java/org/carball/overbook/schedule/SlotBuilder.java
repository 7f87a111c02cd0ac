package org.carball.overbook.schedule;

import lombok.extern.slf4j.Slf4j;
import org.carball.overbook.model.schedule.Booking;
import org.carball.overbook.model.schedule.ProviderCalendar;
import org.carball.overbook.model.schedule.SlotLayout;
import org.carball.overbook.model.schedule.TimeSlot;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Partitions provider calendars into fixed-length slots and assigns bookings to them by time.
 */
@Slf4j
public class SlotBuilder {

    private final int bufferMinutes;

    public SlotBuilder(int bufferMinutes) {
        this.bufferMinutes = bufferMinutes;
    }

    /**
     * Builds slots for every provider, in the iteration order of {@code providerCalendars}.
     * A malformed calendar only drops that provider's slots; it is reported in the layout.
     */
    public SlotLayout build(LocalDate date, List<Booking> bookings, Map<String, ProviderCalendar> providerCalendars) {
        List<TimeSlot> slots = new ArrayList<>();
        Map<String, String> rejected = new LinkedHashMap<>();

        for (Map.Entry<String, ProviderCalendar> entry : providerCalendars.entrySet()) {
            try {
                slots.addAll(buildProvider(date, entry.getKey(), entry.getValue(), bookings));
            } catch (CalendarConfigurationException e) {
                log.warn("Skipping provider {}: {}", entry.getKey(), e.getMessage());
                rejected.put(entry.getKey(), e.getMessage());
            }
        }

        log.info("Built {} slots for {} providers on {}", slots.size(),
                providerCalendars.size() - rejected.size(), date);

        return new SlotLayout(Collections.unmodifiableList(slots), Collections.unmodifiableMap(rejected));
    }

    public List<TimeSlot> buildProvider(LocalDate date, String providerId,
                                        ProviderCalendar calendar, List<Booking> bookings) {
        validateCalendar(providerId, calendar);

        List<Booking> providerBookings = bookings.stream()
                .filter(b -> b.providerId().equals(providerId))
                .collect(Collectors.toList());

        LocalDateTime current = date.atTime(calendar.start());
        LocalDateTime dayEnd = date.atTime(calendar.end());
        int duration = calendar.effectiveSlotDuration();

        List<TimeSlot> slots = new ArrayList<>();
        while (current.isBefore(dayEnd)) {
            LocalDateTime slotEnd = current.plusMinutes(duration);
            if (slotEnd.isAfter(dayEnd)) {
                // trailing partial slot
                break;
            }

            final LocalDateTime slotStart = current;
            List<Booking> slotBookings = providerBookings.stream()
                    .filter(b -> !b.scheduledTime().isBefore(slotStart) && b.scheduledTime().isBefore(slotEnd))
                    .collect(Collectors.toList());

            slots.add(new TimeSlot(providerId, slotStart, slotEnd, slotBookings, TimeSlot.BASE_CAPACITY, bufferMinutes));
            current = slotEnd;
        }

        log.debug("Provider {}: {} slots of {} minutes", providerId, slots.size(), duration);
        return slots;
    }

    private void validateCalendar(String providerId, ProviderCalendar calendar) {
        if (calendar == null || calendar.start() == null || calendar.end() == null) {
            throw new CalendarConfigurationException(providerId, "start and end are required");
        }
        if (!calendar.start().isBefore(calendar.end())) {
            throw new CalendarConfigurationException(providerId,
                    "start " + calendar.start() + " must be before end " + calendar.end());
        }
        if (calendar.effectiveSlotDuration() <= 0) {
            throw new CalendarConfigurationException(providerId,
                    "slot duration must be positive, was " + calendar.effectiveSlotDuration());
        }
    }
}
