package org.carball.overbook.model.optimization;

import org.carball.overbook.model.schedule.Booking;
import org.carball.overbook.model.schedule.TimeSlot;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Persisted form of a slot inside a provider's schedule.
 */
public record ScheduledSlot(
    LocalDateTime start,
    LocalDateTime end,
    List<Booking> bookings,
    int capacity,
    int bufferMinutes
) {
    public ScheduledSlot {
        bookings = List.copyOf(bookings);
    }

    public static ScheduledSlot from(TimeSlot slot) {
        return new ScheduledSlot(slot.start(), slot.end(), slot.bookings(), slot.capacity(), slot.bufferMinutes());
    }
}
