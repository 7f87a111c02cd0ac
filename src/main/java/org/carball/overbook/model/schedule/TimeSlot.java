package org.carball.overbook.model.schedule;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A provider's [start, end) interval and the bookings scheduled inside it.
 * Instances are immutable; optimization produces modified copies.
 */
public record TimeSlot(
    String providerId,
    LocalDateTime start,
    LocalDateTime end,
    List<Booking> bookings,
    int capacity,
    int bufferMinutes
) {
    public static final int BASE_CAPACITY = 1;

    public TimeSlot {
        bookings = List.copyOf(bookings);
    }

    public TimeSlot withCapacity(int newCapacity) {
        return new TimeSlot(providerId, start, end, bookings, newCapacity, bufferMinutes);
    }

    public TimeSlot withBufferMinutes(int newBufferMinutes) {
        return new TimeSlot(providerId, start, end, bookings, capacity, newBufferMinutes);
    }

    public int bookingCount() {
        return bookings.size();
    }

    public boolean hasOpenCapacity() {
        return bookings.size() < capacity;
    }

    public double occupancy() {
        return capacity == 0 ? 1.0 : (double) bookings.size() / capacity;
    }
}
