package org.carball.overbook.reschedule;

import java.time.LocalDateTime;

/**
 * Answers whether a provider already has a booking starting at a given time.
 */
@FunctionalInterface
public interface SlotAvailability {

    boolean isBooked(String providerId, LocalDateTime time);
}
