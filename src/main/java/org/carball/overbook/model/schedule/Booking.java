package org.carball.overbook.model.schedule;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A scheduled appointment for one patient with one provider.
 */
public record Booking(
    String id,
    String providerId,
    String patientId,
    LocalDateTime scheduledTime,
    Integer durationMinutes,
    String appointmentType
) {
    public Booking {
        Objects.requireNonNull(id, "booking id");
        Objects.requireNonNull(providerId, "provider id");
        Objects.requireNonNull(scheduledTime, "scheduled time");
    }

    public static Booking of(String id, String providerId, LocalDateTime scheduledTime) {
        return new Booking(id, providerId, null, scheduledTime, null, null);
    }
}
