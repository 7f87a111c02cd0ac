package org.carball.overbook.model.risk;

import org.carball.overbook.model.schedule.Booking;

import java.time.LocalDateTime;

/**
 * Inputs handed to a risk model for one booking.
 */
public record BookingAttributes(
    String bookingId,
    String patientId,
    String providerId,
    LocalDateTime scheduledTime,
    String appointmentType,
    Integer durationMinutes,
    double patientNoShowRate,
    int patientTotalAppointments,
    double practiceNoShowRate
) {
    // Used until patient and practice history is supplied
    public static final double DEFAULT_PATIENT_NO_SHOW_RATE = 0.15;
    public static final int DEFAULT_PATIENT_TOTAL_APPOINTMENTS = 10;
    public static final double DEFAULT_PRACTICE_NO_SHOW_RATE = 0.12;

    public static BookingAttributes from(Booking booking) {
        return new BookingAttributes(
                booking.id(),
                booking.patientId(),
                booking.providerId(),
                booking.scheduledTime(),
                booking.appointmentType(),
                booking.durationMinutes(),
                DEFAULT_PATIENT_NO_SHOW_RATE,
                DEFAULT_PATIENT_TOTAL_APPOINTMENTS,
                DEFAULT_PRACTICE_NO_SHOW_RATE);
    }
}
