package org.carball.overbook.optimizer;

import java.time.LocalDate;

/**
 * Signals that there is nothing to optimize for the requested day.
 */
public class EmptyScheduleException extends Exception {

    public EmptyScheduleException(LocalDate date) {
        super("No bookings found for optimization on " + date);
    }
}
