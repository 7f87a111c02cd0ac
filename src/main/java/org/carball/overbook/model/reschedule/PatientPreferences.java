package org.carball.overbook.model.reschedule;

import java.util.List;

/**
 * Hours are 0-23. Days are numbered from 0 = Monday through 6 = Sunday, so the default
 * days run Tuesday to Saturday.
 */
public record PatientPreferences(
    List<Integer> preferredHours,
    List<Integer> preferredDays
) {
    public static final List<Integer> DEFAULT_HOURS = List.of(9, 10, 11, 14, 15);
    public static final List<Integer> DEFAULT_DAYS = List.of(1, 2, 3, 4, 5);

    public PatientPreferences {
        preferredHours = preferredHours != null ? List.copyOf(preferredHours) : DEFAULT_HOURS;
        preferredDays = preferredDays != null ? List.copyOf(preferredDays) : DEFAULT_DAYS;
    }

    public static PatientPreferences defaults() {
        return new PatientPreferences(DEFAULT_HOURS, DEFAULT_DAYS);
    }
}
