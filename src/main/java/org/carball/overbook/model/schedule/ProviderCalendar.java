package org.carball.overbook.model.schedule;

import java.time.LocalTime;

/**
 * A provider's working hours for a day. Slot duration falls back to 30 minutes when absent.
 */
public record ProviderCalendar(
    LocalTime start,
    LocalTime end,
    Integer slotDurationMinutes
) {
    public static final int DEFAULT_SLOT_DURATION_MINUTES = 30;

    public static ProviderCalendar of(LocalTime start, LocalTime end) {
        return new ProviderCalendar(start, end, DEFAULT_SLOT_DURATION_MINUTES);
    }

    public int effectiveSlotDuration() {
        return slotDurationMinutes != null ? slotDurationMinutes : DEFAULT_SLOT_DURATION_MINUTES;
    }
}
