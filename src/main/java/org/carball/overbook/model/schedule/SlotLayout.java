package org.carball.overbook.model.schedule;

import java.util.List;
import java.util.Map;

/**
 * Slots built for a day, plus the providers whose calendars were rejected and why.
 */
public record SlotLayout(
    List<TimeSlot> slots,
    Map<String, String> rejectedCalendars
) {
    public boolean hasRejections() {
        return !rejectedCalendars.isEmpty();
    }
}
