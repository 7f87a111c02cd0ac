package org.carball.overbook.optimizer;

import org.carball.overbook.model.optimization.ScheduleChange;
import org.carball.overbook.model.schedule.TimeSlot;

import java.util.ArrayList;
import java.util.List;

public class ScheduleDiffer {

    public static final String OVERBOOK_REASON = "High no-show probability detected";

    /**
     * Compares slots position by position and lists the changes in slot order.
     */
    public List<ScheduleChange> diff(List<TimeSlot> original, List<TimeSlot> optimized) {
        if (original.size() != optimized.size()) {
            throw new IllegalArgumentException("Schedules differ in length: " +
                    original.size() + " original vs " + optimized.size() + " optimized slots");
        }

        List<ScheduleChange> changes = new ArrayList<>();

        for (int i = 0; i < original.size(); i++) {
            TimeSlot before = original.get(i);
            TimeSlot after = optimized.get(i);

            if (after.capacity() > before.capacity()) {
                changes.add(new ScheduleChange.OverbookAdded(
                        before.start(),
                        before.providerId(),
                        after.capacity() - before.capacity(),
                        OVERBOOK_REASON));
            }

            if (after.bufferMinutes() != before.bufferMinutes()) {
                changes.add(new ScheduleChange.BufferAdjusted(
                        before.start(),
                        before.providerId(),
                        after.bufferMinutes(),
                        before.bufferMinutes()));
            }
        }

        return changes;
    }
}
