package org.carball.overbook.model.optimization;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.LocalDateTime;

/**
 * One difference between the original and optimized schedule, tagged by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ScheduleChange.OverbookAdded.class, name = "overbook_added"),
    @JsonSubTypes.Type(value = ScheduleChange.BufferAdjusted.class, name = "buffer_adjusted")
})
public interface ScheduleChange {

    LocalDateTime timeSlot();

    String providerId();

    record OverbookAdded(
        LocalDateTime timeSlot,
        String providerId,
        int additionalCapacity,
        String reason
    ) implements ScheduleChange {}

    record BufferAdjusted(
        LocalDateTime timeSlot,
        String providerId,
        int newBuffer,
        int oldBuffer
    ) implements ScheduleChange {}
}
