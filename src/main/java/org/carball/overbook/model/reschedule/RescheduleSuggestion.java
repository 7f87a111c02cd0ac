package org.carball.overbook.model.reschedule;

import java.time.LocalDateTime;

public record RescheduleSuggestion(
    LocalDateTime time,
    String providerId,
    double confidence
) {}
