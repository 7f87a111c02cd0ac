package org.carball.overbook.model.risk;

public record PracticeAlert(
    String type,
    String priority,
    String message,
    String action
) {}
