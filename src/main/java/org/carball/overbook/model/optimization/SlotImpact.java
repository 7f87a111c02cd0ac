package org.carball.overbook.model.optimization;

public record SlotImpact(
    double predictedRevenueGain,
    double optimizationScore
) {}
