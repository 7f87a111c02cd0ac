package org.carball.overbook.model.risk;

public record RiskFactor(
    String name,
    double impact
) {}
