package org.carball.overbook.model.risk;

import java.util.List;

/**
 * A risk model's verdict for one booking.
 */
public record RiskAssessment(
    double probability,
    RiskLevel riskLevel,
    List<RiskFactor> topFactors
) {
    public RiskAssessment {
        topFactors = topFactors != null ? List.copyOf(topFactors) : List.of();
    }

    public static RiskAssessment of(double probability, List<RiskFactor> topFactors) {
        return new RiskAssessment(probability, RiskLevel.fromProbability(probability), topFactors);
    }
}
