package org.carball.overbook.model.risk;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    private static final double MEDIUM_THRESHOLD = 0.15;
    private static final double HIGH_THRESHOLD = 0.35;

    public static RiskLevel fromProbability(double probability) {
        if (probability < MEDIUM_THRESHOLD) {
            return LOW;
        } else if (probability < HIGH_THRESHOLD) {
            return MEDIUM;
        } else {
            return HIGH;
        }
    }
}
