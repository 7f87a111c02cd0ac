package org.carball.overbook.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

@Data
@Builder(toBuilder = true)
@Slf4j
public class OptimizerConfig {

    // Overbooking limits
    @Builder.Default
    private double maxOverbookPct = 0.15;

    @Builder.Default
    private double minNoShowThreshold = 0.10;

    @Builder.Default
    private int bufferMinutes = 5;

    @Builder.Default
    private OptimizationStrategy strategy = OptimizationStrategy.BALANCED;

    // Applied to bookings the risk model has no prediction for
    @Builder.Default
    private double defaultNoShowProbability = 0.1;

    // Revenue model
    @Builder.Default
    private double avgBookingValue = 150.0;

    @Builder.Default
    private double fillRate = 0.7;

    // Recommendations
    @Builder.Default
    private double highRiskThreshold = 0.4;

    // Rescheduling
    @Builder.Default
    private int rescheduleTopN = 3;

    @Builder.Default
    private int dayScanBudget = 5;

    /**
     * Creates the default practice configuration.
     */
    public static OptimizerConfig defaults() {
        return OptimizerConfig.builder().build();
    }

    /**
     * Validates the configuration and logs warnings for potentially problematic values.
     */
    public void validate() {
        if (maxOverbookPct < 0 || maxOverbookPct > 1.0) {
            log.warn("Max overbook percentage ({}) should be between 0.0 and 1.0", maxOverbookPct);
        }

        if (minNoShowThreshold < 0) {
            log.warn("Minimum no-show threshold ({}) should not be negative", minNoShowThreshold);
        }

        if (bufferMinutes < 0) {
            log.warn("Buffer minutes ({}) should not be negative", bufferMinutes);
        }

        if (defaultNoShowProbability < 0 || defaultNoShowProbability > 1.0) {
            log.warn("Default no-show probability ({}) should be between 0.0 and 1.0", defaultNoShowProbability);
        }

        if (fillRate < 0 || fillRate > 1.0) {
            log.warn("Fill rate ({}) should be between 0.0 and 1.0", fillRate);
        }

        if (avgBookingValue < 0) {
            log.warn("Average booking value ({}) should not be negative", avgBookingValue);
        }

        if (rescheduleTopN <= 0) {
            log.warn("Reschedule top-N ({}) should be positive", rescheduleTopN);
        }

        if (dayScanBudget <= 0) {
            log.warn("Day-scan budget ({}) should be positive", dayScanBudget);
        }

        log.debug("Using config - Max overbook: {}, Threshold: {}, Buffer: {}, Strategy: {}",
                maxOverbookPct, minNoShowThreshold, bufferMinutes, strategy.getName());
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format(Locale.ROOT, "Strategy: %s | Max overbook: %.2f | No-show threshold: %.2f | Buffer: %d min | Booking value: %.1f",
                strategy.getName(), maxOverbookPct, minNoShowThreshold, bufferMinutes, avgBookingValue);
    }
}
