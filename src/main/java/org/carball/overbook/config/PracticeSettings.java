package org.carball.overbook.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Practice-level settings as stored in a settings file. Unset fields keep the
 * value already present in the builder they are applied to.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PracticeSettings {

    @JsonProperty("max_overbook_percentage")
    private Double maxOverbookPercentage;

    @JsonProperty("min_no_show_threshold")
    private Double minNoShowThreshold;

    @JsonProperty("buffer_time_minutes")
    private Integer bufferTimeMinutes;

    @JsonProperty("strategy")
    private String strategy;

    @JsonProperty("avg_appointment_value")
    private Double avgAppointmentValue;

    @JsonProperty("fill_rate")
    private Double fillRate;

    public void applyTo(OptimizerConfig.OptimizerConfigBuilder builder) {
        if (strategy != null) {
            builder.strategy(OptimizationStrategy.fromName(strategy));
        }
        if (maxOverbookPercentage != null) {
            builder.maxOverbookPct(maxOverbookPercentage);
        }
        if (minNoShowThreshold != null) {
            builder.minNoShowThreshold(minNoShowThreshold);
        }
        if (bufferTimeMinutes != null) {
            builder.bufferMinutes(bufferTimeMinutes);
        }
        if (avgAppointmentValue != null) {
            builder.avgBookingValue(avgAppointmentValue);
        }
        if (fillRate != null) {
            builder.fillRate(fillRate);
        }
    }
}
