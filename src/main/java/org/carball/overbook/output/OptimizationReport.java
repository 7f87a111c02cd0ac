package org.carball.overbook.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.overbook.config.OptimizerConfig;
import org.carball.overbook.model.optimization.OptimizationResult;
import org.carball.overbook.model.optimization.ScheduleChange;
import org.carball.overbook.model.optimization.ScheduledSlot;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class OptimizationReport {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final OptimizationResult result;
    private final LocalDate optimizationDate;
    private final OptimizerConfig config;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public OptimizationReport(OptimizationResult result, LocalDate optimizationDate, OptimizerConfig config) {
        this.result = result;
        this.optimizationDate = optimizationDate;
        this.config = config;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Schedule Optimization Report\n\n");
        md.append("**Date:** ").append(optimizationDate).append("  \n");
        md.append("**Strategy:** ").append(config.getStrategy().getName()).append("  \n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n\n");

        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Providers | ").append(result.optimizedSchedule().size()).append(" |\n");
        md.append("| Slots | ").append(result.totalSlots()).append(" |\n");
        md.append("| Changes | ").append(result.changes().size()).append(" |\n");
        md.append("| Added Capacity | ").append(result.addedCapacity()).append(" |\n");
        md.append("| Predicted Revenue Gain | ")
                .append(String.format(Locale.ROOT, "%.2f", result.predictedRevenueGain())).append(" |\n");
        md.append("| Optimization Score | ")
                .append(String.format(Locale.ROOT, "%.3f", result.optimizationScore())).append(" |\n\n");

        md.append("## Optimized Schedule\n\n");
        for (Map.Entry<String, List<ScheduledSlot>> entry : result.optimizedSchedule().entrySet()) {
            md.append("### Provider ").append(entry.getKey()).append("\n\n");
            md.append("| Slot | Bookings | Capacity | Buffer |\n");
            md.append("|------|----------|----------|--------|\n");
            for (ScheduledSlot slot : entry.getValue()) {
                md.append("| ").append(slot.start().format(TIME_FORMAT))
                        .append("-").append(slot.end().format(TIME_FORMAT))
                        .append(" | ").append(slot.bookings().size())
                        .append(" | ").append(slot.capacity())
                        .append(" | ").append(slot.bufferMinutes()).append(" min |\n");
            }
            md.append("\n");
        }

        md.append("## Changes\n\n");
        if (result.changes().isEmpty()) {
            md.append("**No changes recommended for this schedule.**\n\n");
        }
        for (ScheduleChange change : result.changes()) {
            md.append("- ").append(describe(change)).append("\n");
        }
        if (!result.changes().isEmpty()) {
            md.append("\n");
        }

        md.append("## Recommendations\n\n");
        for (String recommendation : result.recommendations()) {
            md.append("- ").append(recommendation).append("\n");
        }

        return md.toString();
    }

    private String describe(ScheduleChange change) {
        String when = change.timeSlot().format(TIME_FORMAT);
        if (change instanceof ScheduleChange.OverbookAdded added) {
            return String.format(Locale.ROOT, "%s %s: +%d capacity (%s)",
                    change.providerId(), when, added.additionalCapacity(), added.reason());
        }
        ScheduleChange.BufferAdjusted adjusted = (ScheduleChange.BufferAdjusted) change;
        return String.format(Locale.ROOT, "%s %s: buffer %d -> %d min",
                change.providerId(), when, adjusted.oldBuffer(), adjusted.newBuffer());
    }
}
