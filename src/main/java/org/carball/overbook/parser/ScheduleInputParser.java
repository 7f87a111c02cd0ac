package org.carball.overbook.parser;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.overbook.model.schedule.Booking;
import org.carball.overbook.model.schedule.ScheduleInput;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reads a day's bookings, provider calendars and no-show probabilities from YAML or JSON.
 */
@Slf4j
public class ScheduleInputParser {

    private final ObjectMapper mapper;

    public ScheduleInputParser() {
        // YAML is a superset of JSON, so one mapper covers both formats
        this.mapper = new ObjectMapper(new YAMLFactory());
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ScheduleInput parse(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("Schedule file not found: " + file);
        }
        return parse(Files.readString(file));
    }

    public ScheduleInput parse(String content) throws IOException {
        ScheduleInput input = mapper.readValue(content, ScheduleInput.class);
        if (input.date() == null) {
            throw new IllegalArgumentException("Schedule input must specify a date");
        }
        validateProbabilities(input);
        warnOnUnknownBookings(input);

        log.info("Parsed schedule for {}: {} bookings, {} providers, {} predictions",
                input.date(), input.bookings().size(), input.providerCalendars().size(),
                input.noShowProbabilities().size());
        return input;
    }

    private void validateProbabilities(ScheduleInput input) {
        for (Map.Entry<String, Double> entry : input.noShowProbabilities().entrySet()) {
            Double p = entry.getValue();
            if (p == null || p < 0.0 || p > 1.0) {
                throw new IllegalArgumentException("No-show probability for booking " + entry.getKey() +
                        " must be between 0 and 1, was " + p);
            }
        }
    }

    private void warnOnUnknownBookings(ScheduleInput input) {
        Set<String> providers = input.providerCalendars().keySet();
        Set<String> seen = new HashSet<>();
        for (Booking booking : input.bookings()) {
            if (!seen.add(booking.id())) {
                log.warn("Duplicate booking id {}", booking.id());
            }
            if (!providers.contains(booking.providerId())) {
                log.warn("Booking {} references provider {} with no calendar", booking.id(), booking.providerId());
            }
        }
    }
}
