package org.carball.overbook.schedule;

import lombok.Getter;

/**
 * Raised when a provider calendar cannot be turned into slots.
 */
@Getter
public class CalendarConfigurationException extends RuntimeException {

    private final String providerId;

    public CalendarConfigurationException(String providerId, String message) {
        super("Invalid calendar for provider " + providerId + ": " + message);
        this.providerId = providerId;
    }
}
