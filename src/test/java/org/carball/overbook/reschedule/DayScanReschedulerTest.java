package org.carball.overbook.reschedule;

import org.carball.overbook.config.OptimizerConfig;
import org.carball.overbook.model.reschedule.RescheduleSuggestion;
import org.carball.overbook.model.schedule.Booking;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class DayScanReschedulerTest {

    // Friday; the next weekday is Monday 2025-03-10
    private static final LocalDate FRIDAY = LocalDate.of(2025, 3, 7);
    private static final LocalDate MONDAY = LocalDate.of(2025, 3, 10);
    private static final LocalDate TUESDAY = LocalDate.of(2025, 3, 11);

    private final Booking cancelled = Booking.of("c1", "dr-lee", FRIDAY.atTime(10, 0));

    @Test
    void shouldSkipWeekendAndStopAtBudget() {
        // Given
        DayScanRescheduler scanner = new DayScanRescheduler(OptimizerConfig.defaults(), (provider, time) -> false);

        // When
        var suggestions = scanner.suggest(cancelled, FRIDAY, 7);

        // Then
        assertThat(suggestions).hasSize(5);
        assertThat(suggestions).allMatch(s -> s.time().toLocalDate().equals(MONDAY));
        assertThat(suggestions).extracting(s -> s.time().getHour()).containsExactly(9, 10, 11, 14, 15);
        assertThat(suggestions.get(0).confidence()).isCloseTo(0.84, within(1e-9));
        assertThat(suggestions).allMatch(s -> s.providerId().equals("dr-lee"));
    }

    @Test
    void shouldContinueToNextDayWhenTimesAreTaken() {
        // Given
        Set<LocalDateTime> booked = Set.of(
                MONDAY.atTime(9, 0), MONDAY.atTime(10, 0), MONDAY.atTime(11, 0), MONDAY.atTime(14, 0));
        DayScanRescheduler scanner = new DayScanRescheduler(OptimizerConfig.defaults(),
                (provider, time) -> booked.contains(time));

        // When
        var suggestions = scanner.suggest(cancelled, FRIDAY, 7);

        // Then
        assertThat(suggestions).extracting(RescheduleSuggestion::time).containsExactly(
                MONDAY.atTime(15, 0), MONDAY.atTime(16, 0),
                TUESDAY.atTime(9, 0), TUESDAY.atTime(10, 0), TUESDAY.atTime(11, 0));
        assertThat(suggestions.get(2).confidence()).isCloseTo(0.82, within(1e-9));
    }

    @Test
    void shouldReturnFewerWhenWindowIsShort() {
        DayScanRescheduler scanner = new DayScanRescheduler(OptimizerConfig.defaults(), (provider, time) -> time.getHour() < 15);

        // Only Monday is scanned: Saturday, Sunday, Monday
        var suggestions = scanner.suggest(cancelled, FRIDAY, 3);

        assertThat(suggestions).extracting(s -> s.time().getHour()).containsExactly(15, 16);
    }

    @Test
    void shouldRejectOutOfRangeWindow() {
        DayScanRescheduler scanner = new DayScanRescheduler(OptimizerConfig.defaults(), (provider, time) -> false);

        assertThatThrownBy(() -> scanner.suggest(cancelled, FRIDAY, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scanner.suggest(cancelled, FRIDAY, 31)).isInstanceOf(IllegalArgumentException.class);
    }
}
