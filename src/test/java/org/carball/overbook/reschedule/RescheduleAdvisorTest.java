package org.carball.overbook.reschedule;

import org.carball.overbook.config.OptimizerConfig;
import org.carball.overbook.model.reschedule.PatientPreferences;
import org.carball.overbook.model.reschedule.RescheduleSuggestion;
import org.carball.overbook.model.schedule.Booking;
import org.carball.overbook.model.schedule.TimeSlot;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class RescheduleAdvisorTest {

    // 2025-03-10 is a Monday, 2025-03-15 a Saturday
    private static final LocalDateTime MONDAY_NINE = LocalDateTime.of(2025, 3, 10, 9, 0);
    private static final LocalDateTime SATURDAY_ONE = LocalDateTime.of(2025, 3, 15, 13, 0);

    private final Booking cancelled = Booking.of("c1", "dr-lee", LocalDateTime.of(2025, 3, 7, 10, 0));
    private final RescheduleAdvisor advisor = new RescheduleAdvisor(OptimizerConfig.defaults());

    private static TimeSlot slot(LocalDateTime start, int bookings, int capacity) {
        List<Booking> booked = new ArrayList<>();
        for (int i = 0; i < bookings; i++) {
            booked.add(Booking.of(start + "-" + i, "dr-lee", start));
        }
        return new TimeSlot("dr-lee", start, start.plusMinutes(30), booked, capacity, 5);
    }

    @Test
    void shouldRankPreferredEmptySlotAboveCrowdedOffPreferenceSlot() {
        // Given
        PatientPreferences mondayMornings = new PatientPreferences(List.of(9), List.of(0));
        TimeSlot crowded = slot(SATURDAY_ONE, 1, 2);
        TimeSlot preferred = slot(MONDAY_NINE, 0, 1);

        // When
        List<RescheduleSuggestion> suggestions = advisor.suggest(cancelled, List.of(crowded, preferred), mondayMornings);

        // Then - 2 + 1 + 1.5 = 4.5 against 0.5 * 1.5 = 0.75
        assertThat(suggestions).hasSize(2);
        assertThat(suggestions.get(0).time()).isEqualTo(MONDAY_NINE);
        assertThat(suggestions.get(0).providerId()).isEqualTo("dr-lee");
        assertThat(suggestions.get(0).confidence()).isCloseTo(0.9, within(1e-9));
        assertThat(suggestions.get(1).time()).isEqualTo(SATURDAY_ONE);
        assertThat(suggestions.get(1).confidence()).isCloseTo(0.15, within(1e-9));
    }

    @Test
    void shouldNumberDaysFromMondayAsZero() {
        // Given
        TimeSlot mondayOne = slot(MONDAY_NINE.withHour(13), 0, 1);

        // When
        double mondayOnly = advisor.score(mondayOne, new PatientPreferences(List.of(), List.of(0)));
        double defaults = advisor.score(mondayOne, PatientPreferences.defaults());

        // Then - the default days 1..5 run Tuesday to Saturday
        assertThat(mondayOnly).isCloseTo(2.5, within(1e-9));
        assertThat(defaults).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void shouldSkipFullSlots() {
        TimeSlot full = slot(MONDAY_NINE, 1, 1);
        TimeSlot overbookedFull = slot(MONDAY_NINE.plusHours(1), 3, 3);

        assertThat(advisor.suggest(cancelled, List.of(full, overbookedFull), PatientPreferences.defaults())).isEmpty();
    }

    @Test
    void shouldReturnAtMostTopThree() {
        List<TimeSlot> slots = new ArrayList<>();
        for (int hour = 9; hour <= 14; hour++) {
            slots.add(slot(MONDAY_NINE.withHour(hour), 0, 1));
        }

        List<RescheduleSuggestion> suggestions = advisor.suggest(cancelled, slots, PatientPreferences.defaults());

        assertThat(suggestions).hasSize(3);
    }

    @Test
    void shouldHonorConfiguredTopN() {
        RescheduleAdvisor single = new RescheduleAdvisor(OptimizerConfig.builder().rescheduleTopN(1).build());
        List<TimeSlot> slots = List.of(slot(MONDAY_NINE, 0, 1), slot(MONDAY_NINE.withHour(10), 0, 1));

        assertThat(single.suggest(cancelled, slots, PatientPreferences.defaults())).hasSize(1);
    }

    @Test
    void shouldKeepSlotOrderForEqualScores() {
        // Given - 12:00 and 13:00 both miss the preferred hours
        TimeSlot noon = slot(MONDAY_NINE.withHour(12), 0, 1);
        TimeSlot one = slot(MONDAY_NINE.withHour(13), 0, 1);
        TimeSlot ten = slot(MONDAY_NINE.withHour(10), 0, 1);

        // When
        List<RescheduleSuggestion> suggestions = advisor.suggest(cancelled, List.of(noon, one, ten),
                PatientPreferences.defaults());

        // Then
        assertThat(suggestions).extracting(RescheduleSuggestion::time)
                .containsExactly(ten.start(), noon.start(), one.start());
    }

    @Test
    void shouldScoreAgainstCustomPreferences() {
        PatientPreferences afternoonsOnSunday = new PatientPreferences(List.of(13), List.of(6));
        TimeSlot saturday = slot(SATURDAY_ONE, 0, 1);
        TimeSlot sunday = slot(SATURDAY_ONE.plusDays(1), 0, 1);

        assertThat(advisor.score(sunday, afternoonsOnSunday)).isCloseTo(4.5, within(1e-9));
        assertThat(advisor.score(saturday, afternoonsOnSunday)).isCloseTo(3.5, within(1e-9));
        assertThat(advisor.score(saturday, PatientPreferences.defaults())).isCloseTo(2.5, within(1e-9));
    }

    @Test
    void shouldClampConfidenceToUnitInterval() {
        assertThat(RescheduleAdvisor.toConfidence(6.0)).isEqualTo(1.0);
        assertThat(RescheduleAdvisor.toConfidence(-1.0)).isEqualTo(0.0);
        assertThat(RescheduleAdvisor.toConfidence(2.5)).isCloseTo(0.5, within(1e-9));
    }
}
